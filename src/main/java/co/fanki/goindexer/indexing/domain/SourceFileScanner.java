package co.fanki.goindexer.indexing.domain;

import co.fanki.goindexer.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Walks a project tree and lists the production source files of one
 * language.
 *
 * <p>Hidden directories and the configured dependency directories are
 * never entered. Test files are never listed. Returned paths are
 * relative to the project root, use {@code /} as separator, and are
 * sorted.</p>
 *
 * <h3>Pattern semantics</h3>
 * <ul>
 *   <li>An exclude pattern removes a file when it matches the relative
 *       path, the file name, or the name of any parent directory.</li>
 *   <li>When include patterns are present, a file is kept only if one of
 *       them matches its relative path or its file name.</li>
 * </ul>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class SourceFileScanner {

    private static final Logger LOG = LoggerFactory.getLogger(
            SourceFileScanner.class);

    private final String extension;

    private final String testSuffix;

    private final Set<String> skippedDirectories;

    /**
     * Creates a scanner.
     *
     * @param theExtension the source file extension, e.g. ".go"
     * @param theTestSuffix the suffix marking test files, e.g. "_test.go"
     * @param theSkippedDirectories directory names never entered
     */
    public SourceFileScanner(final String theExtension,
            final String theTestSuffix,
            final Set<String> theSkippedDirectories) {
        this.extension = Preconditions.requireNonBlank(theExtension,
                "Extension is required");
        this.testSuffix = Preconditions.requireNonBlank(theTestSuffix,
                "Test suffix is required");
        this.skippedDirectories = Set.copyOf(Preconditions.requireNonNull(
                theSkippedDirectories, "Skipped directories are required"));
    }

    /**
     * Lists every production source file, ignoring patterns.
     *
     * @param projectRoot the project root directory
     * @return the sorted relative paths
     * @throws IOException if the tree cannot be walked
     */
    public List<String> scan(final Path projectRoot) throws IOException {
        return scan(projectRoot, List.of(), List.of());
    }

    /**
     * Lists the production source files selected by the patterns.
     *
     * @param projectRoot the project root directory
     * @param includePatterns glob patterns a file must match, may be empty
     * @param excludePatterns glob patterns removing files, may be empty
     * @return the sorted relative paths
     * @throws IOException if the tree cannot be walked
     */
    public List<String> scan(final Path projectRoot,
            final List<String> includePatterns,
            final List<String> excludePatterns) throws IOException {

        Preconditions.requireNonNull(projectRoot, "Project root is required");

        if (!Files.isDirectory(projectRoot)) {
            LOG.warn("Project root is not a directory: {}", projectRoot);
            return List.of();
        }

        final List<PathMatcher> includes = compile(includePatterns);
        final List<PathMatcher> excludes = compile(excludePatterns);
        final List<String> files = new ArrayList<>();

        Files.walkFileTree(projectRoot, new SimpleFileVisitor<>() {

            @Override
            public FileVisitResult preVisitDirectory(final Path dir,
                    final BasicFileAttributes attrs) {
                if (dir.equals(projectRoot)) {
                    return FileVisitResult.CONTINUE;
                }
                final String name = dir.getFileName().toString();
                if (name.startsWith(".")
                        || skippedDirectories.contains(name)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(final Path file,
                    final BasicFileAttributes attrs) {
                final String name = file.getFileName().toString();
                if (attrs.isRegularFile() && name.endsWith(extension)
                        && !name.endsWith(testSuffix)) {
                    final String relative = toRelative(projectRoot, file);
                    if (isSelected(relative, includes, excludes)) {
                        files.add(relative);
                    } else {
                        LOG.debug("Skipping {} by pattern", relative);
                    }
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(final Path file,
                    final IOException e) {
                LOG.warn("Cannot access {}: {}", file, e.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });

        files.sort(String::compareTo);
        return files;
    }

    /**
     * Converts a file under the root to a {@code /}-separated relative path.
     *
     * @param projectRoot the project root
     * @param file a file under the root
     * @return the relative path
     */
    public static String toRelative(final Path projectRoot, final Path file) {
        return projectRoot.relativize(file).toString().replace('\\', '/');
    }

    private static List<PathMatcher> compile(final List<String> patterns) {
        final List<PathMatcher> matchers = new ArrayList<>();
        if (patterns == null) {
            return matchers;
        }
        for (final String pattern : patterns) {
            if (pattern != null && !pattern.isBlank()) {
                matchers.add(FileSystems.getDefault().getPathMatcher(
                        "glob:" + pattern.trim()));
            }
        }
        return matchers;
    }

    private static boolean isSelected(final String relative,
            final List<PathMatcher> includes,
            final List<PathMatcher> excludes) {

        final Path relativePath = Path.of(relative);
        final Path fileName = relativePath.getFileName();

        for (final PathMatcher exclude : excludes) {
            if (exclude.matches(relativePath) || exclude.matches(fileName)) {
                return false;
            }
            for (Path parent = relativePath.getParent(); parent != null;
                    parent = parent.getParent()) {
                if (exclude.matches(parent.getFileName())) {
                    return false;
                }
            }
        }

        if (includes.isEmpty()) {
            return true;
        }
        for (final PathMatcher include : includes) {
            if (include.matches(relativePath) || include.matches(fileName)) {
                return true;
            }
        }
        return false;
    }

}
