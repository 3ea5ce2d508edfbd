package co.fanki.goindexer.indexing.application;

import co.fanki.goindexer.indexing.domain.SourceFileScanner;
import co.fanki.goindexer.indexing.domain.SyntheticDocument;
import co.fanki.goindexer.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Finds README files anywhere in a repository and turns them into
 * {@link IndexedFile}s.
 *
 * <p>Directories deeper than {@value #MAX_DEPTH} levels, hidden
 * directories and common build or dependency directories are not
 * entered. Files larger than {@value #MAX_FILE_SIZE} bytes are skipped
 * with a warning.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ReadmeCollector {

    private static final Logger LOG = LoggerFactory.getLogger(
            ReadmeCollector.class);

    /** Deepest directory level searched. */
    public static final int MAX_DEPTH = 10;

    /** Largest README read, 5 MiB. */
    public static final long MAX_FILE_SIZE = 5L * 1024 * 1024;

    private static final Set<String> README_NAMES = Set.of(
            "README.md", "readme.md", "Readme.md", "ReadMe.md",
            "README.txt", "readme.txt", "Readme.txt", "ReadMe.txt",
            "README.rst", "readme.rst", "Readme.rst", "ReadMe.rst",
            "README", "readme", "Readme", "ReadMe",
            "README.adoc", "readme.adoc", "Readme.adoc",
            "README.org", "readme.org", "Readme.org");

    private static final Set<String> SKIPPED_DIRECTORIES = Set.of(
            "node_modules", "vendor", "__pycache__", "target", "build",
            "dist");

    /**
     * Collects the README files of a repository.
     *
     * @param repositoryId the repository id recorded on each file
     * @param root the repository root
     * @return the README files, sorted by path
     * @throws IOException if the tree cannot be walked
     */
    public List<IndexedFile> collect(final String repositoryId,
            final Path root) throws IOException {

        Preconditions.requireNonBlank(repositoryId,
                "Repository id is required");
        Preconditions.requireNonNull(root, "Repository root is required");

        final List<IndexedFile> readmes = new ArrayList<>();

        Files.walkFileTree(root, new SimpleFileVisitor<>() {

            @Override
            public FileVisitResult preVisitDirectory(final Path dir,
                    final BasicFileAttributes attrs) {
                if (dir.equals(root)) {
                    return FileVisitResult.CONTINUE;
                }
                final String name = dir.getFileName().toString();
                if (depthOf(root.relativize(dir)) > MAX_DEPTH
                        || name.startsWith(".")
                        || SKIPPED_DIRECTORIES.contains(name)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(final Path file,
                    final BasicFileAttributes attrs) {
                final String name = file.getFileName().toString();
                if (!attrs.isRegularFile() || !README_NAMES.contains(name)) {
                    return FileVisitResult.CONTINUE;
                }
                final String relative = SourceFileScanner.toRelative(root,
                        file);
                if (attrs.size() > MAX_FILE_SIZE) {
                    LOG.warn("Skipping large README {} ({} bytes)",
                            relative, attrs.size());
                    return FileVisitResult.CONTINUE;
                }
                try {
                    readmes.add(toIndexedFile(repositoryId, relative, name,
                            Files.readAllBytes(file)));
                    LOG.debug("Discovered README {} ({} bytes)", relative,
                            attrs.size());
                } catch (final IOException e) {
                    LOG.warn("Failed to read README {}: {}", relative,
                            e.getMessage());
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

        readmes.sort((a, b) -> a.path().compareTo(b.path()));
        LOG.info("Found {} README files in {}", readmes.size(), repositoryId);
        return readmes;
    }

    private static IndexedFile toIndexedFile(final String repositoryId,
            final String relative, final String name, final byte[] bytes) {
        final int slash = relative.lastIndexOf('/');
        final String folder = slash < 0 ? "." : relative.substring(0, slash);
        final int depth = (int) relative.chars().filter(c -> c == '/').count();

        return new IndexedFile(relative,
                new String(bytes, StandardCharsets.UTF_8),
                SyntheticDocument.fingerprint(bytes),
                bytes.length,
                detectLanguage(name),
                repositoryId,
                Map.of("file_type", "readme",
                        "subfolder_path", folder,
                        "original_name", name,
                        "folder_depth", String.valueOf(depth)));
    }

    /**
     * Maps a README file name to its format.
     *
     * @param name the file name
     * @return markdown, rst, asciidoc, org or text
     */
    static String detectLanguage(final String name) {
        final String lower = name.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".md")) {
            return "markdown";
        }
        if (lower.endsWith(".rst")) {
            return "rst";
        }
        if (lower.endsWith(".adoc")) {
            return "asciidoc";
        }
        if (lower.endsWith(".org")) {
            return "org";
        }
        return "text";
    }

    private static int depthOf(final Path relativeDir) {
        return relativeDir.getNameCount() - 1;
    }

}
