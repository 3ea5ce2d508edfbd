package co.fanki.goindexer.indexing.domain.golang;

import co.fanki.goindexer.indexing.domain.SourceFileScanner;
import co.fanki.goindexer.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

/**
 * Decides whether a directory is a Go project worth analysing.
 *
 * <p>A directory qualifies when it holds a {@code go.mod} manifest at its
 * root, or when it holds at least {@value #MIN_SOURCE_FILES} production
 * {@code .go} files anywhere below it. Test files, hidden directories and
 * the {@code vendor}, {@code node_modules} and {@code testdata}
 * directories never count. Include and exclude patterns play no part.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class GoProjectDetector {

    private static final Logger LOG = LoggerFactory.getLogger(
            GoProjectDetector.class);

    /** Name of the Go module manifest. */
    public static final String MANIFEST = "go.mod";

    /** Files needed to qualify without a manifest. */
    public static final int MIN_SOURCE_FILES = 3;

    /** Source file extension. */
    static final String EXTENSION = ".go";

    /** Test file suffix. */
    static final String TEST_SUFFIX = "_test.go";

    /** Directories never entered. */
    static final Set<String> SKIPPED_DIRECTORIES = Set.of(
            "vendor", "node_modules", "testdata");

    private final SourceFileScanner scanner;

    /** Creates a detector with the standard Go scanner. */
    public GoProjectDetector() {
        this(newScanner());
    }

    /**
     * Creates a detector over a given scanner.
     *
     * @param theScanner the scanner, never null
     */
    public GoProjectDetector(final SourceFileScanner theScanner) {
        this.scanner = Preconditions.requireNonNull(theScanner,
                "Scanner is required");
    }

    /**
     * Creates the scanner listing production Go files.
     *
     * @return a new scanner
     */
    static SourceFileScanner newScanner() {
        return new SourceFileScanner(EXTENSION, TEST_SUFFIX,
                SKIPPED_DIRECTORIES);
    }

    /**
     * Checks a directory.
     *
     * @param projectRoot the directory to inspect
     * @return true if it is a Go project
     * @throws IOException if the tree cannot be walked
     */
    public boolean isGoProject(final Path projectRoot) throws IOException {
        Preconditions.requireNonNull(projectRoot, "Project root is required");

        if (!Files.isDirectory(projectRoot)) {
            LOG.debug("{} is not a directory", projectRoot);
            return false;
        }
        if (Files.isRegularFile(projectRoot.resolve(MANIFEST))) {
            LOG.debug("Found {} in {}", MANIFEST, projectRoot);
            return true;
        }

        final int count = scanner.scan(projectRoot).size();
        LOG.debug("Found {} Go files in {} without {}", count, projectRoot,
                MANIFEST);
        return count >= MIN_SOURCE_FILES;
    }

}
