package co.fanki.goindexer.indexing.domain.golang;

import co.fanki.goindexer.indexing.domain.FileAnalysis;
import co.fanki.goindexer.indexing.domain.IndexingOptions;
import co.fanki.goindexer.indexing.domain.SourceAnalyzer;
import co.fanki.goindexer.indexing.domain.SourceFileScanner;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Go-specific implementation of {@link SourceAnalyzer}.
 *
 * <p>Parses each {@code .go} file in-process with the tree-sitter Go
 * grammar ({@link GoSyntaxTree}) and extracts its declarations with
 * {@link GoConstructExtractor}. No Go toolchain is needed.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class GoSourceAnalyzer extends SourceAnalyzer {

    private final SourceFileScanner scanner;

    private final GoProjectDetector detector;

    private final GoConstructExtractor extractor;

    /** Creates an analyzer that parses one file at a time. */
    public GoSourceAnalyzer() {
        this(1);
    }

    /**
     * Creates an analyzer.
     *
     * @param parallelism the number of files parsed at once, at least 1
     */
    public GoSourceAnalyzer(final int parallelism) {
        super(parallelism);
        this.scanner = GoProjectDetector.newScanner();
        this.detector = new GoProjectDetector(scanner);
        this.extractor = new GoConstructExtractor();
    }

    /** {@inheritDoc} */
    @Override
    public String language() {
        return "go";
    }

    /** {@inheritDoc} */
    @Override
    public String displayName() {
        return "Go";
    }

    /** {@inheritDoc} */
    @Override
    public String testFilePattern() {
        return "*" + GoProjectDetector.TEST_SUFFIX;
    }

    /** {@inheritDoc} */
    @Override
    public boolean isEligible(final Path projectRoot) throws IOException {
        return detector.isGoProject(projectRoot);
    }

    /** {@inheritDoc} */
    @Override
    protected List<String> discoverFiles(final Path projectRoot,
            final IndexingOptions options) throws IOException {
        return scanner.scan(projectRoot, options.includePatterns(),
                options.excludePatterns());
    }

    /** {@inheritDoc} */
    @Override
    protected FileAnalysis analyzeFile(final Path projectRoot,
            final String relativePath) throws IOException, GoParseException {
        final String source = Files.readString(
                projectRoot.resolve(relativePath), StandardCharsets.UTF_8);
        final GoSyntaxTree tree = GoSyntaxTree.parse(source);
        return new FileAnalysis(relativePath, tree.packageName(),
                extractor.extract(tree, relativePath));
    }

}
