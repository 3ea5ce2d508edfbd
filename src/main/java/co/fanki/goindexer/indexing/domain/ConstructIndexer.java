package co.fanki.goindexer.indexing.domain;

import co.fanki.goindexer.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.TreeMap;

/**
 * Runs the whole engine for one language: analyse a project and render
 * the synthetic document.
 *
 * <p>The document metadata carries the indexer type, the number of
 * discovered files, the number of packages and, for every construct kind
 * present, its count across all constructs regardless of visibility.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ConstructIndexer {

    private static final Logger LOG = LoggerFactory.getLogger(
            ConstructIndexer.class);

    private final SourceAnalyzer analyzer;

    private final DocumentSynthesizer synthesizer;

    /**
     * Creates an indexer whose document speaks the analyzer's language.
     *
     * @param theAnalyzer the language analyzer, never null
     */
    public ConstructIndexer(final SourceAnalyzer theAnalyzer) {
        this(theAnalyzer, new DocumentSynthesizer(
                Preconditions.requireNonNull(theAnalyzer,
                        "Analyzer is required").displayName(),
                theAnalyzer.testFilePattern()));
    }

    /**
     * Creates an indexer.
     *
     * @param theAnalyzer the language analyzer, never null
     * @param theSynthesizer the document renderer, never null
     */
    public ConstructIndexer(final SourceAnalyzer theAnalyzer,
            final DocumentSynthesizer theSynthesizer) {
        this.analyzer = Preconditions.requireNonNull(theAnalyzer,
                "Analyzer is required");
        this.synthesizer = Preconditions.requireNonNull(theSynthesizer,
                "Synthesizer is required");
    }

    /**
     * Returns the identifier of the indexed language.
     *
     * @return the language (e.g., "go")
     */
    public String language() {
        return analyzer.language();
    }

    /**
     * Decides whether a directory qualifies for structural analysis.
     *
     * @param projectRoot the directory
     * @return true if the project should be indexed by this engine
     * @throws IOException if the directory cannot be inspected
     */
    public boolean isEligible(final Path projectRoot) throws IOException {
        return analyzer.isEligible(projectRoot);
    }

    /**
     * Analyses a project and renders its synthetic document.
     *
     * @param projectRoot the project root
     * @param options the run options
     * @return the document and the analysis behind it
     * @throws NoSourceFilesException if no source file is selected
     * @throws IOException if the tree cannot be walked
     */
    public IndexingResult index(final Path projectRoot,
            final IndexingOptions options) throws IOException {

        final RepositoryAnalysis analysis = analyzer.analyze(projectRoot,
                options);
        final String content = synthesizer.render(analysis,
                options.includeNonExported());
        final SyntheticDocument document = SyntheticDocument.of(content,
                metadata(analysis));

        LOG.info("Rendered {} of {} bytes from {} files",
                document.path(), document.size(),
                analysis.analyzedFiles().size());

        return new IndexingResult(document, analysis);
    }

    private Map<String, String> metadata(final RepositoryAnalysis analysis) {
        final Map<String, String> metadata = new TreeMap<>();
        final int discovered = analysis.analyzedFiles().size()
                + analysis.failures().size();
        metadata.put("indexer_type", analyzer.language() + "_native");
        metadata.put(analyzer.language() + "_files_count",
                String.valueOf(discovered));
        metadata.put("packages_count",
                String.valueOf(analysis.packages().size()));
        for (final ConstructKind kind : ConstructKind.values()) {
            final int count = analysis.count(kind);
            if (count > 0) {
                metadata.put(kind.label() + "_count", String.valueOf(count));
            }
        }
        return metadata;
    }

}
