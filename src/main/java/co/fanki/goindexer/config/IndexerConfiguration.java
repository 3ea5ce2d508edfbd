package co.fanki.goindexer.config;

import co.fanki.goindexer.indexing.application.ReadmeCollector;
import co.fanki.goindexer.indexing.domain.ConstructIndexer;
import co.fanki.goindexer.indexing.domain.DocumentSynthesizer;
import co.fanki.goindexer.indexing.domain.SourceAnalyzer;
import co.fanki.goindexer.indexing.domain.golang.GoSourceAnalyzer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the construct indexing engine.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class IndexerConfiguration {

    /**
     * Creates the Go source analyzer.
     *
     * @param parallelism the number of files parsed at once
     * @return the analyzer
     */
    @Bean
    public SourceAnalyzer sourceAnalyzer(
            @Value("${goindexer.parallelism:1}") final int parallelism) {
        return new GoSourceAnalyzer(parallelism);
    }

    /**
     * Creates the document synthesizer for the analyzer's language.
     *
     * @param analyzer the source analyzer
     * @return the synthesizer
     */
    @Bean
    public DocumentSynthesizer documentSynthesizer(
            final SourceAnalyzer analyzer) {
        return new DocumentSynthesizer(analyzer.displayName(),
                analyzer.testFilePattern());
    }

    /**
     * Creates the construct indexer.
     *
     * @param analyzer the source analyzer
     * @param synthesizer the document synthesizer
     * @return the indexer
     */
    @Bean
    public ConstructIndexer constructIndexer(final SourceAnalyzer analyzer,
            final DocumentSynthesizer synthesizer) {
        return new ConstructIndexer(analyzer, synthesizer);
    }

    /**
     * Creates the README collector.
     *
     * @return the collector
     */
    @Bean
    public ReadmeCollector readmeCollector() {
        return new ReadmeCollector();
    }

}
