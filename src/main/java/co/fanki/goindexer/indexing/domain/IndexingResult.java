package co.fanki.goindexer.indexing.domain;

/**
 * Outcome of one engine run: the rendered document and the analysis it
 * was rendered from.
 *
 * @param document the synthetic document
 * @param analysis the analysis, for callers that need counts or failures
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record IndexingResult(
        SyntheticDocument document,
        RepositoryAnalysis analysis
) {
}
