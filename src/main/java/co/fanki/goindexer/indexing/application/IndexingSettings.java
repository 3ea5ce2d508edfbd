package co.fanki.goindexer.indexing.application;

import co.fanki.goindexer.indexing.domain.IndexingOptions;
import co.fanki.goindexer.shared.Preconditions;

/**
 * Per-repository indexing configuration.
 *
 * @param enabled whether indexing may run at all
 * @param options the engine options (patterns and visibility)
 * @param writeDocument whether the synthetic document is written into
 *        the repository root
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record IndexingSettings(
        boolean enabled,
        IndexingOptions options,
        boolean writeDocument
) {

    /** Validates the options. */
    public IndexingSettings {
        Preconditions.requireNonNull(options, "Options are required");
    }

    /**
     * Enabled settings with default options that write the document.
     *
     * @return the settings
     */
    public static IndexingSettings defaults() {
        return new IndexingSettings(true, IndexingOptions.defaults(), true);
    }

}
