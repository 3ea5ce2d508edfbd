package co.fanki.goindexer.indexing.domain;

import java.util.List;

/**
 * Run-wide settings for one indexing run.
 *
 * <p>Passed explicitly to every stage that needs it; no stage keeps the
 * visibility flag as state of its own.</p>
 *
 * @param includePatterns glob patterns a file must match to be analysed;
 *        empty means every file
 * @param excludePatterns glob patterns removing files or directories
 * @param includeNonExported whether non-exported constructs are rendered
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record IndexingOptions(
        List<String> includePatterns,
        List<String> excludePatterns,
        boolean includeNonExported
) {

    /** Freezes the pattern lists. */
    public IndexingOptions {
        includePatterns = includePatterns == null
                ? List.of() : List.copyOf(includePatterns);
        excludePatterns = excludePatterns == null
                ? List.of() : List.copyOf(excludePatterns);
    }

    /**
     * Options with no patterns and exported constructs only.
     *
     * @return the default options
     */
    public static IndexingOptions defaults() {
        return new IndexingOptions(List.of(), List.of(), false);
    }

    /**
     * Copy of these options with another visibility flag.
     *
     * @param value the new flag
     * @return the new options
     */
    public IndexingOptions withIncludeNonExported(final boolean value) {
        return new IndexingOptions(includePatterns, excludePatterns, value);
    }

}
