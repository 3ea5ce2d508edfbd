package co.fanki.goindexer.indexing.application;

/**
 * How a repository gets indexed.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum IndexingStrategy {

    /** Structural analysis by the in-process construct indexer. */
    GO_NATIVE("go_native"),

    /** The project does not qualify; a generic packer is expected. */
    FALLBACK("repomix");

    private final String label;

    IndexingStrategy(final String theLabel) {
        this.label = theLabel;
    }

    /**
     * Returns the label recorded as indexer type.
     *
     * @return the label
     */
    public String label() {
        return label;
    }

}
