package co.fanki.goindexer.indexing.domain;

import co.fanki.goindexer.shared.DomainException;

/**
 * Raised when an indexing run cannot produce a result.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class IndexingException extends DomainException {

    private static final long serialVersionUID = 1L;

    /** The run configuration or arguments are unusable. */
    public static final String INVALID_CONFIG = "INVALID_CONFIG";

    /** Indexing is switched off for the repository. */
    public static final String INDEXING_DISABLED = "INDEXING_DISABLED";

    /** The project tree could not be walked. */
    public static final String DISCOVERY_FAILED = "DISCOVERY_FAILED";

    /**
     * Creates an indexing exception.
     *
     * @param message the error message
     * @param errorCode the error code
     */
    public IndexingException(final String message, final String errorCode) {
        super(message, errorCode);
    }

    /**
     * Creates an indexing exception with a cause.
     *
     * @param message the error message
     * @param errorCode the error code
     * @param cause the underlying cause
     */
    public IndexingException(final String message, final String errorCode,
            final Throwable cause) {
        super(message, errorCode, cause);
    }

}
