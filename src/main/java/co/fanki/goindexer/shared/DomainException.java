package co.fanki.goindexer.shared;

/**
 * Base of the failures that stop an indexing run.
 *
 * <p>Every failure carries one of the indexer's error codes, for example
 * {@code INVALID_CONFIG} or {@code NO_FILES_FOUND}, so the command line
 * and callers can tell the kinds apart without parsing messages.
 * Per-file problems are not domain exceptions: they are recorded and the
 * run goes on.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public abstract class DomainException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String errorCode;

    /**
     * Creates a domain exception.
     *
     * @param message the error message
     * @param theErrorCode the error code, never blank
     */
    protected DomainException(final String message,
            final String theErrorCode) {
        super(message);
        this.errorCode = Preconditions.requireNonBlank(theErrorCode,
                "Error code is required");
    }

    /**
     * Creates a domain exception with a cause.
     *
     * @param message the error message
     * @param theErrorCode the error code, never blank
     * @param cause the underlying cause
     */
    protected DomainException(final String message,
            final String theErrorCode, final Throwable cause) {
        super(message, cause);
        this.errorCode = Preconditions.requireNonBlank(theErrorCode,
                "Error code is required");
    }

    /**
     * Returns the error code for this exception.
     *
     * @return the error code
     */
    public String getErrorCode() {
        return errorCode;
    }

    /**
     * Describes the failure as {@code CODE: message}.
     *
     * @return the description
     */
    public String describe() {
        return errorCode + ": " + getMessage();
    }

}
