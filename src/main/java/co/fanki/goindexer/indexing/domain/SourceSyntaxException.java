package co.fanki.goindexer.indexing.domain;

/**
 * Raised when a source file is not syntactically valid for its language.
 *
 * <p>Checked, because the analysis template recovers from it per file:
 * the file is skipped and the run continues.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class SourceSyntaxException extends Exception {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a syntax exception.
     *
     * @param message the error message
     */
    public SourceSyntaxException(final String message) {
        super(message);
    }

}
