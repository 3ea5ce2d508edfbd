package co.fanki.goindexer.indexing.domain.golang;

import co.fanki.goindexer.indexing.domain.SourceSyntaxException;

/**
 * Raised when Go source text is not syntactically valid.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class GoParseException extends SourceSyntaxException {

    private static final long serialVersionUID = 1L;

    private final int line;

    private final int column;

    /**
     * Creates a parse exception at a position.
     *
     * @param message what was wrong
     * @param theLine the 1-based line
     * @param theColumn the 1-based column
     */
    public GoParseException(final String message, final int theLine,
            final int theColumn) {
        super(theLine + ":" + theColumn + ": " + message);
        this.line = theLine;
        this.column = theColumn;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

}
