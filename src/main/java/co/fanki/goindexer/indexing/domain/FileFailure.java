package co.fanki.goindexer.indexing.domain;

/**
 * A source file skipped during analysis because it could not be read or
 * parsed.
 *
 * @param filePath the file path relative to the project root
 * @param reason a human readable reason, including the position of a
 *        syntax error when known
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record FileFailure(String filePath, String reason) {
}
