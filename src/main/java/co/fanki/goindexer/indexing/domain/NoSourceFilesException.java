package co.fanki.goindexer.indexing.domain;

/**
 * Raised when a project qualified for structural analysis but no source
 * file was left after discovery and pattern filtering.
 *
 * <p>Unlike an ineligible project, this is fatal for the run.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class NoSourceFilesException extends IndexingException {

    private static final long serialVersionUID = 1L;

    /** Error code of this exception. */
    public static final String NO_FILES_FOUND = "NO_FILES_FOUND";

    /**
     * Creates the exception for a project root.
     *
     * @param projectRoot the root that yielded no files
     */
    public NoSourceFilesException(final String projectRoot) {
        super("No source files found in " + projectRoot, NO_FILES_FOUND);
    }

}
