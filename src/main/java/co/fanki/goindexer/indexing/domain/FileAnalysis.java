package co.fanki.goindexer.indexing.domain;

import co.fanki.goindexer.shared.Preconditions;

import java.util.List;

/**
 * The constructs extracted from one successfully parsed source file.
 *
 * <p>Files that cannot be read or parsed never produce a FileAnalysis;
 * they are reported as {@link FileFailure} instead.</p>
 *
 * @param filePath the file path relative to the project root
 * @param packageName the package declared by the file
 * @param constructs the constructs, in source order
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record FileAnalysis(
        String filePath,
        String packageName,
        List<Construct> constructs
) {

    /** Validates the path and freezes the construct list. */
    public FileAnalysis {
        Preconditions.requireNonBlank(filePath, "File path is required");
        packageName = packageName == null ? "" : packageName;
        constructs = constructs == null ? List.of() : List.copyOf(constructs);
    }

    /**
     * Returns the constructs visible under the given visibility flag.
     *
     * @param includeNonExported whether non-exported constructs count
     * @return the visible constructs, in source order
     */
    public List<Construct> visibleConstructs(
            final boolean includeNonExported) {
        if (includeNonExported) {
            return constructs;
        }
        return constructs.stream().filter(Construct::exported).toList();
    }

}
