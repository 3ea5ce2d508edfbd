package co.fanki.goindexer.indexing.domain;

import co.fanki.goindexer.shared.Preconditions;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * All constructs declared under one package name, across every analysed
 * file that declares it.
 *
 * <p>Keeps two views: every construct by kind, and the exported subset
 * by kind. Both views and the per-kind summary iterate in
 * {@link ConstructKind} priority order; kinds without constructs are
 * absent.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class PackageAnalysis {

    private final String packageName;

    private final String path;

    private final SortedSet<String> files;

    private final Map<ConstructKind, List<Construct>> constructsByKind;

    private final Map<ConstructKind, List<Construct>> exportedOnlyByKind;

    private final Map<ConstructKind, Integer> summary;

    /**
     * Creates a package analysis.
     *
     * @param thePackageName the declared package name
     * @param thePath the directory of the first file seen for the package
     * @param theFiles the files declaring the package
     * @param theConstructsByKind every construct, grouped by kind
     * @param theExportedOnlyByKind exported constructs, grouped by kind
     */
    public PackageAnalysis(final String thePackageName, final String thePath,
            final SortedSet<String> theFiles,
            final Map<ConstructKind, List<Construct>> theConstructsByKind,
            final Map<ConstructKind, List<Construct>> theExportedOnlyByKind) {
        Preconditions.requireNonNull(thePackageName,
                "Package name is required");
        Preconditions.requireNonNull(theFiles, "Files are required");
        Preconditions.requireNonNull(theConstructsByKind,
                "Constructs are required");
        Preconditions.requireNonNull(theExportedOnlyByKind,
                "Exported constructs are required");

        this.packageName = thePackageName;
        this.path = thePath == null ? "" : thePath;
        this.files = Collections.unmodifiableSortedSet(
                new TreeSet<>(theFiles));
        this.constructsByKind = freeze(theConstructsByKind);
        this.exportedOnlyByKind = freeze(theExportedOnlyByKind);

        final Map<ConstructKind, Integer> counts =
                new EnumMap<>(ConstructKind.class);
        constructsByKind.forEach((kind, list) -> counts.put(kind, list.size()));
        this.summary = Collections.unmodifiableMap(counts);
    }

    private static Map<ConstructKind, List<Construct>> freeze(
            final Map<ConstructKind, List<Construct>> source) {
        final Map<ConstructKind, List<Construct>> copy =
                new EnumMap<>(ConstructKind.class);
        source.forEach((kind, list) -> {
            if (!list.isEmpty()) {
                copy.put(kind, List.copyOf(list));
            }
        });
        return Collections.unmodifiableMap(copy);
    }

    public String packageName() {
        return packageName;
    }

    public String path() {
        return path;
    }

    public SortedSet<String> files() {
        return files;
    }

    public Map<ConstructKind, List<Construct>> constructsByKind() {
        return constructsByKind;
    }

    public Map<ConstructKind, List<Construct>> exportedOnlyByKind() {
        return exportedOnlyByKind;
    }

    public Map<ConstructKind, Integer> summary() {
        return summary;
    }

    /**
     * Selects the view matching the visibility flag.
     *
     * @param includeNonExported true for every construct, false for the
     *        exported subset
     * @return the constructs by kind
     */
    public Map<ConstructKind, List<Construct>> view(
            final boolean includeNonExported) {
        return includeNonExported ? constructsByKind : exportedOnlyByKind;
    }

}
