package co.fanki.goindexer.indexing.domain;

import java.util.List;
import java.util.SortedMap;

/**
 * Everything learned from one pass over a project, before rendering.
 *
 * @param analyzedFiles relative paths of the files that parsed, sorted
 * @param files the per-file analyses, sorted by path
 * @param packages the per-package analyses, sorted by package name
 * @param failures the files skipped because of read or parse errors
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record RepositoryAnalysis(
        List<String> analyzedFiles,
        List<FileAnalysis> files,
        SortedMap<String, PackageAnalysis> packages,
        List<FileFailure> failures
) {

    /** Freezes the lists. */
    public RepositoryAnalysis {
        analyzedFiles = List.copyOf(analyzedFiles);
        files = List.copyOf(files);
        failures = List.copyOf(failures);
    }

    /**
     * Counts every construct across all files, regardless of visibility.
     *
     * @param kind the kind to count
     * @return the count
     */
    public int count(final ConstructKind kind) {
        return packages.values().stream()
                .mapToInt(pkg -> pkg.summary().getOrDefault(kind, 0))
                .sum();
    }

}
