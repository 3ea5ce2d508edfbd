package co.fanki.goindexer.indexing.domain;

import co.fanki.goindexer.shared.Preconditions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Folds per-file analyses into per-package analyses.
 *
 * <p>Files are visited in path order, so the grouped lists and the
 * package path do not depend on the order in which the analyses were
 * produced. Empty input yields an empty map.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class PackageAggregator {

    /**
     * Groups constructs by package name and kind.
     *
     * @param files the analysed files, in any order
     * @return the packages, sorted by package name
     */
    public SortedMap<String, PackageAnalysis> aggregate(
            final List<FileAnalysis> files) {

        Preconditions.requireNonNull(files, "File analyses are required");

        final List<FileAnalysis> ordered = new ArrayList<>(files);
        ordered.sort(Comparator.comparing(FileAnalysis::filePath));

        final Map<String, Accumulator> byPackage = new LinkedHashMap<>();

        for (final FileAnalysis file : ordered) {
            final Accumulator acc = byPackage.computeIfAbsent(
                    file.packageName(),
                    name -> new Accumulator(parentOf(file.filePath())));
            acc.files.add(file.filePath());

            for (final Construct construct : file.constructs()) {
                acc.all.computeIfAbsent(construct.kind(),
                        kind -> new ArrayList<>()).add(construct);
                if (construct.exported()) {
                    acc.exported.computeIfAbsent(construct.kind(),
                            kind -> new ArrayList<>()).add(construct);
                }
            }
        }

        final SortedMap<String, PackageAnalysis> result = new TreeMap<>();
        byPackage.forEach((name, acc) -> result.put(name,
                new PackageAnalysis(name, acc.path, acc.files, acc.all,
                        acc.exported)));

        return Collections.unmodifiableSortedMap(result);
    }

    private static String parentOf(final String filePath) {
        final int slash = filePath.lastIndexOf('/');
        return slash < 0 ? "." : filePath.substring(0, slash);
    }

    /** Mutable state for one package while folding. */
    private static final class Accumulator {

        private final String path;
        private final TreeSet<String> files = new TreeSet<>();
        private final Map<ConstructKind, List<Construct>> all =
                new EnumMap<>(ConstructKind.class);
        private final Map<ConstructKind, List<Construct>> exported =
                new EnumMap<>(ConstructKind.class);

        private Accumulator(final String thePath) {
            this.path = thePath;
        }
    }

}
