package co.fanki.goindexer.indexing.domain;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.SortedMap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link PackageAggregator}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class PackageAggregatorTest {

    private final PackageAggregator aggregator = new PackageAggregator();

    @Test
    void whenAggregating_givenFilesOfSamePackage_shouldMergeThem() {
        final FileAnalysis a = file("store/a.go", "store",
                func("Open", "store/a.go"), func("close", "store/a.go"));
        final FileAnalysis b = file("store/b.go", "store",
                func("Get", "store/b.go"));

        final SortedMap<String, PackageAnalysis> packages =
                aggregator.aggregate(List.of(b, a));

        final PackageAnalysis store = packages.get("store");
        assertEquals(List.of("store/a.go", "store/b.go"),
                List.copyOf(store.files()));
        assertEquals("store", store.path());
        assertEquals(3, store.constructsByKind().get(ConstructKind.FUNC)
                .size());
        assertEquals(2, store.exportedOnlyByKind().get(ConstructKind.FUNC)
                .size());
        assertEquals(3, store.summary().get(ConstructKind.FUNC));
    }

    @Test
    void whenAggregating_givenAnyOrder_shouldProduceSameResult() {
        final FileAnalysis a = file("x/a.go", "x", func("A", "x/a.go"));
        final FileAnalysis b = file("y/b.go", "x", func("B", "y/b.go"));

        final PackageAnalysis forward = aggregator.aggregate(List.of(a, b))
                .get("x");
        final PackageAnalysis backward = aggregator.aggregate(List.of(b, a))
                .get("x");

        assertEquals(forward.path(), backward.path());
        assertEquals("x", forward.path());
        assertEquals(forward.constructsByKind(), backward.constructsByKind());
    }

    @Test
    void whenAggregating_givenRootFile_shouldUseDotAsPath() {
        final PackageAnalysis main = aggregator.aggregate(List.of(
                file("main.go", "main", func("main", "main.go"))))
                .get("main");

        assertEquals(".", main.path());
        assertTrue(main.exportedOnlyByKind().isEmpty());
        assertFalse(main.constructsByKind().isEmpty());
    }

    @Test
    void whenAggregating_givenNothing_shouldReturnEmptyMap() {
        assertTrue(aggregator.aggregate(List.of()).isEmpty());
    }

    @Test
    void whenAggregating_givenSeveralPackages_shouldSortThemByName() {
        final SortedMap<String, PackageAnalysis> packages =
                aggregator.aggregate(List.of(
                        file("z/z.go", "zeta"),
                        file("a/a.go", "alpha"),
                        file("m/m.go", "mu")));

        assertEquals(List.of("alpha", "mu", "zeta"),
                List.copyOf(packages.keySet()));
        assertTrue(packages.get("mu").summary().isEmpty());
    }

    static FileAnalysis file(final String path, final String pkg,
            final Construct... constructs) {
        return new FileAnalysis(path, pkg, List.of(constructs));
    }

    static Construct func(final String name, final String path) {
        return Construct.builder(ConstructKind.FUNC, name)
                .signature("func " + name + "()")
                .location("", path, 1)
                .build();
    }

}
