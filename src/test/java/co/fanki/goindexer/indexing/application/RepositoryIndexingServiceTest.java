package co.fanki.goindexer.indexing.application;

import co.fanki.goindexer.indexing.domain.Construct;
import co.fanki.goindexer.indexing.domain.ConstructIndexer;
import co.fanki.goindexer.indexing.domain.ConstructKind;
import co.fanki.goindexer.indexing.domain.FileAnalysis;
import co.fanki.goindexer.indexing.domain.FileFailure;
import co.fanki.goindexer.indexing.domain.IndexingException;
import co.fanki.goindexer.indexing.domain.IndexingOptions;
import co.fanki.goindexer.indexing.domain.IndexingResult;
import co.fanki.goindexer.indexing.domain.NoSourceFilesException;
import co.fanki.goindexer.indexing.domain.PackageAggregator;
import co.fanki.goindexer.indexing.domain.RepositoryAnalysis;
import co.fanki.goindexer.indexing.domain.SyntheticDocument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link RepositoryIndexingService}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class RepositoryIndexingServiceTest {

    @TempDir
    Path root;

    private ConstructIndexer indexer;

    private ReadmeCollector readmeCollector;

    private RepositoryIndexingService service;

    @BeforeEach
    void setUp() {
        indexer = createMock(ConstructIndexer.class);
        readmeCollector = createMock(ReadmeCollector.class);
        service = new RepositoryIndexingService(indexer, readmeCollector);
    }

    @Test
    void whenIndexing_givenBlankId_shouldFailWithInvalidConfig() {
        replay(indexer, readmeCollector);

        final IndexingException error = assertThrows(IndexingException.class,
                () -> service.indexRepository(" ", root,
                        IndexingSettings.defaults()));

        assertEquals(IndexingException.INVALID_CONFIG, error.getErrorCode());
        verify(indexer, readmeCollector);
    }

    @Test
    void whenIndexing_givenNullRoot_shouldFailWithInvalidConfig() {
        replay(indexer, readmeCollector);

        final IndexingException error = assertThrows(IndexingException.class,
                () -> service.indexRepository("repo", null,
                        IndexingSettings.defaults()));

        assertEquals(IndexingException.INVALID_CONFIG, error.getErrorCode());
    }

    @Test
    void whenIndexing_givenDisabledSettings_shouldFailWithDisabled() {
        replay(indexer, readmeCollector);

        final IndexingException error = assertThrows(IndexingException.class,
                () -> service.indexRepository("repo", root,
                        new IndexingSettings(false,
                                IndexingOptions.defaults(), true)));

        assertEquals(IndexingException.INDEXING_DISABLED,
                error.getErrorCode());
        verify(indexer, readmeCollector);
    }

    @Test
    void whenIndexing_givenIneligibleProject_shouldReturnEmpty()
            throws IOException {
        expect(indexer.isEligible(root)).andReturn(false);
        replay(indexer, readmeCollector);

        assertTrue(service.indexRepository("repo", root,
                IndexingSettings.defaults()).isEmpty());
        verify(indexer, readmeCollector);
    }

    @Test
    void whenDeterminingStrategy_givenUnreadableRoot_shouldFallBack()
            throws IOException {
        expect(indexer.isEligible(root)).andThrow(new IOException("denied"));
        replay(indexer, readmeCollector);

        assertEquals(IndexingStrategy.FALLBACK,
                service.determineStrategy(root));
        verify(indexer, readmeCollector);
    }

    @Test
    void whenIndexing_givenNoSourceFiles_shouldReturnEmpty()
            throws IOException {
        final IndexingSettings settings = IndexingSettings.defaults();
        expect(indexer.isEligible(root)).andReturn(true);
        expect(indexer.index(root, settings.options()))
                .andThrow(new NoSourceFilesException(root.toString()));
        replay(indexer, readmeCollector);

        assertTrue(service.indexRepository("repo", root, settings)
                .isEmpty());
        verify(indexer, readmeCollector);
    }

    @Test
    void whenIndexing_givenEligibleProject_shouldBuildIndexAndWriteDocument()
            throws IOException {
        final IndexingSettings settings = IndexingSettings.defaults();
        final IndexingResult result = result();
        final IndexedFile readme = new IndexedFile("README.md", "# kv",
                "hash", 4, "markdown", "repo", Map.of());

        expect(indexer.isEligible(root)).andReturn(true);
        expect(indexer.index(root, settings.options())).andReturn(result);
        expect(readmeCollector.collect("repo", root))
                .andReturn(List.of(readme));
        replay(indexer, readmeCollector);

        final Optional<RepositoryIndex> index = service.indexRepository(
                "repo", root, settings);

        verify(indexer, readmeCollector);
        assertTrue(index.isPresent());
        assertEquals(List.of(".repomix.xml", "README.md"),
                List.copyOf(index.get().files().keySet()));
        assertEquals("<repository/>\n",
                Files.readString(root.resolve(".repomix.xml")));

        final Map<String, String> metadata = index.get().metadata();
        assertEquals("go_native", metadata.get("indexer_type"));
        assertEquals(RepositoryIndexingService.INDEXER_VERSION,
                metadata.get("indexer_version"));
        assertEquals("2", metadata.get("file_count"));
        assertEquals("1", metadata.get("skipped_files_count"));
        assertEquals("1", metadata.get("packages_count"));
        assertEquals("1", metadata.get("func_count"));
        assertEquals("1", metadata.get("readme_count"));
        assertEquals("repo", index.get().id());
    }

    @Test
    void whenIndexing_givenWriteDisabledAndReadmeFailure_shouldStillIndex()
            throws IOException {
        final IndexingSettings settings = new IndexingSettings(true,
                IndexingOptions.defaults(), false);

        expect(indexer.isEligible(root)).andReturn(true);
        expect(indexer.index(root, settings.options())).andReturn(result());
        expect(readmeCollector.collect("repo", root))
                .andThrow(new IOException("walk failed"));
        replay(indexer, readmeCollector);

        final RepositoryIndex index = service.indexRepository("repo", root,
                settings).orElseThrow();

        verify(indexer, readmeCollector);
        assertFalse(Files.exists(root.resolve(".repomix.xml")));
        assertFalse(index.metadata().containsKey("readme_count"));
        assertEquals(1, index.files().size());
    }

    private static IndexingResult result() {
        final FileAnalysis file = new FileAnalysis("kv/kv.go", "kv",
                List.of(Construct.builder(ConstructKind.FUNC, "Open")
                        .signature("func Open()")
                        .location("kv", "kv/kv.go", 3)
                        .build()));
        final RepositoryAnalysis analysis = new RepositoryAnalysis(
                List.of("kv/kv.go"), List.of(file),
                new PackageAggregator().aggregate(List.of(file)),
                List.of(new FileFailure("kv/bad.go", "1:1: expected")));
        return new IndexingResult(SyntheticDocument.of("<repository/>\n",
                Map.of("indexer_type", "go_native")), analysis);
    }

}
