package co.fanki.goindexer.indexing.application;

import co.fanki.goindexer.indexing.domain.ConstructIndexer;
import co.fanki.goindexer.indexing.domain.ConstructKind;
import co.fanki.goindexer.indexing.domain.IndexingException;
import co.fanki.goindexer.indexing.domain.IndexingResult;
import co.fanki.goindexer.indexing.domain.NoSourceFilesException;
import co.fanki.goindexer.indexing.domain.RepositoryAnalysis;
import co.fanki.goindexer.indexing.domain.SyntheticDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Application service that indexes a local repository.
 *
 * <p>Chooses a strategy, runs the construct indexer for eligible
 * projects, writes the synthetic document next to the sources, adds the
 * repository README files and assembles the {@link RepositoryIndex}.
 * Projects that do not qualify yield no index; a generic packer is
 * expected to handle them.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class RepositoryIndexingService {

    private static final Logger LOG = LoggerFactory.getLogger(
            RepositoryIndexingService.class);

    /** Version recorded in every index built by this service. */
    public static final String INDEXER_VERSION = "go-construct-indexer-v1.0.0";

    private final ConstructIndexer indexer;

    private final ReadmeCollector readmeCollector;

    /**
     * Creates a new RepositoryIndexingService.
     *
     * @param theIndexer the construct indexer
     * @param theReadmeCollector the README collector
     */
    public RepositoryIndexingService(final ConstructIndexer theIndexer,
            final ReadmeCollector theReadmeCollector) {
        this.indexer = theIndexer;
        this.readmeCollector = theReadmeCollector;
    }

    /**
     * Chooses how a repository is indexed.
     *
     * @param root the repository root
     * @return GO_NATIVE for eligible projects, FALLBACK otherwise
     */
    public IndexingStrategy determineStrategy(final Path root) {
        try {
            return indexer.isEligible(root)
                    ? IndexingStrategy.GO_NATIVE
                    : IndexingStrategy.FALLBACK;
        } catch (final IOException e) {
            LOG.warn("Cannot inspect {}, using fallback: {}", root,
                    e.getMessage());
            return IndexingStrategy.FALLBACK;
        }
    }

    /**
     * Indexes a repository.
     *
     * @param repositoryId the repository id, not blank
     * @param root the repository root, not null
     * @param settings the indexing settings, not null
     * @return the index, or empty when the fallback strategy applies
     * @throws IndexingException with INVALID_CONFIG for bad arguments, or
     *         INDEXING_DISABLED when the settings disable indexing
     * @throws IOException if the source tree cannot be walked
     */
    public Optional<RepositoryIndex> indexRepository(
            final String repositoryId, final Path root,
            final IndexingSettings settings) throws IOException {

        if (repositoryId == null || repositoryId.isBlank() || root == null
                || settings == null) {
            throw new IndexingException("Invalid indexing parameters",
                    IndexingException.INVALID_CONFIG);
        }
        if (!settings.enabled()) {
            throw new IndexingException("Indexing is disabled for "
                    + repositoryId, IndexingException.INDEXING_DISABLED);
        }

        final IndexingStrategy strategy = determineStrategy(root);
        LOG.info("Indexing {} at {} with strategy {}", repositoryId, root,
                strategy);

        if (strategy == IndexingStrategy.FALLBACK) {
            return Optional.empty();
        }

        final IndexingResult result;
        try {
            result = indexer.index(root, settings.options());
        } catch (final NoSourceFilesException e) {
            LOG.warn("Native indexing of {} found nothing, using fallback:"
                    + " {}", repositoryId, e.getMessage());
            return Optional.empty();
        }

        final SyntheticDocument document = result.document();
        if (settings.writeDocument()) {
            writeDocument(root, document);
        }

        final SortedMap<String, IndexedFile> files = new TreeMap<>();
        files.put(document.path(), IndexedFile.of(document, repositoryId));

        final SortedMap<String, String> metadata = metadata(strategy,
                result.analysis());

        try {
            final List<IndexedFile> readmes = readmeCollector.collect(
                    repositoryId, root);
            readmes.forEach(readme -> files.put(readme.path(), readme));
            metadata.put("readme_count", String.valueOf(readmes.size()));
        } catch (final IOException e) {
            LOG.warn("Failed to discover README files in {}: {}", root,
                    e.getMessage());
        }

        final RepositoryIndex index = new RepositoryIndex(repositoryId,
                root.toString(), files, metadata, Instant.now());

        LOG.info("Indexed {}: {} files in index, {} packages", repositoryId,
                files.size(), metadata.get("packages_count"));

        return Optional.of(index);
    }

    private static SortedMap<String, String> metadata(
            final IndexingStrategy strategy,
            final RepositoryAnalysis analysis) {
        final SortedMap<String, String> metadata = new TreeMap<>();
        metadata.put("indexer_type", strategy.label());
        metadata.put("indexer_version", INDEXER_VERSION);
        metadata.put("file_count", String.valueOf(
                analysis.analyzedFiles().size() + analysis.failures().size()));
        metadata.put("skipped_files_count",
                String.valueOf(analysis.failures().size()));
        metadata.put("packages_count",
                String.valueOf(analysis.packages().size()));
        for (final ConstructKind kind : ConstructKind.values()) {
            final int count = analysis.count(kind);
            if (count > 0) {
                metadata.put(kind.label() + "_count", String.valueOf(count));
            }
        }
        return metadata;
    }

    private static void writeDocument(final Path root,
            final SyntheticDocument document) {
        final Path target = root.resolve(document.path());
        try {
            Files.writeString(target, document.content(),
                    StandardCharsets.UTF_8);
            LOG.debug("Wrote {}", target);
        } catch (final IOException e) {
            LOG.warn("Failed to write {}: {}", target, e.getMessage());
        }
    }

}
