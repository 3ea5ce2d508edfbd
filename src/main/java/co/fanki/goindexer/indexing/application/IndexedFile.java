package co.fanki.goindexer.indexing.application;

import co.fanki.goindexer.indexing.domain.SyntheticDocument;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * One file held by a {@link RepositoryIndex}: the synthetic document or a
 * README.
 *
 * <p>The content is not serialized to JSON; summaries show the path,
 * size, hash and metadata only.</p>
 *
 * @param path the path relative to the repository root
 * @param content the file text
 * @param hash the hex content fingerprint
 * @param size the size in bytes
 * @param language the detected format
 * @param repositoryId the owning repository
 * @param metadata file attributes, sorted by key
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IndexedFile(
        String path,
        @JsonIgnore String content,
        String hash,
        long size,
        String language,
        String repositoryId,
        Map<String, String> metadata
) {

    /** Freezes the metadata. */
    public IndexedFile {
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new TreeMap<>(metadata));
    }

    /**
     * Wraps a synthetic document for a repository.
     *
     * @param document the document
     * @param repositoryId the repository id
     * @return the indexed file
     */
    public static IndexedFile of(final SyntheticDocument document,
            final String repositoryId) {
        return new IndexedFile(document.path(), document.content(),
                document.hash(), document.size(), document.language(),
                repositoryId, document.metadata());
    }

}
