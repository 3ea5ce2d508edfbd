package co.fanki.goindexer.indexing.application;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The indexed view of one repository.
 *
 * @param id the repository id
 * @param path the local repository root
 * @param files the indexed files by relative path
 * @param metadata run counters and indexer identification, sorted by key
 * @param indexedAt when the index was built
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RepositoryIndex(
        String id,
        String path,
        SortedMap<String, IndexedFile> files,
        SortedMap<String, String> metadata,
        Instant indexedAt
) {

    /** Freezes the maps. */
    public RepositoryIndex {
        files = Collections.unmodifiableSortedMap(files == null
                ? new TreeMap<String, IndexedFile>()
                : new TreeMap<String, IndexedFile>(files));
        metadata = Collections.unmodifiableSortedMap(metadata == null
                ? new TreeMap<String, String>()
                : new TreeMap<String, String>(metadata));
    }

}
