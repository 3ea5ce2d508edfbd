package co.fanki.goindexer.indexing.domain;

import co.fanki.goindexer.shared.Preconditions;
import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * The single text artifact produced by an indexing run.
 *
 * <p>Immutable. A new run produces a new document; an existing one is
 * never updated.</p>
 *
 * @param path the fixed file name the document is stored under
 * @param content the rendered text
 * @param hash the hex Murmur3-128 fingerprint of the UTF-8 content
 * @param size the UTF-8 length of the content in bytes
 * @param language the format tag of the content
 * @param metadata run counters, sorted by key
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record SyntheticDocument(
        String path,
        String content,
        String hash,
        long size,
        String language,
        Map<String, String> metadata
) {

    /** File name of the synthetic document. */
    public static final String DOCUMENT_PATH = ".repomix.xml";

    /** Format tag of the synthetic document. */
    public static final String DOCUMENT_LANGUAGE = "xml";

    /** Freezes the metadata. */
    public SyntheticDocument {
        Preconditions.requireNonNull(content, "Content is required");
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new TreeMap<>(metadata));
    }

    /**
     * Creates the document for rendered content, computing its size and
     * fingerprint.
     *
     * @param content the rendered document text
     * @param metadata the run counters
     * @return the document
     */
    public static SyntheticDocument of(final String content,
            final Map<String, String> metadata) {
        final byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
        return new SyntheticDocument(DOCUMENT_PATH, content,
                fingerprint(bytes), bytes.length, DOCUMENT_LANGUAGE,
                metadata);
    }

    /**
     * Fingerprints bytes for change detection.
     *
     * @param bytes the content bytes
     * @return the 32 character hex hash
     */
    public static String fingerprint(final byte[] bytes) {
        return Hashing.murmur3_128().hashBytes(bytes).toString();
    }

}
