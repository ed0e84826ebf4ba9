package io.repo.vectors;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collections;
import java.util.HexFormat;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * A contiguous excerpt of a source file that can be embedded and searched.
 *
 * <p>Chunks are value objects: the same content always carries the same
 * {@link #contentHash()}, wherever the chunk boundaries were drawn. Duplicate
 * hashes across files are expected and kept, since each chunk records its own
 * location.</p>
 */
public record CodeChunk(
    /** Exact source text of the passage */
    String content,

    /** Path relative to the repository root, '/' separated */
    String filePath,

    /** Starting line number (1-indexed) */
    int startLine,

    /** Ending line number (1-indexed, inclusive) */
    int endLine,

    /** Type of code chunk */
    ChunkType type,

    /** Language tag, "text" when unknown */
    String language,

    /** UTF-8 byte length of the content */
    int size,

    /** SHA-256 hex digest of the content */
    String contentHash,

    /** Symbol name, doc comment, extraction method */
    Map<String, String> metadata
) {
    public static final String META_NAME = "name";
    public static final String META_DOC = "doc";
    public static final String META_PARENT = "parent";
    public static final String META_EXTRACTION = "extraction";

    public static final String EXTRACTION_STRUCTURAL = "structural";
    public static final String EXTRACTION_PATTERN = "pattern";

    public CodeChunk {
        Objects.requireNonNull(content, "content cannot be null");
        Objects.requireNonNull(filePath, "filePath cannot be null");
        Objects.requireNonNull(type, "type cannot be null");
        Objects.requireNonNull(contentHash, "contentHash cannot be null");
        if (startLine < 1) throw new IllegalArgumentException("startLine must be >= 1");
        if (endLine < startLine) throw new IllegalArgumentException("endLine must be >= startLine");
        language = language != null ? language : "text";
        // Sorted so serialized chunks are byte-identical between runs
        metadata = metadata != null
            ? Collections.unmodifiableMap(new TreeMap<>(metadata))
            : Map.of();
    }

    /**
     * Creates a chunk, deriving {@code size} and {@code contentHash} from the content.
     */
    public static CodeChunk of(String content, String filePath, int startLine, int endLine,
                               ChunkType type, String language, Map<String, String> metadata) {
        return new CodeChunk(
            content,
            filePath,
            startLine,
            endLine,
            type,
            language,
            content.getBytes(StandardCharsets.UTF_8).length,
            hash(content),
            metadata
        );
    }

    /**
     * Deterministic content digest used for chunk identity.
     */
    public static String hash(String content) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(content.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Location-based identifier, e.g. {@code src/app.py:10-42}.
     */
    public String id() {
        return filePath + ":" + startLine + "-" + endLine;
    }

    /**
     * Returns the symbol name, or {@code null} if the chunk has none.
     */
    public String name() {
        return metadata.get(META_NAME);
    }

    /**
     * Returns the leading documentation comment, or {@code null}.
     */
    public String doc() {
        return metadata.get(META_DOC);
    }

    /**
     * Returns a truncated version of the content for display purposes.
     */
    public String truncatedContent(int maxLength) {
        if (content.length() <= maxLength) {
            return content;
        }
        return content.substring(0, maxLength - 3) + "...";
    }

    /**
     * Returns the name qualified with its parent type, falling back to the location.
     */
    public String displayName() {
        String name = name();
        if (name == null || name.isEmpty()) {
            return id();
        }
        String parent = metadata.get(META_PARENT);
        if (parent != null && !parent.isEmpty() && !name.startsWith(parent + ".")) {
            return parent + "." + name;
        }
        return name;
    }
}
