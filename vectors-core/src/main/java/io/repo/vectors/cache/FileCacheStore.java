package io.repo.vectors.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.repo.vectors.CodeChunk;
import io.repo.vectors.UnsupportedFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Stores one {@code <identity>.rvec} file per repository in a directory.
 *
 * <p>File layout: magic {@code RVEC}, format version, dimensions, row count,
 * model id, length-prefixed JSON chunk list, length-prefixed JSON language
 * histogram, then the row-major float matrix. Writes go to a temporary file
 * in the same directory that is then moved over the entry.</p>
 */
public class FileCacheStore implements CacheStore {

    private static final Logger log = LoggerFactory.getLogger(FileCacheStore.class);

    // Format constants
    private static final byte[] MAGIC = "RVEC".getBytes(StandardCharsets.US_ASCII);
    private static final short FORMAT_VERSION = 1;
    private static final String EXTENSION = ".rvec";

    private static final TypeReference<List<CodeChunk>> CHUNK_LIST = new TypeReference<>() { };
    private static final TypeReference<Map<String, Integer>> HISTOGRAM = new TypeReference<>() { };

    private final Path directory;
    private final ObjectMapper mapper;

    public FileCacheStore(Path directory) {
        this.directory = directory;
        this.mapper = new ObjectMapper();
    }

    /**
     * Default location, {@code ~/.repo-vectors/cache}.
     */
    public static FileCacheStore inUserHome() {
        return new FileCacheStore(Path.of(System.getProperty("user.home"), ".repo-vectors", "cache"));
    }

    @Override
    public Optional<CacheEntry> load(String identity) {
        Path path = pathFor(identity);
        if (!Files.isRegularFile(path)) {
            log.debug("No cache entry for {}", identity);
            return Optional.empty();
        }

        try (InputStream is = Files.newInputStream(path)) {
            CacheEntry entry = read(identity, is, Files.size(path));
            log.info("Loaded cache entry {} ({} chunks)", identity, entry.chunks().size());
            return Optional.of(entry);
        } catch (IOException | RuntimeException e) {
            log.warn("Ignoring unreadable cache entry {}: {}", path, e.toString());
            return Optional.empty();
        }
    }

    @Override
    public void save(CacheEntry entry) throws IOException {
        Files.createDirectories(directory);
        Path target = pathFor(entry.identity());
        Path temp = Files.createTempFile(directory, entry.identity() + "-", ".tmp");

        try {
            try (OutputStream os = Files.newOutputStream(temp)) {
                write(entry, os);
            }
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }

        log.info("Saved cache entry {} ({} chunks) to {}", entry.identity(), entry.chunks().size(), target);
    }

    @Override
    public boolean invalidate(String identity) throws IOException {
        boolean deleted = Files.deleteIfExists(pathFor(identity));
        if (deleted) {
            log.info("Invalidated cache entry {}", identity);
        }
        return deleted;
    }

    @Override
    public boolean contains(String identity) {
        return Files.isRegularFile(pathFor(identity));
    }

    public Path directory() {
        return directory;
    }

    Path pathFor(String identity) {
        if (!identity.matches("[A-Za-z0-9_-]+")) {
            throw new IllegalArgumentException("Invalid cache identity: " + identity);
        }
        return directory.resolve(identity + EXTENSION);
    }

    // ==================== Serialization ====================

    private void write(CacheEntry entry, OutputStream os) throws IOException {
        DataOutputStream dos = new DataOutputStream(new BufferedOutputStream(os));

        // Write header
        dos.write(MAGIC);
        dos.writeShort(FORMAT_VERSION);
        dos.writeInt(entry.dimensions());
        dos.writeInt(entry.chunks().size());
        dos.writeUTF(entry.modelId());

        // Write chunks and histogram as JSON
        writeBlock(dos, mapper.writeValueAsBytes(entry.chunks()));
        writeBlock(dos, mapper.writeValueAsBytes(entry.languageHistogram()));

        // Write vectors
        for (float[] vector : entry.vectors()) {
            for (float v : vector) {
                dos.writeFloat(v);
            }
        }

        dos.flush();
    }

    /**
     * Every length field is checked against {@code fileSize} before allocating,
     * so a corrupt entry fails with an {@link IOException}.
     */
    private CacheEntry read(String identity, InputStream is, long fileSize) throws IOException {
        DataInputStream dis = new DataInputStream(new BufferedInputStream(is));

        // Read and verify header
        byte[] magic = new byte[MAGIC.length];
        dis.readFully(magic);
        if (!Arrays.equals(magic, MAGIC)) {
            throw new IOException("Invalid file format: bad magic number");
        }

        short version = dis.readShort();
        if (version != FORMAT_VERSION) {
            throw new UnsupportedFormatException(version);
        }

        int dimensions = dis.readInt();
        int rowCount = dis.readInt();
        if (dimensions < 0 || rowCount < 0
                || (long) dimensions * rowCount * Float.BYTES > fileSize) {
            throw new IOException("Invalid matrix size " + rowCount + "x" + dimensions + " for " + fileSize + " bytes");
        }
        String modelId = dis.readUTF();

        List<CodeChunk> chunks = mapper.readValue(readBlock(dis, fileSize), CHUNK_LIST);
        Map<String, Integer> histogram = mapper.readValue(readBlock(dis, fileSize), HISTOGRAM);

        if (chunks.size() != rowCount) {
            throw new IOException("Chunk count " + chunks.size() + " does not match row count " + rowCount);
        }

        List<float[]> vectors = new ArrayList<>(rowCount);
        for (int i = 0; i < rowCount; i++) {
            float[] vector = new float[dimensions];
            for (int j = 0; j < dimensions; j++) {
                vector[j] = dis.readFloat();
            }
            vectors.add(vector);
        }

        if (dis.read() != -1) {
            throw new IOException("Trailing data after vector matrix");
        }

        return new CacheEntry(identity, modelId, dimensions, chunks, vectors, histogram);
    }

    private static void writeBlock(DataOutputStream dos, byte[] block) throws IOException {
        dos.writeInt(block.length);
        dos.write(block);
    }

    private static byte[] readBlock(DataInputStream dis, long fileSize) throws IOException {
        int length = dis.readInt();
        if (length < 0 || length > fileSize) {
            throw new IOException("Invalid block length " + length + " for " + fileSize + " bytes");
        }
        byte[] block = new byte[length];
        dis.readFully(block);
        return block;
    }
}
