package io.repo.vectors.pipeline;

import io.repo.vectors.ChunkType;
import io.repo.vectors.CodeChunk;
import io.repo.vectors.IndexIntegrityException;
import io.repo.vectors.IndexStats;
import io.repo.vectors.VectorIndex;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * An indexed repository: its chunks and the vector index over them, row
 * {@code i} of the index belonging to chunk {@code i}.
 *
 * <p>Immutable once constructed, so published snapshots can be queried from
 * any thread.</p>
 */
public record RepositorySnapshot(
    String identity,
    String locator,
    List<CodeChunk> chunks,
    Map<String, Integer> languageHistogram,
    VectorIndex index
) {
    public RepositorySnapshot {
        Objects.requireNonNull(identity, "identity cannot be null");
        Objects.requireNonNull(index, "index cannot be null");
        chunks = List.copyOf(chunks);
        languageHistogram = Collections.unmodifiableMap(new TreeMap<>(languageHistogram));
        if (index.size() != chunks.size()) {
            throw new IndexIntegrityException("index rows", chunks.size(), index.size());
        }
    }

    public int size() {
        return chunks.size();
    }

    public CodeChunk chunk(int row) {
        return chunks.get(row);
    }

    public IndexStats stats() {
        Map<ChunkType, Integer> byType = new EnumMap<>(ChunkType.class);
        Set<String> files = new HashSet<>();
        long sizeBytes = (long) index.size() * index.dimensions() * Float.BYTES;

        for (CodeChunk chunk : chunks) {
            byType.merge(chunk.type(), 1, Integer::sum);
            files.add(chunk.filePath());
            sizeBytes += chunk.size() + chunk.filePath().length() + 100;
        }

        return new IndexStats(
            chunks.size(),
            byType,
            files.size(),
            languageHistogram,
            index.dimensions(),
            sizeBytes
        );
    }
}
