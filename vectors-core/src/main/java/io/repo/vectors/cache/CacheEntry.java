package io.repo.vectors.cache;

import io.repo.vectors.CodeChunk;
import io.repo.vectors.IndexIntegrityException;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Persisted state of one repository: chunks, their vectors (same order) and
 * the language histogram.
 */
public record CacheEntry(
    String identity,
    String modelId,
    int dimensions,
    List<CodeChunk> chunks,
    List<float[]> vectors,
    Map<String, Integer> languageHistogram
) {
    public CacheEntry {
        Objects.requireNonNull(identity, "identity cannot be null");
        modelId = modelId != null ? modelId : "";
        chunks = List.copyOf(chunks);
        vectors = List.copyOf(vectors);
        languageHistogram = languageHistogram != null
            ? new TreeMap<>(languageHistogram)
            : new TreeMap<>();
        if (chunks.size() != vectors.size()) {
            throw new IndexIntegrityException("vector rows", chunks.size(), vectors.size());
        }
        for (float[] vector : vectors) {
            if (vector.length != dimensions) {
                throw new IndexIntegrityException("vector dimension", dimensions, vector.length);
            }
        }
    }
}
