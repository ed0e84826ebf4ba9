package io.repo.vectors;

import java.util.List;

/**
 * Dense index over L2-normalized embeddings, one row per chunk.
 *
 * <p>Rows are kept in the order the vectors were given to {@link #build(List)},
 * which is the order of the chunks they belong to. Scores are cosine
 * similarities and may be negative.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * VectorIndex index = VectorIndex.create();
 * index.build(vectors);
 *
 * for (IndexHit hit : index.search(queryVector, 5)) {
 *     CodeChunk chunk = chunks.get(hit.row());
 * }
 * }</pre>
 */
public interface VectorIndex {

    // ==================== Factory Methods ====================

    /**
     * Creates a new empty brute-force index.
     */
    static VectorIndex create() {
        return new InMemoryVectorIndex();
    }

    /**
     * Creates an index built from the given vectors.
     *
     * @throws IndexIntegrityException if the vectors differ in dimension
     */
    static VectorIndex of(List<float[]> vectors) {
        VectorIndex index = create();
        index.build(vectors);
        return index;
    }

    // ==================== Modification ====================

    /**
     * Normalizes and stores the vectors, replacing any previous contents.
     *
     * <p>The replacement is atomic: concurrent searches see either the old or
     * the new rows, never a mix.</p>
     *
     * @param vectors one vector per row, all of the same dimension
     * @throws IndexIntegrityException if the vectors differ in dimension
     */
    void build(List<float[]> vectors);

    // ==================== Search ====================

    /**
     * Searches for the rows most similar to the query vector.
     *
     * @param queryVector query embedding, normalized before scoring
     * @param topK number of hits to return, clamped to the index size
     * @return hits by descending score, ties broken by lower row
     */
    List<IndexHit> search(float[] queryVector, int topK);

    // ==================== Metadata ====================

    /**
     * Returns the number of rows.
     */
    int size();

    /**
     * Returns the vector dimensions, 0 for an empty index.
     */
    int dimensions();

    /**
     * Returns a copy of the stored (normalized) rows, for persistence.
     */
    List<float[]> vectors();

    /**
     * Checks if the index is empty.
     */
    default boolean isEmpty() {
        return size() == 0;
    }
}
