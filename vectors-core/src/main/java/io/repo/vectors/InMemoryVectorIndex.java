package io.repo.vectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * In-memory implementation of VectorIndex using brute-force search.
 *
 * <p>Vectors live in a single row-major {@code float[]}. Since every row is
 * unit length, the inner product with a normalized query is the cosine
 * similarity. Suitable for a repository's worth of chunks (up to ~100k rows).</p>
 */
public class InMemoryVectorIndex implements VectorIndex {

    private static final Logger log = LoggerFactory.getLogger(InMemoryVectorIndex.class);

    private static final Matrix EMPTY = new Matrix(new float[0], 0, 0);

    private volatile Matrix matrix = EMPTY;

    // ==================== Modification ====================

    @Override
    public void build(List<float[]> vectors) {
        if (vectors.isEmpty()) {
            matrix = EMPTY;
            return;
        }

        int dimensions = vectors.get(0).length;
        float[] data = new float[vectors.size() * dimensions];

        for (int row = 0; row < vectors.size(); row++) {
            float[] vector = vectors.get(row);
            if (vector.length != dimensions) {
                throw new IndexIntegrityException("dimension of row " + row, dimensions, vector.length);
            }
            System.arraycopy(vector, 0, data, row * dimensions, dimensions);
            normalize(data, row * dimensions, dimensions);
        }

        matrix = new Matrix(data, vectors.size(), dimensions);
        log.debug("Built index: rows={}, dims={}", vectors.size(), dimensions);
    }

    // ==================== Search ====================

    @Override
    public List<IndexHit> search(float[] queryVector, int topK) {
        Matrix current = matrix;
        if (current.rows() == 0 || topK <= 0) {
            return List.of();
        }
        if (queryVector.length != current.dimensions()) {
            throw new IllegalArgumentException(String.format(
                "Query dimension mismatch: expected %d, got %d",
                current.dimensions(), queryVector.length
            ));
        }

        float[] query = queryVector.clone();
        normalize(query, 0, query.length);

        int k = Math.min(topK, current.rows());

        // Min-heap of the best k, worst hit on top
        PriorityQueue<IndexHit> best = new PriorityQueue<>(k + 1, Comparator.reverseOrder());
        for (int row = 0; row < current.rows(); row++) {
            best.add(new IndexHit(row, dot(query, current.data(), row * current.dimensions())));
            if (best.size() > k) {
                best.poll();
            }
        }

        List<IndexHit> results = new ArrayList<>(best);
        results.sort(Comparator.naturalOrder());
        return results;
    }

    // ==================== Metadata ====================

    @Override
    public int size() {
        return matrix.rows();
    }

    @Override
    public int dimensions() {
        return matrix.dimensions();
    }

    @Override
    public List<float[]> vectors() {
        Matrix current = matrix;
        List<float[]> rows = new ArrayList<>(current.rows());
        for (int row = 0; row < current.rows(); row++) {
            float[] vector = new float[current.dimensions()];
            System.arraycopy(current.data(), row * current.dimensions(), vector, 0, current.dimensions());
            rows.add(vector);
        }
        return rows;
    }

    // ==================== Helper Methods ====================

    private static float dot(float[] query, float[] data, int offset) {
        float sum = 0;
        for (int i = 0; i < query.length; i++) {
            sum += query[i] * data[offset + i];
        }
        // Rounding can push unit vectors slightly past 1
        return Math.max(-1f, Math.min(1f, sum));
    }

    private static void normalize(float[] data, int offset, int length) {
        double norm = 0;
        for (int i = offset; i < offset + length; i++) {
            norm += data[i] * data[i];
        }
        norm = Math.sqrt(norm);

        if (norm > 0) {
            for (int i = offset; i < offset + length; i++) {
                data[i] = (float) (data[i] / norm);
            }
        }
    }

    private record Matrix(float[] data, int rows, int dimensions) {}
}
