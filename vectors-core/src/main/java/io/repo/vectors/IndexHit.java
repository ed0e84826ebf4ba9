package io.repo.vectors;

/**
 * A single row returned by {@link VectorIndex#search(float[], int)}.
 *
 * @param row   row index into the index, equal to the chunk position in its snapshot
 * @param score cosine similarity in [-1, 1]
 */
public record IndexHit(int row, float score) implements Comparable<IndexHit> {

    /**
     * Orders by score descending, then by row ascending.
     */
    @Override
    public int compareTo(IndexHit other) {
        int byScore = Float.compare(other.score, this.score);
        return byScore != 0 ? byScore : Integer.compare(this.row, other.row);
    }
}
