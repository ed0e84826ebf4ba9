package io.repo.vectors.query;

import io.repo.vectors.CodeChunk;

import java.util.Objects;

/**
 * One entry of a query answer.
 */
public record RankedResult(
    /** 1-based position in the answer */
    int rank,

    /** The matching code chunk */
    CodeChunk chunk,

    /** Cosine similarity in [-1, 1], higher is more similar */
    float score
) {
    public RankedResult {
        Objects.requireNonNull(chunk, "chunk cannot be null");
        if (rank < 1) throw new IllegalArgumentException("rank must be >= 1");
    }

    /**
     * Returns the score as a percentage string.
     */
    public String scorePercent() {
        return String.format("%.1f%%", score * 100);
    }

    @Override
    public String toString() {
        return String.format("%d. [%.3f] %s (%s)%n  %s:%d-%d",
            rank, score, chunk.displayName(), chunk.type(),
            chunk.filePath(), chunk.startLine(), chunk.endLine());
    }
}
