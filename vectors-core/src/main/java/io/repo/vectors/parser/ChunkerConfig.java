package io.repo.vectors.parser;

/**
 * Configuration for the code chunkers. Sizes are in characters.
 */
public record ChunkerConfig(
    /** Upper bound for a chunk, exceeded only by a single line longer than it */
    int maxChunkSize,

    /** Upper bound for the lines carried over when a long run is split */
    int overlapSize,

    /** Trailing remnants and structural chunks below this size are dropped */
    int minChunkSize
) {
    public ChunkerConfig {
        if (maxChunkSize <= 0) throw new IllegalArgumentException("maxChunkSize must be > 0");
        if (overlapSize < 0) throw new IllegalArgumentException("overlapSize must be >= 0");
        if (overlapSize >= maxChunkSize) throw new IllegalArgumentException("overlapSize must be < maxChunkSize");
        if (minChunkSize < 0) throw new IllegalArgumentException("minChunkSize must be >= 0");
    }

    public static ChunkerConfig defaults() {
        return new ChunkerConfig(
            1000,   // maxChunkSize
            100,    // overlapSize
            50      // minChunkSize
        );
    }
}
