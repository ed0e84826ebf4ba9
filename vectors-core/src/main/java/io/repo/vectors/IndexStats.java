package io.repo.vectors;

import java.util.Map;

/**
 * Statistics about an indexed repository.
 */
public record IndexStats(
    /** Total number of chunks */
    int totalChunks,

    /** Chunks by type */
    Map<ChunkType, Integer> chunksByType,

    /** Number of source files with at least one chunk */
    int fileCount,

    /** Files per language */
    Map<String, Integer> languages,

    /** Vector dimensions */
    int dimensions,

    /** Estimated in-memory size in bytes */
    long sizeBytes
) {}
