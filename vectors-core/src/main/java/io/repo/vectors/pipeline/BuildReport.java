package io.repo.vectors.pipeline;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Outcome of {@link RepositoryIndexer#buildOrLoad}.
 */
public record BuildReport(
    /** Cache identity of the repository */
    String identity,

    /** Chunks produced by the chunker */
    int chunksCreated,

    /** Chunks that received an embedding and are searchable */
    int chunksEmbedded,

    /** Chunks whose embedding batch failed twice */
    int chunksFailed,

    /** Whether the index was loaded instead of built */
    boolean fromCache,

    /** Files chunked */
    int filesProcessed,

    /** Files skipped as unreadable or failed while chunking */
    int filesSkipped,

    /** Files per language */
    Map<String, Integer> languageHistogram,

    /** Non-fatal problems encountered */
    List<String> warnings,

    /** Wall-clock time of the run */
    long durationMillis,

    /** Whether the result was written to the cache store */
    boolean persisted
) {
    public BuildReport {
        languageHistogram = Collections.unmodifiableMap(new TreeMap<>(languageHistogram));
        warnings = List.copyOf(warnings);
    }

    public boolean hasFailures() {
        return chunksFailed > 0 || filesSkipped > 0;
    }
}
