package io.repo.vectors.pipeline;

import io.repo.vectors.parser.ChunkerConfig;
import io.repo.vectors.scan.SelectorConfig;

import java.time.Duration;
import java.util.Set;

/**
 * Options for one indexing run.
 */
public record IndexingConfig(
    /** Files larger than this are skipped */
    long maxFileSizeBytes,

    /** Path fragments that exclude a file */
    Set<String> excludeNameFragments,

    /** Extensions to index; empty means all */
    Set<String> includeExtensions,

    /** Chunk size bound in characters */
    int maxChunkSize,

    /** Overlap carried into a split chunk, in characters */
    int overlapSize,

    /** Smallest trailing chunk kept */
    int minChunkSize,

    /** Texts per embedding request */
    int batchSize,

    /** Ignore the cache and rebuild */
    boolean forceRebuild,

    /** Worker threads for chunking */
    int chunkingThreads,

    /** Embedding requests in flight at once */
    int embeddingConcurrency,

    /** Timeout of a single embedding request */
    Duration embeddingTimeout
) {
    public IndexingConfig {
        if (batchSize <= 0) throw new IllegalArgumentException("batchSize must be > 0");
        if (chunkingThreads <= 0) throw new IllegalArgumentException("chunkingThreads must be > 0");
        if (embeddingConcurrency <= 0) throw new IllegalArgumentException("embeddingConcurrency must be > 0");
        if (embeddingTimeout == null || embeddingTimeout.isNegative() || embeddingTimeout.isZero()) {
            throw new IllegalArgumentException("embeddingTimeout must be positive");
        }
        excludeNameFragments = excludeNameFragments != null ? Set.copyOf(excludeNameFragments) : Set.of();
        includeExtensions = includeExtensions != null ? Set.copyOf(includeExtensions) : Set.of();
    }

    public static IndexingConfig defaults() {
        SelectorConfig selector = SelectorConfig.defaults();
        ChunkerConfig chunker = ChunkerConfig.defaults();
        return new IndexingConfig(
            selector.maxFileSizeBytes(),
            selector.excludeNameFragments(),
            selector.includeExtensions(),
            chunker.maxChunkSize(),
            chunker.overlapSize(),
            chunker.minChunkSize(),
            32,
            false,
            Math.max(1, Runtime.getRuntime().availableProcessors()),
            2,
            Duration.ofSeconds(60)
        );
    }

    public SelectorConfig toSelectorConfig() {
        return new SelectorConfig(maxFileSizeBytes, excludeNameFragments, includeExtensions);
    }

    public ChunkerConfig toChunkerConfig() {
        return new ChunkerConfig(maxChunkSize, overlapSize, minChunkSize);
    }

    public IndexingConfig withMaxFileSizeBytes(long maxFileSizeBytes) {
        return new IndexingConfig(maxFileSizeBytes, excludeNameFragments, includeExtensions, maxChunkSize,
            overlapSize, minChunkSize, batchSize, forceRebuild, chunkingThreads, embeddingConcurrency, embeddingTimeout);
    }

    public IndexingConfig withExcludeNameFragments(Set<String> excludeNameFragments) {
        return new IndexingConfig(maxFileSizeBytes, excludeNameFragments, includeExtensions, maxChunkSize,
            overlapSize, minChunkSize, batchSize, forceRebuild, chunkingThreads, embeddingConcurrency, embeddingTimeout);
    }

    public IndexingConfig withIncludeExtensions(Set<String> includeExtensions) {
        return new IndexingConfig(maxFileSizeBytes, excludeNameFragments, includeExtensions, maxChunkSize,
            overlapSize, minChunkSize, batchSize, forceRebuild, chunkingThreads, embeddingConcurrency, embeddingTimeout);
    }

    public IndexingConfig withChunkSizes(int maxChunkSize, int overlapSize, int minChunkSize) {
        return new IndexingConfig(maxFileSizeBytes, excludeNameFragments, includeExtensions, maxChunkSize,
            overlapSize, minChunkSize, batchSize, forceRebuild, chunkingThreads, embeddingConcurrency, embeddingTimeout);
    }

    public IndexingConfig withBatchSize(int batchSize) {
        return new IndexingConfig(maxFileSizeBytes, excludeNameFragments, includeExtensions, maxChunkSize,
            overlapSize, minChunkSize, batchSize, forceRebuild, chunkingThreads, embeddingConcurrency, embeddingTimeout);
    }

    public IndexingConfig withForceRebuild(boolean forceRebuild) {
        return new IndexingConfig(maxFileSizeBytes, excludeNameFragments, includeExtensions, maxChunkSize,
            overlapSize, minChunkSize, batchSize, forceRebuild, chunkingThreads, embeddingConcurrency, embeddingTimeout);
    }

    public IndexingConfig withChunkingThreads(int chunkingThreads) {
        return new IndexingConfig(maxFileSizeBytes, excludeNameFragments, includeExtensions, maxChunkSize,
            overlapSize, minChunkSize, batchSize, forceRebuild, chunkingThreads, embeddingConcurrency, embeddingTimeout);
    }

    public IndexingConfig withEmbeddingConcurrency(int embeddingConcurrency) {
        return new IndexingConfig(maxFileSizeBytes, excludeNameFragments, includeExtensions, maxChunkSize,
            overlapSize, minChunkSize, batchSize, forceRebuild, chunkingThreads, embeddingConcurrency, embeddingTimeout);
    }

    public IndexingConfig withEmbeddingTimeout(Duration embeddingTimeout) {
        return new IndexingConfig(maxFileSizeBytes, excludeNameFragments, includeExtensions, maxChunkSize,
            overlapSize, minChunkSize, batchSize, forceRebuild, chunkingThreads, embeddingConcurrency, embeddingTimeout);
    }
}
