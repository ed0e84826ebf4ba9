package io.repo.vectors.pipeline;

import io.repo.vectors.CodeChunk;
import io.repo.vectors.IndexIntegrityException;
import io.repo.vectors.VectorIndex;
import io.repo.vectors.cache.CacheEntry;
import io.repo.vectors.cache.CacheStore;
import io.repo.vectors.cache.RepositoryIdentity;
import io.repo.vectors.parser.CodeChunker;
import io.repo.vectors.parser.ParserRegistry;
import io.repo.vectors.scan.FileSelector;
import io.repo.vectors.scan.SourceFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

/**
 * Builds, caches and publishes repository indexes.
 *
 * <p>Runs for the same repository identity are serialized; different
 * identities index in parallel. A finished snapshot replaces the previous one
 * in a single map update, so queries never see a half-built index.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * RepositoryIndexer indexer = new RepositoryIndexer(
 *     model::embedBatch, model.getModelId(), FileCacheStore.inUserHome(), ParserRegistry.defaults());
 *
 * BuildReport report = indexer.buildOrLoad("https://github.com/owner/repo", checkout, IndexingConfig.defaults());
 * List<RankedResult> results = new QueryEngine(indexer, adapter).query(report.identity(), "parse config", 5);
 * }</pre>
 */
public class RepositoryIndexer {

    private static final Logger log = LoggerFactory.getLogger(RepositoryIndexer.class);

    private final EmbeddingProvider embeddingProvider;
    private final String modelId;
    private final CacheStore cacheStore;
    private final ParserRegistry parserRegistry;

    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, RepositorySnapshot> snapshots = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, PipelineState> states = new ConcurrentHashMap<>();

    private volatile ProgressListener progressListener = ProgressListener.NONE;

    /**
     * @param embeddingProvider embedding function used for chunks
     * @param modelId           identifies the provider's vector space; cache entries of another model are ignored
     * @param cacheStore        where built indexes are persisted
     * @param parserRegistry    structural chunkers available to this indexer
     */
    public RepositoryIndexer(EmbeddingProvider embeddingProvider, String modelId,
                             CacheStore cacheStore, ParserRegistry parserRegistry) {
        this.embeddingProvider = embeddingProvider;
        this.modelId = modelId;
        this.cacheStore = cacheStore;
        this.parserRegistry = parserRegistry;
    }

    /**
     * Sets the listener for stage progress messages.
     */
    public void setProgressListener(ProgressListener listener) {
        this.progressListener = listener != null ? listener : ProgressListener.NONE;
    }

    // ==================== Build ====================

    public BuildReport buildOrLoad(String locator, Path root, IndexingConfig config) throws IOException {
        return buildOrLoad(locator, root, config, CancellationToken.none());
    }

    /**
     * Loads the repository's index from the cache, or builds it from {@code root}.
     *
     * @param locator repository URL or path the identity is derived from
     * @param root    local checkout to index
     * @throws IOException             if the root cannot be walked
     * @throws IndexIntegrityException if vectors and chunks do not line up
     * @throws CancellationException   if the token is cancelled; the previous snapshot stays published
     * @throws IllegalStateException   if the last build failed and {@code forceRebuild} is not set
     */
    public BuildReport buildOrLoad(String locator, Path root, IndexingConfig config, CancellationToken token)
            throws IOException {
        String identity = RepositoryIdentity.of(locator);
        ReentrantLock lock = locks.computeIfAbsent(identity, key -> new ReentrantLock());

        lock.lock();
        try {
            PipelineState previous = state(identity);
            if (previous == PipelineState.FAILED && !config.forceRebuild()) {
                throw new IllegalStateException("Last build of " + locator + " failed, a forced rebuild is required");
            }

            long started = System.nanoTime();

            if (!config.forceRebuild()) {
                states.put(identity, PipelineState.LOADING);
                Optional<RepositorySnapshot> cached = loadSnapshot(identity, locator);
                if (cached.isPresent()) {
                    publish(cached.get());
                    return cachedReport(cached.get(), started);
                }
            }

            try {
                return build(identity, locator, root, config, token, started);
            } catch (CancellationException e) {
                log.info("Indexing of {} cancelled", locator);
                states.put(identity, restoredState(identity, previous));
                throw e;
            } catch (IOException | RuntimeException e) {
                log.error("Indexing of {} failed: {}", locator, e.toString());
                states.put(identity, PipelineState.FAILED);
                throw e;
            }
        } finally {
            lock.unlock();
        }
    }

    private BuildReport build(String identity, String locator, Path root, IndexingConfig config,
                              CancellationToken token, long started) throws IOException {
        log.info("Indexing {} from {}", locator, root);
        List<String> warnings = new ArrayList<>();
        AtomicInteger filesSkipped = new AtomicInteger();

        // Scan and chunk
        states.put(identity, PipelineState.SCANNING);
        progressListener.progress("Scanning " + root, 0);

        FileSelector selector = new FileSelector(config.toSelectorConfig());
        CodeChunker chunker = new CodeChunker(config.toChunkerConfig(), parserRegistry);
        ExecutorService workers = Executors.newFixedThreadPool(config.chunkingThreads());

        List<CodeChunk> chunks = new ArrayList<>();
        Map<String, Integer> histogram = new TreeMap<>();
        int filesProcessed = 0;

        try {
            List<Future<FileChunks>> pending = new ArrayList<>();
            try (Stream<SourceFile> files = selector.select(root, (path, reason) -> {
                filesSkipped.incrementAndGet();
                warnings.add("Skipped " + path + ": " + reason);
            })) {
                states.put(identity, PipelineState.CHUNKING);
                Iterator<SourceFile> iterator = files.iterator();
                while (iterator.hasNext()) {
                    token.throwIfCancelled();
                    SourceFile file = iterator.next();
                    pending.add(workers.submit(() -> chunkFile(chunker, file, token)));
                }
            }
            progressListener.progress("Chunking " + pending.size() + " files", 10);

            // Merge in discovery order, independent of which worker finished first
            for (Future<FileChunks> future : pending) {
                token.throwIfCancelled();
                FileChunks result = awaitChunks(future);
                if (result.error() != null) {
                    filesSkipped.incrementAndGet();
                    warnings.add("Failed to chunk " + result.file().relativePath() + ": " + result.error());
                    continue;
                }
                chunks.addAll(result.chunks());
                histogram.merge(result.file().language(), 1, Integer::sum);
                filesProcessed++;
            }
        } finally {
            workers.shutdownNow();
        }

        log.info("Created {} chunks from {} files ({} skipped)", chunks.size(), filesProcessed, filesSkipped.get());

        // Embed
        states.put(identity, PipelineState.EMBEDDING);
        progressListener.progress("Embedding " + chunks.size() + " chunks", 30);

        EmbeddingAdapter adapter = new EmbeddingAdapter(embeddingProvider, config);
        EmbeddingAdapter.EmbeddingOutcome outcome = adapter.embedChunks(locator, chunks, token,
            (message, percentage) -> progressListener.progress(message, 30 + percentage * 0.6));
        warnings.addAll(outcome.failures());

        // Index the chunks that were embedded
        token.throwIfCancelled();
        states.put(identity, PipelineState.INDEXING);
        progressListener.progress("Indexing", 90);

        List<CodeChunk> indexedChunks = new ArrayList<>(outcome.embeddedCount());
        List<float[]> vectors = new ArrayList<>(outcome.embeddedCount());
        for (int i = 0; i < chunks.size(); i++) {
            if (outcome.isEmbedded(i)) {
                indexedChunks.add(chunks.get(i));
                vectors.add(outcome.vectors().get(i));
            }
        }

        VectorIndex index = VectorIndex.of(vectors);
        RepositorySnapshot snapshot = new RepositorySnapshot(identity, locator, indexedChunks, histogram, index);

        // Persist complete builds only, so failed batches are retried by the next run
        token.throwIfCancelled();
        states.put(identity, PipelineState.PERSISTING);
        progressListener.progress("Saving index", 95);

        boolean persisted = false;
        if (outcome.failedChunks() == 0) {
            try {
                cacheStore.save(new CacheEntry(identity, modelId, index.dimensions(),
                    indexedChunks, index.vectors(), histogram));
                persisted = true;
            } catch (IOException e) {
                log.warn("Failed to save index of {}: {}", locator, e.toString());
                warnings.add("Cache write failed: " + e.getMessage());
            }
        } else {
            warnings.add("Index not cached because " + outcome.failedChunks() + " chunks failed to embed");
        }

        publish(snapshot);
        progressListener.progress("Ready", 100);

        BuildReport report = new BuildReport(
            identity,
            chunks.size(),
            outcome.embeddedCount(),
            outcome.failedChunks(),
            false,
            filesProcessed,
            filesSkipped.get(),
            histogram,
            warnings,
            elapsedMillis(started),
            persisted
        );
        log.info("Indexed {}: {} chunks embedded, {} failed, {} ms",
            locator, report.chunksEmbedded(), report.chunksFailed(), report.durationMillis());
        return report;
    }

    // ==================== Cache ====================

    /**
     * Publishes the cached index of a repository without building anything.
     *
     * @return the snapshot, or empty if no usable cache entry exists
     */
    public Optional<RepositorySnapshot> loadCached(String locator) {
        String identity = RepositoryIdentity.of(locator);
        ReentrantLock lock = locks.computeIfAbsent(identity, key -> new ReentrantLock());

        lock.lock();
        try {
            RepositorySnapshot current = snapshots.get(identity);
            if (current != null) {
                return Optional.of(current);
            }
            PipelineState previous = state(identity);
            states.put(identity, PipelineState.LOADING);
            Optional<RepositorySnapshot> cached = loadSnapshot(identity, locator);
            if (cached.isPresent()) {
                publish(cached.get());
            } else {
                states.put(identity, previous);
            }
            return cached;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops the cache entry and the published snapshot of a repository.
     *
     * @return true if a cache entry was removed
     */
    public boolean invalidate(String locator) throws IOException {
        String identity = RepositoryIdentity.of(locator);
        ReentrantLock lock = locks.computeIfAbsent(identity, key -> new ReentrantLock());

        lock.lock();
        try {
            snapshots.remove(identity);
            states.put(identity, PipelineState.UNINITIALIZED);
            return cacheStore.invalidate(identity);
        } finally {
            lock.unlock();
        }
    }

    private Optional<RepositorySnapshot> loadSnapshot(String identity, String locator) {
        Optional<CacheEntry> entry = cacheStore.load(identity);
        if (entry.isEmpty()) {
            return Optional.empty();
        }
        if (!entry.get().modelId().equals(modelId)) {
            log.warn("Cache entry for {} was built with model '{}', current model is '{}'; rebuilding",
                locator, entry.get().modelId(), modelId);
            return Optional.empty();
        }

        CacheEntry cached = entry.get();
        VectorIndex index = VectorIndex.of(cached.vectors());
        return Optional.of(new RepositorySnapshot(identity, locator, cached.chunks(), cached.languageHistogram(), index));
    }

    private BuildReport cachedReport(RepositorySnapshot snapshot, long started) {
        int files = snapshot.languageHistogram().values().stream().mapToInt(Integer::intValue).sum();
        log.info("Loaded {} from cache: {} chunks", snapshot.locator(), snapshot.size());
        return new BuildReport(
            snapshot.identity(),
            snapshot.size(),
            snapshot.size(),
            0,
            true,
            files,
            0,
            snapshot.languageHistogram(),
            List.of(),
            elapsedMillis(started),
            true
        );
    }

    // ==================== State ====================

    /**
     * Returns the published snapshot of a repository identity.
     */
    public Optional<RepositorySnapshot> snapshot(String identity) {
        return Optional.ofNullable(snapshots.get(identity));
    }

    public PipelineState state(String identity) {
        return states.getOrDefault(identity, PipelineState.UNINITIALIZED);
    }

    public String modelId() {
        return modelId;
    }

    private void publish(RepositorySnapshot snapshot) {
        snapshots.put(snapshot.identity(), snapshot);
        states.put(snapshot.identity(), PipelineState.READY);
    }

    private PipelineState restoredState(String identity, PipelineState previous) {
        if (previous == PipelineState.FAILED) {
            return PipelineState.FAILED;
        }
        return snapshots.containsKey(identity) ? PipelineState.READY : PipelineState.UNINITIALIZED;
    }

    // ==================== Helper Methods ====================

    private static FileChunks chunkFile(CodeChunker chunker, SourceFile file, CancellationToken token) {
        if (token.isCancelled()) {
            return new FileChunks(file, List.of(), "cancelled");
        }
        try {
            return new FileChunks(file, chunker.chunkFile(file), null);
        } catch (RuntimeException e) {
            log.warn("Failed to chunk {}: {}", file.relativePath(), e.toString());
            return new FileChunks(file, List.of(), e.toString());
        }
    }

    private static FileChunks awaitChunks(Future<FileChunks> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while chunking");
        } catch (ExecutionException e) {
            throw new IllegalStateException("Chunking task failed", e.getCause());
        }
    }

    private static long elapsedMillis(long started) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
    }

    private record FileChunks(SourceFile file, List<CodeChunk> chunks, String error) {}
}
