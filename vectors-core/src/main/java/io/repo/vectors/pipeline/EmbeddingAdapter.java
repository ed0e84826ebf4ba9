package io.repo.vectors.pipeline;

import io.repo.vectors.CodeChunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Turns chunks into vectors through an {@link EmbeddingProvider}.
 *
 * <p>Each chunk is sent with a short header (repository, file, type,
 * language, symbol) so the embedding captures where the code lives. Chunks
 * go out in batches of {@code batchSize}, at most {@code concurrency}
 * batches at a time. A batch that fails or times out is retried once; if the
 * retry fails too its chunks are reported as failed. Vectors are written back
 * by chunk position, so the order in which batches finish does not matter.</p>
 */
public class EmbeddingAdapter {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingAdapter.class);

    private final EmbeddingProvider provider;
    private final int batchSize;
    private final int concurrency;
    private final Duration timeout;

    public EmbeddingAdapter(EmbeddingProvider provider, IndexingConfig config) {
        this(provider, config.batchSize(), config.embeddingConcurrency(), config.embeddingTimeout());
    }

    public EmbeddingAdapter(EmbeddingProvider provider, int batchSize, int concurrency, Duration timeout) {
        if (batchSize <= 0) throw new IllegalArgumentException("batchSize must be > 0");
        if (concurrency <= 0) throw new IllegalArgumentException("concurrency must be > 0");
        this.provider = provider;
        this.batchSize = batchSize;
        this.concurrency = concurrency;
        this.timeout = timeout;
    }

    /**
     * Embeds all chunks of a repository.
     *
     * @param repository label written into every header
     * @throws CancellationException if the token is cancelled between batches
     */
    public EmbeddingOutcome embedChunks(String repository, List<CodeChunk> chunks,
                                        CancellationToken token, ProgressListener progress) {
        float[][] vectors = new float[chunks.size()][];
        List<String> failures = new ArrayList<>();
        int failedChunks = 0;
        int dimensions = -1;

        int batchCount = (chunks.size() + batchSize - 1) / batchSize;
        ExecutorService executor = Executors.newCachedThreadPool(daemonThreads());

        try {
            for (int window = 0; window < batchCount; window += concurrency) {
                token.throwIfCancelled();

                int windowEnd = Math.min(window + concurrency, batchCount);
                List<List<String>> texts = new ArrayList<>();
                List<Future<List<float[]>>> futures = new ArrayList<>();

                for (int batch = window; batch < windowEnd; batch++) {
                    List<String> batchTexts = new ArrayList<>();
                    for (int i = batch * batchSize; i < Math.min((batch + 1) * batchSize, chunks.size()); i++) {
                        batchTexts.add(contextText(repository, chunks.get(i)));
                    }
                    texts.add(batchTexts);
                    futures.add(executor.submit(() -> provider.embedBatch(batchTexts)));
                }

                for (int offset = 0; offset < futures.size(); offset++) {
                    int batch = window + offset;
                    List<String> batchTexts = texts.get(offset);

                    List<float[]> result = await(futures.get(offset), batch, batchTexts.size(), dimensions);
                    if (result == null) {
                        token.throwIfCancelled();
                        log.info("Retrying embedding batch {}", batch);
                        result = await(executor.submit(() -> provider.embedBatch(batchTexts)),
                            batch, batchTexts.size(), dimensions);
                    }

                    int first = batch * batchSize;
                    if (result == null) {
                        failedChunks += batchTexts.size();
                        failures.add(String.format("Embedding batch %d (chunks %d-%d) failed after retry",
                            batch, first, first + batchTexts.size() - 1));
                        continue;
                    }

                    dimensions = result.get(0).length;
                    for (int i = 0; i < result.size(); i++) {
                        vectors[first + i] = result.get(i);
                    }
                }

                progress.progress(String.format("Embedded %d/%d batches", windowEnd, batchCount),
                    100.0 * windowEnd / batchCount);
            }
        } finally {
            executor.shutdownNow();
        }

        if (failedChunks > 0) {
            log.warn("{} of {} chunks could not be embedded", failedChunks, chunks.size());
        }
        return new EmbeddingOutcome(Collections.unmodifiableList(Arrays.asList(vectors)), failedChunks, failures);
    }

    /**
     * Embeds a query string as a single-item batch, with the same retry policy.
     *
     * @throws EmbeddingException if both attempts fail
     */
    public float[] embedQuery(String text) {
        ExecutorService executor = Executors.newCachedThreadPool(daemonThreads());
        try {
            for (int attempt = 1; attempt <= 2; attempt++) {
                List<float[]> result = await(executor.submit(() -> provider.embedBatch(List.of(text))), 0, 1, -1);
                if (result != null) {
                    return result.get(0);
                }
            }
        } finally {
            executor.shutdownNow();
        }
        throw new EmbeddingException("Failed to embed query after retry");
    }

    /**
     * Builds the text sent to the provider for a chunk: header lines, a blank line, the content.
     */
    public static String contextText(String repository, CodeChunk chunk) {
        StringBuilder sb = new StringBuilder();
        sb.append("Repository: ").append(repository).append('\n');
        sb.append("File: ").append(chunk.filePath()).append('\n');
        sb.append("Type: ").append(chunk.type().name().toLowerCase(Locale.ROOT)).append('\n');
        sb.append("Language: ").append(chunk.language()).append('\n');
        if (chunk.name() != null) {
            sb.append("Symbol: ").append(chunk.displayName()).append('\n');
        }
        sb.append('\n').append(chunk.content());
        return sb.toString();
    }

    /**
     * Waits for one provider call. Returns null for any failure, after logging it.
     */
    private List<float[]> await(Future<List<float[]>> future, int batch, int expectedSize, int dimensions) {
        try {
            List<float[]> result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            String problem = validate(result, expectedSize, dimensions);
            if (problem != null) {
                log.warn("Embedding batch {} rejected: {}", batch, problem);
                return null;
            }
            return result;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Embedding batch {} timed out after {}", batch, timeout);
            return null;
        } catch (ExecutionException e) {
            log.warn("Embedding batch {} failed: {}", batch, e.getCause().toString());
            return null;
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for embeddings");
        }
    }

    private static String validate(List<float[]> result, int expectedSize, int dimensions) {
        if (result == null || result.size() != expectedSize) {
            return String.format("expected %d vectors, got %s", expectedSize, result == null ? "null" : result.size());
        }
        int expected = dimensions >= 0 ? dimensions : result.get(0) == null ? -1 : result.get(0).length;
        for (float[] vector : result) {
            if (vector == null || vector.length == 0 || vector.length != expected) {
                return String.format("expected dimension %d, got %s", expected,
                    vector == null ? "null" : vector.length);
            }
        }
        return null;
    }

    private static ThreadFactory daemonThreads() {
        return runnable -> {
            Thread thread = new Thread(runnable, "embedding-call");
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Vectors by chunk position, {@code null} where the batch failed.
     */
    public record EmbeddingOutcome(List<float[]> vectors, int failedChunks, List<String> failures) {

        public boolean isEmbedded(int position) {
            return vectors.get(position) != null;
        }

        public int embeddedCount() {
            return vectors.size() - failedChunks;
        }
    }
}
