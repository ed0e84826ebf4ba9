package io.repo.vectors.pipeline;

import io.repo.vectors.BagOfWordsProvider;
import io.repo.vectors.CodeChunk;
import io.repo.vectors.cache.FileCacheStore;
import io.repo.vectors.cache.RepositoryIdentity;
import io.repo.vectors.parser.ParserRegistry;
import io.repo.vectors.query.QueryEngine;
import io.repo.vectors.query.RankedResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RepositoryIndexerTest {

    private static final String LOCATOR = "https://github.com/example/billing";
    private static final String MODEL = "bag-of-words:64";

    @TempDir
    Path tempDir;

    private Path repo;
    private FileCacheStore cacheStore;
    private BagOfWordsProvider provider;
    private IndexingConfig config;

    @BeforeEach
    void setUp() throws IOException {
        repo = Files.createDirectories(tempDir.resolve("repo"));
        cacheStore = new FileCacheStore(tempDir.resolve("cache"));
        provider = new BagOfWordsProvider();
        config = IndexingConfig.defaults()
            .withChunkSizes(200, 40, 20)
            .withBatchSize(2)
            .withChunkingThreads(2);

        Files.writeString(repo.resolve("analytics.py"), """
            def summarize_orders(orders):
                totals = {}
                for order in orders:
                    totals[order.customer] += order.amount
                return totals

            def render_invoice_pdf(invoice, template):
                canvas = template.open_canvas(invoice.number)
                canvas.draw_table(invoice.lines)
                return canvas.export_pdf()
            """);
        Files.createDirectories(repo.resolve("service"));
        Files.writeString(repo.resolve("service/Greeter.java"), """
            public class Greeter {
                public String greet(String visitor) {
                    return "Welcome, " + visitor + "!";
                }
            }
            """);
        Files.write(repo.resolve("blob.bin"), new byte[]{0x7f, 'E', 'L', 'F', 0, 0, 1, 2, 3});
    }

    private RepositoryIndexer indexer(String modelId) {
        return new RepositoryIndexer(provider, modelId, cacheStore, ParserRegistry.defaults());
    }

    private static List<String> hashes(RepositorySnapshot snapshot) {
        return snapshot.chunks().stream().map(CodeChunk::contentHash).toList();
    }

    @Test
    void testBuildsMixedRepository() throws IOException {
        RepositoryIndexer indexer = indexer(MODEL);

        BuildReport report = indexer.buildOrLoad(LOCATOR, repo, config);

        assertFalse(report.fromCache());
        assertTrue(report.chunksCreated() >= 3);
        assertEquals(report.chunksCreated(), report.chunksEmbedded());
        assertEquals(0, report.chunksFailed());
        assertEquals(2, report.filesProcessed());
        assertEquals(1, report.filesSkipped());
        assertEquals(1, report.warnings().size());
        assertTrue(report.warnings().get(0).contains("blob.bin"));
        assertEquals(Map.of("java", 1, "python", 1), report.languageHistogram());
        assertTrue(report.persisted());
        assertEquals(PipelineState.READY, indexer.state(report.identity()));

        RepositorySnapshot snapshot = indexer.snapshot(report.identity()).orElseThrow();
        assertEquals(snapshot.size(), snapshot.index().size());
        assertTrue(snapshot.chunks().stream().noneMatch(c -> c.filePath().equals("blob.bin")));
    }

    @Test
    void testExactChunkTextRanksFirst() throws IOException {
        RepositoryIndexer indexer = indexer(MODEL);
        BuildReport report = indexer.buildOrLoad(LOCATOR, repo, config);
        RepositorySnapshot snapshot = indexer.snapshot(report.identity()).orElseThrow();
        QueryEngine engine = new QueryEngine(indexer, new EmbeddingAdapter(provider, config));

        CodeChunk second = snapshot.chunk(1);
        List<RankedResult> results = engine.query(report.identity(), second.content(), 1);

        assertEquals("render_invoice_pdf", second.name());
        assertEquals(1, results.size());
        assertEquals(second, results.get(0).chunk());
    }

    @Test
    void testSecondRunLoadsFromCache() throws IOException {
        BuildReport first = indexer(MODEL).buildOrLoad(LOCATOR, repo, config);
        int callsAfterBuild = provider.calls();

        RepositoryIndexer fresh = indexer(MODEL);
        BuildReport second = fresh.buildOrLoad(LOCATOR + ".git", repo, config);

        assertTrue(second.fromCache());
        assertEquals(first.identity(), second.identity());
        assertEquals(first.chunksEmbedded(), second.chunksEmbedded());
        assertEquals(first.languageHistogram(), second.languageHistogram());
        assertEquals(callsAfterBuild, provider.calls());
        assertEquals(PipelineState.READY, fresh.state(second.identity()));
    }

    @Test
    void testOtherModelIgnoresCache() throws IOException {
        indexer(MODEL).buildOrLoad(LOCATOR, repo, config);

        BuildReport report = indexer("other-model").buildOrLoad(LOCATOR, repo, config);

        assertFalse(report.fromCache());
    }

    @Test
    void testForcedRebuildIsIdempotent() throws IOException {
        RepositoryIndexer indexer = indexer(MODEL);
        String identity = indexer.buildOrLoad(LOCATOR, repo, config.withForceRebuild(true)).identity();
        List<String> first = hashes(indexer.snapshot(identity).orElseThrow());

        BuildReport second = indexer.buildOrLoad(LOCATOR, repo, config.withForceRebuild(true));

        assertFalse(second.fromCache());
        assertEquals(first, hashes(indexer.snapshot(identity).orElseThrow()));
    }

    @Test
    void testFailedBatchesArePublishedButNotCached() throws IOException {
        EmbeddingProvider flaky = texts -> {
            if (texts.stream().anyMatch(text -> text.contains("Symbol: render_invoice_pdf"))) {
                throw new IllegalStateException("rate limited");
            }
            return provider.embedBatch(texts);
        };
        RepositoryIndexer indexer = new RepositoryIndexer(flaky, MODEL, cacheStore, ParserRegistry.defaults());

        BuildReport report = indexer.buildOrLoad(LOCATOR, repo, config.withBatchSize(1));

        assertEquals(1, report.chunksFailed());
        assertEquals(report.chunksCreated() - 1, report.chunksEmbedded());
        assertFalse(report.persisted());
        assertTrue(report.hasFailures());
        assertFalse(cacheStore.contains(report.identity()));
        assertEquals(report.chunksEmbedded(), indexer.snapshot(report.identity()).orElseThrow().size());
    }

    @Test
    void testChunkerFailureIsIsolatedToFile() throws IOException {
        ParserRegistry registry = ParserRegistry.builder()
            .register("java", (path, content, chunkerConfig) -> {
                throw new IllegalStateException("parser crashed");
            })
            .build();
        RepositoryIndexer indexer = new RepositoryIndexer(provider, MODEL, cacheStore, registry);

        BuildReport report = indexer.buildOrLoad(LOCATOR, repo, config);

        assertEquals(1, report.filesProcessed());
        assertEquals(2, report.filesSkipped());
        assertEquals(Map.of("python", 1), report.languageHistogram());
        assertTrue(report.warnings().stream().anyMatch(w -> w.contains("service/Greeter.java")));
    }

    @Test
    void testFailedBuildRequiresForce() throws IOException {
        RepositoryIndexer indexer = indexer(MODEL);
        String identity = RepositoryIdentity.of(LOCATOR);

        assertThrows(IOException.class, () -> indexer.buildOrLoad(LOCATOR, tempDir.resolve("missing"), config));
        assertEquals(PipelineState.FAILED, indexer.state(identity));

        assertThrows(IllegalStateException.class, () -> indexer.buildOrLoad(LOCATOR, repo, config));

        BuildReport report = indexer.buildOrLoad(LOCATOR, repo, config.withForceRebuild(true));
        assertEquals(PipelineState.READY, indexer.state(report.identity()));
    }

    @Test
    void testCancellationKeepsPreviousSnapshot() throws IOException {
        RepositoryIndexer indexer = indexer(MODEL);
        String identity = indexer.buildOrLoad(LOCATOR, repo, config).identity();
        RepositorySnapshot previous = indexer.snapshot(identity).orElseThrow();

        Files.writeString(repo.resolve("extra.py"), "def extra_step(data):\n    return [d * 2 for d in data]\n");
        CancellationToken token = new CancellationToken();
        indexer.setProgressListener((message, percentage) -> {
            if (message.startsWith("Embedding")) {
                token.cancel();
            }
        });

        assertThrows(CancellationException.class,
            () -> indexer.buildOrLoad(LOCATOR, repo, config.withForceRebuild(true), token));

        assertEquals(PipelineState.READY, indexer.state(identity));
        assertSame(previous, indexer.snapshot(identity).orElseThrow());
    }

    @Test
    void testCancellationOfFirstBuild() {
        RepositoryIndexer indexer = indexer(MODEL);
        CancellationToken token = new CancellationToken();
        token.cancel();

        assertThrows(CancellationException.class, () -> indexer.buildOrLoad(LOCATOR, repo, config, token));

        String identity = RepositoryIdentity.of(LOCATOR);
        assertEquals(PipelineState.UNINITIALIZED, indexer.state(identity));
        assertTrue(indexer.snapshot(identity).isEmpty());
        assertFalse(cacheStore.contains(identity));
    }

    @Test
    void testProgressStages() throws IOException {
        RepositoryIndexer indexer = indexer(MODEL);
        List<String> messages = Collections.synchronizedList(new ArrayList<>());
        indexer.setProgressListener((message, percentage) -> messages.add(message));

        indexer.buildOrLoad(LOCATOR, repo, config);

        assertTrue(messages.get(0).startsWith("Scanning"));
        assertEquals("Ready", messages.get(messages.size() - 1));
        assertTrue(messages.stream().anyMatch(m -> m.startsWith("Embedding")));
    }

    @Test
    void testLoadCachedAndInvalidate() throws IOException {
        indexer(MODEL).buildOrLoad(LOCATOR, repo, config);

        RepositoryIndexer queryOnly = indexer(MODEL);
        assertTrue(queryOnly.loadCached(LOCATOR).isPresent());
        assertTrue(queryOnly.loadCached("https://github.com/example/unknown").isEmpty());

        assertTrue(queryOnly.invalidate(LOCATOR));
        String identity = RepositoryIdentity.of(LOCATOR);
        assertEquals(PipelineState.UNINITIALIZED, queryOnly.state(identity));
        assertTrue(queryOnly.snapshot(identity).isEmpty());
        assertTrue(indexer(MODEL).loadCached(LOCATOR).isEmpty());
    }

    @Test
    void testEmptyRepository() throws IOException {
        Path empty = Files.createDirectories(tempDir.resolve("empty"));
        RepositoryIndexer indexer = indexer(MODEL);

        BuildReport report = indexer.buildOrLoad("/srv/empty", empty, config);

        assertEquals(0, report.chunksCreated());
        RepositorySnapshot snapshot = indexer.snapshot(report.identity()).orElseThrow();
        assertTrue(snapshot.index().isEmpty());
        assertEquals(List.of(), new QueryEngine(indexer, new EmbeddingAdapter(provider, config))
            .query(report.identity(), "anything", 3));
    }

    @Test
    void testTimeoutConfigurationIsUsed() throws IOException {
        EmbeddingProvider slow = texts -> {
            try {
                Thread.sleep(1_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return provider.embedBatch(texts);
        };
        RepositoryIndexer indexer = new RepositoryIndexer(slow, MODEL, cacheStore, ParserRegistry.defaults());

        BuildReport report = indexer.buildOrLoad(LOCATOR, repo,
            config.withBatchSize(100).withEmbeddingTimeout(Duration.ofMillis(20)));

        assertEquals(report.chunksCreated(), report.chunksFailed());
        assertEquals(0, indexer.snapshot(report.identity()).orElseThrow().size());
    }

    @Test
    void testBuildsOfSameRepositoryAreSerialized() throws Exception {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        EmbeddingProvider slow = texts -> {
            maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            try {
                Thread.sleep(100);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                inFlight.decrementAndGet();
            }
            return provider.embedBatch(texts);
        };
        RepositoryIndexer indexer = new RepositoryIndexer(slow, MODEL, cacheStore, ParserRegistry.defaults());
        IndexingConfig forced = config.withBatchSize(100).withEmbeddingConcurrency(1).withForceRebuild(true);

        ExecutorService callers = Executors.newFixedThreadPool(2);
        try {
            Future<BuildReport> first = callers.submit(() -> indexer.buildOrLoad(LOCATOR, repo, forced));
            Future<BuildReport> second = callers.submit(() -> indexer.buildOrLoad(LOCATOR, repo, forced));

            assertFalse(first.get(10, TimeUnit.SECONDS).fromCache());
            assertFalse(second.get(10, TimeUnit.SECONDS).fromCache());
        } finally {
            callers.shutdownNow();
        }

        assertEquals(2, provider.calls());
        assertEquals(1, maxInFlight.get());
    }

    @Test
    void testQueriesSeePreviousSnapshotDuringRebuild() throws Exception {
        AtomicBoolean hold = new AtomicBoolean();
        CountDownLatch embedding = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        EmbeddingProvider gated = texts -> {
            if (hold.get()) {
                embedding.countDown();
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return provider.embedBatch(texts);
        };
        RepositoryIndexer indexer = new RepositoryIndexer(gated, MODEL, cacheStore, ParserRegistry.defaults());
        String identity = indexer.buildOrLoad(LOCATOR, repo, config).identity();
        RepositorySnapshot previous = indexer.snapshot(identity).orElseThrow();
        QueryEngine engine = new QueryEngine(indexer, new EmbeddingAdapter(new BagOfWordsProvider(), config));

        String extra = "def export_ledger(ledger):\n    return ledger.to_csv()\n";
        Files.writeString(repo.resolve("ledger.py"), extra);
        hold.set(true);

        ExecutorService caller = Executors.newSingleThreadExecutor();
        try {
            Future<BuildReport> rebuild = caller.submit(
                () -> indexer.buildOrLoad(LOCATOR, repo, config.withForceRebuild(true)));
            assertTrue(embedding.await(10, TimeUnit.SECONDS));

            assertSame(previous, indexer.snapshot(identity).orElseThrow());
            assertEquals(PipelineState.EMBEDDING, indexer.state(identity));
            List<RankedResult> during = engine.query(identity, extra, 10);
            assertEquals(previous.size(), during.size());
            assertTrue(during.stream().noneMatch(r -> r.chunk().filePath().equals("ledger.py")));

            release.countDown();
            rebuild.get(10, TimeUnit.SECONDS);
        } finally {
            caller.shutdownNow();
        }

        RepositorySnapshot rebuilt = indexer.snapshot(identity).orElseThrow();
        assertNotSame(previous, rebuilt);
        assertTrue(rebuilt.chunks().stream().anyMatch(c -> c.filePath().equals("ledger.py")));
    }
}
