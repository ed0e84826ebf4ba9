package io.repo.vectors.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.repo.vectors.ChunkType;
import io.repo.vectors.IndexStats;
import io.repo.vectors.VectorIndex;
import io.repo.vectors.cache.CacheEntry;
import io.repo.vectors.cache.FileCacheStore;
import io.repo.vectors.cache.RepositoryIdentity;
import io.repo.vectors.embeddings.EmbeddingModel;
import io.repo.vectors.parser.ParserRegistry;
import io.repo.vectors.pipeline.BuildReport;
import io.repo.vectors.pipeline.EmbeddingAdapter;
import io.repo.vectors.pipeline.IndexingConfig;
import io.repo.vectors.pipeline.RepositoryIndexer;
import io.repo.vectors.pipeline.RepositorySnapshot;
import io.repo.vectors.query.QueryEngine;
import io.repo.vectors.query.RankedResult;
import io.repo.vectors.query.ResultFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.*;
import picocli.CommandLine.Model.CommandSpec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Command-line interface for Repo Vectors.
 */
@Command(
    name = "repo-vectors",
    mixinStandardHelpOptions = true,
    version = "repo-vectors 1.0.0",
    description = "Index source repositories and search them in natural language",
    subcommands = {
        VectorsCli.IndexCommand.class,
        VectorsCli.QueryCommand.class,
        VectorsCli.StatsCommand.class,
        VectorsCli.InvalidateCommand.class
    }
)
public class VectorsCli implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(VectorsCli.class);

    @Spec
    CommandSpec spec;

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    /**
     * Creates the command line with error reporting that prints messages instead of stack traces.
     */
    static CommandLine commandLine() {
        return new CommandLine(new VectorsCli())
            .setCaseInsensitiveEnumValuesAllowed(true)
            .setExecutionExceptionHandler((e, cmd, parseResult) -> {
                log.debug("Command failed", e);
                cmd.getErr().println("Error: " + e.getMessage());
                return 1;
            });
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    /**
     * Index one repository checkout, or every checkout listed in a batch file.
     */
    @Command(
        name = "index",
        description = "Chunk, embed and cache a repository checkout",
        footer = {
            "",
            "Examples:",
            "  repo-vectors index ./checkout --locator https://github.com/owner/repo",
            "  repo-vectors index --batch repos.txt --output results.json",
            "  repo-vectors index ./checkout --chunk-size 1500 --verbose"
        }
    )
    static class IndexCommand implements Callable<Integer> {

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", arity = "0..1", description = "Repository checkout to index")
        Path root;

        @Option(names = {"-l", "--locator"}, description = "Repository URL identifying the index (default: the checkout path)")
        String locator;

        @Option(names = {"--batch"}, paramLabel = "FILE",
            description = "File listing checkouts, one '<path> [locator]' per line, '#' for comments")
        Path batchFile;

        @Option(names = {"-f", "--force"}, description = "Rebuild even if a cached index exists")
        boolean force;

        @Option(names = {"--chunk-size"}, description = "Maximum chunk size in characters (default: ${DEFAULT-VALUE})",
            defaultValue = "1000")
        int chunkSize;

        @Option(names = {"--overlap-size"}, description = "Overlap between split chunks (default: ${DEFAULT-VALUE})",
            defaultValue = "100")
        int overlapSize;

        @Option(names = {"--min-chunk-size"}, description = "Smallest trailing chunk kept (default: ${DEFAULT-VALUE})",
            defaultValue = "50")
        int minChunkSize;

        @Option(names = {"--batch-size"}, description = "Chunks per embedding request (default: ${DEFAULT-VALUE})",
            defaultValue = "32")
        int batchSize;

        @Option(names = {"--max-file-size"}, description = "Skip files larger than this many bytes (default: ${DEFAULT-VALUE})",
            defaultValue = "1048576")
        long maxFileSize;

        @Option(names = {"--include"}, split = ",", description = "Only index these extensions, e.g. py,java")
        List<String> includeExtensions = new ArrayList<>();

        @Option(names = {"--exclude"}, split = ",", description = "Additional excluded path fragments, e.g. vendor/")
        List<String> excludeFragments = new ArrayList<>();

        @Option(names = {"-o", "--output"}, paramLabel = "FILE", description = "Save build results to a JSON file")
        Path output;

        @Option(names = {"-v", "--verbose"}, description = "Show progress and warnings")
        boolean verbose;

        @Mixin
        ProviderOptions providerOptions;

        @Override
        public Integer call() throws Exception {
            PrintWriter out = spec.commandLine().getOut();
            List<Target> targets = targets();
            if (targets.isEmpty()) {
                throw new ParameterException(spec.commandLine(), "Specify a repository checkout or --batch FILE");
            }

            IndexingConfig config = indexingConfig();
            List<IndexResult> results = new ArrayList<>();

            try (EmbeddingModel model = providerOptions.loadModel()) {
                RepositoryIndexer indexer = new RepositoryIndexer(model::embedBatch, model.getModelId(),
                    providerOptions.cacheStore(), ParserRegistry.defaults());
                if (verbose) {
                    indexer.setProgressListener((message, percentage) ->
                        out.printf("  [%3.0f%%] %s%n", percentage, message));
                }

                out.println("Using model: " + model.getModelId());
                for (Target target : targets) {
                    results.add(index(indexer, target, config, out));
                }
            }

            if (targets.size() > 1) {
                printSummary(results, out);
            }
            if (output != null) {
                writeResults(results, output);
                out.println("Results saved to: " + output);
            }

            return results.stream().allMatch(IndexResult::success) ? 0 : 1;
        }

        private IndexResult index(RepositoryIndexer indexer, Target target, IndexingConfig config, PrintWriter out) {
            out.println();
            out.println("Indexing " + target.locator() + " from " + target.root());
            String processedAt = Instant.now().toString();
            try {
                BuildReport report = indexer.buildOrLoad(target.locator(), target.root(), config);
                printReport(report, out);
                return new IndexResult(target.locator(), target.root().toString(), true, null, report, processedAt);
            } catch (Exception e) {
                log.error("Failed to index {}", target.locator(), e);
                out.println("Failed to index " + target.locator() + ": " + e.getMessage());
                return new IndexResult(target.locator(), target.root().toString(), false, e.getMessage(), null, processedAt);
            }
        }

        private void printReport(BuildReport report, PrintWriter out) {
            if (report.fromCache()) {
                out.printf("Loaded from cache: %d chunks%n", report.chunksEmbedded());
            } else {
                out.printf("Files: %d processed, %d skipped%n", report.filesProcessed(), report.filesSkipped());
                out.printf("Chunks: %d created, %d embedded, %d failed%n",
                    report.chunksCreated(), report.chunksEmbedded(), report.chunksFailed());
                out.println("Cached: " + (report.persisted() ? "yes" : "no"));
            }
            out.println("Languages: " + report.languageHistogram());
            out.printf("Time: %.2fs%n", report.durationMillis() / 1000.0);
            if (verbose) {
                report.warnings().forEach(warning -> out.println("  warning: " + warning));
            } else if (!report.warnings().isEmpty()) {
                out.printf("%d warnings (use --verbose to list them)%n", report.warnings().size());
            }
        }

        private void printSummary(List<IndexResult> results, PrintWriter out) {
            long successful = results.stream().filter(IndexResult::success).count();
            out.println();
            out.println("Batch summary");
            out.println("=".repeat(40));
            out.println("Successful: " + successful);
            out.println("Failed: " + (results.size() - successful));
            results.stream()
                .filter(result -> !result.success())
                .forEach(result -> out.println("  - " + result.locator() + ": " + result.error()));
        }

        private List<Target> targets() throws IOException {
            List<Target> targets = new ArrayList<>();
            if (root != null) {
                targets.add(new Target(root, locator != null ? locator : root.toAbsolutePath().normalize().toString()));
            }
            if (batchFile != null) {
                for (String line : Files.readAllLines(batchFile)) {
                    line = line.strip();
                    if (line.isEmpty() || line.startsWith("#")) {
                        continue;
                    }
                    String[] parts = line.split("\\s+", 2);
                    Path path = Path.of(parts[0]);
                    targets.add(new Target(path, parts.length > 1 ? parts[1] : path.toAbsolutePath().normalize().toString()));
                }
            }
            return targets;
        }

        private IndexingConfig indexingConfig() {
            IndexingConfig config = IndexingConfig.defaults()
                .withChunkSizes(chunkSize, overlapSize, minChunkSize)
                .withBatchSize(batchSize)
                .withMaxFileSizeBytes(maxFileSize)
                .withForceRebuild(force);
            if (!includeExtensions.isEmpty()) {
                config = config.withIncludeExtensions(Set.copyOf(includeExtensions));
            }
            if (!excludeFragments.isEmpty()) {
                Set<String> excludes = new LinkedHashSet<>(config.excludeNameFragments());
                excludes.addAll(excludeFragments);
                config = config.withExcludeNameFragments(excludes);
            }
            return config;
        }

        private static void writeResults(List<IndexResult> results, Path output) throws IOException {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .writeValue(output.toFile(), results);
        }

        private record Target(Path root, String locator) {}
    }

    /**
     * One entry of the JSON results file.
     */
    record IndexResult(
        String locator,
        String root,
        boolean success,
        String error,
        BuildReport report,
        String processedAt
    ) {}

    /**
     * Query a cached repository index.
     */
    @Command(
        name = "query",
        description = "Search a cached repository index"
    )
    static class QueryCommand implements Callable<Integer> {

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", description = "Repository locator used when indexing")
        String locator;

        @Parameters(index = "1", description = "Search query")
        String query;

        @Option(names = {"-n", "--top"}, description = "Number of results (default: ${DEFAULT-VALUE})",
            defaultValue = "5")
        int topK;

        @Option(names = {"-t", "--type"}, description = "Only return chunks of this type: ${COMPLETION-CANDIDATES}")
        ChunkType type;

        @Option(names = {"--context"}, description = "Print results as context blocks for an answer generator")
        boolean context;

        @Option(names = {"--show-code"}, description = "Show code snippets", defaultValue = "true", negatable = true)
        boolean showCode;

        @Mixin
        ProviderOptions providerOptions;

        @Override
        public Integer call() throws Exception {
            PrintWriter out = spec.commandLine().getOut();

            try (EmbeddingModel model = providerOptions.loadModel()) {
                RepositoryIndexer indexer = new RepositoryIndexer(model::embedBatch, model.getModelId(),
                    providerOptions.cacheStore(), ParserRegistry.defaults());

                Optional<RepositorySnapshot> snapshot = indexer.loadCached(locator);
                if (snapshot.isEmpty()) {
                    spec.commandLine().getErr().println("No index of " + locator + " for model "
                        + model.getModelId() + ". Run 'repo-vectors index' first.");
                    return 1;
                }

                EmbeddingAdapter queryAdapter = new EmbeddingAdapter(model::embedQueries, IndexingConfig.defaults());
                List<RankedResult> results = new QueryEngine(indexer, queryAdapter)
                    .query(snapshot.get(), query, topK, type);

                if (context) {
                    out.println(ResultFormatter.format(results));
                    return 0;
                }

                out.println("Searching for: " + query);
                out.println("Found " + results.size() + " results:");
                out.println("=".repeat(60));
                for (RankedResult result : results) {
                    printResult(result, out);
                }
            }
            return 0;
        }

        private void printResult(RankedResult result, PrintWriter out) {
            out.println();
            out.printf("#%d [%s] %s %s%n", result.rank(), result.scorePercent(),
                result.chunk().type(), result.chunk().displayName());
            out.println("    File: " + result.chunk().filePath() + ":" + result.chunk().startLine());

            if (showCode) {
                out.println("    " + "-".repeat(50));
                for (String line : result.chunk().truncatedContent(300).split("\n")) {
                    out.println("    " + line);
                }
            }
        }
    }

    /**
     * Show statistics of a cached index.
     */
    @Command(
        name = "stats",
        description = "Display statistics of a cached repository index"
    )
    static class StatsCommand implements Callable<Integer> {

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", description = "Repository locator used when indexing")
        String locator;

        @Option(names = {"--cache-dir"}, description = "Index cache directory (default: ~/.repo-vectors/cache)")
        Path cacheDir;

        @Override
        public Integer call() {
            PrintWriter out = spec.commandLine().getOut();
            FileCacheStore store = cacheDir != null ? new FileCacheStore(cacheDir) : FileCacheStore.inUserHome();
            String identity = RepositoryIdentity.of(locator);

            Optional<CacheEntry> entry = store.load(identity);
            if (entry.isEmpty()) {
                spec.commandLine().getErr().println("No cached index for " + locator);
                return 1;
            }

            CacheEntry cached = entry.get();
            RepositorySnapshot snapshot = new RepositorySnapshot(identity, locator, cached.chunks(),
                cached.languageHistogram(), VectorIndex.of(cached.vectors()));
            IndexStats stats = snapshot.stats();

            out.println();
            out.println("Repository Index Statistics");
            out.println("=".repeat(40));
            out.println("Repository: " + locator);
            out.println("Identity: " + identity);
            out.println("Model: " + cached.modelId());
            out.println("Dimensions: " + stats.dimensions());
            out.println("Total chunks: " + stats.totalChunks());
            out.println("Source files: " + stats.fileCount());
            out.printf("Index size: %.1f KB%n", stats.sizeBytes() / 1024.0);
            out.println();
            out.println("Chunks by type:");
            stats.chunksByType().forEach((type, count) -> out.println("  " + type + ": " + count));
            out.println();
            out.println("Files by language:");
            stats.languages().forEach((language, count) -> out.println("  " + language + ": " + count));
            return 0;
        }
    }

    /**
     * Drop a cached index.
     */
    @Command(
        name = "invalidate",
        description = "Delete the cached index of a repository"
    )
    static class InvalidateCommand implements Callable<Integer> {

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", description = "Repository locator used when indexing")
        String locator;

        @Option(names = {"--cache-dir"}, description = "Index cache directory (default: ~/.repo-vectors/cache)")
        Path cacheDir;

        @Override
        public Integer call() throws IOException {
            FileCacheStore store = cacheDir != null ? new FileCacheStore(cacheDir) : FileCacheStore.inUserHome();
            boolean removed = store.invalidate(RepositoryIdentity.of(locator));
            spec.commandLine().getOut().println(removed
                ? "Removed cached index of " + locator
                : "No cached index for " + locator);
            return 0;
        }
    }
}
