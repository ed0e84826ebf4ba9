package io.repo.vectors.cli;

import io.repo.vectors.cache.FileCacheStore;
import io.repo.vectors.embeddings.EmbeddingBackend;
import io.repo.vectors.embeddings.EmbeddingConfig;
import io.repo.vectors.embeddings.EmbeddingModel;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Embedding provider and cache options shared by the commands.
 */
class ProviderOptions {

    @Option(names = {"-p", "--provider"}, description = "Embedding provider: simple, voyage, openai",
        defaultValue = "simple")
    String provider;

    @Option(names = {"-m", "--model"}, description = "Provider model name (default: the provider's default)")
    String model;

    @Option(names = {"--dimensions"}, description = "Embedding dimensions (0 = model default)", defaultValue = "0")
    int dimensions;

    @Option(names = {"--api-key"}, description = "API key for remote providers (or set VOYAGE_API_KEY / OPENAI_API_KEY)")
    String apiKey;

    @Option(names = {"--cache-dir"}, description = "Index cache directory (default: ~/.repo-vectors/cache)")
    Path cacheDir;

    EmbeddingModel loadModel() {
        return EmbeddingModel.load(embeddingConfig());
    }

    EmbeddingConfig embeddingConfig() {
        EmbeddingConfig config = switch (provider.toLowerCase(Locale.ROOT)) {
            case "voyage", "voyage-ai", "voyageai" -> EmbeddingConfig.voyage();
            case "openai" -> EmbeddingConfig.openAi();
            case "simple", "hash" -> EmbeddingConfig.defaults().withBackend(EmbeddingBackend.SIMPLE);
            default -> throw new IllegalArgumentException("Unknown provider: " + provider
                + ". Use: simple, voyage, openai");
        };
        if (model != null && !model.isBlank()) {
            config = config.withModel(model);
        }
        if (apiKey != null && !apiKey.isBlank()) {
            config = config.withApiKey(apiKey);
        }
        return config.withDimensions(dimensions);
    }

    FileCacheStore cacheStore() {
        return cacheDir != null ? new FileCacheStore(cacheDir) : FileCacheStore.inUserHome();
    }
}
