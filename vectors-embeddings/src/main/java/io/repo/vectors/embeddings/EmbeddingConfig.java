package io.repo.vectors.embeddings;

import java.net.URI;
import java.time.Duration;

/**
 * Configuration for embedding models.
 */
public record EmbeddingConfig(
    /** Backend to use for embedding generation */
    EmbeddingBackend backend,

    /** Provider model name, null for the backend's default */
    String model,

    /** API key for remote providers; null falls back to the provider's environment variable */
    String apiKey,

    /** Output dimensions (0 = use model default) */
    int dimensions,

    /** Whether to split identifiers before embedding */
    boolean preprocessCode,

    /** Endpoint override for remote providers, null for the public API */
    URI endpoint,

    /** Timeout of a single HTTP request */
    Duration requestTimeout,

    /** Attempts per request when rate limited or on a server error */
    int maxRetries
) {

    public static final int DEFAULT_SIMPLE_DIMENSIONS = 384;

    public EmbeddingConfig {
        if (backend == null) throw new IllegalArgumentException("backend cannot be null");
        if (dimensions < 0) throw new IllegalArgumentException("dimensions must be >= 0");
        if (maxRetries < 1) throw new IllegalArgumentException("maxRetries must be >= 1");
        requestTimeout = requestTimeout != null ? requestTimeout : Duration.ofSeconds(60);
    }

    public static EmbeddingConfig defaults() {
        return new EmbeddingConfig(
            EmbeddingBackend.SIMPLE,
            null,
            null,
            0,
            true,
            null,
            Duration.ofSeconds(60),
            3
        );
    }

    public static EmbeddingConfig voyage() {
        return defaults().withBackend(EmbeddingBackend.VOYAGE);
    }

    public static EmbeddingConfig openAi() {
        return defaults().withBackend(EmbeddingBackend.OPENAI).withPreprocessing(false);
    }

    public EmbeddingConfig withBackend(EmbeddingBackend backend) {
        return new EmbeddingConfig(backend, model, apiKey, dimensions, preprocessCode, endpoint, requestTimeout, maxRetries);
    }

    public EmbeddingConfig withModel(String model) {
        return new EmbeddingConfig(backend, model, apiKey, dimensions, preprocessCode, endpoint, requestTimeout, maxRetries);
    }

    public EmbeddingConfig withApiKey(String apiKey) {
        return new EmbeddingConfig(backend, model, apiKey, dimensions, preprocessCode, endpoint, requestTimeout, maxRetries);
    }

    public EmbeddingConfig withDimensions(int dimensions) {
        return new EmbeddingConfig(backend, model, apiKey, dimensions, preprocessCode, endpoint, requestTimeout, maxRetries);
    }

    public EmbeddingConfig withPreprocessing(boolean enabled) {
        return new EmbeddingConfig(backend, model, apiKey, dimensions, enabled, endpoint, requestTimeout, maxRetries);
    }

    public EmbeddingConfig withEndpoint(URI endpoint) {
        return new EmbeddingConfig(backend, model, apiKey, dimensions, preprocessCode, endpoint, requestTimeout, maxRetries);
    }

    public EmbeddingConfig withRequestTimeout(Duration requestTimeout) {
        return new EmbeddingConfig(backend, model, apiKey, dimensions, preprocessCode, endpoint, requestTimeout, maxRetries);
    }

    public EmbeddingConfig withMaxRetries(int maxRetries) {
        return new EmbeddingConfig(backend, model, apiKey, dimensions, preprocessCode, endpoint, requestTimeout, maxRetries);
    }
}
