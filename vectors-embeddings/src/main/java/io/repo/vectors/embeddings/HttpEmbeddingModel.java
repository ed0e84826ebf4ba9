package io.repo.vectors.embeddings;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base class for embedding providers reached over an OpenAI-style REST API.
 *
 * <p>Both supported providers accept {@code {"input": [...], "model": ...}} and
 * answer with {@code {"data": [{"embedding": [...], "index": n}]}}. Subclasses
 * contribute the endpoint, the key variable and provider-specific request
 * fields.</p>
 *
 * <p>Rate limiting (429) and server errors (5xx) are retried with exponential
 * backoff up to {@link EmbeddingConfig#maxRetries()} attempts; other statuses
 * fail immediately.</p>
 */
public abstract class HttpEmbeddingModel implements EmbeddingModel {

    private static final Logger log = LoggerFactory.getLogger(HttpEmbeddingModel.class);

    private static final long BACKOFF_BASE_MILLIS = 1000;

    protected final String model;
    protected final int dimensions;

    private final String apiKey;
    private final URI endpoint;
    private final Duration requestTimeout;
    private final int maxRetries;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final CodePreprocessor preprocessor;

    protected HttpEmbeddingModel(EmbeddingConfig config, String defaultModel, int defaultDimensions) {
        this.model = resolveModel(config.model() != null ? config.model() : defaultModel);
        this.dimensions = config.dimensions() > 0 ? config.dimensions() : defaultDimensions;
        this.apiKey = resolveApiKey(config.apiKey());
        this.endpoint = config.endpoint() != null ? config.endpoint() : URI.create(defaultEndpoint());
        this.requestTimeout = config.requestTimeout();
        this.maxRetries = config.maxRetries();
        this.preprocessor = config.preprocessCode() ? CodePreprocessor.defaults() : null;

        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(30))
            .build();
        this.objectMapper = new ObjectMapper();

        log.info("Initialized {} embedding model: {} ({}d)", providerName(), model, dimensions);
    }

    // ==================== Provider Specifics ====================

    /** Human-readable provider name for logs and errors. */
    protected abstract String providerName();

    protected abstract String defaultEndpoint();

    /** Environment variable consulted when the config carries no key. */
    protected abstract String apiKeyVariable();

    /** Largest number of inputs accepted in one request. */
    protected abstract int maxBatchSize();

    /**
     * Adds provider-specific fields to a request body.
     *
     * @param query whether the inputs are search queries rather than documents
     */
    protected abstract void customizeRequest(Map<String, Object> request, boolean query);

    /** Maps short aliases to full model names. */
    protected String resolveModel(String model) {
        return model;
    }

    // ==================== EmbeddingModel ====================

    @Override
    public float[] embed(String text) {
        return embedBatch(List.of(text)).get(0);
    }

    @Override
    public List<float[]> embedBatch(List<String> texts) {
        return embedAll(texts, false);
    }

    @Override
    public List<float[]> embedQueries(List<String> queries) {
        return embedAll(queries, true);
    }

    @Override
    public int getDimensions() {
        return dimensions;
    }

    @Override
    public void close() {
        // HttpClient holds no resources that need explicit release on JDK 17
    }

    private List<float[]> embedAll(List<String> texts, boolean query) {
        List<float[]> embeddings = new ArrayList<>(texts.size());

        for (int i = 0; i < texts.size(); i += maxBatchSize()) {
            List<String> batch = texts.subList(i, Math.min(i + maxBatchSize(), texts.size()));
            if (preprocessor != null) {
                batch = batch.stream().map(preprocessor::preprocess).toList();
            }
            embeddings.addAll(request(batch, query));
        }
        return embeddings;
    }

    private List<float[]> request(List<String> texts, boolean query) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("input", texts);
        body.put("model", model);
        customizeRequest(body, query);

        HttpRequest httpRequest;
        try {
            httpRequest = HttpRequest.newBuilder()
                .uri(endpoint)
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + apiKey)
                .timeout(requestTimeout)
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
                .build();
        } catch (IOException e) {
            throw new EmbeddingApiException("Failed to encode " + providerName() + " request", e);
        }

        for (int attempt = 1; ; attempt++) {
            HttpResponse<String> response;
            try {
                response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
            } catch (IOException e) {
                throw new EmbeddingApiException("Failed to call " + providerName() + " API", e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new EmbeddingApiException("Interrupted during " + providerName() + " API call", e);
            }

            int status = response.statusCode();
            if (status == 200) {
                return parse(response.body(), texts.size());
            }

            boolean retryable = status == 429 || status >= 500;
            if (!retryable || attempt >= maxRetries) {
                log.error("{} API error: {} - {}", providerName(), status, response.body());
                throw new EmbeddingApiException(describe(status, response.body()), status);
            }

            long waitMs = BACKOFF_BASE_MILLIS << (attempt - 1);
            log.warn("{} API returned {}, waiting {}ms before retry {}/{}",
                providerName(), status, waitMs, attempt + 1, maxRetries);
            sleep(waitMs);
        }
    }

    private List<float[]> parse(String body, int expected) {
        EmbeddingResponse response;
        try {
            response = objectMapper.readValue(body, EmbeddingResponse.class);
        } catch (IOException e) {
            throw new EmbeddingApiException("Malformed " + providerName() + " response", e);
        }
        if (response.data == null || response.data.size() != expected) {
            throw new EmbeddingApiException(String.format("%s returned %d embeddings for %d inputs",
                providerName(), response.data == null ? 0 : response.data.size(), expected), 200);
        }
        if (response.usage != null) {
            log.debug("{} request used {} tokens", providerName(), response.usage.totalTokens);
        }

        return response.data.stream()
            .sorted(Comparator.comparingInt(d -> d.index))
            .map(d -> d.embedding)
            .toList();
    }

    private String describe(int status, String body) {
        return switch (status) {
            case 401 -> "Invalid " + providerName() + " API key. Check " + apiKeyVariable() + " or --api-key";
            case 400 -> "Bad request to " + providerName() + " API: " + body;
            default -> providerName() + " API error " + status + ": " + body;
        };
    }

    private String resolveApiKey(String configured) {
        String key = configured;
        if (key == null || key.isBlank()) {
            key = System.getenv(apiKeyVariable());
        }
        if (key == null || key.isBlank()) {
            throw new IllegalStateException(providerName() + " API key not found. Set the "
                + apiKeyVariable() + " environment variable or use the --api-key option.");
        }
        return key;
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingApiException("Interrupted while backing off", e);
        }
    }

    // ==================== Response DTOs ====================

    @JsonIgnoreProperties(ignoreUnknown = true)
    private static class EmbeddingResponse {
        @JsonProperty("data")
        public List<EmbeddingData> data;

        @JsonProperty("usage")
        public Usage usage;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private static class EmbeddingData {
        @JsonProperty("embedding")
        public float[] embedding;

        @JsonProperty("index")
        public int index;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private static class Usage {
        @JsonProperty("total_tokens")
        public int totalTokens;
    }
}
