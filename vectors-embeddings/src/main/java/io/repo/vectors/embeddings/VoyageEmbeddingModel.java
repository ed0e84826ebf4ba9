package io.repo.vectors.embeddings;

import java.util.Locale;
import java.util.Map;

/**
 * Voyage AI embedding model using their REST API.
 *
 * <p>API key can be provided via:
 * <ol>
 *   <li>EmbeddingConfig.apiKey()</li>
 *   <li>Environment variable: VOYAGE_API_KEY</li>
 * </ol>
 *
 * @see <a href="https://docs.voyageai.com/docs/embeddings">Voyage AI Embeddings</a>
 */
public class VoyageEmbeddingModel extends HttpEmbeddingModel {

    private static final String API_URL = "https://api.voyageai.com/v1/embeddings";
    private static final int MAX_BATCH_SIZE = 128;
    private static final int DEFAULT_DIMENSIONS = 1024;

    /** Available Voyage AI models */
    public static final String MODEL_CODE_3 = "voyage-code-3";
    public static final String MODEL_3_LARGE = "voyage-3-large";
    public static final String MODEL_3_5 = "voyage-3.5";
    public static final String MODEL_3_5_LITE = "voyage-3.5-lite";

    public VoyageEmbeddingModel(EmbeddingConfig config) {
        super(config, MODEL_CODE_3, DEFAULT_DIMENSIONS);
    }

    @Override
    protected String resolveModel(String model) {
        return switch (model.toLowerCase(Locale.ROOT)) {
            case "voyage-code", "voyage-code-3", "code" -> MODEL_CODE_3;
            case "voyage-3-large", "large" -> MODEL_3_LARGE;
            case "voyage-3.5", "3.5" -> MODEL_3_5;
            case "voyage-3.5-lite", "lite" -> MODEL_3_5_LITE;
            default -> model;
        };
    }

    @Override
    protected void customizeRequest(Map<String, Object> request, boolean query) {
        request.put("input_type", query ? "query" : "document");
        if (dimensions != DEFAULT_DIMENSIONS) {
            request.put("output_dimension", dimensions);
        }
    }

    @Override
    public String getModelId() {
        return "voyage:" + model + ":" + dimensions;
    }

    @Override
    protected String providerName() {
        return "Voyage AI";
    }

    @Override
    protected String defaultEndpoint() {
        return API_URL;
    }

    @Override
    protected String apiKeyVariable() {
        return "VOYAGE_API_KEY";
    }

    @Override
    protected int maxBatchSize() {
        return MAX_BATCH_SIZE;
    }
}
