package io.repo.vectors.embeddings;

import java.util.Locale;
import java.util.Map;

/**
 * OpenAI embedding model ({@code text-embedding-3-*}).
 *
 * <p>The key comes from the config or the OPENAI_API_KEY environment variable.
 * Dimensions other than the model default are requested through the
 * {@code dimensions} field, which the v3 models support.</p>
 */
public class OpenAiEmbeddingModel extends HttpEmbeddingModel {

    private static final String API_URL = "https://api.openai.com/v1/embeddings";
    private static final int MAX_BATCH_SIZE = 256;

    public static final String MODEL_SMALL = "text-embedding-3-small";
    public static final String MODEL_LARGE = "text-embedding-3-large";

    public OpenAiEmbeddingModel(EmbeddingConfig config) {
        super(config, MODEL_SMALL, defaultDimensions(config.model()));
    }

    private static int defaultDimensions(String model) {
        return MODEL_LARGE.equals(model) || "large".equalsIgnoreCase(String.valueOf(model)) ? 3072 : 1536;
    }

    @Override
    protected String resolveModel(String model) {
        return switch (model.toLowerCase(Locale.ROOT)) {
            case "small" -> MODEL_SMALL;
            case "large" -> MODEL_LARGE;
            default -> model;
        };
    }

    @Override
    protected void customizeRequest(Map<String, Object> request, boolean query) {
        if (dimensions != defaultDimensions(model)) {
            request.put("dimensions", dimensions);
        }
    }

    @Override
    public String getModelId() {
        return "openai:" + model + ":" + dimensions;
    }

    @Override
    protected String providerName() {
        return "OpenAI";
    }

    @Override
    protected String defaultEndpoint() {
        return API_URL;
    }

    @Override
    protected String apiKeyVariable() {
        return "OPENAI_API_KEY";
    }

    @Override
    protected int maxBatchSize() {
        return MAX_BATCH_SIZE;
    }
}
