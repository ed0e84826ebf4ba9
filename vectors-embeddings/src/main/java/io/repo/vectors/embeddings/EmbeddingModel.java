package io.repo.vectors.embeddings;

import java.io.Closeable;
import java.util.List;

/**
 * Interface for generating embeddings of repository passages.
 *
 * <p>Implementations compute vectors locally or call a remote API. All vectors
 * returned by one model have {@link #getDimensions()} components.</p>
 */
public interface EmbeddingModel extends Closeable {

    /**
     * Generates an embedding for a single passage.
     *
     * @param text passage text, usually a chunk with its context header
     * @return vector embedding
     */
    float[] embed(String text);

    /**
     * Generates embeddings for multiple passages.
     *
     * <p>Implementations may split the list into requests of their own size.</p>
     *
     * @param texts passages to embed
     * @return embeddings in the same order
     * @throws EmbeddingApiException if a remote provider rejects the request
     */
    List<float[]> embedBatch(List<String> texts);

    /**
     * Generates embeddings for search queries.
     *
     * <p>Providers that distinguish documents from queries override this.</p>
     */
    default List<float[]> embedQueries(List<String> queries) {
        return embedBatch(queries);
    }

    /**
     * Returns the model identifier (e.g., "voyage:voyage-code-3").
     *
     * <p>Indexes built with one model id are never searched with another.</p>
     */
    String getModelId();

    /**
     * Returns the embedding dimensions.
     */
    int getDimensions();

    @Override
    void close();

    /**
     * Creates the model selected by the configuration's backend.
     *
     * @param config configuration options
     * @return configured embedding model
     */
    static EmbeddingModel load(EmbeddingConfig config) {
        return switch (config.backend()) {
            case SIMPLE -> new SimpleEmbeddingModel(config);
            case VOYAGE -> new VoyageEmbeddingModel(config);
            case OPENAI -> new OpenAiEmbeddingModel(config);
        };
    }
}
