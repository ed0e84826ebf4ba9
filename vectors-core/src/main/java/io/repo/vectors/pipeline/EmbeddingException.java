package io.repo.vectors.pipeline;

/**
 * Thrown when the embedding provider fails for a request even after its retry.
 */
public class EmbeddingException extends RuntimeException {

    public EmbeddingException(String message) {
        super(message);
    }

    public EmbeddingException(String message, Throwable cause) {
        super(message, cause);
    }
}
