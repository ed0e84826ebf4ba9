package io.repo.vectors.embeddings;

/**
 * Thrown when a remote embedding provider cannot produce vectors.
 */
public class EmbeddingApiException extends RuntimeException {

    private final int statusCode;

    public EmbeddingApiException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public EmbeddingApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /**
     * Returns the HTTP status of the failed call, or -1 if no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
