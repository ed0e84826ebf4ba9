package io.repo.vectors.embeddings;

/**
 * Available embedding backends.
 */
public enum EmbeddingBackend {
    /** Hashing-trick bag of code tokens, offline and deterministic */
    SIMPLE,

    /** Voyage AI API */
    VOYAGE,

    /** OpenAI embeddings API */
    OPENAI
}
