package io.repo.vectors.pipeline;

/**
 * Lifecycle of one repository identity inside a {@link RepositoryIndexer}.
 *
 * <p>A cache hit goes {@code UNINITIALIZED -> LOADING -> READY}; a build goes
 * through {@code SCANNING, CHUNKING, EMBEDDING, INDEXING, PERSISTING} to
 * {@code READY}. {@code FAILED} is left only by a forced rebuild.</p>
 */
public enum PipelineState {
    UNINITIALIZED,
    LOADING,
    SCANNING,
    CHUNKING,
    EMBEDDING,
    INDEXING,
    PERSISTING,
    READY,
    FAILED
}
