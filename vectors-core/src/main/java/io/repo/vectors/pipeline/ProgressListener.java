package io.repo.vectors.pipeline;

/**
 * Receives stage messages while a repository is being indexed.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (message, percentage) -> { };

    /**
     * @param message    what the pipeline is doing
     * @param percentage overall completion, 0 to 100
     */
    void progress(String message, double percentage);
}
