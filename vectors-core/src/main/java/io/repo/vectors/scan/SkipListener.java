package io.repo.vectors.scan;

/**
 * Receives files that the selector had to skip while reading.
 */
@FunctionalInterface
public interface SkipListener {

    SkipListener NONE = (relativePath, reason) -> { };

    void skipped(String relativePath, String reason);
}
