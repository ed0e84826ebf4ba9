package io.repo.vectors.cache;

import io.repo.vectors.CodeChunk;

/**
 * Derives cache keys from repository locators (URLs or paths).
 */
public final class RepositoryIdentity {

    private RepositoryIdentity() {
    }

    /**
     * Returns the SHA-256 hex digest of the normalized locator.
     *
     * <p>{@code https://host/owner/repo}, {@code https://host/owner/repo/} and
     * {@code https://host/owner/repo.git} share one identity.</p>
     */
    public static String of(String locator) {
        if (locator == null || locator.isBlank()) {
            throw new IllegalArgumentException("locator cannot be blank");
        }
        return CodeChunk.hash(normalize(locator));
    }

    static String normalize(String locator) {
        String normalized = locator.trim().replace('\\', '/');
        while (normalized.length() > 1 && normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        if (normalized.endsWith(".git")) {
            normalized = normalized.substring(0, normalized.length() - 4);
        }
        return normalized;
    }
}
