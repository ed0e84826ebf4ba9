package io.repo.vectors.cache;

import java.io.IOException;
import java.util.Optional;

/**
 * Persistent store of indexed repositories, keyed by repository identity.
 */
public interface CacheStore {

    /**
     * Loads the entry for an identity.
     *
     * @return the entry, or empty if there is none or it cannot be read
     */
    Optional<CacheEntry> load(String identity);

    /**
     * Replaces the entry for {@code entry.identity()}. Readers never observe a
     * partially written entry.
     *
     * @throws IOException if the entry cannot be written
     */
    void save(CacheEntry entry) throws IOException;

    /**
     * Removes the entry for an identity.
     *
     * @return true if an entry existed
     * @throws IOException if the entry exists but cannot be removed
     */
    boolean invalidate(String identity) throws IOException;

    /**
     * Checks whether an entry exists, without validating it.
     */
    boolean contains(String identity);
}
