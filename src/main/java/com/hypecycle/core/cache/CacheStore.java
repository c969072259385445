package com.hypecycle.core.cache;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Append-only store of classification results keyed by keyword.
 * <p>
 * Implementations report storage problems as {@link CacheStoreException}.
 */
public interface CacheStore {

    /**
     * The most recent entry for the keyword that has not expired at {@code now}.
     */
    Optional<CacheEntry> get(String keyword, Instant now);

    /** Appends a new entry. Existing entries are never modified. */
    void put(CacheEntry entry);

    /** Up to {@code limit} entries, newest first, expired ones included. */
    List<CacheEntry> recent(int limit);
}
