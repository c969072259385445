package com.hypecycle.core.cache;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Process-local {@link CacheStore}, used when no DataSource is configured.
 * Entries are lost on restart.
 */
public class InMemoryCacheStore implements CacheStore {

    private final CopyOnWriteArrayList<CacheEntry> entries = new CopyOnWriteArrayList<>();

    @Override
    public Optional<CacheEntry> get(String keyword, Instant now) {
        return entries.stream()
                .filter(entry -> entry.keyword().equals(keyword))
                .filter(entry -> !entry.isExpired(now))
                .max(Comparator.comparing(CacheEntry::createdAt));
    }

    @Override
    public void put(CacheEntry entry) {
        entries.add(entry);
    }

    @Override
    public List<CacheEntry> recent(int limit) {
        List<CacheEntry> newestFirst = new ArrayList<>(entries);
        newestFirst.sort(Comparator.comparing(CacheEntry::createdAt).reversed());
        return List.copyOf(newestFirst.subList(0, Math.min(limit, newestFirst.size())));
    }
}
