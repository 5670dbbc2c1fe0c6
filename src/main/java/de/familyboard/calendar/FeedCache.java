package de.familyboard.calendar;

import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Holds at most one {@link FeedCacheEntry} per calendar source. Entries are only ever
 * replaced as a whole; concurrent writers for the same source race with last write wins.
 */
@Component
public class FeedCache {

    private final ConcurrentMap<String, FeedCacheEntry> entries = new ConcurrentHashMap<>();

    public Optional<FeedCacheEntry> get(String sourceId) {
        return Optional.ofNullable(entries.get(sourceId));
    }

    void put(FeedCacheEntry entry) {
        entries.put(entry.sourceId(), entry);
    }

    public int size() {
        return entries.size();
    }
}
