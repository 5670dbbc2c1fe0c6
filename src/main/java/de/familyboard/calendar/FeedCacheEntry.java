package de.familyboard.calendar;

import java.time.Duration;
import java.time.Instant;

/**
 * The last successfully fetched content of one calendar source.
 *
 * @param sourceId  the id of the calendar source
 * @param content   the fetched content
 * @param fetchedAt when the content was fetched
 */
public record FeedCacheEntry(String sourceId, FeedContent content, Instant fetchedAt) {

    /**
     * @return whether the entry was fetched less than {@code staleness} before {@code now}
     */
    public boolean isFresh(Instant now, Duration staleness) {
        return fetchedAt.plus(staleness).isAfter(now);
    }
}
