package de.familyboard.calendar;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class FeedCacheTest {

    private static final Instant FETCHED_AT = Instant.parse("2026-03-01T12:00:00Z");

    private final FeedCache cache = new FeedCache();

    @Test
    void missing_entry_is_empty() {
        assertThat(cache.get("family")).isEmpty();
    }

    @Test
    void put_replaces_entry_of_same_source() {
        cache.put(new FeedCacheEntry("family", new FeedContent.ICalendarText("old"), FETCHED_AT));
        cache.put(new FeedCacheEntry("family", new FeedContent.ICalendarText("new"), FETCHED_AT.plusSeconds(60)));
        cache.put(new FeedCacheEntry("school", new FeedContent.ICalendarText("other"), FETCHED_AT));

        assertThat(cache.size()).isEqualTo(2);
        assertThat(cache.get("family")).get()
                .extracting(FeedCacheEntry::content)
                .isEqualTo(new FeedContent.ICalendarText("new"));
    }

    @Test
    void entry_is_fresh_until_staleness_elapsed() {
        var entry = new FeedCacheEntry("family", new FeedContent.ICalendarText("x"), FETCHED_AT);
        var staleness = Duration.ofMinutes(10);

        assertThat(entry.isFresh(FETCHED_AT.plusSeconds(599), staleness)).isTrue();
        assertThat(entry.isFresh(FETCHED_AT.plusSeconds(600), staleness)).isFalse();
    }
}
