package de.familyboard.calendar;

import biweekly.util.ICalDate;
import biweekly.util.com.google.ical.compat.javautil.DateIterator;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collections;
import java.util.Date;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * Turns a {@link RawEvent} into the start instants of its occurrences inside a
 * {@link TimeWindow}.
 * <p>
 * Recurring events are expanded lazily: occurrences are pulled one at a time from the
 * rule's date iterator, so rules without COUNT or UNTIL never get materialized. The
 * iterator stops at the first occurrence at or after the end of the window. An event with
 * more than {@link #MAX_OCCURRENCES} occurrences in the window fails with a
 * {@link CalendarException} rather than being cut short.
 */
@Component
class RecurrenceExpander {

    private static final Logger log = LoggerFactory.getLogger(RecurrenceExpander.class);

    /** Occurrences examined per event and window before expansion fails. */
    static final int MAX_OCCURRENCES = 10_000;

    Iterator<Instant> expand(RawEvent event, TimeWindow window) {
        return expand(event, window, Set.of());
    }

    /**
     * @param event    the event to expand
     * @param window   the window occurrences must start in
     * @param replaced occurrence starts that are replaced by override instances
     * @return the occurrence starts in non-decreasing order; iterating fails with a
     * {@link CalendarException} once more than {@link #MAX_OCCURRENCES} occurrences are examined
     */
    Iterator<Instant> expand(RawEvent event, TimeWindow window, Set<Instant> replaced) {
        var recurrence = event.recurrence();
        if (recurrence == null) {
            return window.contains(event.start())
                    ? List.of(event.start()).iterator()
                    : Collections.emptyIterator();
        }

        var skipped = new HashSet<Instant>(event.exceptions());
        skipped.addAll(replaced);

        var dates = recurrence.getDateIterator(new ICalDate(Date.from(event.start()), true), event.zone());
        if (window.start().isAfter(event.start())) {
            dates.advanceTo(Date.from(window.start()));
        }
        return new WindowedOccurrences(event.uid(), dates, window, skipped);
    }

    private static final class WindowedOccurrences implements Iterator<Instant> {

        private final String uid;
        private final DateIterator dates;
        private final TimeWindow window;
        private final Set<Instant> skipped;

        private @Nullable Instant next;
        private boolean exhausted;
        private int examined;

        WindowedOccurrences(String uid, DateIterator dates, TimeWindow window, Set<Instant> skipped) {
            this.uid = uid;
            this.dates = dates;
            this.window = window;
            this.skipped = skipped;
        }

        @Override
        public boolean hasNext() {
            if (next == null && !exhausted) {
                next = advance();
                exhausted = next == null;
            }
            return next != null;
        }

        @Override
        public Instant next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            var occurrence = next;
            next = null;
            return occurrence;
        }

        private @Nullable Instant advance() {
            while (dates.hasNext()) {
                if (++examined > MAX_OCCURRENCES) {
                    log.warn("Stopped expanding event {} after {} occurrences", uid, MAX_OCCURRENCES);
                    throw new CalendarException("Event " + uid + " has more than " + MAX_OCCURRENCES
                            + " occurrences in the requested window.");
                }
                var candidate = dates.next().toInstant();
                if (!candidate.isBefore(window.end())) {
                    return null;
                }
                if (candidate.isBefore(window.start()) || skipped.contains(candidate)) {
                    continue;
                }
                return candidate;
            }
            return null;
        }
    }
}
