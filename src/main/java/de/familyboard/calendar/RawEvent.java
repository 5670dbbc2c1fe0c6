package de.familyboard.calendar;

import biweekly.util.Recurrence;
import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.Set;
import java.util.TimeZone;

/**
 * A VEVENT as read from an iCalendar feed, before recurrence expansion.
 *
 * @param uid          the UID of the event, shared by a series and its overrides
 * @param summary      the SUMMARY, or {@code null} if the event has none
 * @param start        the DTSTART, the anchor of the recurrence if there is one
 * @param allDay       whether DTSTART is a date without time
 * @param zone         the zone the recurrence is iterated in
 * @param recurrence   the RRULE, or {@code null} for single events
 * @param exceptions   EXDATE instants that are removed from the recurrence
 * @param recurrenceId the RECURRENCE-ID of an override instance, or {@code null}
 */
record RawEvent(
        String uid,
        @Nullable String summary,
        Instant start,
        boolean allDay,
        TimeZone zone,
        @Nullable Recurrence recurrence,
        Set<Instant> exceptions,
        @Nullable Instant recurrenceId
) {

    RawEvent {
        exceptions = Set.copyOf(exceptions);
    }

    boolean isRecurring() {
        return recurrence != null;
    }

    boolean isOverride() {
        return recurrenceId != null;
    }
}
