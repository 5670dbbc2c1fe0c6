package de.familyboard.calendar;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * A single event occurrence as shown to the dashboard, independent of the format of the
 * calendar it came from.
 *
 * @param summary      the name/summary of the event ({@code No Title} when the source had none)
 * @param start        the start of this occurrence; all-day events start at local midnight
 * @param allDay       whether the event is an all-day event without a time of day
 * @param recurring    whether the occurrence was expanded from a recurrence rule
 * @param calendarId   the id of the calendar source
 * @param calendarName the display name of the calendar source
 * @param color        the color tag of the calendar source
 * @param zone         the zone the start is local to; all-day dates belong to this zone
 */
public record NormalizedEvent(
        String summary,
        Instant start,
        boolean allDay,
        boolean recurring,
        String calendarId,
        String calendarName,
        String color,
        ZoneId zone
) {

    static final String NO_TITLE = "No Title";

    static NormalizedEvent of(CalendarSource source, @Nullable String summary, Instant start, boolean allDay,
                              boolean recurring, ZoneId zone) {
        var title = (summary == null || summary.isBlank()) ? NO_TITLE : summary.strip();
        return new NormalizedEvent(title, start, allDay, recurring, source.id(), source.name(), source.color(),
                zone);
    }

    /**
     * @return the calendar date of the start in the event's own zone
     */
    public LocalDate localDate() {
        return LocalDate.ofInstant(start, zone);
    }
}
