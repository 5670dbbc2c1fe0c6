package de.familyboard.calendar;

import java.time.Duration;
import java.time.Instant;

/**
 * A half-open {@code [start, end)} range of instants used to select events and to bound
 * recurrence expansion.
 *
 * @param start the first instant inside the window
 * @param end   the first instant after the window
 */
public record TimeWindow(Instant start, Instant end) {

    public TimeWindow {
        if (start == null || end == null) {
            throw new CalendarException("Time window start and end must not be empty.");
        }
        if (!end.isAfter(start)) {
            throw new CalendarException("Time window end must be after its start.");
        }
    }

    public static TimeWindow startingAt(Instant start, Duration length) {
        return new TimeWindow(start, start.plus(length));
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && instant.isBefore(end);
    }
}
