package de.familyboard.calendar;

/**
 * Thrown when iCalendar text is structurally invalid, e.g. an unterminated component
 * or an event without a start.
 */
public class CalendarParseException extends CalendarException {

    public CalendarParseException(String message) {
        super(message);
    }

    public CalendarParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
