package de.familyboard.calendar;

/**
 * Exception thrown when a calendar operation fails.
 */
public class CalendarException extends RuntimeException {

    public CalendarException(String message) {
        super(message);
    }

    public CalendarException(String message, Throwable cause) {
        super(message, cause);
    }
}
