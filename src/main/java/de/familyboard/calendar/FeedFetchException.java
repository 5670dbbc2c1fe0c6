package de.familyboard.calendar;

/**
 * Thrown when the raw content of a calendar source cannot be retrieved: the endpoint is
 * unreachable or timed out, answered with a non-success status, or returned content that
 * is not structurally what its content type declares.
 */
public class FeedFetchException extends CalendarException {

    private final String sourceId;

    public FeedFetchException(String sourceId, String message) {
        super(message);
        this.sourceId = sourceId;
    }

    public FeedFetchException(String sourceId, String message, Throwable cause) {
        super(message, cause);
        this.sourceId = sourceId;
    }

    public String getSourceId() {
        return sourceId;
    }
}
