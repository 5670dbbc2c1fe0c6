package de.familyboard.calendar;

/**
 * The content formats a calendar source can deliver.
 */
public enum FeedFormat {

    /** RFC 5545 iCalendar text. */
    ICALENDAR,

    /** JSON event list of the cloud calendar provider. */
    CLOUD_JSON
}
