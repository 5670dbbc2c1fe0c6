package de.familyboard.calendar;

import com.fasterxml.jackson.databind.node.ArrayNode;
import org.jspecify.annotations.Nullable;

/**
 * Raw content of a calendar source as it is kept in the fetch cache.
 */
public sealed interface FeedContent permits FeedContent.ICalendarText, FeedContent.CloudEvents {

    FeedFormat format();

    /**
     * iCalendar text of a feed.
     *
     * @param text the unparsed feed body
     */
    record ICalendarText(String text) implements FeedContent {

        @Override
        public FeedFormat format() {
            return FeedFormat.ICALENDAR;
        }
    }

    /**
     * Decoded event list of the cloud provider.
     *
     * @param events   the JSON event objects; never modified after decoding
     * @param timeZone the calendar's time zone reported by the provider, if any
     */
    record CloudEvents(ArrayNode events, @Nullable String timeZone) implements FeedContent {

        @Override
        public FeedFormat format() {
            return FeedFormat.CLOUD_JSON;
        }
    }
}
