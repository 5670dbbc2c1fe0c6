package de.familyboard.calendar;

import org.jspecify.annotations.Nullable;

/**
 * A configured calendar the dashboard shows events from. Exactly one of
 * {@code feedUrl} and {@code cloudCalendarId} is set.
 *
 * @param id              opaque identifier, also the key of the fetch cache
 * @param name            the human-readable name of the calendar
 * @param color           a color tag (hex string like {@code #3F51B5} or a palette name)
 * @param feedUrl         the URL of a remote iCalendar feed, or {@code null} for cloud calendars
 * @param cloudCalendarId the calendar id at the cloud provider, or {@code null} for feeds
 */
public record CalendarSource(
        String id,
        String name,
        String color,
        @Nullable String feedUrl,
        @Nullable String cloudCalendarId
) {

    static final String DEFAULT_COLOR = "primary";

    public CalendarSource {
        if (id == null || id.isBlank()) {
            throw new CalendarException("Calendar id must not be empty.");
        }
        if (name == null || name.isBlank()) {
            name = id;
        }
        if (color == null || color.isBlank()) {
            color = DEFAULT_COLOR;
        }
        var hasFeed = feedUrl != null && !feedUrl.isBlank();
        var hasCloud = cloudCalendarId != null && !cloudCalendarId.isBlank();
        if (hasFeed == hasCloud) {
            throw new CalendarException("Calendar '" + id + "' must have either a feed URL or a cloud calendar id.");
        }
    }

    public static CalendarSource feed(String id, String name, String color, String feedUrl) {
        return new CalendarSource(id, name, color, feedUrl, null);
    }

    public static CalendarSource cloud(String id, String name, String color, String cloudCalendarId) {
        return new CalendarSource(id, name, color, null, cloudCalendarId);
    }

    public boolean isCloud() {
        return cloudCalendarId != null && !cloudCalendarId.isBlank();
    }
}
