package de.familyboard.calendar;

import java.time.Duration;
import java.time.ZoneId;
import java.util.List;

/**
 * Shared fixtures for calendar tests.
 */
final class TestCalendars {

    private TestCalendars() {
    }

    static CalendarProperties defaults() {
        return new CalendarProperties(null, null, 0, 0, null, null, false, null, null, null);
    }

    static CalendarProperties withZone(ZoneId zone) {
        return new CalendarProperties(null, null, 0, 0, null, zone, false, null, null, null);
    }

    static CalendarProperties withFetchTimeout(Duration fetchTimeout) {
        return new CalendarProperties(null, fetchTimeout, 0, 0, null, null, false, null, null, null);
    }

    static CalendarProperties withTrustAllCertificates(Duration fetchTimeout) {
        return new CalendarProperties(null, fetchTimeout, 2, 0, null, null, true, null, null, null);
    }

    static CalendarProperties withAccessToken(String token) {
        return new CalendarProperties(null, null, 0, 0, null, null, false,
                new CalendarProperties.Cloud("https://calendar.example.org/v3/", token, 0), null, null);
    }

    static CalendarProperties withSources(List<CalendarProperties.Source> sources) {
        return new CalendarProperties(null, null, 0, 0, null, null, false, null, null, sources);
    }

    static CalendarSource feed(String id) {
        return CalendarSource.feed(id, id.toUpperCase(), "#3F51B5", "https://dav.example.org/" + id + ".ics");
    }

    static CalendarSource cloud(String id) {
        return CalendarSource.cloud(id, id.toUpperCase(), "success", id + "@group.calendar.google.com");
    }
}
