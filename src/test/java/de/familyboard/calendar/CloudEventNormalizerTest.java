package de.familyboard.calendar;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class CloudEventNormalizerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final CloudEventNormalizer normalizer = new CloudEventNormalizer(TestCalendars.defaults());
    private final CalendarSource school = TestCalendars.cloud("school");

    @Test
    void timed_event_uses_offset_of_date_time() throws Exception {
        var event = json("""
                {"summary": "Parents evening", "start": {"dateTime": "2026-03-04T19:00:00+01:00"}}
                """);

        var normalized = normalizer.normalize(event, school, null);

        assertThat(normalized).get().satisfies(e -> {
            assertThat(e.start()).isEqualTo(Instant.parse("2026-03-04T18:00:00Z"));
            assertThat(e.allDay()).isFalse();
            assertThat(e.summary()).isEqualTo("Parents evening");
            assertThat(e.calendarId()).isEqualTo("school");
        });
    }

    @Test
    void all_day_event_starts_at_midnight_of_calendar_zone() throws Exception {
        var event = json("""
                {"summary": "Holiday", "start": {"date": "2026-03-05"}}
                """);

        var normalized = normalizer.normalize(event, school, "Europe/Berlin");

        assertThat(normalized).get().satisfies(e -> {
            assertThat(e.start()).isEqualTo(Instant.parse("2026-03-04T23:00:00Z"));
            assertThat(e.allDay()).isTrue();
            assertThat(e.localDate()).isEqualTo(LocalDate.of(2026, 3, 5));
        });
    }

    @Test
    void date_time_without_offset_uses_event_zone() throws Exception {
        var event = json("""
                {"start": {"dateTime": "2026-03-04T08:00:00", "timeZone": "Europe/Berlin"}}
                """);

        assertThat(normalizer.normalize(event, school, null)).get()
                .extracting(NormalizedEvent::start)
                .isEqualTo(Instant.parse("2026-03-04T07:00:00Z"));
    }

    @Test
    void instance_of_recurring_event_is_marked_recurring() throws Exception {
        var event = json("""
                {"summary": "Choir", "recurringEventId": "abc",
                 "recurrence": ["RRULE:FREQ=DAILY"],
                 "start": {"dateTime": "2026-03-04T17:00:00Z"}}
                """);

        assertThat(normalizer.normalize(event, school, null)).get()
                .extracting(NormalizedEvent::recurring)
                .isEqualTo(true);
    }

    @Test
    void event_without_start_is_skipped() throws Exception {
        assertThat(normalizer.normalize(json("{\"summary\": \"Nothing\"}"), school, null)).isEmpty();
        assertThat(normalizer.normalize(json("{\"start\": {}}"), school, null)).isEmpty();
    }

    @Test
    void event_with_unparsable_start_is_skipped() throws Exception {
        assertThat(normalizer.normalize(json("{\"start\": {\"date\": \"next tuesday\"}}"), school, null)).isEmpty();
    }

    @Test
    void missing_summary_becomes_no_title() throws Exception {
        assertThat(normalizer.normalize(json("{\"start\": {\"date\": \"2026-03-05\"}}"), school, null)).get()
                .extracting(NormalizedEvent::summary)
                .isEqualTo("No Title");
    }

    @Test
    void normalize_all_filters_by_window_and_skips_bad_events() throws Exception {
        var events = json("""
                [
                  {"summary": "Inside", "start": {"dateTime": "2026-03-02T10:00:00Z"}},
                  {"summary": "Broken", "start": {}},
                  {"summary": "Outside", "start": {"dateTime": "2026-04-02T10:00:00Z"}}
                ]
                """);
        var window = TimeWindow.startingAt(Instant.parse("2026-03-01T00:00:00Z"), Duration.ofDays(7));

        var normalized = normalizer.normalizeAll(events, school, null, window);

        assertThat(normalized).extracting(NormalizedEvent::summary).containsExactly("Inside");
    }

    private JsonNode json(String text) throws Exception {
        return objectMapper.readTree(text);
    }
}
