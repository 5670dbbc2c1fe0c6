package de.familyboard.calendar;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Converts events of the cloud calendar provider into {@link NormalizedEvent}s.
 * <p>
 * Every event carries either a timed {@code start.dateTime} or an all-day
 * {@code start.date}. The provider already expands recurring events into instances, so
 * recurrence fields are never read here. Events without a usable start are skipped.
 */
@Component
class CloudEventNormalizer {

    private static final Logger log = LoggerFactory.getLogger(CloudEventNormalizer.class);

    private final ZoneId defaultZone;

    CloudEventNormalizer(CalendarProperties properties) {
        this.defaultZone = properties.defaultZone();
    }

    /**
     * Normalizes all events of a source that start inside the window.
     *
     * @param events   the event objects of the source
     * @param timeZone the calendar's zone reported by the provider, if any
     */
    List<NormalizedEvent> normalizeAll(Iterable<JsonNode> events, CalendarSource source, @Nullable String timeZone,
                                       TimeWindow window) {
        var normalized = new ArrayList<NormalizedEvent>();
        var skipped = 0;
        for (var event : events) {
            var result = normalize(event, source, timeZone);
            if (result.isEmpty()) {
                skipped++;
            } else if (window.contains(result.get().start())) {
                normalized.add(result.get());
            }
        }
        if (skipped > 0) {
            log.debug("Skipped {} event(s) without a usable start in calendar {}", skipped, source.id());
        }
        return normalized;
    }

    /**
     * @return the normalized event, or empty if the event has neither a date nor a date-time start
     */
    Optional<NormalizedEvent> normalize(JsonNode event, CalendarSource source, @Nullable String timeZone) {
        var start = event.path("start");
        var summary = event.path("summary").textValue();
        var recurring = event.hasNonNull("recurringEventId");

        try {
            var dateTime = start.path("dateTime").textValue();
            if (dateTime != null && !dateTime.isBlank()) {
                var zone = zoneOf(start.path("timeZone").textValue(), timeZone);
                return Optional.of(NormalizedEvent.of(source, summary, parseDateTime(dateTime, zone), false, recurring,
                        zone));
            }
            var date = start.path("date").textValue();
            if (date != null && !date.isBlank()) {
                var zone = zoneOf(null, timeZone);
                var instant = LocalDate.parse(date.strip()).atStartOfDay(zone).toInstant();
                return Optional.of(NormalizedEvent.of(source, summary, instant, true, recurring, zone));
            }
        } catch (DateTimeParseException e) {
            log.debug("Skipping event {} in calendar {}: cannot parse start '{}'",
                    event.path("id").asText("?"), source.id(), e.getParsedString());
            return Optional.empty();
        }

        log.debug("Skipping event {} in calendar {}: no start", event.path("id").asText("?"), source.id());
        return Optional.empty();
    }

    private static Instant parseDateTime(String value, ZoneId zone) {
        var text = value.strip();
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException e) {
            // no offset given, read in the event's zone
            return LocalDateTime.parse(text).atZone(zone).toInstant();
        }
    }

    private ZoneId zoneOf(@Nullable String eventZone, @Nullable String calendarZone) {
        for (var candidate : new String[]{eventZone, calendarZone}) {
            if (candidate != null && !candidate.isBlank()) {
                try {
                    return ZoneId.of(candidate.strip());
                } catch (DateTimeException e) {
                    log.debug("Ignoring unknown time zone '{}'", candidate);
                }
            }
        }
        return defaultZone;
    }
}
