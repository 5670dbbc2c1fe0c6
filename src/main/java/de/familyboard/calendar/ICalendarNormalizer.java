package de.familyboard.calendar;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Produces the {@link NormalizedEvent}s of an iCalendar feed inside a time window.
 * <p>
 * A VEVENT carrying a RECURRENCE-ID replaces the occurrence of the series with the same
 * UID that starts at that instant; the override itself is treated like a single event.
 */
@Component
class ICalendarNormalizer {

    private final ICalendarParser parser;
    private final RecurrenceExpander expander;

    ICalendarNormalizer(ICalendarParser parser, RecurrenceExpander expander) {
        this.parser = parser;
        this.expander = expander;
    }

    /**
     * @throws CalendarParseException if the feed is malformed
     */
    List<NormalizedEvent> normalize(String text, CalendarSource source, TimeWindow window) {
        var events = parser.parse(text);

        Map<String, Set<Instant>> overridden = events.stream()
                .filter(RawEvent::isOverride)
                .collect(Collectors.groupingBy(RawEvent::uid,
                        Collectors.mapping(RawEvent::recurrenceId, Collectors.toSet())));

        var normalized = new ArrayList<NormalizedEvent>();
        for (var event : events) {
            var replaced = event.isRecurring() ? overridden.getOrDefault(event.uid(), Set.of()) : Set.<Instant>of();
            var occurrences = expander.expand(event, window, replaced);
            var zone = event.zone().toZoneId();
            while (occurrences.hasNext()) {
                normalized.add(NormalizedEvent.of(source, event.summary(), occurrences.next(), event.allDay(),
                        event.isRecurring() || event.isOverride(), zone));
            }
        }
        return normalized;
    }
}
