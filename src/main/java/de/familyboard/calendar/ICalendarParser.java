package de.familyboard.calendar;

import biweekly.Biweekly;
import biweekly.ICalendar;
import biweekly.io.TimezoneInfo;
import biweekly.property.ICalProperty;
import biweekly.util.ICalDate;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.TimeZone;

/**
 * Parses iCalendar text into {@link RawEvent}s using biweekly.
 * <p>
 * Before handing the text to biweekly the component structure is checked, because
 * biweekly silently closes unterminated components. Date values are resolved as follows:
 * <ul>
 *   <li>dates without time are naive and placed at midnight of the feed's zone,</li>
 *   <li>UTC values and values with a known {@code TZID} keep their explicit zone,</li>
 *   <li>floating values are read in the feed's zone.</li>
 * </ul>
 * The feed's zone is the one declared with {@code X-WR-TIMEZONE}, or the configured
 * default zone.
 */
@Component
class ICalendarParser {

    private static final Logger log = LoggerFactory.getLogger(ICalendarParser.class);

    private static final String DECLARED_ZONE_PROPERTY = "X-WR-TIMEZONE";
    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final ZoneId defaultZone;

    ICalendarParser(CalendarProperties properties) {
        this.defaultZone = properties.defaultZone();
    }

    /**
     * Parses all VEVENT components of the given text.
     *
     * @param text iCalendar text, optionally starting with a byte order mark
     * @return the events in document order
     * @throws CalendarParseException if the structure is invalid or an event has no start
     */
    List<RawEvent> parse(String text) {
        if (!text.isEmpty() && text.charAt(0) == BYTE_ORDER_MARK) {
            text = text.substring(1);
        }
        var declaredZone = checkStructure(text);
        var feedZone = resolveFeedZone(declaredZone);

        ICalendar ical;
        try {
            ical = Biweekly.parse(text).first();
        } catch (RuntimeException e) {
            throw new CalendarParseException("Failed to parse iCalendar data: " + e.getMessage(), e);
        }
        if (ical == null) {
            throw new CalendarParseException("iCalendar data contains no calendar.");
        }

        var tzInfo = ical.getTimezoneInfo();
        var events = new ArrayList<RawEvent>();
        var index = 0;
        for (var event : ical.getEvents()) {
            index++;
            var uid = (event.getUid() != null && event.getUid().getValue() != null)
                    ? event.getUid().getValue() : "event-" + index;

            var dateStart = event.getDateStart();
            if (dateStart == null || dateStart.getValue() == null) {
                throw new CalendarParseException("Event " + uid + " has no DTSTART.");
            }
            var start = resolve(dateStart.getValue(), dateStart, tzInfo, feedZone);

            var exceptions = new HashSet<Instant>();
            for (var exceptionDates : event.getExceptionDates()) {
                for (var value : exceptionDates.getValues()) {
                    exceptions.add(resolve(value, exceptionDates, tzInfo, feedZone).instant());
                }
            }

            Instant recurrenceId = null;
            var recurrenceIdProperty = event.getRecurrenceId();
            if (recurrenceIdProperty != null && recurrenceIdProperty.getValue() != null) {
                recurrenceId = resolve(recurrenceIdProperty.getValue(), recurrenceIdProperty, tzInfo, feedZone).instant();
            }

            var rule = event.getRecurrenceRule();
            var summary = event.getSummary() != null ? event.getSummary().getValue() : null;

            events.add(new RawEvent(
                    uid,
                    summary,
                    start.instant(),
                    start.allDay(),
                    start.zone(),
                    rule != null ? rule.getValue() : null,
                    exceptions,
                    recurrenceId
            ));
        }

        log.debug("Parsed {} event(s) in zone {}", events.size(), feedZone);
        return events;
    }

    /**
     * A resolved date value.
     *
     * @param instant the absolute point in time
     * @param allDay  whether the value was a date without time
     * @param zone    the zone in which recurrences of this value are computed
     */
    record ResolvedDate(Instant instant, boolean allDay, TimeZone zone) {
    }

    private ResolvedDate resolve(ICalDate value, ICalProperty property, TimezoneInfo tzInfo, ZoneId feedZone) {
        var raw = value.getRawComponents();
        if (!value.hasTime()) {
            var date = raw != null
                    ? LocalDate.of(raw.getYear(), raw.getMonth(), raw.getDate())
                    : LocalDate.ofInstant(value.toInstant(), ZoneId.systemDefault());
            return new ResolvedDate(date.atStartOfDay(feedZone).toInstant(), true, TimeZone.getTimeZone(feedZone));
        }

        var assignment = tzInfo.getTimezone(property);
        if (assignment != null) {
            return new ResolvedDate(value.toInstant(), false, assignment.getTimeZone());
        }
        if (raw != null && raw.isUtc()) {
            return new ResolvedDate(value.toInstant(), false, TimeZone.getTimeZone("UTC"));
        }

        // floating time, or a TZID nobody defined
        var local = raw != null
                ? LocalDateTime.of(raw.getYear(), raw.getMonth(), raw.getDate(),
                raw.getHour(), raw.getMinute(), raw.getSecond())
                : LocalDateTime.ofInstant(value.toInstant(), ZoneId.systemDefault());
        return new ResolvedDate(local.atZone(feedZone).toInstant(), false, TimeZone.getTimeZone(feedZone));
    }

    private ZoneId resolveFeedZone(@Nullable String declaredZone) {
        if (declaredZone == null || declaredZone.isBlank()) {
            return defaultZone;
        }
        try {
            return ZoneId.of(declaredZone.strip());
        } catch (DateTimeException e) {
            log.debug("Ignoring unknown {} '{}', using {}", DECLARED_ZONE_PROPERTY, declaredZone, defaultZone);
            return defaultZone;
        }
    }

    /**
     * Checks that every {@code BEGIN} has a matching {@code END} and that a VCALENDAR
     * is present.
     *
     * @return the value of {@code X-WR-TIMEZONE}, or {@code null} if the feed declares none
     */
    static @Nullable String checkStructure(String text) {
        var open = new ArrayDeque<String>();
        var sawCalendar = false;
        String declaredZone = null;
        var lineNumber = 0;

        for (var line : text.split("\\r?\\n|\\r")) {
            lineNumber++;
            if (line.isEmpty() || line.charAt(0) == ' ' || line.charAt(0) == '\t') {
                continue;
            }
            var colon = line.indexOf(':');
            if (colon < 0) {
                continue;
            }
            var name = line.substring(0, colon).toUpperCase(Locale.ROOT);
            var value = line.substring(colon + 1).strip().toUpperCase(Locale.ROOT);

            if (name.equals("BEGIN")) {
                open.push(value);
                if (value.equals("VCALENDAR")) {
                    sawCalendar = true;
                }
            } else if (name.equals("END")) {
                if (open.isEmpty() || !open.peek().equals(value)) {
                    throw new CalendarParseException("Unexpected END:" + value + " at line " + lineNumber + ".");
                }
                open.pop();
            } else if (name.equals(DECLARED_ZONE_PROPERTY) || name.startsWith(DECLARED_ZONE_PROPERTY + ";")) {
                declaredZone = line.substring(colon + 1).strip();
            }
        }

        if (!open.isEmpty()) {
            throw new CalendarParseException("Unterminated component BEGIN:" + open.peek() + ".");
        }
        if (!sawCalendar) {
            throw new CalendarParseException("iCalendar data contains no VCALENDAR component.");
        }
        return declaredZone;
    }
}
