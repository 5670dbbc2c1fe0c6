package de.familyboard.calendar.ui;

import de.familyboard.calendar.NormalizedEvent;

import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Set;

/**
 * Display helpers shared by the dashboard and the kiosk display.
 */
final class EventFormat {

    private static final DateTimeFormatter DAY_FORMATTER = DateTimeFormatter.ofPattern("EEE, MMM d");
    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("H:mm");

    /** Color tags that map to Lumo theme colors. */
    private static final Set<String> THEME_COLORS = Set.of("primary", "error", "success", "warning", "contrast");

    private EventFormat() {
    }

    static String day(NormalizedEvent event, ZoneId zone) {
        var date = date(event, zone);
        var today = LocalDate.now(zone);
        if (date.equals(today)) {
            return "Today";
        }
        if (date.equals(today.plusDays(1))) {
            return "Tomorrow";
        }
        return date.format(DAY_FORMATTER);
    }

    /**
     * All-day events keep the date of their own calendar; timed events are shown in the
     * display zone.
     */
    static LocalDate date(NormalizedEvent event, ZoneId displayZone) {
        return event.allDay() ? event.localDate() : LocalDate.ofInstant(event.start(), displayZone);
    }

    static String time(NormalizedEvent event, ZoneId zone) {
        return event.allDay() ? "All day" : event.start().atZone(zone).format(TIME_FORMATTER);
    }

    /**
     * Resolves a calendar color tag to a CSS color. Theme names become Lumo variables,
     * anything else is used as given.
     */
    static String cssColor(String color) {
        return THEME_COLORS.contains(color)
                ? "var(--lumo-" + color + "-color)"
                : color;
    }
}
