package de.familyboard.calendar;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

/**
 * Registry backed by the {@code calendar.sources} configuration. The order of the
 * configuration entries is the registration order used to break ties between events.
 */
@Component
class ConfiguredCalendarSourceRegistry implements CalendarSourceRegistry {

    private static final Logger log = LoggerFactory.getLogger(ConfiguredCalendarSourceRegistry.class);

    private final List<CalendarSource> sources;

    ConfiguredCalendarSourceRegistry(CalendarProperties properties) {
        var configured = new ArrayList<CalendarSource>();
        var ids = new HashSet<String>();
        var entries = properties.sources();
        for (int i = 0; i < entries.size(); i++) {
            var entry = entries.get(i);
            var id = (entry.id() == null || entry.id().isBlank()) ? "calendar-" + (i + 1) : entry.id().strip();
            if (!ids.add(id)) {
                throw new CalendarException("Calendar id '" + id + "' is configured more than once.");
            }
            configured.add(new CalendarSource(id, entry.name(), entry.color(), entry.url(), entry.cloudId()));
        }
        this.sources = List.copyOf(configured);
        log.info("Registered {} calendar source(s)", sources.size());
    }

    @Override
    public List<CalendarSource> findAll() {
        return sources;
    }
}
