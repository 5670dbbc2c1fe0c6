package de.familyboard.calendar;

import java.util.List;

/**
 * Outcome of one aggregation cycle.
 *
 * @param events        the merged events, ordered by start and truncated to the requested limit
 * @param failedSources the sources that contributed nothing because they failed in this cycle
 */
public record AggregationResult(List<NormalizedEvent> events, List<CalendarSource> failedSources) {

    public AggregationResult {
        events = List.copyOf(events);
        failedSources = List.copyOf(failedSources);
    }

    public boolean hasFailures() {
        return !failedSources.isEmpty();
    }
}
