package de.familyboard.calendar;

import java.util.List;

/**
 * Read-only view of the calendars configured for the household.
 */
public interface CalendarSourceRegistry {

    /**
     * @return all configured calendar sources in registration order
     */
    List<CalendarSource> findAll();
}
