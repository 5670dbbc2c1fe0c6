package de.familyboard.calendar;

import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.ZoneId;
import java.util.List;

/**
 * Configuration properties for calendar aggregation.
 *
 * @param staleness            how long fetched feed content is served from the cache before a refresh
 * @param fetchTimeout         upper bound for fetching and processing one source
 * @param fetchThreads         number of threads fetching sources concurrently
 * @param defaultLimit         number of events returned when the caller does not choose
 * @param defaultWindow        length of the "upcoming" window starting now
 * @param defaultZone          zone for floating times and all-day dates when a feed declares none
 * @param trustAllCertificates whether self-signed certificates of self-hosted feeds are accepted
 * @param cloud                cloud calendar provider settings
 * @param refresh              background refresh settings
 * @param sources              the configured calendars, in registration order
 */
@ConfigurationProperties(prefix = "calendar")
public record CalendarProperties(
        Duration staleness,
        Duration fetchTimeout,
        int fetchThreads,
        int defaultLimit,
        Duration defaultWindow,
        ZoneId defaultZone,
        boolean trustAllCertificates,
        Cloud cloud,
        Refresh refresh,
        List<Source> sources
) {

    static final Duration DEFAULT_STALENESS = Duration.ofMinutes(10);
    static final Duration DEFAULT_FETCH_TIMEOUT = Duration.ofSeconds(30);
    static final int DEFAULT_FETCH_THREADS = 8;
    static final int DEFAULT_LIMIT = 10;
    static final Duration DEFAULT_WINDOW = Duration.ofDays(7);

    public CalendarProperties {
        if (staleness == null || staleness.isNegative()) {
            staleness = DEFAULT_STALENESS;
        }
        if (fetchTimeout == null || fetchTimeout.isZero() || fetchTimeout.isNegative()) {
            fetchTimeout = DEFAULT_FETCH_TIMEOUT;
        }
        if (fetchThreads < 1) {
            fetchThreads = DEFAULT_FETCH_THREADS;
        }
        if (defaultLimit < 1) {
            defaultLimit = DEFAULT_LIMIT;
        }
        if (defaultWindow == null || defaultWindow.isZero() || defaultWindow.isNegative()) {
            defaultWindow = DEFAULT_WINDOW;
        }
        if (defaultZone == null) {
            defaultZone = ZoneId.of("UTC");
        }
        if (cloud == null) {
            cloud = new Cloud(null, null, 0);
        }
        if (refresh == null) {
            refresh = new Refresh(false, null);
        }
        sources = sources == null ? List.of() : List.copyOf(sources);
    }

    /**
     * Settings of the cloud calendar provider (Google Calendar API v3).
     *
     * @param apiUrl      base URL of the calendar API
     * @param accessToken bearer token used for requests; obtaining it is up to the deployment
     * @param maxResults  maximum number of event instances requested per calendar
     */
    public record Cloud(String apiUrl, @Nullable String accessToken, int maxResults) {

        static final String DEFAULT_API_URL = "https://www.googleapis.com/calendar/v3";
        static final int DEFAULT_MAX_RESULTS = 50;

        public Cloud {
            if (apiUrl == null || apiUrl.isBlank()) {
                apiUrl = DEFAULT_API_URL;
            }
            apiUrl = apiUrl.replaceAll("/+$", "");
            if (maxResults < 1) {
                maxResults = DEFAULT_MAX_RESULTS;
            }
        }
    }

    /**
     * Settings of the periodic background refresh.
     *
     * @param enabled  whether all sources are refreshed periodically
     * @param interval delay between two refresh cycles, at least ten seconds
     */
    public record Refresh(boolean enabled, Duration interval) {

        static final Duration DEFAULT_INTERVAL = Duration.ofHours(1);
        static final Duration MIN_INTERVAL = Duration.ofSeconds(10);

        public Refresh {
            if (interval == null) {
                interval = DEFAULT_INTERVAL;
            } else if (interval.compareTo(MIN_INTERVAL) < 0) {
                interval = MIN_INTERVAL;
            }
        }
    }

    /**
     * One configured calendar.
     *
     * @param id      opaque identifier
     * @param name    display name
     * @param color   color tag
     * @param url     iCalendar feed URL
     * @param cloudId cloud provider calendar id
     */
    public record Source(
            @Nullable String id,
            @Nullable String name,
            @Nullable String color,
            @Nullable String url,
            @Nullable String cloudId
    ) {
    }
}
