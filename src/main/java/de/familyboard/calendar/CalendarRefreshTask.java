package de.familyboard.calendar;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;
import org.springframework.stereotype.Component;

/**
 * Refreshes all registered calendar sources at startup and then periodically, so that
 * aggregation usually finds fresh content in the cache.
 * Only active with {@code calendar.refresh.enabled=true}.
 */
@Component
@ConditionalOnProperty(prefix = "calendar.refresh", name = "enabled", havingValue = "true")
class CalendarRefreshTask implements SchedulingConfigurer {

    private static final Logger log = LoggerFactory.getLogger(CalendarRefreshTask.class);

    private final FeedFetcher fetcher;
    private final CalendarSourceRegistry registry;
    private final CalendarProperties properties;

    CalendarRefreshTask(FeedFetcher fetcher, CalendarSourceRegistry registry, CalendarProperties properties) {
        this.fetcher = fetcher;
        this.registry = registry;
        this.properties = properties;
    }

    @Override
    public void configureTasks(ScheduledTaskRegistrar taskRegistrar) {
        var interval = properties.refresh().interval();
        log.info("Refreshing calendars every {}", interval);
        taskRegistrar.addFixedDelayTask(this::refreshAll, interval);
    }

    /**
     * Refreshes every registered source once. A failing source is logged and does not
     * stop the others.
     *
     * @return the number of sources refreshed successfully
     */
    int refreshAll() {
        var sources = registry.findAll();
        var cloud = 0;
        var feeds = 0;
        for (var source : sources) {
            try {
                fetcher.refresh(source);
                if (source.isCloud()) {
                    cloud++;
                } else {
                    feeds++;
                }
            } catch (CalendarException e) {
                log.warn("Background refresh of calendar {} ({}) failed: {}", source.id(), source.name(),
                        e.getMessage());
            }
        }
        log.info("Background refresh finished: {} cloud and {} iCalendar source(s) refreshed, {} failed",
                cloud, feeds, sources.size() - cloud - feeds);
        return cloud + feeds;
    }
}
