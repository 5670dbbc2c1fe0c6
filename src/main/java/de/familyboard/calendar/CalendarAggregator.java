package de.familyboard.calendar;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Merges the events of several calendar sources into one ordered list.
 * <p>
 * Sources with fresh cached content are normalized directly; all others are loaded
 * concurrently on the fetch executor. A source that cannot be fetched, parsed or processed
 * within the fetch timeout contributes no events and is reported in
 * {@link AggregationResult#failedSources()}; it never fails the whole aggregation.
 * Events are ordered by start, then by the position of their source in the given list,
 * then by summary.
 */
@Service
public class CalendarAggregator {

    private static final Logger log = LoggerFactory.getLogger(CalendarAggregator.class);

    private static final Comparator<Indexed> ORDER = Comparator
            .comparing((Indexed indexed) -> indexed.event().start())
            .thenComparingInt(Indexed::sourceIndex)
            .thenComparing(indexed -> indexed.event().summary());

    private final FeedFetcher fetcher;
    private final ICalendarNormalizer iCalendarNormalizer;
    private final CloudEventNormalizer cloudEventNormalizer;
    private final CalendarSourceRegistry registry;
    private final ExecutorService executor;
    private final CalendarProperties properties;
    private final Clock clock;

    CalendarAggregator(FeedFetcher fetcher, ICalendarNormalizer iCalendarNormalizer,
                       CloudEventNormalizer cloudEventNormalizer, CalendarSourceRegistry registry,
                       ExecutorService calendarFetchExecutor, CalendarProperties properties, Clock clock) {
        this.fetcher = fetcher;
        this.iCalendarNormalizer = iCalendarNormalizer;
        this.cloudEventNormalizer = cloudEventNormalizer;
        this.registry = registry;
        this.executor = calendarFetchExecutor;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Aggregates the events of all registered sources starting within the configured
     * default window from now, limited to the configured default number of events.
     */
    public AggregationResult upcoming() {
        var window = TimeWindow.startingAt(clock.instant(), properties.defaultWindow());
        return collect(registry.findAll(), window, properties.defaultLimit());
    }

    /**
     * Returns the first {@code limit} events of the given sources that start within the window.
     *
     * @param sources the sources, in registration order
     * @param window  the window events must start in
     * @param limit   maximum number of events, at least 1
     * @return the ordered events, possibly empty
     * @throws CalendarException if the window is missing or the limit is below 1
     */
    public List<NormalizedEvent> aggregate(List<CalendarSource> sources, TimeWindow window, int limit) {
        return collect(sources, window, limit).events();
    }

    /**
     * Like {@link #aggregate}, additionally reporting the sources that failed.
     *
     * @throws CalendarException if the window is missing or the limit is below 1
     */
    public AggregationResult collect(List<CalendarSource> sources, TimeWindow window, int limit) {
        if (window == null) {
            throw new CalendarException("Time window must not be empty.");
        }
        if (limit < 1) {
            throw new CalendarException("Limit must be at least 1, was " + limit + ".");
        }

        var timeout = properties.fetchTimeout().toMillis();
        var futures = new ArrayList<CompletableFuture<List<NormalizedEvent>>>(sources.size());
        for (var source : sources) {
            var fresh = fetcher.fresh(source);
            futures.add(fresh.isPresent()
                    ? normalizeInline(source, fresh.get(), window)
                    : submit(source, window, timeout));
        }

        var merged = new ArrayList<Indexed>();
        var failed = new ArrayList<CalendarSource>();
        for (int i = 0; i < sources.size(); i++) {
            var source = sources.get(i);
            try {
                for (var event : futures.get(i).join()) {
                    merged.add(new Indexed(i, event));
                }
            } catch (CompletionException e) {
                var cause = e.getCause() != null ? e.getCause() : e;
                if (cause instanceof TimeoutException) {
                    log.warn("Calendar {} ({}) did not respond within {} ms", source.id(), source.name(), timeout);
                } else {
                    log.warn("Calendar {} ({}) failed: {}", source.id(), source.name(), cause.getMessage());
                    log.debug("Failure of calendar {}", source.id(), cause);
                }
                failed.add(source);
            }
        }

        merged.sort(ORDER);
        var events = merged.stream()
                .limit(limit)
                .map(Indexed::event)
                .toList();

        log.info("Aggregated {} of {} event(s) from {} calendar(s), {} failed",
                events.size(), merged.size(), sources.size(), failed.size());
        return new AggregationResult(events, failed);
    }

    /**
     * Loads and normalizes one source on the fetch executor. The timeout starts when the
     * task starts running, so time spent waiting for a pool thread does not count against
     * the source. A task that times out is cancelled and its thread interrupted.
     */
    private CompletableFuture<List<NormalizedEvent>> submit(CalendarSource source, TimeWindow window,
                                                            long timeoutMillis) {
        var result = new CompletableFuture<List<NormalizedEvent>>();
        var task = executor.submit(() -> {
            result.orTimeout(timeoutMillis, TimeUnit.MILLISECONDS);
            try {
                result.complete(normalize(source, fetcher.load(source), window));
            } catch (Throwable e) {
                result.completeExceptionally(e);
            }
        });
        result.whenComplete((events, failure) -> {
            if (failure instanceof TimeoutException) {
                task.cancel(true);
            }
        });
        return result;
    }

    private CompletableFuture<List<NormalizedEvent>> normalizeInline(CalendarSource source, FeedContent content,
                                                                     TimeWindow window) {
        try {
            return CompletableFuture.completedFuture(normalize(source, content, window));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private List<NormalizedEvent> normalize(CalendarSource source, FeedContent content, TimeWindow window) {
        if (content instanceof FeedContent.ICalendarText text) {
            return iCalendarNormalizer.normalize(text.text(), source, window);
        }
        if (content instanceof FeedContent.CloudEvents cloud) {
            return cloudEventNormalizer.normalizeAll(cloud.events(), source, cloud.timeZone(), window);
        }
        throw new CalendarException("Unsupported content of calendar '" + source.name() + "'.");
    }

    private record Indexed(int sourceIndex, NormalizedEvent event) {
    }
}
