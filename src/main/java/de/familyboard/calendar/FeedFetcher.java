package de.familyboard.calendar;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Retrieves the raw content of calendar sources over HTTP and keeps the last good
 * content of every source in the {@link FeedCache}.
 * <p>
 * Feed sources are fetched from their URL. Cloud sources are fetched from the
 * provider's event list endpoint with server-side expansion of recurring events
 * ({@code singleEvents=true}). In both cases the declared content type of the response
 * decides, via the {@link FeedFormatDetector}, whether the body is kept as iCalendar
 * text or decoded as a JSON event list.
 */
@Component
public class FeedFetcher {

    private static final Logger log = LoggerFactory.getLogger(FeedFetcher.class);

    private static final String FEED_ACCEPT = "text/calendar, application/json;q=0.9, */*;q=0.8";
    private static final String ICALENDAR_MARKER = "BEGIN:VCALENDAR";
    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final FeedFormatDetector formatDetector;
    private final FeedCache cache;
    private final CloudAccessTokenProvider tokenProvider;
    private final CalendarProperties properties;
    private final Clock clock;

    FeedFetcher(HttpClient calendarHttpClient, ObjectMapper objectMapper, FeedFormatDetector formatDetector,
                FeedCache cache, CloudAccessTokenProvider tokenProvider, CalendarProperties properties,
                Clock clock) {
        this.httpClient = calendarHttpClient;
        this.objectMapper = objectMapper;
        this.formatDetector = formatDetector;
        this.cache = cache;
        this.tokenProvider = tokenProvider;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Returns the content of the source, from the cache while it is fresh.
     * <p>
     * Stale or missing content is refreshed. If that refresh fails, previously fetched
     * content is served instead; only a source that has never been fetched successfully
     * fails.
     *
     * @param source the calendar source
     * @return the current or last known good content of the source
     * @throws FeedFetchException if the source cannot be fetched and nothing is cached
     */
    public FeedContent load(CalendarSource source) {
        var fresh = fresh(source);
        if (fresh.isPresent()) {
            return fresh.get();
        }

        var cached = cache.get(source.id());

        try {
            return refresh(source);
        } catch (FeedFetchException e) {
            if (cached.isPresent()) {
                log.warn("Refreshing calendar {} failed, serving content fetched at {}: {}",
                        source.id(), cached.get().fetchedAt(), e.getMessage());
                return cached.get().content();
            }
            throw e;
        }
    }

    /**
     * Returns cached content of the source if it was fetched within the staleness window.
     * Never touches the network.
     */
    public Optional<FeedContent> fresh(CalendarSource source) {
        var cached = cache.get(source.id());
        if (cached.isPresent() && cached.get().isFresh(clock.instant(), properties.staleness())) {
            log.debug("Serving calendar {} from cache (fetched at {})", source.id(), cached.get().fetchedAt());
            return Optional.of(cached.get().content());
        }
        return Optional.empty();
    }

    /**
     * Fetches the source from the network and replaces its cache entry on success.
     * A failed fetch leaves the cache entry untouched.
     *
     * @param source the calendar source
     * @return the freshly fetched content
     * @throws FeedFetchException if the request fails, the status is not 2xx or the body is malformed
     */
    public FeedContent refresh(CalendarSource source) {
        var request = source.isCloud() ? createCloudRequest(source) : createFeedRequest(source);

        HttpResponse<String> response;
        try {
            log.debug("Fetching calendar {} from {}", source.id(), request.uri());
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new FeedFetchException(source.id(),
                    "Failed to fetch calendar '" + source.name() + "': " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FeedFetchException(source.id(), "Interrupted while fetching calendar '" + source.name() + "'.", e);
        }

        var status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw switch (status) {
                case 401 -> new FeedFetchException(source.id(),
                        "Authentication failed for calendar '" + source.name() + "'.");
                case 403 -> new FeedFetchException(source.id(),
                        "Access denied to calendar '" + source.name() + "'.");
                case 404 -> new FeedFetchException(source.id(),
                        "Calendar '" + source.name() + "' not found.");
                default -> new FeedFetchException(source.id(),
                        "Calendar '" + source.name() + "' returned unexpected status " + status + ".");
            };
        }

        var contentType = response.headers().firstValue("Content-Type").orElse(null);
        var content = decode(source, formatDetector.detect(contentType), response.body());

        cache.put(new FeedCacheEntry(source.id(), content, clock.instant()));
        log.debug("Fetched calendar {} as {}", source.id(), content.format());
        return content;
    }

    FeedContent decode(CalendarSource source, FeedFormat format, String body) {
        if (body == null || body.isBlank()) {
            throw new FeedFetchException(source.id(), "Calendar '" + source.name() + "' returned an empty body.");
        }
        if (body.charAt(0) == BYTE_ORDER_MARK) {
            body = body.substring(1);
        }
        return switch (format) {
            case ICALENDAR -> {
                if (!body.contains(ICALENDAR_MARKER)) {
                    throw new FeedFetchException(source.id(),
                            "Calendar '" + source.name() + "' did not return iCalendar data.");
                }
                yield new FeedContent.ICalendarText(body);
            }
            case CLOUD_JSON -> decodeEventList(source, body);
        };
    }

    private FeedContent.CloudEvents decodeEventList(CalendarSource source, String body) {
        try {
            var root = objectMapper.readTree(body);
            if (root.isArray()) {
                return new FeedContent.CloudEvents((ArrayNode) root, null);
            }
            var items = root.path("items");
            if (items.isArray()) {
                return new FeedContent.CloudEvents((ArrayNode) items, root.path("timeZone").textValue());
            }
        } catch (JsonProcessingException e) {
            throw new FeedFetchException(source.id(),
                    "Calendar '" + source.name() + "' returned invalid JSON: " + e.getOriginalMessage(), e);
        }
        throw new FeedFetchException(source.id(),
                "Calendar '" + source.name() + "' returned JSON without an event list.");
    }

    private HttpRequest createFeedRequest(CalendarSource source) {
        return HttpRequest.newBuilder()
                .uri(toUri(source, source.feedUrl()))
                .GET()
                .header("Accept", FEED_ACCEPT)
                .timeout(properties.fetchTimeout())
                .build();
    }

    private HttpRequest createCloudRequest(CalendarSource source) {
        var token = tokenProvider.accessToken()
                .orElseThrow(() -> new FeedFetchException(source.id(),
                        "No access token available for cloud calendar '" + source.name() + "'."));

        var cloud = properties.cloud();
        var timeMin = clock.instant().truncatedTo(ChronoUnit.SECONDS).toString();
        var url = cloud.apiUrl()
                + "/calendars/" + encode(source.cloudCalendarId())
                + "/events?timeMin=" + encode(timeMin)
                + "&singleEvents=true&orderBy=startTime"
                + "&maxResults=" + cloud.maxResults();

        return HttpRequest.newBuilder()
                .uri(toUri(source, url))
                .GET()
                .header("Accept", "application/json")
                .header("Authorization", "Bearer " + token)
                .timeout(properties.fetchTimeout())
                .build();
    }

    private static URI toUri(CalendarSource source, String url) {
        try {
            return URI.create(url.strip());
        } catch (IllegalArgumentException e) {
            throw new FeedFetchException(source.id(), "Invalid URL for calendar '" + source.name() + "'.", e);
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
