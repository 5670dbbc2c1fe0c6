package de.familyboard.calendar;

import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Routes JSON media types ({@code application/json}, {@code application/*+json}) to the
 * cloud event path and everything else, including a missing content type, to iCalendar.
 */
@Component
class ContentTypeFormatDetector implements FeedFormatDetector {

    @Override
    public FeedFormat detect(@Nullable String contentType) {
        if (contentType == null) {
            return FeedFormat.ICALENDAR;
        }
        var mediaType = contentType.split(";", 2)[0].strip().toLowerCase(Locale.ROOT);
        if (mediaType.equals("application/json") || mediaType.endsWith("+json")) {
            return FeedFormat.CLOUD_JSON;
        }
        return FeedFormat.ICALENDAR;
    }
}
