package de.familyboard.calendar;

import org.jspecify.annotations.Nullable;

/**
 * Decides which parser handles a fetched response.
 */
public interface FeedFormatDetector {

    /**
     * @param contentType the declared content type of the response, or {@code null} if absent
     * @return the format the response body is parsed as
     */
    FeedFormat detect(@Nullable String contentType);
}
