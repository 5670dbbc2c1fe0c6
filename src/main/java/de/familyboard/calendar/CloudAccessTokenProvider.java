package de.familyboard.calendar;

import java.util.Optional;

/**
 * Supplies the bearer token for the cloud calendar API. How the token is obtained and
 * refreshed (OAuth consent, refresh tokens) is up to the implementation.
 */
public interface CloudAccessTokenProvider {

    /**
     * @return a currently valid access token, or empty if the cloud provider is not connected
     */
    Optional<String> accessToken();
}
