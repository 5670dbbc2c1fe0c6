package de.familyboard.calendar;

import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Uses the static token from {@code calendar.cloud.access-token}.
 */
@Component
class ConfiguredAccessTokenProvider implements CloudAccessTokenProvider {

    private final CalendarProperties properties;

    ConfiguredAccessTokenProvider(CalendarProperties properties) {
        this.properties = properties;
    }

    @Override
    public Optional<String> accessToken() {
        return Optional.ofNullable(properties.cloud().accessToken())
                .map(String::strip)
                .filter(token -> !token.isEmpty());
    }
}
