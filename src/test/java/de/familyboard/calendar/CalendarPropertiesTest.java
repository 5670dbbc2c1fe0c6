package de.familyboard.calendar;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.time.Duration;
import java.time.ZoneId;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CalendarPropertiesTest {

    @Test
    void defaults_apply_when_nothing_is_configured() {
        var properties = TestCalendars.defaults();

        assertThat(properties.staleness()).isEqualTo(Duration.ofMinutes(10));
        assertThat(properties.fetchTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(properties.fetchThreads()).isEqualTo(8);
        assertThat(properties.defaultLimit()).isEqualTo(10);
        assertThat(properties.defaultWindow()).isEqualTo(Duration.ofDays(7));
        assertThat(properties.defaultZone()).isEqualTo(ZoneId.of("UTC"));
        assertThat(properties.cloud().apiUrl()).isEqualTo("https://www.googleapis.com/calendar/v3");
        assertThat(properties.cloud().maxResults()).isEqualTo(50);
        assertThat(properties.refresh().enabled()).isFalse();
        assertThat(properties.refresh().interval()).isEqualTo(Duration.ofHours(1));
        assertThat(properties.sources()).isEmpty();
    }

    @Test
    void binds_configured_values() {
        var source = new MapConfigurationPropertySource(Map.of(
                "calendar.staleness", "5m",
                "calendar.default-zone", "Europe/Berlin",
                "calendar.cloud.api-url", "https://calendar.example.org/v3/",
                "calendar.refresh.enabled", "true",
                "calendar.refresh.interval", "30m",
                "calendar.sources[0].name", "Family",
                "calendar.sources[0].url", "https://dav.example.org/family.ics",
                "calendar.sources[1].id", "school",
                "calendar.sources[1].cloud-id", "school@group.calendar.google.com"));

        var properties = new Binder(source).bind("calendar", CalendarProperties.class).get();

        assertThat(properties.staleness()).isEqualTo(Duration.ofMinutes(5));
        assertThat(properties.defaultZone()).isEqualTo(ZoneId.of("Europe/Berlin"));
        assertThat(properties.cloud().apiUrl()).isEqualTo("https://calendar.example.org/v3");
        assertThat(properties.refresh().enabled()).isTrue();
        assertThat(properties.refresh().interval()).isEqualTo(Duration.ofMinutes(30));
        assertThat(properties.sources()).hasSize(2);
        assertThat(properties.sources().get(1).cloudId()).isEqualTo("school@group.calendar.google.com");
    }

    @Test
    void refresh_interval_is_clamped_to_minimum() {
        var refresh = new CalendarProperties.Refresh(true, Duration.ofSeconds(1));

        assertThat(refresh.interval()).isEqualTo(Duration.ofSeconds(10));
    }
}
