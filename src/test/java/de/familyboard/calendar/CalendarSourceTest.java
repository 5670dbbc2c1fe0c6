package de.familyboard.calendar;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CalendarSourceTest {

    @Test
    void feed_source_is_not_cloud() {
        var source = CalendarSource.feed("family", "Family", "#ff0000", "https://dav.example.org/family.ics");

        assertThat(source.isCloud()).isFalse();
        assertThat(source.feedUrl()).isEqualTo("https://dav.example.org/family.ics");
    }

    @Test
    void cloud_source_is_cloud() {
        var source = CalendarSource.cloud("school", "School", "success", "school@group.calendar.google.com");

        assertThat(source.isCloud()).isTrue();
        assertThat(source.feedUrl()).isNull();
    }

    @Test
    void missing_name_and_color_fall_back_to_defaults() {
        var source = CalendarSource.feed("family", " ", null, "https://dav.example.org/family.ics");

        assertThat(source.name()).isEqualTo("family");
        assertThat(source.color()).isEqualTo("primary");
    }

    @Test
    void rejects_source_with_feed_and_cloud_id() {
        assertThatThrownBy(() -> new CalendarSource("both", "Both", null, "https://x.example.org", "cal-id"))
                .isInstanceOf(CalendarException.class)
                .hasMessageContaining("either a feed URL or a cloud calendar id");
    }

    @Test
    void rejects_source_without_location() {
        assertThatThrownBy(() -> new CalendarSource("none", "None", null, "", null))
                .isInstanceOf(CalendarException.class)
                .hasMessageContaining("either a feed URL or a cloud calendar id");
    }

    @Test
    void rejects_blank_id() {
        assertThatThrownBy(() -> CalendarSource.feed(" ", "Family", null, "https://dav.example.org/family.ics"))
                .isInstanceOf(CalendarException.class)
                .hasMessageContaining("id must not be empty");
    }
}
