package de.familyboard.calendar;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CalendarRefreshTaskTest {

    private final CalendarSource familyFeed = TestCalendars.feed("family");
    private final CalendarSource schoolCloud = TestCalendars.cloud("school");
    private final CalendarSource sportsFeed = TestCalendars.feed("sports");

    @Mock
    private FeedFetcher fetcher;

    @Test
    void refreshes_all_sources_and_continues_after_failure() {
        when(fetcher.refresh(familyFeed)).thenThrow(new FeedFetchException("family", "Connection refused"));
        when(fetcher.refresh(schoolCloud)).thenReturn(new FeedContent.ICalendarText("BEGIN:VCALENDAR"));
        when(fetcher.refresh(sportsFeed)).thenReturn(new FeedContent.ICalendarText("BEGIN:VCALENDAR"));

        var refreshed = task(TestCalendars.defaults()).refreshAll();

        assertThat(refreshed).isEqualTo(2);
        verify(fetcher).refresh(sportsFeed);
    }

    @Test
    void registers_fixed_delay_task_with_configured_interval() {
        var properties = new CalendarProperties(null, null, 0, 0, null, null, false, null,
                new CalendarProperties.Refresh(true, Duration.ofMinutes(15)), null);
        var registrar = new ScheduledTaskRegistrar();

        task(properties).configureTasks(registrar);

        assertThat(registrar.getFixedDelayTaskList()).singleElement()
                .satisfies(scheduled -> assertThat(scheduled.getIntervalDuration()).isEqualTo(Duration.ofMinutes(15)));
    }

    private CalendarRefreshTask task(CalendarProperties properties) {
        CalendarSourceRegistry registry = () -> List.of(familyFeed, schoolCloud, sportsFeed);
        return new CalendarRefreshTask(fetcher, registry, properties);
    }
}
