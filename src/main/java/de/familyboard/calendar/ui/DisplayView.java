package de.familyboard.calendar.ui;

import com.vaadin.flow.component.AttachEvent;
import com.vaadin.flow.component.DetachEvent;
import com.vaadin.flow.component.html.Div;
import com.vaadin.flow.component.html.H1;
import com.vaadin.flow.component.html.Span;
import com.vaadin.flow.component.orderedlayout.VerticalLayout;
import com.vaadin.flow.router.Menu;
import com.vaadin.flow.router.PageTitle;
import com.vaadin.flow.router.Route;
import com.vaadin.flow.shared.Registration;
import de.familyboard.calendar.CalendarAggregator;
import de.familyboard.calendar.CalendarException;
import de.familyboard.calendar.CalendarProperties;
import de.familyboard.calendar.NormalizedEvent;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.ZoneId;

/**
 * Kiosk display for a wall-mounted screen. Shows the same upcoming events as the
 * dashboard in large type and reloads them periodically.
 */
@Route("display")
@PageTitle("Family Calendar")
@Menu(order = 1, icon = "vaadin:desktop", title = "Display")
class DisplayView extends VerticalLayout {

    private static final Logger log = LoggerFactory.getLogger(DisplayView.class);

    /** Reload every five minutes. */
    private static final int POLL_INTERVAL_MILLIS = 5 * 60 * 1000;

    private final CalendarAggregator aggregator;
    private final ZoneId zone;

    private final VerticalLayout eventList;

    private @Nullable Registration pollRegistration;

    DisplayView(CalendarAggregator aggregator, CalendarProperties properties) {
        this.aggregator = aggregator;
        this.zone = properties.defaultZone();

        setSizeFull();
        setPadding(true);
        getStyle().set("font-size", "var(--lumo-font-size-xl)");

        add(new H1("Coming up"));

        eventList = new VerticalLayout();
        eventList.setPadding(false);
        eventList.setSpacing(true);
        add(eventList);
    }

    @Override
    protected void onAttach(AttachEvent attachEvent) {
        super.onAttach(attachEvent);
        var ui = attachEvent.getUI();
        ui.setPollInterval(POLL_INTERVAL_MILLIS);
        pollRegistration = ui.addPollListener(event -> showEvents());
        showEvents();
    }

    @Override
    protected void onDetach(DetachEvent detachEvent) {
        if (pollRegistration != null) {
            pollRegistration.remove();
            pollRegistration = null;
        }
        detachEvent.getUI().setPollInterval(-1);
        super.onDetach(detachEvent);
    }

    private void showEvents() {
        eventList.removeAll();
        try {
            var events = aggregator.upcoming().events();
            if (events.isEmpty()) {
                eventList.add(new Span("Nothing planned."));
            }
            for (var event : events) {
                eventList.add(createEventRow(event));
            }
        } catch (CalendarException e) {
            log.warn("Loading events for the display failed: {}", e.getMessage());
            eventList.add(new Span("Events are currently unavailable."));
        }
    }

    private Div createEventRow(NormalizedEvent event) {
        var when = new Span(EventFormat.day(event, zone) + " " + EventFormat.time(event, zone));
        when.getStyle()
                .set("color", "var(--lumo-secondary-text-color)")
                .set("min-width", "12em")
                .set("display", "inline-block");

        var summary = new Span(event.summary());
        summary.getStyle().set("font-weight", "600");

        var row = new Div(when, summary);
        row.getStyle()
                .set("border-left", "6px solid " + EventFormat.cssColor(event.color()))
                .set("padding-left", "var(--lumo-space-m)");
        return row;
    }
}
