package de.familyboard.calendar.ui;

import com.vaadin.flow.component.AttachEvent;
import com.vaadin.flow.component.button.Button;
import com.vaadin.flow.component.button.ButtonVariant;
import com.vaadin.flow.component.grid.Grid;
import com.vaadin.flow.component.grid.GridVariant;
import com.vaadin.flow.component.html.H2;
import com.vaadin.flow.component.html.Span;
import com.vaadin.flow.component.icon.VaadinIcon;
import com.vaadin.flow.component.notification.Notification;
import com.vaadin.flow.component.notification.NotificationVariant;
import com.vaadin.flow.component.orderedlayout.FlexComponent;
import com.vaadin.flow.component.orderedlayout.HorizontalLayout;
import com.vaadin.flow.component.orderedlayout.VerticalLayout;
import com.vaadin.flow.data.renderer.ComponentRenderer;
import com.vaadin.flow.router.Menu;
import com.vaadin.flow.router.PageTitle;
import com.vaadin.flow.router.Route;
import de.familyboard.calendar.CalendarAggregator;
import de.familyboard.calendar.CalendarException;
import de.familyboard.calendar.CalendarProperties;
import de.familyboard.calendar.CalendarSource;
import de.familyboard.calendar.NormalizedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.ZoneId;
import java.util.stream.Collectors;

/**
 * Dashboard listing the upcoming events of all household calendars, with a notice for
 * calendars that could not be loaded.
 */
@Route("")
@PageTitle("Upcoming Events")
@Menu(order = 0, icon = "vaadin:calendar", title = "Upcoming")
class UpcomingEventsView extends VerticalLayout {

    private static final Logger log = LoggerFactory.getLogger(UpcomingEventsView.class);

    private final CalendarAggregator aggregator;
    private final ZoneId zone;

    private final Grid<NormalizedEvent> grid;
    private final Span failureNotice;

    UpcomingEventsView(CalendarAggregator aggregator, CalendarProperties properties) {
        this.aggregator = aggregator;
        this.zone = properties.defaultZone();

        setSizeFull();

        var title = new H2("Upcoming Events");
        var refreshButton = new Button("Refresh", VaadinIcon.REFRESH.create(), event -> loadEvents());
        refreshButton.addThemeVariants(ButtonVariant.LUMO_TERTIARY);

        var header = new HorizontalLayout(title, refreshButton);
        header.setDefaultVerticalComponentAlignment(FlexComponent.Alignment.CENTER);
        header.setWidthFull();
        header.expand(title);
        add(header);

        failureNotice = new Span();
        failureNotice.getStyle()
                .set("color", "var(--lumo-error-text-color)")
                .set("font-size", "var(--lumo-font-size-s)");
        failureNotice.setVisible(false);
        add(failureNotice);

        grid = new Grid<>();
        grid.addThemeVariants(GridVariant.LUMO_ROW_STRIPES);
        grid.addColumn(event -> EventFormat.day(event, zone)).setHeader("Day").setAutoWidth(true);
        grid.addColumn(event -> EventFormat.time(event, zone)).setHeader("Time").setAutoWidth(true);
        grid.addColumn(NormalizedEvent::summary).setHeader("Event").setFlexGrow(1);
        grid.addColumn(new ComponentRenderer<>(this::createCalendarCell)).setHeader("Calendar").setAutoWidth(true);
        grid.setSizeFull();
        add(grid);
        setFlexGrow(1, grid);
    }

    @Override
    protected void onAttach(AttachEvent attachEvent) {
        super.onAttach(attachEvent);
        loadEvents();
    }

    private void loadEvents() {
        try {
            var result = aggregator.upcoming();
            grid.setItems(result.events());

            if (result.hasFailures()) {
                var names = result.failedSources().stream()
                        .map(CalendarSource::name)
                        .collect(Collectors.joining(", "));
                failureNotice.setText("Could not load: " + names);
                failureNotice.setVisible(true);
            } else {
                failureNotice.setVisible(false);
            }
        } catch (CalendarException e) {
            log.warn("Loading upcoming events failed: {}", e.getMessage());
            Notification.show("Could not load events: " + e.getMessage(), 5000, Notification.Position.BOTTOM_CENTER)
                    .addThemeVariants(NotificationVariant.LUMO_ERROR);
        }
    }

    private Span createCalendarCell(NormalizedEvent event) {
        var label = new Span(event.calendarName());
        label.getStyle()
                .set("border-left", "4px solid " + EventFormat.cssColor(event.color()))
                .set("padding-left", "var(--lumo-space-s)");
        if (event.recurring()) {
            var icon = VaadinIcon.REFRESH.create();
            icon.setSize("var(--lumo-icon-size-s)");
            icon.getElement().setAttribute("title", "Recurring");
            label.add(icon);
        }
        return label;
    }
}
