package io.github.jakubt4.transitfinder.service.search;

import io.github.jakubt4.transitfinder.domain.TaskOutcome;
import io.github.jakubt4.transitfinder.domain.TransitEvent;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Merges task outcomes into the final, time-ordered event list.
 */
@Component
public class ResultAggregator {

    static final Comparator<TransitEvent> EVENT_ORDER = Comparator
            .comparing(TransitEvent::time)
            .thenComparing(TransitEvent::satellite)
            .thenComparing(TransitEvent::body);

    /**
     * @throws AggregationInvariantViolationException if two events share satellite, body and time
     */
    public List<TransitEvent> aggregate(final List<TaskOutcome> outcomes) {
        final var events = outcomes.stream()
                .filter(outcome -> !outcome.isFailure())
                .map(TaskOutcome::event)
                .flatMap(Optional::stream)
                .sorted(EVENT_ORDER)
                .toList();
        verify(events);
        return events;
    }

    private static void verify(final List<TransitEvent> events) {
        for (var i = 1; i < events.size(); i++) {
            final var previous = events.get(i - 1);
            final var current = events.get(i);
            if (EVENT_ORDER.compare(previous, current) >= 0) {
                throw new AggregationInvariantViolationException(
                        "Events out of order or duplicated: %s/%s at %s then %s/%s at %s".formatted(
                                previous.satellite(), previous.body(), previous.time(),
                                current.satellite(), current.body(), current.time()));
            }
        }
    }
}
