package io.github.jakubt4.transitfinder.service.search;

import io.github.jakubt4.transitfinder.domain.CelestialBody;
import io.github.jakubt4.transitfinder.domain.PassWindow;
import io.github.jakubt4.transitfinder.domain.TaskOutcome;
import io.github.jakubt4.transitfinder.domain.TransitEvent;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static io.github.jakubt4.transitfinder.TestFixtures.T;
import static io.github.jakubt4.transitfinder.TestFixtures.event;
import static io.github.jakubt4.transitfinder.TestFixtures.pass;
import static io.github.jakubt4.transitfinder.TestFixtures.task;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResultAggregatorTest {

    private final ResultAggregator aggregator = new ResultAggregator();

    @Test
    void sortsByTimeAndDropsNonEvents() {
        final var outcomes = List.of(
                found(0, event("ISS", CelestialBody.SUN, T.plusSeconds(500))),
                TaskOutcome.of(task(1, somePass(), CelestialBody.MOON), Optional.empty()),
                TaskOutcome.failed(task(2, somePass(), CelestialBody.SUN), "boom"),
                found(3, event("HST", CelestialBody.MOON, T))
        );

        final var events = aggregator.aggregate(outcomes);

        assertThat(events).extracting(TransitEvent::time).containsExactly(T, T.plusSeconds(500));
        assertThat(events).extracting(TransitEvent::satellite).containsExactly("HST", "ISS");
    }

    @Test
    void sameTimestampIsOrderedBySatelliteName() {
        final var outcomes = List.of(
                found(0, event("Tiangong", CelestialBody.SUN, T)),
                found(1, event("ISS", CelestialBody.SUN, T)),
                found(2, event("HST", CelestialBody.SUN, T))
        );

        final var events = aggregator.aggregate(outcomes);

        assertThat(events).extracting(TransitEvent::satellite).containsExactly("HST", "ISS", "Tiangong");
        assertThat(aggregator.aggregate(List.of(outcomes.get(2), outcomes.get(0), outcomes.get(1))))
                .isEqualTo(events);
    }

    @Test
    void duplicateEventIsAnInternalDefect() {
        final var outcomes = List.of(
                found(0, event("ISS", CelestialBody.SUN, T)),
                found(1, event("ISS", CelestialBody.SUN, T))
        );

        assertThatThrownBy(() -> aggregator.aggregate(outcomes))
                .isInstanceOf(AggregationInvariantViolationException.class)
                .hasMessageContaining("ISS");
    }

    @Test
    void noOutcomesIsAnEmptyResult() {
        assertThat(aggregator.aggregate(List.of())).isEmpty();
    }

    private static TaskOutcome found(final int id, final TransitEvent event) {
        return TaskOutcome.of(task(id, somePass(), event.body()), Optional.of(event));
    }

    private static PassWindow somePass() {
        return pass("ISS", T.minusSeconds(300), T.plusSeconds(300));
    }
}
