package io.github.jakubt4.transitfinder.domain;

import java.util.Optional;

/**
 * Result of one {@link SearchTask}: an event, nothing, or a failure.
 */
public record TaskOutcome(SearchTask task, Optional<TransitEvent> event, String failure) {

    public static TaskOutcome of(final SearchTask task, final Optional<TransitEvent> event) {
        return new TaskOutcome(task, event, null);
    }

    public static TaskOutcome failed(final SearchTask task, final String failure) {
        return new TaskOutcome(task, Optional.empty(), failure);
    }

    public boolean isFailure() {
        return failure != null;
    }
}
