package io.github.jakubt4.transitfinder.service.search;

/**
 * Aggregated events broke ordering or uniqueness. Always a defect, never a user error.
 */
public class AggregationInvariantViolationException extends IllegalStateException {

    public AggregationInvariantViolationException(final String message) {
        super(message);
    }
}
