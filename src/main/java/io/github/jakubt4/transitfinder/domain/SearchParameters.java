package io.github.jakubt4.transitfinder.domain;

import java.time.Duration;

/**
 * Numeric tuning of the coarse-to-fine search. Fixed per deployment so results are reproducible.
 *
 * @param coarseStep             sampling step over the whole pass
 * @param fineHalfWindow         half-width of the refinement window around the coarse minimum
 * @param fineStep               sampling step inside the refinement window
 * @param pruneMarginKm          added to the search radius before a coarse minimum is rejected
 * @param minBodyElevationDegrees body elevation at the observer below which a hit is discarded
 */
public record SearchParameters(Duration coarseStep,
                               Duration fineHalfWindow,
                               Duration fineStep,
                               double pruneMarginKm,
                               double minBodyElevationDegrees) {

    public static final SearchParameters DEFAULTS = new SearchParameters(
            Duration.ofSeconds(2), Duration.ofSeconds(10), Duration.ofMillis(100), 500.0, -2.0);

    public SearchParameters {
        if (coarseStep.isNegative() || coarseStep.isZero() || fineStep.isNegative() || fineStep.isZero()) {
            throw new IllegalArgumentException("Search steps must be positive");
        }
        if (fineStep.compareTo(coarseStep) > 0) {
            throw new IllegalArgumentException("Fine step " + fineStep + " exceeds coarse step " + coarseStep);
        }
        // the refinement window has to reach the true minimum the coarse grid may have stepped over
        if (fineHalfWindow.multipliedBy(2).compareTo(coarseStep) < 0) {
            throw new IllegalArgumentException("Fine window " + fineHalfWindow + " cannot cover coarse step " + coarseStep);
        }
        if (pruneMarginKm < 0) {
            throw new IllegalArgumentException("Prune margin must not be negative");
        }
    }
}
