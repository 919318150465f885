package io.github.jakubt4.transitfinder.domain;

import java.util.List;

/**
 * Ordered events of a search plus anything that reduced its coverage.
 */
public record SearchResult(List<TransitEvent> events, List<String> warnings, int failedTasks) {

    public SearchResult {
        events = List.copyOf(events);
        warnings = List.copyOf(warnings);
    }

    public boolean partial() {
        return !warnings.isEmpty() || failedTasks > 0;
    }
}
