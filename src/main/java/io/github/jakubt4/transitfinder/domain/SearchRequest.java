package io.github.jakubt4.transitfinder.domain;

import java.time.LocalDate;

/**
 * Search input; both dates are inclusive UTC days.
 */
public record SearchRequest(Observer observer, LocalDate startDate, LocalDate endDate) {
}
