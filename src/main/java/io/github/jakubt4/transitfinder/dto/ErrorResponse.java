package io.github.jakubt4.transitfinder.dto;

/**
 * Body returned when a search is not carried out.
 *
 * @param status  {@code "REJECTED"} for invalid input, {@code "FAILED"} for internal errors
 * @param message human-readable reason
 */
public record ErrorResponse(String status, String message) {
}
