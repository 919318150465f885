package io.github.jakubt4.transitfinder.dto;

/**
 * Inbound transit search request.
 *
 * @param lat       observer latitude, degrees
 * @param lon       observer longitude, degrees
 * @param radiusKm  distance the observer is willing to travel
 * @param startDate first day searched, {@code YYYY-MM-DD} (UTC)
 * @param endDate   last day searched, inclusive
 */
public record CalculateRequest(Double lat, Double lon, Double radiusKm, String startDate, String endDate) {
}
