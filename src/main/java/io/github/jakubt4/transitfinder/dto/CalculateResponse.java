package io.github.jakubt4.transitfinder.dto;

import java.util.List;

/**
 * Transit search response.
 *
 * @param events   predicted events ordered by time, possibly empty
 * @param partial  {@code true} if some satellites or passes could not be searched
 * @param warnings what reduced the coverage
 */
public record CalculateResponse(List<TransitEventResponse> events, boolean partial, List<String> warnings) {
}
