package io.github.jakubt4.transitfinder.controller;

import io.github.jakubt4.transitfinder.domain.Observer;
import io.github.jakubt4.transitfinder.domain.SearchRequest;
import io.github.jakubt4.transitfinder.dto.CalculateRequest;
import io.github.jakubt4.transitfinder.dto.CalculateResponse;
import io.github.jakubt4.transitfinder.dto.ErrorResponse;
import io.github.jakubt4.transitfinder.dto.TransitEventResponse;
import io.github.jakubt4.transitfinder.service.InvalidSearchRequestException;
import io.github.jakubt4.transitfinder.service.TransitSearchService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * REST endpoint for transit searches.
 *
 * <p>{@code POST /api/calculate} runs a full search synchronously and returns every predicted
 * transit of the tracked satellites across the Sun and Moon, ordered by time.
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class TransitSearchController {

    private final TransitSearchService transitSearchService;

    /**
     * @param request observer location, search radius and inclusive date range
     * @return {@code 200 OK} with the events (possibly partial), {@code 400 Bad Request} on invalid
     *         input, {@code 500} if the search itself breaks
     */
    @PostMapping("/calculate")
    public ResponseEntity<?> calculate(@RequestBody final CalculateRequest request) {
        if (request.lat() == null || request.lon() == null || request.radiusKm() == null) {
            return ResponseEntity.badRequest()
                    .body(new ErrorResponse("REJECTED", "lat, lon and radius_km are required"));
        }
        if (request.startDate() == null || request.endDate() == null) {
            return ResponseEntity.badRequest()
                    .body(new ErrorResponse("REJECTED", "start_date and end_date are required"));
        }

        final LocalDate startDate;
        final LocalDate endDate;
        try {
            startDate = LocalDate.parse(request.startDate());
            endDate = LocalDate.parse(request.endDate());
        } catch (final DateTimeParseException e) {
            return ResponseEntity.badRequest()
                    .body(new ErrorResponse("REJECTED", "Invalid date format. Use YYYY-MM-DD"));
        }

        final var observer = new Observer(request.lat(), request.lon(), request.radiusKm());
        try {
            final var result = transitSearchService.search(new SearchRequest(observer, startDate, endDate));
            final var events = result.events().stream()
                    .map(TransitEventResponse::from)
                    .toList();
            return ResponseEntity.ok(new CalculateResponse(events, result.partial(), result.warnings()));
        } catch (final InvalidSearchRequestException e) {
            log.info("Search rejected: {}", e.getMessage());
            return ResponseEntity.badRequest()
                    .body(new ErrorResponse("REJECTED", e.getMessage()));
        } catch (final RuntimeException e) {
            log.error("Transit search failed: {}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(new ErrorResponse("FAILED", "Transit search failed: " + e.getMessage()));
        }
    }
}
