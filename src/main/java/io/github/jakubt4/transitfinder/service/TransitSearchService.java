package io.github.jakubt4.transitfinder.service;

import io.github.jakubt4.transitfinder.domain.SearchParameters;
import io.github.jakubt4.transitfinder.domain.SearchRequest;
import io.github.jakubt4.transitfinder.domain.SearchResult;
import io.github.jakubt4.transitfinder.domain.TaskOutcome;
import io.github.jakubt4.transitfinder.service.search.ParallelTaskExecutor;
import io.github.jakubt4.transitfinder.service.search.ResultAggregator;
import io.github.jakubt4.transitfinder.service.search.SearchTaskGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;

/**
 * Entry point of a transit search: validates the request, enumerates passes of every tracked
 * satellite, fans the passes out to the worker pool and merges what comes back.
 */
@Slf4j
@Service
public class TransitSearchService {

    private final TrackedSatelliteCatalog catalog;
    private final SearchTaskGenerator taskGenerator;
    private final ParallelTaskExecutor executor;
    private final ResultAggregator aggregator;
    private final SearchParameters parameters;
    private final int maxRangeDays;

    public TransitSearchService(final TrackedSatelliteCatalog catalog,
                                final SearchTaskGenerator taskGenerator,
                                final ParallelTaskExecutor executor,
                                final ResultAggregator aggregator,
                                final SearchParameters parameters,
                                @Value("${transit.search.max-range-days:31}") final int maxRangeDays) {
        this.catalog = catalog;
        this.taskGenerator = taskGenerator;
        this.executor = executor;
        this.aggregator = aggregator;
        this.parameters = parameters;
        this.maxRangeDays = maxRangeDays;
    }

    /**
     * @throws InvalidSearchRequestException if the observer or the date range is malformed
     */
    public SearchResult search(final SearchRequest request) {
        validate(request);
        final var startedMs = System.currentTimeMillis();
        final var observer = request.observer();

        final var start = request.startDate().atStartOfDay().toInstant(ZoneOffset.UTC);
        final var end = request.endDate().plusDays(1).atStartOfDay().toInstant(ZoneOffset.UTC);
        log.info("Transit search — observer ({}, {}), radius {} km, {} to {}",
                observer.latitude(), observer.longitude(), observer.radiusKm(), request.startDate(), request.endDate());

        final var warnings = new ArrayList<String>();
        catalog.missing().forEach(name -> warnings.add(name + ": no orbital elements available"));

        final var plan = taskGenerator.generate(catalog.available(), observer, start, end, parameters);
        warnings.addAll(plan.warnings());

        final var outcomes = executor.execute(plan.tasks());
        final var failed = (int) outcomes.stream().filter(TaskOutcome::isFailure).count();
        if (failed > 0) {
            warnings.add(failed + " of " + outcomes.size() + " pass computations failed");
        }

        final var events = aggregator.aggregate(outcomes);
        log.info("Transit search completed in {}ms — {} events from {} tasks, {} failed",
                System.currentTimeMillis() - startedMs, events.size(), outcomes.size(), failed);
        return new SearchResult(events, warnings, failed);
    }

    private void validate(final SearchRequest request) {
        final var observer = request.observer();
        if (observer == null) {
            throw new InvalidSearchRequestException("Observer location is required");
        }
        if (!(observer.latitude() >= -90.0 && observer.latitude() <= 90.0)) {
            throw new InvalidSearchRequestException("Latitude must be between -90 and 90 degrees");
        }
        if (!(observer.longitude() >= -180.0 && observer.longitude() <= 180.0)) {
            throw new InvalidSearchRequestException("Longitude must be between -180 and 180 degrees");
        }
        if (!Double.isFinite(observer.radiusKm()) || observer.radiusKm() <= 0.0) {
            throw new InvalidSearchRequestException("Search radius must be a positive number of kilometers");
        }
        if (request.startDate() == null || request.endDate() == null) {
            throw new InvalidSearchRequestException("Start and end dates are required");
        }
        if (request.endDate().isBefore(request.startDate())) {
            throw new InvalidSearchRequestException("End date must not precede start date");
        }
        final var days = ChronoUnit.DAYS.between(request.startDate(), request.endDate()) + 1;
        if (days > maxRangeDays) {
            throw new InvalidSearchRequestException("Date range of " + days + " days exceeds " + maxRangeDays);
        }
    }
}
