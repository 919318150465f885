package io.github.jakubt4.transitfinder.config;

import io.github.jakubt4.transitfinder.domain.SearchParameters;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Numeric constants of the transit search. Defaults match {@link SearchParameters#DEFAULTS};
 * changing them changes which sample instants are evaluated.
 */
@Slf4j
@Configuration
public class SearchConfig {

    @Bean
    SearchParameters searchParameters(
            @Value("${transit.search.coarse-step:2s}") final Duration coarseStep,
            @Value("${transit.search.fine-half-window:10s}") final Duration fineHalfWindow,
            @Value("${transit.search.fine-step:100ms}") final Duration fineStep,
            @Value("${transit.search.prune-margin-km:500}") final double pruneMarginKm,
            @Value("${transit.search.min-body-elevation-deg:-2.0}") final double minBodyElevation) {
        final var parameters = new SearchParameters(coarseStep, fineHalfWindow, fineStep, pruneMarginKm, minBodyElevation);
        log.info("Transit search — coarse step {}, fine window ±{} at {}, prune margin {} km",
                coarseStep, fineHalfWindow, fineStep, pruneMarginKm);
        return parameters;
    }
}
