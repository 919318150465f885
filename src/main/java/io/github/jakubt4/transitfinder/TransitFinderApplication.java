package io.github.jakubt4.transitfinder;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Transit Finder — predicts when the ISS, Tiangong and Hubble cross the Sun or Moon.
 *
 * <p>Enumerates satellite passes over an observer with Orekit SGP4/SDP4, searches each pass for
 * the instant its silhouette's ground track comes closest to the observer, and reports the swath
 * from which the transit is visible.
 *
 * @see io.github.jakubt4.transitfinder.service.TransitSearchService
 * @see io.github.jakubt4.transitfinder.service.search.CoarseToFineSearcher
 */
@SpringBootApplication
@EnableScheduling
@EnableRetry
public class TransitFinderApplication {

    public static void main(String[] args) {
        SpringApplication.run(TransitFinderApplication.class, args);
    }
}
