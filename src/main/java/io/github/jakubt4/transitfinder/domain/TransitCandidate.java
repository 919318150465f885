package io.github.jakubt4.transitfinder.domain;

import java.time.Instant;

/**
 * Closest ground-track sample found so far by a scan.
 */
public record TransitCandidate(Instant time, GroundProjection projection, double distanceKm) {

    public GeoPoint point() {
        return projection.point();
    }
}
