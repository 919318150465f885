package io.github.jakubt4.transitfinder.domain;

import java.time.Instant;
import java.util.List;

/**
 * A predicted transit or close pass.
 *
 * @param satellite          satellite name
 * @param body               body being crossed
 * @param time               instant of closest ground-track approach to the observer
 * @param type               full-disk transit or partial/close pass
 * @param separationDegrees  satellite to body-centre angle seen from the observer
 * @param azimuthDegrees     satellite azimuth seen from the observer
 * @param elevationDegrees   satellite elevation seen from the observer
 * @param swathWidthKm       full width of the band from which the transit is visible
 * @param closestApproachKm  observer to ground-track distance at {@code time}
 * @param durationSeconds    estimated time spent on the disk, zero for a partial pass
 * @param groundTrack        swath centreline, ordered by time
 */
public record TransitEvent(String satellite,
                           CelestialBody body,
                           Instant time,
                           TransitType type,
                           double separationDegrees,
                           double azimuthDegrees,
                           double elevationDegrees,
                           double swathWidthKm,
                           double closestApproachKm,
                           double durationSeconds,
                           List<GeoPoint> groundTrack) {

    public TransitEvent {
        if (groundTrack.size() < 2) {
            throw new IllegalArgumentException("Ground track needs at least two points, got " + groundTrack.size());
        }
        groundTrack = List.copyOf(groundTrack);
    }
}
