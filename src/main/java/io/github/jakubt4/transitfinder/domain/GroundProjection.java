package io.github.jakubt4.transitfinder.domain;

import org.hipparchus.geometry.euclidean.threed.Vector3D;

import java.time.Instant;

/**
 * Ground-track point of a satellite against a body at one instant.
 *
 * @param time              sample instant
 * @param point             where the body-satellite line meets the ellipsoid
 * @param satellitePosition Earth-fixed satellite position in meters
 * @param bodyPosition      Earth-fixed body position in meters
 * @param halfWidthKm       lateral half-width of the visibility band at {@code point}
 */
public record GroundProjection(Instant time,
                               GeoPoint point,
                               Vector3D satellitePosition,
                               Vector3D bodyPosition,
                               double halfWidthKm) {
}
