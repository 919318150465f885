package io.github.jakubt4.transitfinder.domain;

/**
 * Topocentric direction of a target.
 *
 * @param azimuthDegrees   clockwise from north, [0, 360)
 * @param elevationDegrees above the local horizon
 * @param rangeKm          slant range
 */
public record LookAngles(double azimuthDegrees, double elevationDegrees, double rangeKm) {
}
