package io.github.jakubt4.transitfinder.domain;

/**
 * A point on the WGS84 ellipsoid surface.
 *
 * @param latitude  geodetic latitude in degrees
 * @param longitude longitude in degrees, east positive
 */
public record GeoPoint(double latitude, double longitude) {
}
