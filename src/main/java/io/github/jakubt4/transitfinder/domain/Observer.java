package io.github.jakubt4.transitfinder.domain;

/**
 * Ground observer of a search request.
 *
 * @param latitude  WGS84 latitude in degrees
 * @param longitude WGS84 longitude in degrees
 * @param radiusKm  how far from the site the observer is willing to travel
 */
public record Observer(double latitude, double longitude, double radiusKm) {

    public GeoPoint location() {
        return new GeoPoint(latitude, longitude);
    }
}
