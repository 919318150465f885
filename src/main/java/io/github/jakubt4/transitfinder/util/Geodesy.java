package io.github.jakubt4.transitfinder.util;

import io.github.jakubt4.transitfinder.domain.GeoPoint;

/**
 * Great-circle helpers on a spherical Earth.
 */
public final class Geodesy {

    public static final double MEAN_EARTH_RADIUS_KM = 6_371.0;

    private Geodesy() {
    }

    /**
     * Haversine distance between two points.
     *
     * @return distance in kilometers
     */
    public static double distanceKm(final GeoPoint a, final GeoPoint b) {
        final double lat1 = Math.toRadians(a.latitude());
        final double lat2 = Math.toRadians(b.latitude());
        final double dLat = lat2 - lat1;
        final double dLon = Math.toRadians(b.longitude() - a.longitude());

        final double h = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(lat1) * Math.cos(lat2) * Math.sin(dLon / 2) * Math.sin(dLon / 2);

        return 2 * MEAN_EARTH_RADIUS_KM * Math.atan2(Math.sqrt(h), Math.sqrt(Math.max(0.0, 1.0 - h)));
    }
}
