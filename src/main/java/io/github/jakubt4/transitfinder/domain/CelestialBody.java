package io.github.jakubt4.transitfinder.domain;

/**
 * Bodies a tracked satellite can be seen crossing.
 */
public enum CelestialBody {

    SUN("Sun", 696_340.0),
    MOON("Moon", 1_737.4);

    private final String displayName;
    private final double radiusKm;

    CelestialBody(final String displayName, final double radiusKm) {
        this.displayName = displayName;
        this.radiusKm = radiusKm;
    }

    public String displayName() {
        return displayName;
    }

    public double radiusKm() {
        return radiusKm;
    }

    /**
     * Half-angle subtended by the body's disk from a point {@code distanceKm} away
     * from its centre. Moon libration is ignored.
     *
     * @return angular radius in radians
     */
    public double angularRadius(final double distanceKm) {
        if (distanceKm <= radiusKm) {
            throw new IllegalArgumentException(
                    "Distance %.1f km is inside %s".formatted(distanceKm, displayName));
        }
        return Math.asin(radiusKm / distanceKm);
    }
}
