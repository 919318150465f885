package io.github.jakubt4.transitfinder.ephemeris;

import io.github.jakubt4.transitfinder.domain.CelestialBody;
import io.github.jakubt4.transitfinder.domain.GeoPoint;
import io.github.jakubt4.transitfinder.domain.LookAngles;
import io.github.jakubt4.transitfinder.domain.Observer;
import io.github.jakubt4.transitfinder.domain.PassWindow;
import io.github.jakubt4.transitfinder.domain.TrackedSatellite;
import org.hipparchus.geometry.euclidean.threed.Vector3D;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Position and Earth-shape capabilities the transit search is built on.
 *
 * <p>All vectors are Earth-fixed and expressed in meters. Implementations must be safe to call
 * from several worker threads at once.
 */
public interface EphemerisProvider {

    /**
     * Enumerates every interval in {@code [start, end]} during which the satellite is above the
     * observer's horizon. Passes in progress at either bound are clipped to it.
     *
     * @throws EphemerisUnavailableException if the satellite cannot be propagated over the range
     */
    List<PassWindow> findPasses(TrackedSatellite satellite, Observer observer, Instant start, Instant end);

    Vector3D satellitePosition(TrackedSatellite satellite, Instant time);

    Vector3D bodyPosition(CelestialBody body, Instant time);

    /**
     * Follows the ray that starts at {@code origin} and passes through {@code through}, and returns
     * the first point beyond {@code through} where it meets the reference ellipsoid.
     *
     * @return empty when the ray leaves {@code through} without hitting the Earth
     */
    Optional<GeoPoint> intersectEllipsoid(Vector3D origin, Vector3D through, Instant time);

    /**
     * Earth-fixed position of a point on the ellipsoid surface.
     */
    Vector3D toCartesian(GeoPoint point);

    LookAngles lookAngles(GeoPoint site, Vector3D target, Instant time);
}
