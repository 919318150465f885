package io.github.jakubt4.transitfinder.service.search;

import io.github.jakubt4.transitfinder.domain.CelestialBody;
import io.github.jakubt4.transitfinder.domain.GroundProjection;
import io.github.jakubt4.transitfinder.domain.TrackedSatellite;
import io.github.jakubt4.transitfinder.ephemeris.EphemerisProvider;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;

/**
 * Projects a satellite's silhouette against the Sun or Moon onto the ground.
 *
 * <p>The centreline point is where the line from the body's centre through the satellite meets the
 * WGS84 ellipsoid: an observer standing there sees the satellite centred on the disk. The band
 * around it has half-width {@code slantRange × tan(angularRadius)}, where the slant range is the
 * satellite-to-ground distance along that line and the angular radius is measured from the ground
 * point. Directly under the satellite this reduces to {@code altitude × tan(angularRadius)}.
 */
@Component
@RequiredArgsConstructor
public class GroundTrackProjector {

    private final EphemerisProvider ephemeris;

    /**
     * @return empty when there is no ground point: the line misses the Earth, or the body is
     *         below the horizon of the point it would hit
     */
    public Optional<GroundProjection> project(final TrackedSatellite satellite, final CelestialBody body,
                                              final Instant time) {
        final var satellitePosition = ephemeris.satellitePosition(satellite, time);
        final var bodyPosition = ephemeris.bodyPosition(body, time);

        final var hit = ephemeris.intersectEllipsoid(bodyPosition, satellitePosition, time);
        if (hit.isEmpty()) {
            return Optional.empty();
        }
        final var point = hit.get();
        if (ephemeris.lookAngles(point, bodyPosition, time).elevationDegrees() < 0.0) {
            return Optional.empty();
        }

        final var ground = ephemeris.toCartesian(point);
        final double slantRangeKm = satellitePosition.distance(ground) / 1000.0;
        final double angularRadius = body.angularRadius(bodyPosition.distance(ground) / 1000.0);
        final double halfWidthKm = slantRangeKm * Math.tan(angularRadius);

        return Optional.of(new GroundProjection(time, point, satellitePosition, bodyPosition, halfWidthKm));
    }
}
