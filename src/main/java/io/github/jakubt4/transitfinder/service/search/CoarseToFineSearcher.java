package io.github.jakubt4.transitfinder.service.search;

import io.github.jakubt4.transitfinder.domain.GeoPoint;
import io.github.jakubt4.transitfinder.domain.GroundProjection;
import io.github.jakubt4.transitfinder.domain.SearchTask;
import io.github.jakubt4.transitfinder.domain.TransitCandidate;
import io.github.jakubt4.transitfinder.domain.TransitEvent;
import io.github.jakubt4.transitfinder.domain.TransitType;
import io.github.jakubt4.transitfinder.ephemeris.EphemerisProvider;
import io.github.jakubt4.transitfinder.util.Geodesy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Finds the closest approach of a pass's ground track to the observer and decides whether it is a
 * transit.
 *
 * <p>Two fixed-step scans: the whole pass at the coarse step, then a short window around the
 * coarse minimum at the fine step. Sample instants are {@code start + k × step} for every
 * {@code k ≥ 0} that stays within the scanned interval, so results are reproducible.
 * Ties keep the earliest sample.
 *
 * <p>Stateless; one instance serves all worker threads.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CoarseToFineSearcher {

    private static final Duration RATE_PROBE = Duration.ofSeconds(1);

    private final GroundTrackProjector projector;
    private final EphemerisProvider ephemeris;

    public Optional<TransitEvent> search(final SearchTask task) {
        final var pass = task.passWindow();
        final var observer = task.observer();
        final var parameters = task.parameters();

        final var coarse = scan(task, pass.rise(), pass.set(), parameters.coarseStep());
        final var candidate = closest(coarse);
        if (candidate.isEmpty()) {
            log.debug("{} — no ground projection during pass", task.describe());
            return Optional.empty();
        }
        if (candidate.get().distanceKm() > observer.radiusKm() + parameters.pruneMarginKm()) {
            log.debug("{} — pruned, coarse minimum {} km", task.describe(), format(candidate.get().distanceKm()));
            return Optional.empty();
        }

        final var center = candidate.get().time();
        final var fineStart = latest(pass.rise(), center.minus(parameters.fineHalfWindow()));
        final var fineEnd = earliest(pass.set(), center.plus(parameters.fineHalfWindow()));
        final var fine = scan(task, fineStart, fineEnd, parameters.fineStep());
        if (fine.size() < 2) {
            log.debug("{} — only {} fine samples projected", task.describe(), fine.size());
            return Optional.empty();
        }

        final var best = closest(fine).orElseThrow();
        final var atMinimum = best.projection();
        if (best.distanceKm() > observer.radiusKm() + atMinimum.halfWidthKm()) {
            log.debug("{} — closest approach {} km outside radius", task.describe(), format(best.distanceKm()));
            return Optional.empty();
        }

        return classify(task, best, fine);
    }

    private Optional<TransitEvent> classify(final SearchTask task, final TransitCandidate best,
                                            final List<TransitCandidate> fine) {
        final var observer = task.observer();
        final var projection = best.projection();
        final var time = best.time();

        final var bodyLook = ephemeris.lookAngles(observer.location(), projection.bodyPosition(), time);
        if (bodyLook.elevationDegrees() < task.parameters().minBodyElevationDegrees()) {
            log.debug("{} — {} below horizon ({} deg)", task.describe(), task.body().displayName(),
                    format(bodyLook.elevationDegrees()));
            return Optional.empty();
        }

        final var site = ephemeris.toCartesian(observer.location());
        final var toSatellite = projection.satellitePosition().subtract(site);
        final var toBody = projection.bodyPosition().subtract(site);
        final double separation = Vector3D.angle(toSatellite, toBody);
        final double angularRadius = task.body().angularRadius(toBody.getNorm() / 1000.0);
        final var type = TransitType.classify(separation, angularRadius);

        final var satelliteLook = ephemeris.lookAngles(observer.location(), projection.satellitePosition(), time);
        final double duration = type == TransitType.FULL_DISK
                ? diskCrossingSeconds(task, site, toSatellite, separation, angularRadius, time)
                : 0.0;

        final var track = new ArrayList<GeoPoint>(fine.size());
        fine.forEach(sample -> track.add(sample.point()));

        final var event = new TransitEvent(
                task.satellite().name(),
                task.body(),
                time,
                type,
                Math.toDegrees(separation),
                satelliteLook.azimuthDegrees(),
                satelliteLook.elevationDegrees(),
                2 * projection.halfWidthKm(),
                best.distanceKm(),
                duration,
                track
        );
        log.info("{} — {} at {}, closest approach {} km, separation {} deg", task.describe(),
                type.label(), time, format(best.distanceKm()), format(event.separationDegrees()));
        return Optional.of(event);
    }

    /**
     * Time spent on the disk along the chord at the current separation, using the satellite's
     * apparent angular rate over the next second. The body's own motion is negligible beside it.
     */
    private double diskCrossingSeconds(final SearchTask task, final Vector3D site, final Vector3D toSatellite,
                                       final double separation, final double angularRadius, final Instant time) {
        final var later = ephemeris.satellitePosition(task.satellite(), time.plus(RATE_PROBE)).subtract(site);
        final double rate = Vector3D.angle(toSatellite, later) / (RATE_PROBE.toNanos() / 1.0e9);
        if (rate <= 0.0) {
            return 0.0;
        }
        final double chord = 2 * Math.sqrt(angularRadius * angularRadius - separation * separation);
        return chord / rate;
    }

    /**
     * Projects every sample instant of {@code [from, to]}; samples without a ground point are
     * left out, the rest stay in time order.
     */
    List<TransitCandidate> scan(final SearchTask task, final Instant from, final Instant to, final Duration step) {
        final var observerPoint = task.observer().location();
        final var span = Duration.between(from, to).toNanos();
        final var stepNanos = step.toNanos();

        final var samples = new ArrayList<TransitCandidate>();
        for (long k = 0; k * stepNanos <= span; k++) {
            final var time = from.plusNanos(k * stepNanos);
            final Optional<GroundProjection> projection = projector.project(task.satellite(), task.body(), time);
            projection.ifPresent(p -> samples.add(
                    new TransitCandidate(time, p, Geodesy.distanceKm(observerPoint, p.point()))));
        }
        return samples;
    }

    private static Optional<TransitCandidate> closest(final List<TransitCandidate> samples) {
        TransitCandidate best = null;
        for (final var sample : samples) {
            if (best == null || sample.distanceKm() < best.distanceKm()) {
                best = sample;
            }
        }
        return Optional.ofNullable(best);
    }

    private static Instant latest(final Instant a, final Instant b) {
        return a.isAfter(b) ? a : b;
    }

    private static Instant earliest(final Instant a, final Instant b) {
        return a.isBefore(b) ? a : b;
    }

    private static String format(final double value) {
        return String.format("%.2f", value);
    }
}
