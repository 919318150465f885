package io.github.jakubt4.transitfinder.ephemeris;

import io.github.jakubt4.transitfinder.config.OrekitConfig;
import io.github.jakubt4.transitfinder.domain.CelestialBody;
import io.github.jakubt4.transitfinder.domain.GeoPoint;
import io.github.jakubt4.transitfinder.domain.LookAngles;
import io.github.jakubt4.transitfinder.domain.Observer;
import io.github.jakubt4.transitfinder.domain.PassWindow;
import io.github.jakubt4.transitfinder.domain.TrackedSatellite;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.geometry.euclidean.threed.Line;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.util.FastMath;
import org.orekit.bodies.CelestialBodyFactory;
import org.orekit.bodies.GeodeticPoint;
import org.orekit.bodies.OneAxisEllipsoid;
import org.orekit.errors.OrekitException;
import org.orekit.frames.Frame;
import org.orekit.frames.FramesFactory;
import org.orekit.frames.TopocentricFrame;
import org.orekit.propagation.analytical.tle.TLE;
import org.orekit.propagation.analytical.tle.TLEPropagator;
import org.orekit.propagation.events.ElevationDetector;
import org.orekit.time.AbsoluteDate;
import org.orekit.time.TimeScale;
import org.orekit.time.TimeScalesFactory;
import org.orekit.utils.Constants;
import org.orekit.utils.IERSConventions;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.Optional;

/**
 * {@link EphemerisProvider} backed by Orekit: SGP4/SDP4 for satellites, JPL ephemerides for the
 * Sun and Moon, and the WGS84 ellipsoid in ITRF (IERS 2010).
 *
 * <p>{@link TLEPropagator} is not thread-safe, so every worker thread lazily builds and keeps its
 * own propagator per satellite, rebuilt when the satellite's element set changes.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OrekitEphemerisProvider implements EphemerisProvider {

    private static final double PASS_MAX_CHECK_SECONDS = 60.0;
    private static final double PASS_MIN_CHECK_SECONDS = 1.0;
    /** Upper bound of a LEO satellite's elevation rate, about 1.1 deg/s at zenith. */
    private static final double MAX_ELEVATION_RATE_DEG_PER_SECOND = 2.0;
    private static final double PASS_THRESHOLD_SECONDS = 1.0e-3;
    private static final double LINE_TOLERANCE_METERS = 1.0e-3;

    @SuppressWarnings("unused") // injected to guarantee Orekit data is loaded before @PostConstruct
    private final OrekitConfig orekitConfig;

    private final ThreadLocal<ElementSetCache<TLEPropagator>> workerPropagators =
            ThreadLocal.withInitial(ElementSetCache::new);

    private OneAxisEllipsoid earth;
    private Frame itrf;
    private TimeScale utc;
    private org.orekit.bodies.CelestialBody sun;
    private org.orekit.bodies.CelestialBody moon;

    @PostConstruct
    void init() {
        itrf = FramesFactory.getITRF(IERSConventions.IERS_2010, true);
        earth = new OneAxisEllipsoid(
                Constants.WGS84_EARTH_EQUATORIAL_RADIUS,
                Constants.WGS84_EARTH_FLATTENING,
                itrf
        );
        utc = TimeScalesFactory.getUTC();
        sun = CelestialBodyFactory.getSun();
        moon = CelestialBodyFactory.getMoon();
        log.info("Ephemeris ready — WGS84 ellipsoid, ITRF/IERS-2010, JPL Sun/Moon");
    }

    @Override
    public List<PassWindow> findPasses(final TrackedSatellite satellite, final Observer observer,
                                       final Instant start, final Instant end) {
        try {
            // fresh propagator: event detectors must not leak into the workers' cached ones
            final var propagator = TLEPropagator.selectExtrapolator(parse(satellite));
            final var site = new TopocentricFrame(earth, toGeodetic(observer.location()), satellite.name() + "-observer");
            final var handler = new HorizonCrossingHandler();
            final var detector = new ElevationDetector(PASS_MAX_CHECK_SECONDS, PASS_THRESHOLD_SECONDS, site)
                    .withConstantElevation(0.0)
                    .withMaxCheck(state -> passCheckSeconds(FastMath.toDegrees(site.getElevation(
                            state.getPVCoordinates().getPosition(), state.getFrame(), state.getDate()))))
                    .withHandler(handler);

            final var startDate = toDate(start);
            final var endDate = toDate(end);
            final var initial = propagator.propagate(startDate);
            final var visibleAtStart = detector.g(initial) > 0;

            propagator.addEventDetector(detector);
            propagator.propagate(startDate, endDate);

            final var edges = handler.crossings().stream()
                    .map(c -> new PassAssembler.Edge(toInstant(c.date()), c.rising()))
                    .toList();
            final var passes = PassAssembler.assemble(satellite, visibleAtStart, edges, start, end);
            log.debug("[{}] {} horizon crossings, {} passes between {} and {}",
                    satellite.name(), edges.size(), passes.size(), start, end);
            return passes;
        } catch (final OrekitException | IllegalArgumentException e) {
            throw new EphemerisUnavailableException(
                    "Pass enumeration failed for " + satellite.name() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Vector3D satellitePosition(final TrackedSatellite satellite, final Instant time) {
        final var propagator = workerPropagators.get()
                .get(satellite, s -> TLEPropagator.selectExtrapolator(parse(s)));
        return propagator.getPVCoordinates(toDate(time), itrf).getPosition();
    }

    /**
     * Check interval of the horizon detector at the given elevation: the time the satellite needs
     * to reach the horizon at its fastest, so no pass of at least one second is stepped over.
     */
    static double passCheckSeconds(final double elevationDegrees) {
        final double toHorizon = FastMath.abs(elevationDegrees) / MAX_ELEVATION_RATE_DEG_PER_SECOND;
        return FastMath.max(PASS_MIN_CHECK_SECONDS, FastMath.min(PASS_MAX_CHECK_SECONDS, toHorizon));
    }

    @Override
    public Vector3D bodyPosition(final CelestialBody body, final Instant time) {
        final var provider = body == CelestialBody.SUN ? sun : moon;
        return provider.getPVCoordinates(toDate(time), itrf).getPosition();
    }

    @Override
    public Optional<GeoPoint> intersectEllipsoid(final Vector3D origin, final Vector3D through, final Instant time) {
        final var date = toDate(time);
        final var line = new Line(origin, through, LINE_TOLERANCE_METERS);
        final var hit = earth.getIntersectionPoint(line, through, itrf, date);
        if (hit == null) {
            return Optional.empty();
        }
        // the intersection closest to `through` may sit between origin and through
        final var hitPosition = earth.transform(hit);
        final var beyond = Vector3D.dotProduct(hitPosition.subtract(through), through.subtract(origin)) > 0;
        if (!beyond) {
            return Optional.empty();
        }
        return Optional.of(new GeoPoint(FastMath.toDegrees(hit.getLatitude()), FastMath.toDegrees(hit.getLongitude())));
    }

    @Override
    public Vector3D toCartesian(final GeoPoint point) {
        return earth.transform(toGeodetic(point));
    }

    @Override
    public LookAngles lookAngles(final GeoPoint site, final Vector3D target, final Instant time) {
        final var date = toDate(time);
        final var topo = new TopocentricFrame(earth, toGeodetic(site), "site");
        return new LookAngles(
                FastMath.toDegrees(topo.getAzimuth(target, itrf, date)),
                FastMath.toDegrees(topo.getElevation(target, itrf, date)),
                topo.getRange(target, itrf, date) / 1000.0
        );
    }

    private TLE parse(final TrackedSatellite satellite) {
        return new TLE(satellite.line1(), satellite.line2());
    }

    private static GeodeticPoint toGeodetic(final GeoPoint point) {
        return new GeodeticPoint(FastMath.toRadians(point.latitude()), FastMath.toRadians(point.longitude()), 0.0);
    }

    private AbsoluteDate toDate(final Instant instant) {
        return new AbsoluteDate(Date.from(instant), utc);
    }

    private Instant toInstant(final AbsoluteDate date) {
        return date.toDate(utc).toInstant();
    }
}
