package io.github.jakubt4.transitfinder.service.search;

import io.github.jakubt4.transitfinder.domain.CelestialBody;
import io.github.jakubt4.transitfinder.ephemeris.SphericalEarthEphemeris;
import io.github.jakubt4.transitfinder.util.Geodesy;
import org.junit.jupiter.api.Test;

import static io.github.jakubt4.transitfinder.TestFixtures.BEIJING;
import static io.github.jakubt4.transitfinder.TestFixtures.T;
import static io.github.jakubt4.transitfinder.TestFixtures.satellite;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class GroundTrackProjectorTest {

    private final SphericalEarthEphemeris ephemeris = new SphericalEarthEphemeris(BEIJING.location());
    private final GroundTrackProjector projector = new GroundTrackProjector(ephemeris);

    @Test
    void projectsSatelliteOverheadOntoTheObserver() {
        ephemeris.withFlyby("ISS", T, 0.0);

        final var projection = projector.project(satellite("ISS"), CelestialBody.SUN, T).orElseThrow();

        assertThat(Geodesy.distanceKm(projection.point(), BEIJING.location())).isLessThan(0.01);
        assertThat(projection.time()).isEqualTo(T);
    }

    @Test
    void halfWidthIsAltitudeTimesTangentOfAngularRadiusUnderTheSatellite() {
        ephemeris.withFlyby("ISS", T, 0.0);

        final var projection = projector.project(satellite("ISS"), CelestialBody.SUN, T).orElseThrow();

        final var sunRadius = CelestialBody.SUN.angularRadius(SphericalEarthEphemeris.AU_M / 1000.0 - 6_371.0);
        assertThat(projection.halfWidthKm()).isCloseTo(400.0 * Math.tan(sunRadius), within(1.0e-3));
    }

    @Test
    void moonSwathIsNarrowerForSameGeometry() {
        ephemeris.withFlyby("ISS", T, 0.0)
                .withBody(CelestialBody.MOON, SphericalEarthEphemeris.up(BEIJING.location())
                        .scalarMultiply(SphericalEarthEphemeris.MOON_DISTANCE_M));

        final var sun = projector.project(satellite("ISS"), CelestialBody.SUN, T).orElseThrow();
        final var moon = projector.project(satellite("ISS"), CelestialBody.MOON, T).orElseThrow();

        assertThat(moon.halfWidthKm()).isLessThan(sun.halfWidthKm());
        assertThat(moon.halfWidthKm()).isCloseTo(400.0 * Math.tan(Math.asin(1_737.4 / (384_400.0 - 6_371.0))), within(1.0e-3));
    }

    @Test
    void noProjectionWhenBodyIsBehindTheEarth() {
        ephemeris.withFlyby("ISS", T, 0.0)
                .withBody(CelestialBody.SUN, SphericalEarthEphemeris.up(BEIJING.location())
                        .scalarMultiply(-SphericalEarthEphemeris.AU_M));

        assertThat(projector.project(satellite("ISS"), CelestialBody.SUN, T)).isEmpty();
    }
}
