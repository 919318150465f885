package io.github.jakubt4.transitfinder.service.search;

import io.github.jakubt4.transitfinder.domain.CelestialBody;
import io.github.jakubt4.transitfinder.domain.TransitCandidate;
import io.github.jakubt4.transitfinder.domain.TransitType;
import io.github.jakubt4.transitfinder.ephemeris.SphericalEarthEphemeris;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static io.github.jakubt4.transitfinder.TestFixtures.BEIJING;
import static io.github.jakubt4.transitfinder.TestFixtures.T;
import static io.github.jakubt4.transitfinder.TestFixtures.pass;
import static io.github.jakubt4.transitfinder.TestFixtures.task;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CoarseToFineSearcherTest {

    private static final Instant RISE = T.minusSeconds(300);
    private static final Instant SET = T.plusSeconds(300);

    private final SphericalEarthEphemeris ephemeris = new SphericalEarthEphemeris(BEIJING.location());
    private final CoarseToFineSearcher searcher =
            new CoarseToFineSearcher(new GroundTrackProjector(ephemeris), ephemeris);

    @Test
    void closePassWithinRadiusYieldsOneEventAtClosestApproach() {
        ephemeris.withFlyby("ISS", T, 40.0);

        final var event = searcher.search(task(0, pass("ISS", RISE, SET), CelestialBody.SUN));

        assertThat(event).isPresent();
        final var e = event.get();
        assertThat(e.satellite()).isEqualTo("ISS");
        assertThat(e.body()).isEqualTo(CelestialBody.SUN);
        assertThat(e.time()).isEqualTo(T);
        assertThat(e.closestApproachKm()).isCloseTo(40.0, within(0.05));
        assertThat(e.closestApproachKm()).isLessThanOrEqualTo(BEIJING.radiusKm() + e.swathWidthKm() / 2);
        // satellite 400 km up and 40 km east: about 5.7 deg from the zenith Sun, outside its disk
        assertThat(e.type()).isEqualTo(TransitType.PARTIAL);
        assertThat(e.separationDegrees()).isBetween(5.5, 6.0);
        assertThat(e.azimuthDegrees()).isCloseTo(90.0, within(0.5));
        assertThat(e.elevationDegrees()).isBetween(83.0, 86.0);
        assertThat(e.swathWidthKm()).isCloseTo(3.72, within(0.05));
        assertThat(e.durationSeconds()).isZero();
    }

    @Test
    void groundTrackSpansTheFineWindowInTimeOrder() {
        ephemeris.withFlyby("ISS", T, 40.0);

        final var event = searcher.search(task(0, pass("ISS", RISE, SET), CelestialBody.SUN)).orElseThrow();

        assertThat(event.groundTrack()).hasSize(201);
        for (var i = 1; i < event.groundTrack().size(); i++) {
            assertThat(event.groundTrack().get(i).latitude())
                    .isGreaterThan(event.groundTrack().get(i - 1).latitude());
        }
    }

    @Test
    void samplesCoarseGridThenFineWindowAroundMinimum() {
        ephemeris.withFlyby("ISS", T, 40.0);

        searcher.search(task(0, pass("ISS", RISE, SET), CelestialBody.SUN));

        final var calls = ephemeris.intersectionCalls();
        assertThat(calls).hasSize(301 + 201);
        for (var k = 0; k <= 300; k++) {
            assertThat(calls.get(k)).isEqualTo(RISE.plusSeconds(2L * k));
        }
        for (var k = 0; k <= 200; k++) {
            assertThat(calls.get(301 + k)).isEqualTo(T.minusSeconds(10).plusMillis(100L * k));
        }
    }

    @Test
    void distantPassIsPrunedAfterCoarseScan() {
        ephemeris.withFlyby("ISS", T, 700.0);

        final var event = searcher.search(task(0, pass("ISS", RISE, SET), CelestialBody.SUN));

        assertThat(event).isEmpty();
        assertThat(ephemeris.intersectionCalls()).hasSize(301);
    }

    @Test
    void passInsidePruneMarginButOutsideRadiusIsRefinedThenRejected() {
        ephemeris.withFlyby("ISS", T, 150.0);

        final var event = searcher.search(task(0, pass("ISS", RISE, SET), CelestialBody.SUN));

        assertThat(event).isEmpty();
        assertThat(ephemeris.intersectionCalls()).hasSize(301 + 201);
    }

    @Test
    void passShorterThanFineWindowIsScannedInFull() {
        ephemeris.withFlyby("ISS", T, 40.0);
        final var rise = T.minusMillis(1500);
        final var set = T.plusMillis(1500);

        final var event = searcher.search(task(0, pass("ISS", rise, set), CelestialBody.SUN));

        assertThat(event).isPresent();
        assertThat(event.get().time()).isEqualTo(T);
        assertThat(event.get().groundTrack()).hasSize(31);
        final var calls = ephemeris.intersectionCalls();
        assertThat(calls).hasSize(2 + 31);
        assertThat(calls.subList(0, 2)).containsExactly(rise, rise.plusSeconds(2));
        assertThat(calls.get(2)).isEqualTo(rise);
        assertThat(calls.get(calls.size() - 1)).isEqualTo(set);
    }

    @Test
    void equallyCloseCoarseMinimaResolveToTheEarliest() {
        // approaches, recedes, and comes back over the same spot 200 s later
        ephemeris.withFlyby("ISS", T, 40.0, 400.0, seconds -> 7.0 * (Math.abs(seconds) - 100.0));

        final var event = searcher.search(task(0, pass("ISS", RISE, SET), CelestialBody.SUN));

        assertThat(event).isPresent();
        assertThat(event.get().time()).isEqualTo(T.minusSeconds(100));
    }

    @Test
    void overheadPassAcrossTheDiskIsFullDiskTransit() {
        ephemeris.withFlyby("ISS", T, 0.0);

        final var event = searcher.search(task(0, pass("ISS", RISE, SET), CelestialBody.SUN)).orElseThrow();

        assertThat(event.type()).isEqualTo(TransitType.FULL_DISK);
        assertThat(event.separationDegrees()).isLessThan(0.01);
        assertThat(event.closestApproachKm()).isCloseTo(0.0, within(0.01));
        // 0.53 deg disk crossed at about 1.07 deg/s
        assertThat(event.durationSeconds()).isBetween(0.45, 0.55);
    }

    @Test
    void bodyBelowHorizonProducesNoCandidate() {
        ephemeris.withFlyby("ISS", T, 0.0);

        final var event = searcher.search(task(1, pass("ISS", RISE, SET), CelestialBody.MOON));

        assertThat(event).isEmpty();
        assertThat(ephemeris.intersectionCalls()).hasSize(301);
    }

    @Test
    void coarseSampleCountFollowsPassDuration() {
        ephemeris.withFlyby("ISS", T, 40.0);
        final var rise = T.minusSeconds(5);

        final var samples = searcher.scan(task(0, pass("ISS", rise, T.plusSeconds(4)), CelestialBody.SUN),
                rise, T.plusSeconds(4), Duration.ofSeconds(2));

        // 9 s pass: offsets 0, 2, 4, 6, 8
        assertThat(samples).extracting(TransitCandidate::time)
                .containsExactly(rise, rise.plusSeconds(2), rise.plusSeconds(4), rise.plusSeconds(6), rise.plusSeconds(8));
    }
}
