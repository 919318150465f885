package io.github.jakubt4.transitfinder.service;

import org.junit.jupiter.api.Test;
import org.orekit.time.TimeScale;
import org.orekit.time.TimeScalesFactory;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

import static io.github.jakubt4.transitfinder.TestFixtures.TLE_LINE1;
import static io.github.jakubt4.transitfinder.TestFixtures.TLE_LINE2;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TleParserTest {

    // TAI needs no leap-second data; epochs read and written in it keep their calendar value
    private static final TimeScale TIME_SCALE = TimeScalesFactory.getTAI();

    @Test
    void parsesThreeLineEntries() {
        final var text = """
                ISS (ZARYA)
                %s
                %s
                HST            \s
                %s
                %s
                """.formatted(TLE_LINE1, TLE_LINE2, TLE_LINE1, TLE_LINE2);

        final var entries = TleParser.parse(text, TIME_SCALE);

        assertThat(entries).extracting(TleParser.NamedTle::name).containsExactly("ISS (ZARYA)", "HST");
        assertThat(entries.get(0).line1()).isEqualTo(TLE_LINE1);
        assertThat(entries.get(0).line2()).isEqualTo(TLE_LINE2);
    }

    @Test
    void skipsMalformedEntryAndResynchronises() {
        final var text = """
                BROKEN
                1 25544U truncated
                ISS (ZARYA)
                %s
                %s
                """.formatted(TLE_LINE1, TLE_LINE2);

        assertThat(TleParser.parse(text, TIME_SCALE)).extracting(TleParser.NamedTle::name)
                .containsExactly("ISS (ZARYA)");
    }

    @Test
    void rejectsEntryWithWrongChecksum() {
        final var corrupted = TLE_LINE1.substring(0, 68) + "8";
        final var text = """
                ISS (ZARYA)
                %s
                %s
                HST
                %s
                %s
                """.formatted(corrupted, TLE_LINE2, TLE_LINE1, TLE_LINE2);

        assertThat(TleParser.parse(text, TIME_SCALE)).extracting(TleParser.NamedTle::name)
                .containsExactly("HST");
    }

    @Test
    void epochIsDecodedFromLineOne() {
        final var entries = TleParser.parse("ISS (ZARYA)\n" + TLE_LINE1 + "\n" + TLE_LINE2 + "\n", TIME_SCALE);

        assertThat(entries).singleElement().satisfies(entry -> assertThat(entry.epoch())
                .isCloseTo(Instant.parse("2008-09-20T12:25:40.104Z"), within(1, ChronoUnit.MILLIS)));
    }

    @Test
    void textWithoutElementSetsYieldsNothing() {
        assertThat(TleParser.parse("No GP data found", TIME_SCALE)).isEmpty();
    }
}
