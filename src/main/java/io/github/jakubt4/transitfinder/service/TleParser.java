package io.github.jakubt4.transitfinder.service;

import lombok.extern.slf4j.Slf4j;
import org.orekit.errors.OrekitException;
import org.orekit.propagation.analytical.tle.TLE;
import org.orekit.time.TimeScale;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads three-line TLE text (name line followed by lines 1 and 2), as served by CelesTrak.
 *
 * <p>Element lines are screened with {@link TLE#isFormatOK}, so entries with a bad layout or a
 * wrong checksum never reach the catalog.
 */
@Slf4j
final class TleParser {

    record NamedTle(String name, String line1, String line2, Instant epoch) {
    }

    private TleParser() {
    }

    /**
     * @param timeScale scale the TLE epochs are expressed in (UTC)
     */
    static List<NamedTle> parse(final String text, final TimeScale timeScale) {
        final var lines = text.lines()
                .map(String::stripTrailing)
                .filter(line -> !line.isBlank())
                .toList();

        final var result = new ArrayList<NamedTle>();
        var i = 0;
        while (i + 2 < lines.size()) {
            final var name = lines.get(i).strip();
            final var line1 = lines.get(i + 1);
            final var line2 = lines.get(i + 2);
            if (!isValid(name, line1, line2)) {
                i++;
                continue;
            }
            final var tle = new TLE(line1, line2, timeScale);
            final var epoch = tle.getDate().toDate(timeScale).toInstant();
            result.add(new NamedTle(name, line1, line2, epoch));
            i += 3;
        }
        return result;
    }

    private static boolean isValid(final String name, final String line1, final String line2) {
        try {
            if (TLE.isFormatOK(line1, line2)) {
                return true;
            }
            log.debug("Skipping malformed TLE entry [{}]", name);
        } catch (final OrekitException e) {
            log.warn("Skipping TLE entry [{}]: {}", name, e.getMessage());
        }
        return false;
    }
}
