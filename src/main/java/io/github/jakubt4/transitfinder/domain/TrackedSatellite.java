package io.github.jakubt4.transitfinder.domain;

import java.time.Instant;

/**
 * A satellite and the two-line element set it is propagated from.
 *
 * @param name       catalog name used in results (e.g. "ISS")
 * @param line1      NORAD TLE line 1
 * @param line2      NORAD TLE line 2
 * @param validFrom  earliest instant the elements are trusted for
 * @param validUntil latest instant the elements are trusted for
 */
public record TrackedSatellite(String name, String line1, String line2,
                               Instant validFrom, Instant validUntil) {

    public TrackedSatellite {
        if (!validFrom.isBefore(validUntil)) {
            throw new IllegalArgumentException("Validity window of " + name + " is empty");
        }
    }

    /**
     * Identity of the element set, used to key propagator caches.
     */
    public String elementsKey() {
        return name + '\n' + line1 + '\n' + line2;
    }
}
