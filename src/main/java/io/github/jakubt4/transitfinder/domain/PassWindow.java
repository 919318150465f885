package io.github.jakubt4.transitfinder.domain;

import java.time.Duration;
import java.time.Instant;

/**
 * Maximal interval during which a satellite is above the observer's horizon.
 */
public record PassWindow(TrackedSatellite satellite, Instant rise, Instant set) {

    public PassWindow {
        if (!rise.isBefore(set)) {
            throw new IllegalArgumentException(
                    "Pass of %s rises at %s, not before it sets at %s".formatted(satellite.name(), rise, set));
        }
    }

    public Duration duration() {
        return Duration.between(rise, set);
    }
}
