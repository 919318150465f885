package io.github.jakubt4.transitfinder.domain;

/**
 * One unit of parallel work: a single pass checked against a single body.
 */
public record SearchTask(int id,
                         PassWindow passWindow,
                         CelestialBody body,
                         Observer observer,
                         SearchParameters parameters) {

    public TrackedSatellite satellite() {
        return passWindow.satellite();
    }

    /**
     * Short label for logs, e.g. {@code #12 ISS/Moon 2026-03-01T19:02:11Z}.
     */
    public String describe() {
        return "#" + id + " " + satellite().name() + "/" + body.displayName() + " " + passWindow.rise();
    }
}
