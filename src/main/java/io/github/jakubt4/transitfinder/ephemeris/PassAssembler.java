package io.github.jakubt4.transitfinder.ephemeris;

import io.github.jakubt4.transitfinder.domain.PassWindow;
import io.github.jakubt4.transitfinder.domain.TrackedSatellite;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Pairs rise and set crossings into {@link PassWindow}s.
 */
final class PassAssembler {

    record Edge(Instant time, boolean rising) {
    }

    private PassAssembler() {
    }

    /**
     * @param visibleAtStart whether the satellite is already above the horizon at {@code start}
     * @param edges          horizon crossings inside {@code [start, end]}, in any order
     */
    static List<PassWindow> assemble(final TrackedSatellite satellite, final boolean visibleAtStart,
                                     final List<Edge> edges, final Instant start, final Instant end) {
        final var sorted = edges.stream()
                .sorted(Comparator.comparing(Edge::time))
                .toList();

        final var passes = new ArrayList<PassWindow>();
        Instant riseAt = visibleAtStart ? start : null;
        for (final var edge : sorted) {
            if (edge.rising()) {
                if (riseAt == null) {
                    riseAt = edge.time();
                }
            } else if (riseAt != null) {
                // zero-length crossings happen when the detector brackets a grazing pass
                if (riseAt.isBefore(edge.time())) {
                    passes.add(new PassWindow(satellite, riseAt, edge.time()));
                }
                riseAt = null;
            }
        }
        if (riseAt != null && riseAt.isBefore(end)) {
            passes.add(new PassWindow(satellite, riseAt, end));
        }
        return passes;
    }
}
