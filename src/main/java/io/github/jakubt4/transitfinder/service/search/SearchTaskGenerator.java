package io.github.jakubt4.transitfinder.service.search;

import io.github.jakubt4.transitfinder.domain.CelestialBody;
import io.github.jakubt4.transitfinder.domain.Observer;
import io.github.jakubt4.transitfinder.domain.PassWindow;
import io.github.jakubt4.transitfinder.domain.SearchParameters;
import io.github.jakubt4.transitfinder.domain.SearchTask;
import io.github.jakubt4.transitfinder.domain.TrackedSatellite;
import io.github.jakubt4.transitfinder.ephemeris.EphemerisProvider;
import io.github.jakubt4.transitfinder.ephemeris.EphemerisUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns every pass of every tracked satellite into one search task per celestial body.
 *
 * <p>Runs on the coordinating thread. Task ids follow satellite order, then pass order, then
 * {@link CelestialBody} order.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SearchTaskGenerator {

    private final EphemerisProvider ephemeris;

    /**
     * Satellites whose passes cannot be enumerated are skipped with a warning; the others still
     * produce their tasks.
     */
    public TaskPlan generate(final List<TrackedSatellite> satellites, final Observer observer,
                             final Instant start, final Instant end, final SearchParameters parameters) {
        final var tasks = new ArrayList<SearchTask>();
        final var warnings = new ArrayList<String>();

        for (final var satellite : satellites) {
            final var from = satellite.validFrom().isAfter(start) ? satellite.validFrom() : start;
            final var to = satellite.validUntil().isBefore(end) ? satellite.validUntil() : end;
            if (!from.isBefore(to)) {
                log.warn("[{}] elements valid {} to {}, outside search range", satellite.name(),
                        satellite.validFrom(), satellite.validUntil());
                warnings.add(satellite.name() + ": orbital elements are not valid for the requested dates");
                continue;
            }
            if (!from.equals(start) || !to.equals(end)) {
                warnings.add("%s: searched only %s to %s, the validity of its orbital elements"
                        .formatted(satellite.name(), from, to));
            }

            try {
                final var passes = ephemeris.findPasses(satellite, observer, from, to);
                tasks.addAll(tasksFor(passes, observer, parameters, tasks.size()));
                log.debug("[{}] {} passes", satellite.name(), passes.size());
            } catch (final EphemerisUnavailableException e) {
                log.warn("[{}] skipped — {}", satellite.name(), e.getMessage());
                warnings.add(satellite.name() + ": ephemeris unavailable (" + e.getMessage() + ")");
            }
        }

        log.info("Generated {} search tasks for {} satellites", tasks.size(), satellites.size());
        return new TaskPlan(tasks, warnings);
    }

    private static List<SearchTask> tasksFor(final List<PassWindow> passes, final Observer observer,
                                             final SearchParameters parameters, final int firstId) {
        final var tasks = new ArrayList<SearchTask>(passes.size() * CelestialBody.values().length);
        var id = firstId;
        for (final var pass : passes) {
            for (final var body : CelestialBody.values()) {
                tasks.add(new SearchTask(id++, pass, body, observer, parameters));
            }
        }
        return tasks;
    }
}
