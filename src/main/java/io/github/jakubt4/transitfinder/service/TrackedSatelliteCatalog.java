package io.github.jakubt4.transitfinder.service;

import io.github.jakubt4.transitfinder.client.CelestrakTleClient;
import io.github.jakubt4.transitfinder.domain.TrackedSatellite;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.orekit.time.TimeScale;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The fixed set of satellites searched for transits, with their latest element sets.
 *
 * <p>Elements come from the CelesTrak group file, cached on disk. The cache is read at start-up
 * (downloaded when absent) and refreshed on a fixed delay. A failed download, or one in which no
 * tracked satellite can be found, keeps the previous snapshot and cache file.
 */
@Slf4j
@Service
public class TrackedSatelliteCatalog {

    /** Result name → CelesTrak names it may be published under, in preference order. */
    static final Map<String, List<String>> TRACKED = trackedSatellites();

    private final CelestrakTleClient celestrakTleClient;
    private final TimeScale utc;
    private final Path cacheFile;
    private final Duration validity;

    private final AtomicReference<Map<String, TrackedSatellite>> snapshot = new AtomicReference<>(Map.of());

    public TrackedSatelliteCatalog(final CelestrakTleClient celestrakTleClient,
                                   final TimeScale utc,
                                   @Value("${tle.cache-file:visual.txt}") final String cacheFile,
                                   @Value("${tle.validity-days:30}") final int validityDays) {
        this.celestrakTleClient = celestrakTleClient;
        this.utc = utc;
        this.cacheFile = Path.of(cacheFile);
        this.validity = Duration.ofDays(validityDays);
    }

    private static Map<String, List<String>> trackedSatellites() {
        final var tracked = new LinkedHashMap<String, List<String>>();
        tracked.put("ISS", List.of("ISS (ZARYA)"));
        tracked.put("Tiangong", List.of("CSS (TIANHE)", "CSS (TIANGONG)"));
        tracked.put("HST", List.of("HST"));
        return Collections.unmodifiableMap(tracked);
    }

    @PostConstruct
    void init() {
        if (Files.isRegularFile(cacheFile)) {
            try {
                if (apply(Files.readString(cacheFile, StandardCharsets.UTF_8))) {
                    log.info("TLE cache loaded from {}", cacheFile.toAbsolutePath());
                    return;
                }
            } catch (final IOException e) {
                log.warn("Could not read TLE cache {}: {}", cacheFile, e.getMessage());
            }
        }
        refresh();
    }

    /**
     * Downloads the group, swaps in the new snapshot and rewrites the cache file.
     */
    @Scheduled(fixedDelayString = "${tle.refresh-interval:PT6H}", initialDelayString = "${tle.refresh-interval:PT6H}")
    public void refresh() {
        final var download = celestrakTleClient.fetchGroup();
        if (download.isEmpty()) {
            log.warn("TLE refresh failed, keeping {} cached satellites", snapshot.get().size());
            return;
        }

        final var text = download.get();
        if (!apply(text)) {
            log.warn("TLE refresh returned no tracked satellites, keeping {} cached satellites",
                    snapshot.get().size());
            return;
        }
        try {
            Files.writeString(cacheFile, text, StandardCharsets.UTF_8);
        } catch (final IOException e) {
            log.warn("Could not write TLE cache {}: {}", cacheFile, e.getMessage());
        }
    }

    /**
     * @return satellites with elements, in catalog order
     */
    public List<TrackedSatellite> available() {
        final var current = snapshot.get();
        return TRACKED.keySet().stream()
                .filter(current::containsKey)
                .map(current::get)
                .toList();
    }

    /**
     * @return names of tracked satellites for which no elements are loaded
     */
    public List<String> missing() {
        final var current = snapshot.get();
        return TRACKED.keySet().stream()
                .filter(name -> !current.containsKey(name))
                .toList();
    }

    /**
     * Swaps in the element sets found in {@code text}.
     *
     * @return {@code false}, leaving the snapshot untouched, if no tracked satellite is present
     */
    boolean apply(final String text) {
        final var byCelestrakName = new LinkedHashMap<String, TleParser.NamedTle>();
        TleParser.parse(text, utc).forEach(tle -> byCelestrakName.putIfAbsent(tle.name(), tle));

        final var next = new LinkedHashMap<String, TrackedSatellite>();
        TRACKED.forEach((name, aliases) -> aliases.stream()
                .map(byCelestrakName::get)
                .filter(Objects::nonNull)
                .findFirst()
                .ifPresent(tle -> next.put(name, new TrackedSatellite(name, tle.line1(), tle.line2(),
                        tle.epoch().minus(validity), tle.epoch().plus(validity)))));

        if (next.isEmpty()) {
            return false;
        }
        snapshot.set(Map.copyOf(next));
        log.info("Element sets loaded for {} of {} tracked satellites {}", next.size(), TRACKED.size(), next.keySet());
        return true;
    }
}
