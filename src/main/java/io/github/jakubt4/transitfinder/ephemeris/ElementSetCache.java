package io.github.jakubt4.transitfinder.ephemeris;

import io.github.jakubt4.transitfinder.domain.TrackedSatellite;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * One value per satellite built from its current element set. A refreshed element set replaces
 * the satellite's entry, so the cache never holds more entries than there are satellites.
 * Not thread-safe; meant to be confined to one thread.
 */
final class ElementSetCache<V> {

    private record Entry<V>(String elementsKey, V value) {
    }

    private final Map<String, Entry<V>> entries = new HashMap<>();

    V get(final TrackedSatellite satellite, final Function<TrackedSatellite, V> factory) {
        final var entry = entries.get(satellite.name());
        if (entry != null && entry.elementsKey().equals(satellite.elementsKey())) {
            return entry.value();
        }
        final var value = factory.apply(satellite);
        entries.put(satellite.name(), new Entry<>(satellite.elementsKey(), value));
        return value;
    }

    int size() {
        return entries.size();
    }
}
