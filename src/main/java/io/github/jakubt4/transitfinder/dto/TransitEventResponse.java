package io.github.jakubt4.transitfinder.dto;

import io.github.jakubt4.transitfinder.domain.TransitEvent;

import java.util.List;

public record TransitEventResponse(String satellite,
                                   String celestialBody,
                                   String transitType,
                                   String timeUtc,
                                   double durationSec,
                                   double swathWidthKm,
                                   double separationDeg,
                                   double azimuthDeg,
                                   double elevationDeg,
                                   double closestApproachKm,
                                   List<TransitPointResponse> pathPoints) {

    public static TransitEventResponse from(final TransitEvent event) {
        return new TransitEventResponse(
                event.satellite(),
                event.body().displayName(),
                event.type().label(),
                event.time().toString(),
                event.durationSeconds(),
                event.swathWidthKm(),
                event.separationDegrees(),
                event.azimuthDegrees(),
                event.elevationDegrees(),
                event.closestApproachKm(),
                event.groundTrack().stream()
                        .map(p -> new TransitPointResponse(p.latitude(), p.longitude()))
                        .toList()
        );
    }
}
