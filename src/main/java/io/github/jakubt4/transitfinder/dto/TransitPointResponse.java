package io.github.jakubt4.transitfinder.dto;

public record TransitPointResponse(double lat, double lon) {
}
