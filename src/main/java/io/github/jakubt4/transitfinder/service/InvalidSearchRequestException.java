package io.github.jakubt4.transitfinder.service;

/**
 * Search input rejected before any work is scheduled.
 */
public class InvalidSearchRequestException extends RuntimeException {

    public InvalidSearchRequestException(final String message) {
        super(message);
    }
}
