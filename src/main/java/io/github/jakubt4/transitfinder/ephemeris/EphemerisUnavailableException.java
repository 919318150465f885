package io.github.jakubt4.transitfinder.ephemeris;

/**
 * Raised when positions for a satellite cannot be produced (bad elements, propagation failure,
 * missing ephemeris data).
 */
public class EphemerisUnavailableException extends RuntimeException {

    public EphemerisUnavailableException(final String message, final Throwable cause) {
        super(message, cause);
    }

    public EphemerisUnavailableException(final String message) {
        super(message);
    }
}
