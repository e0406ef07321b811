package com.streetsignal.domain.exception;

/**
 * Thrown when a district cannot be turned into a single centroid.
 */
public class GeocodeFailureException extends RuntimeException {

    public GeocodeFailureException(String message) {
        super(message);
    }

    public GeocodeFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
