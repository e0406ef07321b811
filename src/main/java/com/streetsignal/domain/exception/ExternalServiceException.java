package com.streetsignal.domain.exception;

import lombok.Getter;

/**
 * Thrown when a call to an external service fails for good, either because the
 * retry budget ran out or because the failure was not worth retrying.
 */
@Getter
public class ExternalServiceException extends RuntimeException {

    private final String service;
    private final int attempts;
    private final Integer statusCode;

    public ExternalServiceException(String service, String message, int attempts, Integer statusCode,
            Throwable cause) {
        super(message, cause);
        this.service = service;
        this.attempts = attempts;
        this.statusCode = statusCode;
    }

    public ExternalServiceException(String service, String message) {
        this(service, message, 0, null, null);
    }

    public boolean isNotFound() {
        return statusCode != null && statusCode == 404;
    }
}
