package com.airlinereservation.airline.exception;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base type for every failure the service reports to clients. {@code details} names the
 * ids and constraints involved.
 */
@Getter
public class AirlineException extends RuntimeException {

    private final String errorCode;
    private final boolean retryable;
    private final Map<String, String> details;

    public AirlineException(String errorCode, String message) {
        this(errorCode, message, false, null, Collections.emptyMap());
    }

    public AirlineException(String errorCode, String message, Map<String, String> details) {
        this(errorCode, message, false, null, details);
    }

    public AirlineException(String errorCode, String message, boolean retryable, Throwable cause,
                            Map<String, String> details) {
        super(message, cause);
        this.errorCode = errorCode;
        this.retryable = retryable;
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }
}
