package com.airlinereservation.airline.config;

import com.airlinereservation.airline.constants.AirlineConstants;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings under {@code airline.reservation.lock}.
 */
@Data
@ConfigurationProperties(prefix = "airline.reservation.lock")
public class LockProperties {

    private String mode = AirlineConstants.LOCK_MODE_LOCAL;

    /** How long a booking waits for another booking on the same flight. */
    private long waitTimeoutMs = AirlineConstants.DEFAULT_LOCK_WAIT_TIMEOUT_MS;

    /** Redis only: expiry of a lock whose holder died without releasing it. */
    private long leaseTimeoutMs = AirlineConstants.DEFAULT_LOCK_LEASE_TIMEOUT_MS;

    public Duration waitTimeout() {
        return Duration.ofMillis(waitTimeoutMs);
    }

    public Duration leaseTimeout() {
        return Duration.ofMillis(leaseTimeoutMs);
    }
}
