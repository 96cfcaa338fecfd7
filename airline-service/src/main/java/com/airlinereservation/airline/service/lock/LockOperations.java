package com.airlinereservation.airline.service.lock;

import java.util.function.Supplier;

/**
 * Interface for mutual exclusion keyed on a resource.
 * Implemented in-process for single-instance deployments and on Redis for several instances.
 */
public interface LockOperations {

    /**
     * Executes action while holding the lock on a single resource.
     *
     * @param resourceId Resource to lock
     * @param action Action to execute while holding lock
     * @return Result of action
     * @throws LockAcquisitionException if lock cannot be acquired within the wait timeout
     */
    <T> T executeWithLock(String resourceId, Supplier<T> action);

    class LockAcquisitionException extends RuntimeException {
        public LockAcquisitionException(String message) {
            super(message);
        }
    }
}
