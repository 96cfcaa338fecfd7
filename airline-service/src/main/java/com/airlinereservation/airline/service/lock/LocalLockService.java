package com.airlinereservation.airline.service.lock;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-process lock striped over a fixed set of fair {@link ReentrantLock}s.
 * Equal resource ids always map to the same stripe.
 */
@Slf4j
public class LocalLockService implements LockOperations {

    private static final int DEFAULT_STRIPES = 64;

    private final ReentrantLock[] stripes;
    private final Duration waitTimeout;

    public LocalLockService(Duration waitTimeout) {
        this(DEFAULT_STRIPES, waitTimeout);
    }

    public LocalLockService(int stripeCount, Duration waitTimeout) {
        if (stripeCount < 1) {
            throw new IllegalArgumentException("Stripe count must be positive");
        }
        this.stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock(true);
        }
        this.waitTimeout = waitTimeout;
    }

    @Override
    public <T> T executeWithLock(String resourceId, Supplier<T> action) {
        ReentrantLock lock = stripeFor(resourceId);
        boolean acquired;
        try {
            acquired = lock.tryLock(waitTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Lock acquisition interrupted: resource={}", resourceId);
            throw new LockAcquisitionException("Interrupted while acquiring lock for: " + resourceId);
        }

        if (!acquired) {
            log.warn("Failed to acquire lock within timeout: resource={}, waitTimeout={}ms",
                    resourceId, waitTimeout.toMillis());
            throw new LockAcquisitionException("Failed to acquire lock for: " + resourceId);
        }

        log.debug("Acquired local lock: resource={}", resourceId);
        try {
            return action.get();
        } finally {
            lock.unlock();
            log.debug("Released local lock: resource={}", resourceId);
        }
    }

    ReentrantLock stripeFor(String resourceId) {
        return stripes[Math.floorMod(resourceId.hashCode(), stripes.length)];
    }
}
