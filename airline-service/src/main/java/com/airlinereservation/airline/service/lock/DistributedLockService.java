package com.airlinereservation.airline.service.lock;

import com.airlinereservation.airline.config.LockProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Booking lock shared by every instance through Redis.
 *
 * <p>A holder writes a random token under {@code airline:lock:<resource>} with a lease, and
 * only the key still carrying that token is deleted on release. A holder that dies leaves the
 * key to expire.
 */
@Slf4j
public class DistributedLockService implements LockOperations {

    static final String KEY_PREFIX = "airline:lock:";

    private static final Duration POLL_INTERVAL = Duration.ofMillis(50);

    private static final RedisScript<Long> COMPARE_AND_DELETE = new DefaultRedisScript<>(
            "if redis.call('GET', KEYS[1]) == ARGV[1] then return redis.call('DEL', KEYS[1]) end return 0",
            Long.class);

    private final StringRedisTemplate redis;
    private final Duration lease;
    private final Duration wait;

    public DistributedLockService(StringRedisTemplate redis, LockProperties properties) {
        this.redis = redis;
        this.lease = properties.leaseTimeout();
        this.wait = properties.waitTimeout();
    }

    @Override
    public <T> T executeWithLock(String resourceId, Supplier<T> action) {
        String key = KEY_PREFIX + resourceId;
        String token = tryAcquire(key)
                .orElseThrow(() -> new LockAcquisitionException("Failed to acquire lock for: " + resourceId));

        try {
            return action.get();
        } finally {
            release(key, token);
        }
    }

    private Optional<String> tryAcquire(String key) {
        String token = UUID.randomUUID().toString();
        long deadline = System.nanoTime() + wait.toNanos();

        do {
            if (Boolean.TRUE.equals(redis.opsForValue().setIfAbsent(key, token, lease))) {
                log.debug("Acquired Redis lock: key={}", key);
                return Optional.of(token);
            }
            if (!pause()) {
                log.warn("Interrupted waiting for Redis lock: key={}", key);
                return Optional.empty();
            }
        } while (System.nanoTime() < deadline);

        log.warn("Redis lock still held after {}ms: key={}", wait.toMillis(), key);
        return Optional.empty();
    }

    private void release(String key, String token) {
        Long deleted = redis.execute(COMPARE_AND_DELETE, List.of(key), token);
        if (deleted == null || deleted == 0L) {
            log.warn("Redis lock lease ran out before release: key={}", key);
        } else {
            log.debug("Released Redis lock: key={}", key);
        }
    }

    private static boolean pause() {
        try {
            Thread.sleep(POLL_INTERVAL.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
