package com.airlinereservation.airline.config;

import com.airlinereservation.airline.constants.AirlineConstants;
import com.airlinereservation.airline.service.lock.DistributedLockService;
import com.airlinereservation.airline.service.lock.LocalLockService;
import com.airlinereservation.airline.service.lock.LockOperations;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Chooses how bookings on the same flight are serialized:
 * {@code airline.reservation.lock.mode=local} (default) or {@code redis}.
 */
@Configuration
@EnableConfigurationProperties(LockProperties.class)
@Slf4j
public class LockConfiguration {

    @Bean
    @ConditionalOnProperty(name = "airline.reservation.lock.mode",
            havingValue = AirlineConstants.LOCK_MODE_LOCAL, matchIfMissing = true)
    public LockOperations localLockService(LockProperties properties) {
        log.info("Using in-process booking locks: waitTimeout={}ms", properties.getWaitTimeoutMs());
        return new LocalLockService(properties.waitTimeout());
    }

    @Bean
    @ConditionalOnProperty(name = "airline.reservation.lock.mode", havingValue = AirlineConstants.LOCK_MODE_REDIS)
    public LockOperations distributedLockService(StringRedisTemplate stringRedisTemplate, LockProperties properties) {
        log.info("Using Redis booking locks: leaseTimeout={}ms, waitTimeout={}ms",
                properties.getLeaseTimeoutMs(), properties.getWaitTimeoutMs());
        return new DistributedLockService(stringRedisTemplate, properties);
    }
}
