package com.ridematch.pool.service;

import com.ridematch.pool.metrics.PoolMetrics;
import com.ridematch.pool.model.PassengerStatus;
import com.ridematch.pool.model.PoolStatus;
import com.ridematch.pool.repository.PoolPassengerRepository;
import com.ridematch.pool.repository.PoolRideRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.UUID;

/**
 * Cancels pools still MATCHING after their deadline, together with their open passengers.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PoolExpiryScheduler {

    private final PoolRideRepository poolRideRepository;
    private final PoolPassengerRepository passengerRepository;
    private final PoolMetrics metrics;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${pool.expiry.interval-ms:60000}")
    @Transactional
    public void cleanupExpiredPools() {
        Instant now = clock.instant();
        List<UUID> expired = poolRideRepository.findIdsByStatusAndDeadlineBefore(PoolStatus.MATCHING, now);
        if (expired.isEmpty()) {
            return;
        }

        int passengers = passengerRepository.updateStatusForPools(expired,
                EnumSet.of(PassengerStatus.PENDING, PassengerStatus.CONFIRMED), PassengerStatus.CANCELLED, now);
        int pools = poolRideRepository.updateStatus(expired, PoolStatus.MATCHING, PoolStatus.CANCELLED, now);

        metrics.recordExpired(pools);
        log.info("Cancelled {} expired pool rides and {} waiting passengers", pools, passengers);
    }
}
