package com.ridematch.pool.service;

import com.ridematch.pool.model.PassengerStatus;
import com.ridematch.pool.model.PoolStats;
import com.ridematch.pool.model.PoolStatus;
import com.ridematch.pool.repository.PoolPassengerRepository;
import com.ridematch.pool.repository.PoolRideRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class PoolStatsService {

    /** Rough passenger-car emissions per kilometre. */
    static final double CO2_KG_PER_KM = 0.21;

    private final PoolRideRepository poolRideRepository;
    private final PoolPassengerRepository passengerRepository;

    @Transactional(readOnly = true)
    public PoolStats getPoolStats() {
        long totalRequests = passengerRepository.count();
        long notCancelled = passengerRepository.countByStatusNot(PassengerStatus.CANCELLED);

        return PoolStats.builder()
                .totalPoolRides(poolRideRepository.count())
                .activePoolRides(poolRideRepository.countByStatusIn(PoolStatus.ACTIVE))
                .avgPassengersPerPool(orZero(poolRideRepository.averagePassengers(PoolStatus.COMPLETED)))
                .avgSavingsPercent(orZero(passengerRepository.averageSavingsPercent(PassengerStatus.DROPPED_OFF)))
                .matchSuccessRate(totalRequests == 0 ? 0 : (double) notCancelled / totalRequests * 100)
                .totalCo2SavedKg(orZero(passengerRepository.sumKilometresSaved(PassengerStatus.DROPPED_OFF)) * CO2_KG_PER_KM)
                .build();
    }

    private static double orZero(Double value) {
        return value == null ? 0 : value;
    }
}
