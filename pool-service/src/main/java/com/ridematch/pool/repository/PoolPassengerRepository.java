package com.ridematch.pool.repository;

import com.ridematch.pool.entity.PoolPassenger;
import com.ridematch.pool.model.PassengerStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PoolPassengerRepository extends JpaRepository<PoolPassenger, UUID> {

    Optional<PoolPassenger> findFirstByRiderIdAndStatusNotIn(String riderId, Collection<PassengerStatus> statuses);

    Optional<PoolPassenger> findFirstByRiderIdAndPoolRideIdOrderByCreatedAtDesc(String riderId, UUID poolRideId);

    List<PoolPassenger> findByPoolRideIdOrderByCreatedAtAscIdAsc(UUID poolRideId);

    @Modifying
    @Query("UPDATE PoolPassenger p SET p.status = :to, p.updatedAt = :now"
            + " WHERE p.poolRideId IN :poolRideIds AND p.status IN :from")
    int updateStatusForPools(Collection<UUID> poolRideIds, Collection<PassengerStatus> from,
                             PassengerStatus to, Instant now);

    long countByStatusNot(PassengerStatus status);

    @Query("SELECT COALESCE(AVG(p.savingsPercent), 0.0) FROM PoolPassenger p WHERE p.status = :status")
    Double averageSavingsPercent(PassengerStatus status);

    /** Kilometres not driven thanks to pooling, approximated from each rider's savings share. */
    @Query("SELECT COALESCE(SUM(p.directDistanceKm * p.savingsPercent / 100), 0.0)"
            + " FROM PoolPassenger p WHERE p.status = :status")
    Double sumKilometresSaved(PassengerStatus status);
}
