package com.ridematch.pool.repository;

import com.ridematch.pool.entity.PoolRide;
import com.ridematch.pool.model.PoolStatus;
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
public interface PoolRideRepository extends JpaRepository<PoolRide, UUID> {

    /**
     * Pools still forming in the given cells that can seat {@code seats} more riders.
     */
    @Query("SELECT p FROM PoolRide p WHERE p.status = :status AND p.h3Index IN :cells"
            + " AND p.matchDeadline > :now AND p.currentPassengers + :seats <= p.maxPassengers"
            + " ORDER BY p.matchDeadline ASC LIMIT 10")
    List<PoolRide> findJoinable(PoolStatus status, Collection<String> cells, int seats, Instant now);

    Optional<PoolRide> findFirstByDriverIdAndStatusIn(String driverId, Collection<PoolStatus> statuses);

    @Query("SELECT p.id FROM PoolRide p WHERE p.status = :status AND p.matchDeadline < :now")
    List<UUID> findIdsByStatusAndDeadlineBefore(PoolStatus status, Instant now);

    @Modifying
    @Query("UPDATE PoolRide p SET p.status = :to, p.updatedAt = :now, p.version = p.version + 1"
            + " WHERE p.id IN :ids AND p.status = :from")
    int updateStatus(Collection<UUID> ids, PoolStatus from, PoolStatus to, Instant now);

    long countByStatusIn(Collection<PoolStatus> statuses);

    @Query("SELECT COALESCE(AVG(p.currentPassengers), 0.0) FROM PoolRide p WHERE p.status = :status")
    Double averagePassengers(PoolStatus status);
}
