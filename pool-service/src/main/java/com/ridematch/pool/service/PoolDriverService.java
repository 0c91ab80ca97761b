package com.ridematch.pool.service;

import com.ridematch.pool.entity.PoolPassenger;
import com.ridematch.pool.entity.PoolRide;
import com.ridematch.pool.entity.RouteStop;
import com.ridematch.pool.event.PoolRouteChangedEvent;
import com.ridematch.pool.exception.PoolException;
import com.ridematch.pool.model.DriverPoolRideInfo;
import com.ridematch.pool.model.PassengerStatus;
import com.ridematch.pool.model.PoolStatus;
import com.ridematch.pool.model.RouteStopType;
import com.ridematch.pool.repository.PoolPassengerRepository;
import com.ridematch.pool.repository.PoolRideRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Driver side of a pool: assignment, start, pickups and dropoffs.
 * A pool completes when its last passenger is dropped off.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PoolDriverService {

    private final PoolRideRepository poolRideRepository;
    private final PoolPassengerRepository passengerRepository;
    private final PoolFareCalculator fareCalculator;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Transactional
    public PoolRide assignDriver(UUID poolRideId, String driverId, String vehicleId) {
        PoolRide pool = findPool(poolRideId);
        if (!pool.getStatus().canTransitionTo(PoolStatus.CONFIRMED)) {
            throw PoolException.badRequest("POOL_NOT_MATCHING", "Pool ride is " + pool.getStatus() + ", cannot assign a driver");
        }
        poolRideRepository.findFirstByDriverIdAndStatusIn(driverId, PoolStatus.DRIVER_ACTIVE)
                .ifPresent(active -> {
                    throw PoolException.conflict("DRIVER_BUSY", "Driver " + driverId + " already serves pool " + active.getId());
                });

        pool.setDriverId(driverId);
        pool.setVehicleId(vehicleId);
        pool.setStatus(PoolStatus.CONFIRMED);
        pool = saveAndFlush(pool);

        log.info("Driver {} assigned to pool {} with {} passengers", driverId, poolRideId, pool.getCurrentPassengers());
        return pool;
    }

    @Transactional
    public PoolRide startPoolRide(String driverId, UUID poolRideId) {
        PoolRide pool = findPool(poolRideId);
        if (!pool.isDrivenBy(driverId)) {
            throw PoolException.forbidden("NOT_POOL_DRIVER", "Not authorized to start this pool");
        }
        if (pool.getStatus() != PoolStatus.CONFIRMED) {
            throw PoolException.badRequest("POOL_NOT_CONFIRMED", "Pool ride is not confirmed");
        }

        start(pool, clock.instant());
        pool = saveAndFlush(pool);
        log.info("Pool ride {} started by driver {}", poolRideId, driverId);
        return pool;
    }

    @Transactional(readOnly = true)
    public DriverPoolRideInfo getDriverPoolRide(String driverId) {
        PoolRide pool = activePoolOf(driverId, () ->
                PoolException.notFound("NO_ACTIVE_POOL", "No active pool ride for driver " + driverId));

        List<PoolPassenger> passengers = passengerRepository.findByPoolRideIdOrderByCreatedAtAscIdAsc(pool.getId());
        BigDecimal totalFare = passengers.stream()
                .filter(p -> p.getStatus() != PassengerStatus.CANCELLED && p.getStatus() != PassengerStatus.NO_SHOW)
                .map(PoolPassenger::getPoolFare)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        RouteStop nextStop = pool.getRoute().stream()
                .filter(stop -> stop.getActualArrival() == null)
                .findFirst()
                .orElse(null);

        return DriverPoolRideInfo.builder()
                .poolRide(pool)
                .passengers(passengers)
                .routeStops(List.copyOf(pool.getRoute()))
                .nextStop(nextStop)
                .totalFare(totalFare)
                .driverEarnings(fareCalculator.driverEarnings(totalFare))
                .build();
    }

    @Transactional
    public PoolPassenger pickupPassenger(String driverId, UUID passengerId) {
        PoolRide pool = activePoolOf(driverId, () -> PoolException.forbidden("NO_ACTIVE_POOL", "No active pool ride"));
        PoolPassenger passenger = passengerInPool(pool, passengerId);

        if (!passenger.getStatus().canTransitionTo(PassengerStatus.PICKED_UP)) {
            throw PoolException.badRequest("PASSENGER_NOT_CONFIRMED", "Passenger is not confirmed");
        }

        Instant now = clock.instant();
        if (pool.getStatus() == PoolStatus.CONFIRMED) {
            start(pool, now);
            log.info("Pool ride {} started by first pickup", pool.getId());
        }

        passenger.setStatus(PassengerStatus.PICKED_UP);
        passenger.setPickedUpAt(now);
        passenger = passengerRepository.save(passenger);

        markStopReached(pool, passengerId, RouteStopType.PICKUP, now);
        saveAndFlush(pool);
        eventPublisher.publishEvent(new PoolRouteChangedEvent(pool.getId(), PoolRouteChangedEvent.PICKED_UP));

        log.info("Passenger {} picked up by driver {}", passengerId, driverId);
        return passenger;
    }

    @Transactional
    public PoolPassenger dropoffPassenger(String driverId, UUID passengerId) {
        PoolRide pool = activePoolOf(driverId, () -> PoolException.forbidden("NO_ACTIVE_POOL", "No active pool ride"));
        PoolPassenger passenger = passengerInPool(pool, passengerId);

        if (!passenger.getStatus().canTransitionTo(PassengerStatus.DROPPED_OFF)) {
            throw PoolException.badRequest("PASSENGER_NOT_PICKED_UP", "Passenger is not picked up");
        }

        Instant now = clock.instant();
        passenger.setStatus(PassengerStatus.DROPPED_OFF);
        passenger.setDroppedOffAt(now);
        passenger = passengerRepository.save(passenger);

        markStopReached(pool, passengerId, RouteStopType.DROPOFF, now);

        boolean allDone = passengerRepository.findByPoolRideIdOrderByCreatedAtAscIdAsc(pool.getId()).stream()
                .allMatch(p -> p.getId().equals(passengerId) || p.getStatus().isTerminal());
        if (allDone) {
            pool.setStatus(PoolStatus.COMPLETED);
            pool.setCompletedAt(now);
            log.info("Pool ride {} completed", pool.getId());
        }
        saveAndFlush(pool);
        if (!allDone) {
            eventPublisher.publishEvent(new PoolRouteChangedEvent(pool.getId(), PoolRouteChangedEvent.DROPPED_OFF));
        }

        log.info("Passenger {} dropped off by driver {}", passengerId, driverId);
        return passenger;
    }

    private void start(PoolRide pool, Instant now) {
        pool.setStatus(PoolStatus.IN_PROGRESS);
        pool.setStartedAt(now);
    }

    /** Records the arrival by swapping in a rebuilt stop list; stops are never edited in place. */
    private static void markStopReached(PoolRide pool, UUID passengerId, RouteStopType type, Instant at) {
        List<RouteStop> updated = pool.getRoute().stream()
                .map(stop -> stop.getPoolPassengerId().equals(passengerId) && stop.getType() == type
                        && stop.getActualArrival() == null
                        ? stop.toBuilder().actualArrival(at).build()
                        : stop)
                .toList();
        pool.replaceRoute(updated, pool.getTotalDistanceKm(), pool.getTotalDurationMinutes());
    }

    private PoolRide activePoolOf(String driverId, Supplier<PoolException> missing) {
        return poolRideRepository.findFirstByDriverIdAndStatusIn(driverId, PoolStatus.DRIVER_ACTIVE)
                .orElseThrow(missing);
    }

    private PoolPassenger passengerInPool(PoolRide pool, UUID passengerId) {
        PoolPassenger passenger = passengerRepository.findById(passengerId)
                .orElseThrow(() -> PoolException.notFound("PASSENGER_NOT_FOUND", "Passenger " + passengerId + " not found"));
        if (!passenger.getPoolRideId().equals(pool.getId())) {
            throw PoolException.forbidden("NOT_IN_YOUR_POOL", "Passenger not in your pool");
        }
        return passenger;
    }

    private PoolRide findPool(UUID poolRideId) {
        return poolRideRepository.findById(poolRideId)
                .orElseThrow(() -> PoolException.notFound("POOL_NOT_FOUND", "Pool ride " + poolRideId + " not found"));
    }

    private PoolRide saveAndFlush(PoolRide pool) {
        try {
            return poolRideRepository.saveAndFlush(pool);
        } catch (OptimisticLockingFailureException e) {
            throw PoolException.conflict("POOL_CHANGED", "Pool " + pool.getId() + " changed concurrently, retry");
        }
    }
}
