package com.ridematch.pool.service;

import com.ridematch.pool.config.PoolProperties;
import com.ridematch.pool.entity.PoolPassenger;
import com.ridematch.pool.entity.PoolRide;
import com.ridematch.pool.entity.RouteStop;
import com.ridematch.pool.event.PoolRouteChangedEvent;
import com.ridematch.pool.exception.PoolException;
import com.ridematch.pool.metrics.PoolMetrics;
import com.ridematch.pool.model.ConfirmPoolRequest;
import com.ridematch.pool.model.PassengerInfo;
import com.ridematch.pool.model.PassengerStatus;
import com.ridematch.pool.model.PoolRideRequest;
import com.ridematch.pool.model.PoolRideResponse;
import com.ridematch.pool.model.PoolSettings;
import com.ridematch.pool.model.PoolStatus;
import com.ridematch.pool.model.PoolStatusResponse;
import com.ridematch.pool.model.RouteMatchScore;
import com.ridematch.pool.model.RouteStopType;
import com.ridematch.pool.repository.PoolPassengerRepository;
import com.ridematch.pool.repository.PoolRideRepository;
import com.ridematch.pool.routing.RouteInfo;
import com.ridematch.pool.routing.RoutingException;
import com.ridematch.pool.routing.RoutingService;
import com.ridematch.shared.geo.SpatialCellIndex;
import com.ridematch.shared.model.GeoLocation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Rider-facing pool operations: request (match or open), confirm, status and cancel.
 *
 * A request searches MATCHING pools in the pickup's cell and its neighbour ring, scores each
 * with {@link MatchScorer} and joins the best one clearing the minimum score. Otherwise it
 * opens a new pool seeded with the rider's own route. Route rebuilding after a change is
 * published as a {@link PoolRouteChangedEvent} and runs after commit.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PoolMatchingService {

    /** Joined riders are quoted a fixed pickup estimate until the route is rebuilt. */
    static final Duration JOINED_PICKUP_ESTIMATE = Duration.ofMinutes(5);

    private final PoolRideRepository poolRideRepository;
    private final PoolPassengerRepository passengerRepository;
    private final PoolSettingsResolver settingsResolver;
    private final MatchScorer matchScorer;
    private final PoolFareCalculator fareCalculator;
    private final RoutingService routingService;
    private final SpatialCellIndex cellIndex;
    private final ApplicationEventPublisher eventPublisher;
    private final PoolMetrics metrics;
    private final PoolProperties properties;
    private final Clock clock;

    @Transactional
    public PoolRideResponse requestPoolRide(String riderId, PoolRideRequest request) {
        passengerRepository.findFirstByRiderIdAndStatusNotIn(riderId, PassengerStatus.TERMINAL)
                .ifPresent(existing -> {
                    throw PoolException.badRequest("ACTIVE_POOL_EXISTS", "You already have an active pool ride");
                });

        GeoLocation pickup = new GeoLocation(request.getPickupLat(), request.getPickupLng(), request.getPickupAddress());
        GeoLocation dropoff = new GeoLocation(request.getDropoffLat(), request.getDropoffLng(), request.getDropoffAddress());
        if (pickup.getLat() == dropoff.getLat() && pickup.getLng() == dropoff.getLng()) {
            throw PoolException.badRequest("INVALID_LOCATION", "Pickup and dropoff must be different places");
        }

        PoolSettings settings = settingsResolver.resolve(request.getCityId());
        int seats = request.seatsRequested();
        if (seats < 1 || seats > settings.maxPassengersPerRide()) {
            throw PoolException.badRequest("INVALID_SEAT_COUNT",
                    "Seat count must be between 1 and " + settings.maxPassengersPerRide());
        }

        RouteInfo solo = soloRoute(pickup, dropoff);
        BigDecimal originalFare = fareCalculator.soloFare(solo.distanceKm(), solo.durationMinutes());
        int maxWaitMinutes = request.getMaxWaitMinutes() != null ? request.getMaxWaitMinutes() : settings.maxWaitMinutes();
        Instant now = clock.instant();

        Optional<ScoredPool> best = findBestMatch(pickup, dropoff, seats, settings, now);

        PoolRideResponse response = best.isPresent()
                ? joinPool(riderId, pickup, dropoff, seats, solo, originalFare, best.get(), settings, now)
                : openPool(riderId, pickup, dropoff, seats, solo, originalFare, settings, maxWaitMinutes, now);

        metrics.recordRequest(response.isMatchFound());
        log.info("Pool ride requested by rider {}: pool={} matched={} savings={}%",
                riderId, response.getPoolRideId(), response.isMatchFound(), Math.round(response.getSavingsPercent()));
        return response;
    }

    @Transactional
    public void confirmPoolRide(String riderId, ConfirmPoolRequest request) {
        PoolPassenger passenger = ownedPassenger(riderId, request.getPoolPassengerId(), "confirm");

        if (passenger.getStatus() != PassengerStatus.PENDING) {
            throw PoolException.badRequest("NOT_PENDING", "Pool ride is not pending confirmation");
        }

        if (Boolean.TRUE.equals(request.getAccept())) {
            passenger.setStatus(PassengerStatus.CONFIRMED);
            passengerRepository.save(passenger);
            log.info("Pool passenger {} confirmed by rider {}", passenger.getId(), riderId);
        } else {
            passenger.setStatus(PassengerStatus.CANCELLED);
            passengerRepository.save(passenger);
            releaseSeats(passenger);
            eventPublisher.publishEvent(new PoolRouteChangedEvent(passenger.getPoolRideId(), PoolRouteChangedEvent.DECLINED));
            log.info("Pool passenger {} declined by rider {}", passenger.getId(), riderId);
        }
    }

    @Transactional(readOnly = true)
    public PoolStatusResponse getPoolStatus(String riderId, UUID poolRideId) {
        PoolRide pool = poolRideRepository.findById(poolRideId)
                .orElseThrow(() -> PoolException.notFound("POOL_NOT_FOUND", "Pool ride " + poolRideId + " not found"));

        PoolPassenger me = passengerRepository.findFirstByRiderIdAndPoolRideIdOrderByCreatedAtDesc(riderId, poolRideId)
                .orElseThrow(() -> PoolException.forbidden("NOT_IN_POOL", "Not authorized to view this pool"));

        List<PassengerInfo> others = passengerRepository.findByPoolRideIdOrderByCreatedAtAscIdAsc(poolRideId).stream()
                .filter(p -> !p.isOwnedBy(riderId))
                .filter(p -> p.getStatus() != PassengerStatus.CANCELLED)
                .map(p -> new PassengerInfo("P", null,
                        stopNumber(pool.getRoute(), p.getId(), RouteStopType.PICKUP),
                        stopNumber(pool.getRoute(), p.getId(), RouteStopType.DROPOFF)))
                .toList();

        return PoolStatusResponse.builder()
                .poolRide(pool)
                .myStatus(me.getStatus())
                .otherPassengers(others)
                .routeStops(List.copyOf(pool.getRoute()))
                .estimatedArrival(me.getEstimatedDropoff())
                .build();
    }

    @Transactional
    public void cancelPoolRide(String riderId, UUID poolPassengerId) {
        PoolPassenger passenger = ownedPassenger(riderId, poolPassengerId, "cancel");

        if (passenger.getStatus() == PassengerStatus.PICKED_UP) {
            throw PoolException.badRequest("ALREADY_PICKED_UP", "Cannot cancel after pickup");
        }
        if (!passenger.getStatus().canTransitionTo(PassengerStatus.CANCELLED)) {
            throw PoolException.badRequest("ALREADY_FINISHED", "Pool ride is already completed or cancelled");
        }

        passenger.setStatus(PassengerStatus.CANCELLED);
        passengerRepository.save(passenger);
        releaseSeats(passenger);
        eventPublisher.publishEvent(new PoolRouteChangedEvent(passenger.getPoolRideId(), PoolRouteChangedEvent.CANCELLED));

        log.info("Pool passenger {} cancelled by rider {}", poolPassengerId, riderId);
    }

    /** 1-based position of the passenger's stop on the route, 0 when absent. */
    static int stopNumber(List<RouteStop> route, UUID passengerId, RouteStopType type) {
        for (int i = 0; i < route.size(); i++) {
            RouteStop stop = route.get(i);
            if (stop.getPoolPassengerId().equals(passengerId) && stop.getType() == type) {
                return i + 1;
            }
        }
        return 0;
    }

    private Optional<ScoredPool> findBestMatch(GeoLocation pickup, GeoLocation dropoff, int seats,
                                               PoolSettings settings, Instant now) {
        List<String> cells = cellIndex.kRingNeighbors(pickup.getLat(), pickup.getLng(),
                settings.h3Resolution(), properties.searchRingSize());

        List<PoolRide> nearby = poolRideRepository.findJoinable(PoolStatus.MATCHING, cells, seats, now);
        log.debug("{} joinable pools in {} cells around ({},{})", nearby.size(), cells.size(), pickup.getLat(), pickup.getLng());

        return nearby.stream()
                .map(pool -> {
                    RouteMatchScore score = matchScorer.score(pool, pickup, dropoff, settings);
                    metrics.recordMatchScore(score.score());
                    return new ScoredPool(pool, score);
                })
                .filter(candidate -> candidate.score().clears(settings.minMatchScore()))
                .max(Comparator.comparingDouble(candidate -> candidate.score().score()));
    }

    private PoolRideResponse joinPool(String riderId, GeoLocation pickup, GeoLocation dropoff, int seats,
                                      RouteInfo solo, BigDecimal originalFare, ScoredPool match,
                                      PoolSettings settings, Instant now) {
        PoolRide pool = match.pool();
        RouteMatchScore score = match.score();

        try {
            pool.addPassengers(seats);
            pool = poolRideRepository.saveAndFlush(pool);
        } catch (IllegalStateException e) {
            throw PoolException.conflict("POOL_CAPACITY_CHANGED",
                    "The matched pool filled up while you were joining. Please request again.");
        } catch (OptimisticLockingFailureException e) {
            throw PoolException.conflict("POOL_CAPACITY_CHANGED",
                    "The matched pool changed while you were joining. Please request again.");
        }

        BigDecimal poolFare = fareCalculator.discounted(originalFare, settings.discountPercent() * score.score());
        Instant estimatedPickup = now.plus(JOINED_PICKUP_ESTIMATE);
        Instant estimatedDropoff = estimatedPickup.plus(Duration.ofMinutes(pool.getTotalDurationMinutes()));

        PoolPassenger passenger = passengerRepository.save(newPassenger(riderId, pool.getId(), pickup, dropoff,
                seats, solo, originalFare, poolFare, estimatedPickup, estimatedDropoff));

        eventPublisher.publishEvent(new PoolRouteChangedEvent(pool.getId(), PoolRouteChangedEvent.JOINED));

        return PoolRideResponse.builder()
                .poolPassengerId(passenger.getId())
                .poolRideId(pool.getId())
                .status(passenger.getStatus())
                .matchFound(true)
                .originalFare(originalFare)
                .poolFare(poolFare)
                .savingsPercent(passenger.getSavingsPercent())
                .estimatedPickup(estimatedPickup)
                .estimatedDropoff(estimatedDropoff)
                .matchDeadline(pool.getMatchDeadline())
                .matchScore(score)
                .currentPassengers(pool.getCurrentPassengers())
                .maxPassengers(pool.getMaxPassengers())
                .message(matchMessage(passenger.getSavingsPercent()))
                .build();
    }

    private PoolRideResponse openPool(String riderId, GeoLocation pickup, GeoLocation dropoff, int seats,
                                      RouteInfo solo, BigDecimal originalFare, PoolSettings settings,
                                      int maxWaitMinutes, Instant now) {
        Instant deadline = now.plus(Duration.ofMinutes(maxWaitMinutes));
        PoolRide pool = PoolRide.builder()
                .status(PoolStatus.MATCHING)
                .maxPassengers(settings.maxPassengersPerRide())
                .currentPassengers(0)
                .totalDistanceKm(solo.distanceKm())
                .totalDurationMinutes(solo.durationMinutes())
                .centerLat(pickup.getLat())
                .centerLng(pickup.getLng())
                .radiusKm(settings.matchRadiusKm())
                .h3Index(cellIndex.cellForPoint(pickup.getLat(), pickup.getLng(), settings.h3Resolution()))
                .baseFare(properties.baseFare())
                .perKmRate(properties.perKmRate())
                .perMinuteRate(properties.perMinuteRate())
                .matchDeadline(deadline)
                .build();
        pool.addPassengers(seats);
        pool = poolRideRepository.save(pool);

        BigDecimal poolFare = fareCalculator.discounted(originalFare, settings.discountPercent());
        Instant estimatedPickup = deadline;
        Instant estimatedDropoff = estimatedPickup.plus(Duration.ofMinutes(solo.durationMinutes()));

        PoolPassenger passenger = passengerRepository.save(newPassenger(riderId, pool.getId(), pickup, dropoff,
                seats, solo, originalFare, poolFare, estimatedPickup, estimatedDropoff));

        pool.replaceRoute(List.of(
                RouteStop.builder().poolPassengerId(passenger.getId()).type(RouteStopType.PICKUP)
                        .lat(pickup.getLat()).lng(pickup.getLng()).address(pickup.getAddress())
                        .sequenceOrder(1).estimatedArrival(estimatedPickup).build(),
                RouteStop.builder().poolPassengerId(passenger.getId()).type(RouteStopType.DROPOFF)
                        .lat(dropoff.getLat()).lng(dropoff.getLng()).address(dropoff.getAddress())
                        .sequenceOrder(2).estimatedArrival(estimatedDropoff).build()),
                solo.distanceKm(), solo.durationMinutes());
        pool = poolRideRepository.save(pool);

        return PoolRideResponse.builder()
                .poolPassengerId(passenger.getId())
                .poolRideId(pool.getId())
                .status(passenger.getStatus())
                .matchFound(false)
                .originalFare(originalFare)
                .poolFare(poolFare)
                .savingsPercent(passenger.getSavingsPercent())
                .estimatedPickup(estimatedPickup)
                .estimatedDropoff(estimatedDropoff)
                .matchDeadline(deadline)
                .currentPassengers(pool.getCurrentPassengers())
                .maxPassengers(pool.getMaxPassengers())
                .message("We're looking for other riders heading your way. You'll be notified when we find a match.")
                .build();
    }

    private PoolPassenger newPassenger(String riderId, UUID poolRideId, GeoLocation pickup, GeoLocation dropoff,
                                       int seats, RouteInfo solo, BigDecimal originalFare, BigDecimal poolFare,
                                       Instant estimatedPickup, Instant estimatedDropoff) {
        return PoolPassenger.builder()
                .poolRideId(poolRideId)
                .riderId(riderId)
                .status(PassengerStatus.PENDING)
                .seatCount(seats)
                .pickupLat(pickup.getLat())
                .pickupLng(pickup.getLng())
                .pickupAddress(pickup.getAddress())
                .dropoffLat(dropoff.getLat())
                .dropoffLng(dropoff.getLng())
                .dropoffAddress(dropoff.getAddress())
                .directDistanceKm(solo.distanceKm())
                .directDurationMinutes(solo.durationMinutes())
                .originalFare(originalFare)
                .poolFare(poolFare)
                .savingsPercent(fareCalculator.savingsPercent(originalFare, poolFare))
                .estimatedPickup(estimatedPickup)
                .estimatedDropoff(estimatedDropoff)
                .build();
    }

    private RouteInfo soloRoute(GeoLocation pickup, GeoLocation dropoff) {
        try {
            return routingService.getRoute(pickup, dropoff);
        } catch (RoutingException e) {
            log.error("Routing failed for pool request ({},{}) -> ({},{}): {}",
                    pickup.getLat(), pickup.getLng(), dropoff.getLat(), dropoff.getLng(), e.getMessage());
            throw PoolException.upstream("ROUTING_UNAVAILABLE", "Failed to calculate route", e);
        }
    }

    private PoolPassenger ownedPassenger(String riderId, UUID passengerId, String action) {
        PoolPassenger passenger = passengerRepository.findById(passengerId)
                .orElseThrow(() -> PoolException.notFound("PASSENGER_NOT_FOUND", "Pool passenger " + passengerId + " not found"));
        if (!passenger.isOwnedBy(riderId)) {
            throw PoolException.forbidden("NOT_OWNER", "Not authorized to " + action + " this pool");
        }
        return passenger;
    }

    private void releaseSeats(PoolPassenger passenger) {
        poolRideRepository.findById(passenger.getPoolRideId()).ifPresent(pool -> {
            pool.releaseSeats(passenger.getSeatCount());
            try {
                poolRideRepository.saveAndFlush(pool);
            } catch (OptimisticLockingFailureException e) {
                throw PoolException.conflict("POOL_CAPACITY_CHANGED", "Pool " + pool.getId() + " changed concurrently, retry");
            }
        });
    }

    private static String matchMessage(double savingsPercent) {
        return "Great! We found a pool match. You'll save " + (int) savingsPercent + "% on this ride.";
    }

    private record ScoredPool(PoolRide pool, RouteMatchScore score) {
    }
}
