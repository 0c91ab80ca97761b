package com.ridematch.pool.service;

import com.ridematch.pool.entity.PoolPassenger;
import com.ridematch.pool.entity.PoolRide;
import com.ridematch.pool.entity.RouteStop;
import com.ridematch.pool.event.PoolRouteChangedEvent;
import com.ridematch.pool.metrics.PoolMetrics;
import com.ridematch.pool.model.RouteStopType;
import com.ridematch.pool.repository.PoolPassengerRepository;
import com.ridematch.pool.repository.PoolRideRepository;
import com.ridematch.pool.routing.MultiStopRoute;
import com.ridematch.pool.routing.RoutingException;
import com.ridematch.pool.routing.RoutingService;
import com.ridematch.shared.model.GeoLocation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.event.TransactionalEventListener;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Rebuilds a pool's stop list from its open passengers: each passenger contributes
 * [pickup, dropoff] in join order, and the routing service supplies totals and leg times.
 * Arrivals already recorded on the previous route are carried over.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RouteOptimizer {

    private final PoolRideRepository poolRideRepository;
    private final PoolPassengerRepository passengerRepository;
    private final RoutingService routingService;
    private final PoolMetrics metrics;
    private final Clock clock;

    @Async("routeOptimizerExecutor")
    @TransactionalEventListener(fallbackExecution = true)
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void onRouteChanged(PoolRouteChangedEvent event) {
        log.debug("Re-optimizing pool {} after {}", event.poolRideId(), event.reason());
        try {
            reoptimize(event.poolRideId());
        } catch (RoutingException e) {
            metrics.recordReoptimization(false);
            log.error("Failed to re-optimize route for pool {}: {}", event.poolRideId(), e.getMessage());
        } catch (OptimisticLockingFailureException e) {
            // the competing write publishes its own change event, which rebuilds from the newer state
            metrics.recordReoptimization(false);
            log.warn("Pool {} changed during re-optimization after {}, rebuild skipped",
                    event.poolRideId(), event.reason());
        }
    }

    /**
     * @return false when the pool is gone or has no open passengers
     * @throws RoutingException when the routing service cannot route the stops
     * @throws OptimisticLockingFailureException when the pool was written since it was read
     */
    public boolean reoptimize(UUID poolRideId) {
        Optional<PoolRide> found = poolRideRepository.findById(poolRideId);
        if (found.isEmpty()) {
            log.warn("Pool {} disappeared before re-optimization", poolRideId);
            return false;
        }
        PoolRide pool = found.get();

        List<PoolPassenger> open = passengerRepository.findByPoolRideIdOrderByCreatedAtAscIdAsc(poolRideId).stream()
                .filter(p -> !p.getStatus().isTerminal())
                .toList();
        if (open.isEmpty()) {
            return false;
        }

        List<GeoLocation> points = new ArrayList<>(open.size() * 2);
        for (PoolPassenger p : open) {
            points.add(new GeoLocation(p.getPickupLat(), p.getPickupLng(), p.getPickupAddress()));
            points.add(new GeoLocation(p.getDropoffLat(), p.getDropoffLng(), p.getDropoffAddress()));
        }

        MultiStopRoute route = routingService.getMultiStopRoute(points);

        Map<String, Instant> reached = new HashMap<>();
        for (RouteStop stop : pool.getRoute()) {
            if (stop.getActualArrival() != null) {
                reached.put(stopKey(stop.getPoolPassengerId(), stop.getType()), stop.getActualArrival());
            }
        }

        Instant eta = clock.instant();
        List<RouteStop> stops = new ArrayList<>(points.size());
        for (int i = 0; i < points.size(); i++) {
            if (i > 0 && i - 1 < route.legs().size()) {
                eta = eta.plus(Duration.ofMinutes(route.legs().get(i - 1).durationMinutes()));
            }
            PoolPassenger owner = open.get(i / 2);
            RouteStopType type = i % 2 == 0 ? RouteStopType.PICKUP : RouteStopType.DROPOFF;
            GeoLocation point = points.get(i);
            stops.add(RouteStop.builder()
                    .poolPassengerId(owner.getId())
                    .type(type)
                    .lat(point.getLat())
                    .lng(point.getLng())
                    .address(point.getAddress())
                    .sequenceOrder(i + 1)
                    .estimatedArrival(eta)
                    .actualArrival(reached.get(stopKey(owner.getId(), type)))
                    .build());
        }

        pool.replaceRoute(stops, route.totalDistanceKm(), route.totalDurationMinutes());
        poolRideRepository.saveAndFlush(pool);
        metrics.recordReoptimization(true);

        log.info("Pool {} route re-optimized: {} stops, {} km, {} min",
                poolRideId, stops.size(), route.totalDistanceKm(), route.totalDurationMinutes());
        return true;
    }

    private static String stopKey(UUID passengerId, RouteStopType type) {
        return passengerId + ":" + type;
    }
}
