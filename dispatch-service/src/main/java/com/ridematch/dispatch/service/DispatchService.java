package com.ridematch.dispatch.service;

import com.ridematch.dispatch.config.MatchingProperties;
import com.ridematch.dispatch.exception.DispatchException;
import com.ridematch.dispatch.locator.CandidateLocator;
import com.ridematch.dispatch.metrics.DispatchMetrics;
import com.ridematch.dispatch.model.DriverCandidate;
import com.ridematch.dispatch.model.OfferBatches;
import com.ridematch.dispatch.notification.NotificationSink;
import com.ridematch.shared.enums.RideStatus;
import com.ridematch.shared.events.RideAcceptedEvent;
import com.ridematch.shared.events.RideCancelledEvent;
import com.ridematch.shared.events.RideRequestedEvent;
import com.ridematch.shared.messages.OfferCancelledMessage;
import com.ridematch.shared.messages.RideOfferMessage;
import com.ridematch.shared.messages.UserNotification;
import com.ridematch.shared.model.GeoLocation;
import com.ridematch.shared.util.GeoMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Event-driven dispatch: one ride request fans out to nearby drivers in two batches.
 *
 * Flow per ride:
 *  1. ride.requested → find up to maxDriversToNotify available drivers near pickup
 *  2. none → tell the rider, stop (no retry; the rider requests again)
 *  3. rank nearest first, offer the first batch now
 *  4. schedule the rest after retryDelay; they go out only if the ride is still pending then
 *  5. ride.accepted / ride.cancelled → withdraw every outstanding offer and drop the offer set
 *
 * Offers are tracked in the ephemeral store with TTLs; there is no lock around the
 * steps, so a sent-but-untracked offer (or the reverse) is possible and tolerated.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DispatchService {

    static final double AVERAGE_SPEED_KMH = 30.0;

    private final CandidateLocator candidateLocator;
    private final OfferTracker offerTracker;
    private final RideStatusCache rideStatusCache;
    private final NotificationSink notificationSink;
    private final TaskScheduler offerBatchScheduler;
    private final MatchingProperties properties;
    private final DispatchMetrics metrics;
    private final Clock clock;

    public void onRideRequested(RideRequestedEvent event) {
        long startNanos = System.nanoTime();
        try {
            dispatch(event);
        } finally {
            metrics.getDispatchLatencyTimer().record(Duration.ofNanos(System.nanoTime() - startNanos));
        }
    }

    private void dispatch(RideRequestedEvent event) {
        String rideId = event.getRideId();

        List<DriverCandidate> found;
        try {
            found = candidateLocator.findAvailableDrivers(
                    event.getPickupLat(), event.getPickupLng(), properties.maxDriversToNotify());
        } catch (DispatchException e) {
            metrics.recordCandidateSearchFailure();
            log.error("Dispatch aborted for ride {} [{}]: {}", rideId, e.getCode(), e.getMessage());
            return;
        }

        List<DriverCandidate> ranked = rankByProximity(event, found);
        if (ranked.isEmpty()) {
            handleNoDrivers(event);
            return;
        }

        OfferBatches batches = OfferBatches.split(ranked, properties.firstBatchSize());
        batches.immediate().forEach(candidate -> sendOfferToDriver(event, candidate));

        if (batches.hasDelayed()) {
            Instant runAt = clock.instant().plus(properties.retryDelay());
            offerBatchScheduler.schedule(() -> sendDelayedBatch(event, batches.delayed()), runAt);
            log.info("Ride {}: offered to {} drivers, {} more scheduled in {}s",
                    rideId, batches.immediate().size(), batches.delayed().size(), properties.retryDelaySeconds());
        } else {
            log.info("Ride {}: offered to {} drivers", rideId, batches.immediate().size());
        }
    }

    /**
     * Runs after the retry delay. The ride may have been accepted or cancelled
     * in the meantime, in which case nothing is sent.
     */
    void sendDelayedBatch(RideRequestedEvent event, List<DriverCandidate> delayed) {
        String rideId = event.getRideId();
        boolean pending;
        try {
            pending = rideStatusCache.isRidePending(rideId);
        } catch (DataAccessException e) {
            log.error("Could not verify status of ride {}, dropping delayed batch of {}: {}",
                    rideId, delayed.size(), e.getMessage());
            metrics.recordDelayedBatchSkipped();
            return;
        }

        if (!pending) {
            log.info("Ride {} no longer pending, skipping delayed batch of {}", rideId, delayed.size());
            metrics.recordDelayedBatchSkipped();
            return;
        }

        delayed.forEach(candidate -> sendOfferToDriver(event, candidate));
        metrics.recordDelayedBatchSent();
        log.info("Ride {}: delayed batch offered to {} drivers", rideId, delayed.size());
    }

    void sendOfferToDriver(RideRequestedEvent event, DriverCandidate candidate) {
        String rideId = event.getRideId();
        String driverId = candidate.getDriverId();
        Instant now = clock.instant();

        double distanceKm = candidateLocator.calculateDistance(
                candidate.getLat(), candidate.getLng(), event.getPickupLat(), event.getPickupLng());
        int etaMinutes = GeoMath.travelMinutes(distanceKm, AVERAGE_SPEED_KMH);
        Instant expiresAt = now.plus(properties.offerTimeout());

        RideOfferMessage offer = RideOfferMessage.builder()
                .rideId(rideId)
                .riderId(event.getRiderId())
                .riderName(event.getRiderName())
                .riderRating(event.getRiderRating())
                .pickup(new GeoLocation(event.getPickupLat(), event.getPickupLng(), event.getPickupAddress()))
                .dropoff(event.hasDropoff()
                        ? new GeoLocation(event.getDropoffLat(), event.getDropoffLng(), event.getDropoffAddress())
                        : null)
                .rideTypeName(event.getRideTypeName())
                .estimatedFare(event.getEstimatedFare())
                .estimatedDistanceKm(event.getEstimatedDistanceKm())
                .estimatedDurationMinutes(event.getEstimatedDurationMinutes())
                .currency(event.getCurrency())
                .distanceToPickupKm(distanceKm)
                .etaToPickupMinutes(etaMinutes)
                .expiresAt(expiresAt)
                .timeoutSeconds(properties.offerTimeoutSeconds())
                .build();

        try {
            offerTracker.trackOffer(rideId, driverId, now, expiresAt);
        } catch (DataAccessException e) {
            log.warn("Offer for ride {} to driver {} sent untracked: {}", rideId, driverId, e.getMessage());
        }

        try {
            notificationSink.sendToUser(driverId, UserNotification.builder()
                    .type(UserNotification.TYPE_RIDE_OFFER)
                    .userId(driverId)
                    .rideId(rideId)
                    .payload(offer)
                    .sentAt(now)
                    .build());
            metrics.recordOfferSent();
            log.info("Offered ride {} to driver {} ({} km away, ETA {} min)",
                    rideId, driverId, String.format("%.2f", distanceKm), etaMinutes);
        } catch (RuntimeException e) {
            metrics.recordOfferNotificationFailed();
            log.warn("Failed to push offer for ride {} to driver {}: {}", rideId, driverId, e.getMessage());
        }
    }

    public void onRideAccepted(RideAcceptedEvent event) {
        rideStatusCache.record(event.getRideId(), RideStatus.ACCEPTED);
        int cancelled = cancelPendingOffers(event.getRideId(), event.getDriverId(),
                OfferCancelledMessage.REASON_RIDE_TAKEN);
        log.info("Ride {} accepted by driver {}, withdrew {} other offers",
                event.getRideId(), event.getDriverId(), cancelled);
    }

    public void onRideCancelled(RideCancelledEvent event) {
        rideStatusCache.record(event.getRideId(), RideStatus.CANCELLED);
        int cancelled = cancelPendingOffers(event.getRideId(), null, OfferCancelledMessage.REASON_RIDE_CANCELLED);
        log.info("Ride {} cancelled by {}, withdrew {} offers", event.getRideId(), event.getCancelledBy(), cancelled);
    }

    /**
     * Tells every driver in the ride's offer set, except {@code acceptedDriverId},
     * that the ride is gone, deletes their offer records, then deletes the set.
     * A missing offer set is a no-op, so repeated calls are harmless.
     *
     * @return number of drivers whose offer was withdrawn
     */
    public int cancelPendingOffers(String rideId, String acceptedDriverId, String reason) {
        Set<String> offered;
        try {
            offered = offerTracker.offeredDrivers(rideId);
        } catch (DataAccessException e) {
            log.error("Could not read offer set for ride {}, offers will lapse by TTL: {}", rideId, e.getMessage());
            return 0;
        }
        if (offered.isEmpty()) {
            log.debug("No live offer set for ride {}", rideId);
            return 0;
        }

        int withdrawn = 0;
        for (String driverId : offered) {
            if (driverId.equals(acceptedDriverId)) continue;

            notifyOfferCancelled(rideId, driverId, reason);
            try {
                offerTracker.removeOffer(rideId, driverId);
            } catch (DataAccessException e) {
                log.warn("Could not delete offer of ride {} for driver {}: {}", rideId, driverId, e.getMessage());
            }
            withdrawn++;
        }

        try {
            offerTracker.clearOfferSet(rideId);
        } catch (DataAccessException e) {
            log.warn("Could not delete offer set for ride {}: {}", rideId, e.getMessage());
        }
        metrics.recordOffersCancelled(reason, withdrawn);
        return withdrawn;
    }

    // --- helpers ---

    private List<DriverCandidate> rankByProximity(RideRequestedEvent event, List<DriverCandidate> found) {
        Map<String, DriverCandidate> distinct = new LinkedHashMap<>();
        for (DriverCandidate candidate : found) {
            distinct.putIfAbsent(candidate.getDriverId(), candidate);
        }
        distinct.values().forEach(c -> c.setDistanceKm(candidateLocator.calculateDistance(
                c.getLat(), c.getLng(), event.getPickupLat(), event.getPickupLng())));
        return distinct.values().stream()
                .sorted(Comparator.comparingDouble(DriverCandidate::getDistanceKm))
                .limit(Math.max(0, properties.maxDriversToNotify()))
                .toList();
    }

    private void handleNoDrivers(RideRequestedEvent event) {
        rideStatusCache.record(event.getRideId(), RideStatus.NO_DRIVER_FOUND);
        metrics.recordNoDriverFound();
        log.warn("No drivers available for ride {}", event.getRideId());
        try {
            notificationSink.sendToUser(event.getRiderId(), UserNotification.builder()
                    .type(UserNotification.TYPE_NO_DRIVERS)
                    .userId(event.getRiderId())
                    .rideId(event.getRideId())
                    .payload(Map.of("message", "No drivers available nearby. Please try again in a few minutes."))
                    .sentAt(clock.instant())
                    .build());
        } catch (RuntimeException e) {
            log.warn("Failed to tell rider {} about ride {}: {}", event.getRiderId(), event.getRideId(), e.getMessage());
        }
    }

    private void notifyOfferCancelled(String rideId, String driverId, String reason) {
        OfferCancelledMessage notice = OfferCancelledMessage.builder()
                .rideId(rideId)
                .reason(reason)
                .message(OfferCancelledMessage.REASON_RIDE_TAKEN.equals(reason)
                        ? "This ride has been accepted by another driver"
                        : "This ride has been cancelled")
                .build();
        try {
            notificationSink.sendToUser(driverId, UserNotification.builder()
                    .type(UserNotification.TYPE_RIDE_OFFER_CANCELLED)
                    .userId(driverId)
                    .rideId(rideId)
                    .payload(notice)
                    .sentAt(clock.instant())
                    .build());
        } catch (RuntimeException e) {
            log.warn("Failed to withdraw offer of ride {} from driver {}: {}", rideId, driverId, e.getMessage());
        }
    }
}
