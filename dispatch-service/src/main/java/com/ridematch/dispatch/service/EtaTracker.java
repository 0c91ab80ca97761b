package com.ridematch.dispatch.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ridematch.dispatch.config.EtaTrackingProperties;
import com.ridematch.dispatch.entity.Ride;
import com.ridematch.dispatch.model.ActiveRideInfo;
import com.ridematch.dispatch.notification.NotificationSink;
import com.ridematch.dispatch.repository.RideRepository;
import com.ridematch.shared.enums.RideStatus;
import com.ridematch.shared.events.DriverLocationUpdatedEvent;
import com.ridematch.shared.events.RideAcceptedEvent;
import com.ridematch.shared.events.RideCancelledEvent;
import com.ridematch.shared.events.RideStatusChangedEvent;
import com.ridematch.shared.messages.EtaUpdateMessage;
import com.ridematch.shared.messages.UserNotification;
import com.ridematch.shared.model.GeoLocation;
import com.ridematch.shared.store.EphemeralStore;
import com.ridematch.shared.util.GeoMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;

/**
 * Pushes live ETA updates to the rider while a driver is heading to pickup or dropoff.
 *
 * Key pattern:
 *   ride:active:{driverId}    JSON ActiveRideInfo, TTL 2h
 *   eta:throttle:{driverId}   present while the driver is inside the update interval
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EtaTracker {

    static final String ACTIVE_RIDE_KEY_PREFIX = "ride:active:";
    static final String THROTTLE_KEY_PREFIX = "eta:throttle:";

    private final EphemeralStore store;
    private final RideRepository rideRepository;
    private final NotificationSink notificationSink;
    private final EtaTrackingProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public static String activeRideKey(String driverId) {
        return ACTIVE_RIDE_KEY_PREFIX + driverId;
    }

    public void onRideAccepted(RideAcceptedEvent event) {
        Optional<Ride> ride = findRide(event.getRideId());
        if (ride.isEmpty()) {
            log.warn("Ride {} not found, ETA tracking not started for driver {}", event.getRideId(), event.getDriverId());
            return;
        }
        Ride r = ride.get();
        register(ActiveRideInfo.builder()
                .rideId(event.getRideId())
                .riderId(r.getRiderId())
                .driverId(event.getDriverId())
                .pickup(new GeoLocation(r.getPickupLat(), r.getPickupLng(), r.getPickupAddress()))
                .dropoff(r.getDropoffLat() != null && r.getDropoffLng() != null
                        ? new GeoLocation(r.getDropoffLat(), r.getDropoffLng(), r.getDropoffAddress())
                        : null)
                .status(RideStatus.ACCEPTED)
                .build());
    }

    public void onRideInProgress(RideStatusChangedEvent event) {
        findRegistration(event.getDriverId())
                .filter(info -> info.getRideId().equals(event.getRideId()))
                .ifPresent(info -> {
                    info.setStatus(RideStatus.IN_PROGRESS);
                    register(info);
                });
    }

    public void onRideCompleted(RideStatusChangedEvent event) {
        unregister(event.getDriverId(), event.getRideId());
    }

    public void onRideCancelled(RideCancelledEvent event) {
        findRide(event.getRideId())
                .map(Ride::getDriverId)
                .ifPresent(driverId -> unregister(driverId, event.getRideId()));
    }

    public void register(ActiveRideInfo info) {
        try {
            store.setWithExpiration(activeRideKey(info.getDriverId()), toJson(info), properties.registrationTtl());
            log.debug("Tracking ETA for ride {} (driver {}, {})", info.getRideId(), info.getDriverId(), info.getStatus());
        } catch (DataAccessException e) {
            log.warn("Could not register ETA tracking for ride {}: {}", info.getRideId(), e.getMessage());
        }
    }

    /**
     * Rate-limited per driver: at most one update per update interval.
     */
    public void onDriverLocationUpdated(DriverLocationUpdatedEvent event) {
        String driverId = event.getDriverId();
        Optional<ActiveRideInfo> registration = findRegistration(driverId);
        if (registration.isEmpty()) {
            return;
        }
        ActiveRideInfo info = registration.get();
        GeoLocation destination = info.destination();
        if (destination == null) {
            return;
        }

        String throttleKey = THROTTLE_KEY_PREFIX + driverId;
        if (!store.setIfAbsent(throttleKey, "1", properties.updateInterval())) {
            return;
        }

        double distanceKm = GeoMath.distanceKm(event.getLatitude(), event.getLongitude(),
                destination.getLat(), destination.getLng());
        int etaMinutes = estimateEtaMinutes(distanceKm, event.getSpeedKmh());

        EtaUpdateMessage update = EtaUpdateMessage.builder()
                .rideId(info.getRideId())
                .driverId(driverId)
                .driverLat(event.getLatitude())
                .driverLng(event.getLongitude())
                .heading(event.getHeading())
                .distanceKm(distanceKm)
                .etaMinutes(etaMinutes)
                .rideStatus(info.getStatus().hintValue())
                .updatedAt(clock.instant())
                .build();
        try {
            notificationSink.sendToUser(info.getRiderId(), UserNotification.builder()
                    .type(UserNotification.TYPE_ETA_UPDATE)
                    .userId(info.getRiderId())
                    .rideId(info.getRideId())
                    .payload(update)
                    .sentAt(clock.instant())
                    .build());
        } catch (RuntimeException e) {
            log.warn("Failed to push ETA for ride {}: {}", info.getRideId(), e.getMessage());
        }
    }

    int estimateEtaMinutes(double distanceKm, Double reportedSpeedKmh) {
        double speed = reportedSpeedKmh != null && reportedSpeedKmh > properties.minReportedSpeedKmh()
                ? reportedSpeedKmh
                : properties.defaultSpeedKmh();
        return GeoMath.travelMinutes(distanceKm, speed);
    }

    Optional<ActiveRideInfo> findRegistration(String driverId) {
        if (driverId == null) {
            return Optional.empty();
        }
        return store.get(activeRideKey(driverId)).map(this::fromJson);
    }

    private void unregister(String driverId, String rideId) {
        if (driverId == null) {
            return;
        }
        findRegistration(driverId)
                .filter(info -> info.getRideId().equals(rideId))
                .ifPresent(info -> {
                    store.delete(activeRideKey(driverId));
                    log.debug("Stopped ETA tracking for ride {} (driver {})", rideId, driverId);
                });
    }

    private Optional<Ride> findRide(String rideId) {
        try {
            return rideRepository.findById(UUID.fromString(rideId));
        } catch (IllegalArgumentException e) {
            log.warn("Ride id {} is not a UUID", rideId);
            return Optional.empty();
        }
    }

    private String toJson(ActiveRideInfo info) {
        try {
            return objectMapper.writeValueAsString(info);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise ETA registration for ride " + info.getRideId(), e);
        }
    }

    private ActiveRideInfo fromJson(String json) {
        try {
            return objectMapper.readValue(json, ActiveRideInfo.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt ETA registration: " + json, e);
        }
    }
}
