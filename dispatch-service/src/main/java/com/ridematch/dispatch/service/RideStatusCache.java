package com.ridematch.dispatch.service;

import com.ridematch.dispatch.config.MatchingProperties;
import com.ridematch.dispatch.entity.Ride;
import com.ridematch.dispatch.repository.RideRepository;
import com.ridematch.shared.enums.RideStatus;
import com.ridematch.shared.store.EphemeralStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Ride status lookups for the delayed offer batch: cached hint first
 * ({@code ride_status:{rideId}}), rides table when the hint is absent.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RideStatusCache {

    static final String STATUS_KEY_PREFIX = "ride_status:";
    private static final Duration HINT_GRACE = Duration.ofSeconds(60);

    private final EphemeralStore store;
    private final RideRepository rideRepository;
    private final MatchingProperties properties;

    public static String statusKey(String rideId) {
        return STATUS_KEY_PREFIX + rideId;
    }

    /**
     * Whether the ride can still be offered. A ride unknown to both the cache and
     * the rides table is treated as not pending.
     *
     * @throws DataAccessException if the database fallback fails
     */
    public boolean isRidePending(String rideId) {
        Optional<RideStatus> hinted = readHint(rideId);
        if (hinted.isPresent()) {
            return hinted.get().isAwaitingDriver();
        }
        return findPersistedStatus(rideId)
                .map(RideStatus::isAwaitingDriver)
                .orElse(false);
    }

    /** Best-effort hint write; the rides table stays authoritative. */
    public void record(String rideId, RideStatus status) {
        Duration ttl = properties.retryDelay().plus(properties.offerTimeout()).plus(HINT_GRACE);
        try {
            store.setWithExpiration(statusKey(rideId), status.hintValue(), ttl);
        } catch (DataAccessException e) {
            log.warn("Could not cache status {} for ride {}: {}", status, rideId, e.getMessage());
        }
    }

    private Optional<RideStatus> readHint(String rideId) {
        try {
            return store.get(statusKey(rideId)).flatMap(RideStatus::fromHint);
        } catch (DataAccessException e) {
            log.warn("Status cache unavailable for ride {}, falling back to database: {}", rideId, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<RideStatus> findPersistedStatus(String rideId) {
        UUID id;
        try {
            id = UUID.fromString(rideId);
        } catch (IllegalArgumentException e) {
            log.warn("Ride id {} is not a UUID, cannot look it up", rideId);
            return Optional.empty();
        }
        return rideRepository.findById(id).map(Ride::getStatus);
    }
}
