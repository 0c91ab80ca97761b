package com.ridematch.dispatch.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ridematch.dispatch.model.TrackedOffer;
import com.ridematch.shared.store.EphemeralStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;

/**
 * Offer bookkeeping in the ephemeral store.
 *
 * Key pattern:
 *   ride_offer:{rideId}:{driverId}   JSON {driver_id, sent_at, expires_at}, TTL = offer lifetime
 *   ride_offers:{rideId}             set of offered driver ids, TTL = offer lifetime + 30s
 *
 * Nothing here garbage-collects; expiry is left to the store.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OfferTracker {

    static final String OFFER_KEY_PREFIX = "ride_offer:";
    static final String OFFER_SET_KEY_PREFIX = "ride_offers:";
    static final Duration OFFER_SET_GRACE = Duration.ofSeconds(30);

    private final EphemeralStore store;
    private final ObjectMapper objectMapper;

    public static String offerKey(String rideId, String driverId) {
        return OFFER_KEY_PREFIX + rideId + ":" + driverId;
    }

    public static String offerSetKey(String rideId) {
        return OFFER_SET_KEY_PREFIX + rideId;
    }

    /**
     * Records the offer and adds the driver to the ride's offer set. An offer that
     * has already expired is not recorded.
     */
    public void trackOffer(String rideId, String driverId, Instant sentAt, Instant expiresAt) {
        Duration ttl = Duration.between(sentAt, expiresAt);
        if (ttl.isNegative() || ttl.isZero()) {
            log.debug("Offer for ride {} to driver {} already expired, not tracking", rideId, driverId);
            return;
        }
        TrackedOffer record = TrackedOffer.builder()
                .driverId(driverId)
                .sentAt(sentAt)
                .expiresAt(expiresAt)
                .build();
        store.setWithExpiration(offerKey(rideId, driverId), toJson(record), ttl);
        store.addToSet(offerSetKey(rideId), driverId, ttl.plus(OFFER_SET_GRACE));
    }

    public Optional<TrackedOffer> findOffer(String rideId, String driverId) {
        return store.get(offerKey(rideId, driverId)).map(this::fromJson);
    }

    public Set<String> offeredDrivers(String rideId) {
        return store.members(offerSetKey(rideId));
    }

    public void removeOffer(String rideId, String driverId) {
        store.delete(offerKey(rideId, driverId));
    }

    public void clearOfferSet(String rideId) {
        store.delete(offerSetKey(rideId));
    }

    private String toJson(TrackedOffer record) {
        try {
            return objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise offer for driver " + record.getDriverId(), e);
        }
    }

    private TrackedOffer fromJson(String json) {
        try {
            return objectMapper.readValue(json, TrackedOffer.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt offer record: " + json, e);
        }
    }
}
