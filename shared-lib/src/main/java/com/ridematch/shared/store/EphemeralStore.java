package com.ridematch.shared.store;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

/**
 * Key/value store with per-key expiration. An absent key means the entry
 * never existed or has already expired; readers must not treat it as an error.
 */
public interface EphemeralStore {

    void setWithExpiration(String key, String value, Duration ttl);

    /**
     * Writes the value only when {@code key} is absent, as a single atomic step.
     *
     * @return true when this call created the key
     */
    boolean setIfAbsent(String key, String value, Duration ttl);

    Optional<String> get(String key);

    void delete(String key);

    /**
     * Adds a member to the set stored at {@code key} and resets the set's expiry.
     * The add itself is atomic, so concurrent appends for the same key never lose members.
     */
    void addToSet(String key, String member, Duration ttl);

    /** Members of the set at {@code key}, empty when the key is absent. */
    Set<String> members(String key);

    boolean exists(String key);
}
