package com.ridematch.shared.store;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

/**
 * Redis-backed {@link EphemeralStore}. Plain values use SET with EX (NX for setIfAbsent), sets use SADD + EXPIRE.
 *
 * Registered via EphemeralStoreAutoConfiguration. Inspect state via Redis CLI:
 *   SMEMBERS ride_offers:{rideId}
 *   GET ride_offer:{rideId}:{driverId}
 */
@Slf4j
@RequiredArgsConstructor
public class RedisEphemeralStore implements EphemeralStore {

    private final StringRedisTemplate redisTemplate;

    @Override
    public void setWithExpiration(String key, String value, Duration ttl) {
        requirePositive(key, ttl);
        redisTemplate.opsForValue().set(key, value, ttl);
    }

    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        requirePositive(key, ttl);
        return Boolean.TRUE.equals(redisTemplate.opsForValue().setIfAbsent(key, value, ttl));
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(redisTemplate.opsForValue().get(key));
    }

    @Override
    public void delete(String key) {
        redisTemplate.delete(key);
    }

    @Override
    public void addToSet(String key, String member, Duration ttl) {
        requirePositive(key, ttl);
        redisTemplate.opsForSet().add(key, member);
        redisTemplate.expire(key, ttl);
    }

    @Override
    public Set<String> members(String key) {
        Set<String> members = redisTemplate.opsForSet().members(key);
        return members != null ? members : Set.of();
    }

    @Override
    public boolean exists(String key) {
        return Boolean.TRUE.equals(redisTemplate.hasKey(key));
    }

    private void requirePositive(String key, Duration ttl) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("TTL for key " + key + " must be positive, was " + ttl);
        }
    }
}
