package com.ridematch.dispatch.locator;

import com.ridematch.dispatch.config.MatchingProperties;
import com.ridematch.dispatch.exception.DispatchException;
import com.ridematch.dispatch.model.DriverCandidate;
import com.ridematch.shared.util.GeoMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.geo.Circle;
import org.springframework.data.geo.Distance;
import org.springframework.data.geo.GeoResult;
import org.springframework.data.geo.GeoResults;
import org.springframework.data.geo.Metrics;
import org.springframework.data.geo.Point;
import org.springframework.data.redis.connection.RedisGeoCommands;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds available drivers with Redis GEORADIUS, widening the search ring until
 * enough drivers are found or the maximum radius is reached.
 *
 * Expects the location service to maintain:
 *   drivers:geo:{regionId}   GEO set of driver positions
 *   driver:{driverId}        hash with at least a "status" field
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisCandidateLocator implements CandidateLocator {

    private static final String GEO_KEY_PREFIX = "drivers:geo:";
    private static final String DRIVER_HASH_PREFIX = "driver:";
    static final String AVAILABLE = "AVAILABLE";

    private final StringRedisTemplate redisTemplate;
    private final MatchingProperties properties;

    @Override
    public List<DriverCandidate> findAvailableDrivers(double lat, double lng, int maxDrivers) {
        if (maxDrivers <= 0) {
            return List.of();
        }
        try {
            double radiusKm = properties.searchRadiusKm();
            List<DriverCandidate> found = searchWithin(lat, lng, radiusKm, maxDrivers);
            while (found.size() < maxDrivers
                    && radiusKm < properties.maxSearchRadiusKm()
                    && properties.radiusIncrementKm() > 0) {
                radiusKm = Math.min(radiusKm + properties.radiusIncrementKm(), properties.maxSearchRadiusKm());
                found = searchWithin(lat, lng, radiusKm, maxDrivers);
            }
            log.debug("Found {} available drivers within {} km of ({},{})", found.size(), radiusKm, lat, lng);
            return found;
        } catch (DataAccessException e) {
            throw new DispatchException("CANDIDATE_SEARCH_FAILED",
                    "Driver search near (" + lat + "," + lng + ") failed: " + e.getMessage(), e);
        }
    }

    @Override
    public double calculateDistance(double lat1, double lng1, double lat2, double lng2) {
        return GeoMath.distanceKm(lat1, lng1, lat2, lng2);
    }

    private List<DriverCandidate> searchWithin(double lat, double lng, double radiusKm, int maxDrivers) {
        Circle circle = new Circle(new Point(lng, lat), new Distance(radiusKm, Metrics.KILOMETERS));

        // over-fetch: some nearby drivers will be busy or offline
        GeoResults<RedisGeoCommands.GeoLocation<String>> geoResults = redisTemplate.opsForGeo().radius(
                GEO_KEY_PREFIX + properties.regionId(),
                circle,
                RedisGeoCommands.GeoRadiusCommandArgs.newGeoRadiusArgs()
                        .includeDistance()
                        .includeCoordinates()
                        .sortAscending()
                        .limit(maxDrivers * 2L));

        if (geoResults == null) {
            return List.of();
        }

        List<DriverCandidate> candidates = new ArrayList<>();
        for (GeoResult<RedisGeoCommands.GeoLocation<String>> result : geoResults.getContent()) {
            if (candidates.size() >= maxDrivers) break;

            String driverId = result.getContent().getName();
            Object status = redisTemplate.opsForHash().get(DRIVER_HASH_PREFIX + driverId, "status");
            if (status == null || !AVAILABLE.equalsIgnoreCase(status.toString())) continue;

            Point position = result.getContent().getPoint();
            candidates.add(DriverCandidate.builder()
                    .driverId(driverId)
                    .lat(position != null ? position.getY() : lat)
                    .lng(position != null ? position.getX() : lng)
                    .status(AVAILABLE)
                    .distanceKm(result.getDistance() != null ? result.getDistance().getValue() : 0.0)
                    .build());
        }
        return candidates;
    }
}
