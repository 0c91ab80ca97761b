package com.ridematch.pool.repository;

import com.ridematch.pool.entity.PoolRide;
import com.ridematch.pool.model.PoolStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
class PoolRideRepositoryTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Autowired private PoolRideRepository poolRideRepository;
    @Autowired private TestEntityManager entityManager;

    @Test
    @DisplayName("Joinable pools are MATCHING, in the searched cells, before deadline and with room; soonest deadline first")
    void findJoinable() {
        PoolRide open = save(PoolStatus.MATCHING, "cell-a", 1, 10);
        PoolRide soonest = save(PoolStatus.MATCHING, "cell-b", 2, 3);
        save(PoolStatus.MATCHING, "cell-a", 4, 10);   // full
        save(PoolStatus.MATCHING, "cell-z", 1, 10);   // elsewhere
        save(PoolStatus.CONFIRMED, "cell-a", 1, 10);  // has a driver
        save(PoolStatus.MATCHING, "cell-a", 1, -1);   // expired

        List<PoolRide> oneSeat = poolRideRepository.findJoinable(PoolStatus.MATCHING, List.of("cell-a", "cell-b"), 1, NOW);
        List<PoolRide> threeSeats = poolRideRepository.findJoinable(PoolStatus.MATCHING, List.of("cell-a", "cell-b"), 3, NOW);

        assertThat(oneSeat).containsExactly(soonest, open);
        assertThat(threeSeats).containsExactly(open);
    }

    @Test
    @DisplayName("Expired matching pools are found and cancelled in bulk; other statuses are untouched")
    void expireInBulk() {
        PoolRide expired = save(PoolStatus.MATCHING, "cell-a", 1, -2);
        PoolRide confirmed = save(PoolStatus.CONFIRMED, "cell-a", 2, -2);
        save(PoolStatus.MATCHING, "cell-a", 1, 5);

        List<UUID> ids = poolRideRepository.findIdsByStatusAndDeadlineBefore(PoolStatus.MATCHING, NOW);
        assertThat(ids).containsExactly(expired.getId());

        int updated = poolRideRepository.updateStatus(List.of(expired.getId(), confirmed.getId()),
                PoolStatus.MATCHING, PoolStatus.CANCELLED, NOW);
        entityManager.clear();

        assertThat(updated).isEqualTo(1);
        PoolRide reloaded = poolRideRepository.findById(expired.getId()).orElseThrow();
        assertThat(reloaded.getStatus()).isEqualTo(PoolStatus.CANCELLED);
        assertThat(reloaded.getVersion()).isEqualTo(expired.getVersion() + 1);
        assertThat(poolRideRepository.findById(confirmed.getId()).orElseThrow().getStatus())
                .isEqualTo(PoolStatus.CONFIRMED);
    }

    @Test
    void findActivePoolOfDriver() {
        PoolRide active = save(PoolStatus.IN_PROGRESS, "cell-a", 2, -5);
        active.setDriverId("driver-1");
        PoolRide done = save(PoolStatus.COMPLETED, "cell-a", 2, -30);
        done.setDriverId("driver-1");
        entityManager.flush();

        assertThat(poolRideRepository.findFirstByDriverIdAndStatusIn("driver-1", PoolStatus.DRIVER_ACTIVE))
                .contains(active);
        assertThat(poolRideRepository.findFirstByDriverIdAndStatusIn("driver-2", PoolStatus.DRIVER_ACTIVE))
                .isEmpty();
    }

    @Test
    void statsQueries() {
        save(PoolStatus.COMPLETED, "cell-a", 2, -30);
        save(PoolStatus.COMPLETED, "cell-a", 3, -30);
        save(PoolStatus.MATCHING, "cell-a", 1, 5);

        assertThat(poolRideRepository.averagePassengers(PoolStatus.COMPLETED)).isEqualTo(2.5);
        assertThat(poolRideRepository.averagePassengers(PoolStatus.CANCELLED)).isZero();
        assertThat(poolRideRepository.countByStatusIn(PoolStatus.ACTIVE)).isEqualTo(1);
    }

    private PoolRide save(PoolStatus status, String cell, int passengers, int deadlineMinutesFromNow) {
        return poolRideRepository.saveAndFlush(PoolRide.builder()
                .status(status)
                .maxPassengers(4)
                .currentPassengers(passengers)
                .centerLat(37.77)
                .centerLng(-122.42)
                .h3Index(cell)
                .totalDistanceKm(10.0)
                .totalDurationMinutes(20)
                .matchDeadline(NOW.plus(Duration.ofMinutes(deadlineMinutesFromNow)))
                .build());
    }
}
