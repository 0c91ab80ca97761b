package com.ridematch.pool.repository;

import com.ridematch.pool.entity.PoolPassenger;
import com.ridematch.pool.model.PassengerStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DataJpaTest
class PoolPassengerRepositoryTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Autowired private PoolPassengerRepository passengerRepository;
    @Autowired private TestEntityManager entityManager;

    @Test
    @DisplayName("A rider's open pool ride is found; finished ones are not")
    void findOpenRideOfRider() {
        UUID pool = UUID.randomUUID();
        save(pool, "rider-1", PassengerStatus.DROPPED_OFF, 20);
        PoolPassenger open = save(pool, "rider-1", PassengerStatus.CONFIRMED, 20);
        save(pool, "rider-2", PassengerStatus.CANCELLED, 20);

        assertThat(passengerRepository.findFirstByRiderIdAndStatusNotIn("rider-1", PassengerStatus.TERMINAL))
                .contains(open);
        assertThat(passengerRepository.findFirstByRiderIdAndStatusNotIn("rider-2", PassengerStatus.TERMINAL))
                .isEmpty();
    }

    @Test
    @DisplayName("Bulk cancellation only touches waiting passengers of the given pools")
    void updateStatusForPools() {
        UUID expired = UUID.randomUUID();
        UUID other = UUID.randomUUID();
        PoolPassenger pending = save(expired, "rider-1", PassengerStatus.PENDING, 20);
        PoolPassenger confirmed = save(expired, "rider-2", PassengerStatus.CONFIRMED, 20);
        PoolPassenger declined = save(expired, "rider-3", PassengerStatus.CANCELLED, 20);
        PoolPassenger elsewhere = save(other, "rider-4", PassengerStatus.PENDING, 20);

        int updated = passengerRepository.updateStatusForPools(List.of(expired),
                EnumSet.of(PassengerStatus.PENDING, PassengerStatus.CONFIRMED), PassengerStatus.CANCELLED, NOW);
        entityManager.clear();

        assertThat(updated).isEqualTo(2);
        assertThat(statusOf(pending)).isEqualTo(PassengerStatus.CANCELLED);
        assertThat(statusOf(confirmed)).isEqualTo(PassengerStatus.CANCELLED);
        assertThat(statusOf(declined)).isEqualTo(PassengerStatus.CANCELLED);
        assertThat(statusOf(elsewhere)).isEqualTo(PassengerStatus.PENDING);
    }

    @Test
    void passengersOfPoolInJoinOrder() {
        UUID pool = UUID.randomUUID();
        PoolPassenger first = save(pool, "rider-1", PassengerStatus.CONFIRMED, 20);
        PoolPassenger second = save(pool, "rider-2", PassengerStatus.PENDING, 20);
        save(UUID.randomUUID(), "rider-3", PassengerStatus.PENDING, 20);

        assertThat(passengerRepository.findByPoolRideIdOrderByCreatedAtAscIdAsc(pool))
                .containsExactlyInAnyOrder(first, second);
    }

    @Test
    @DisplayName("Savings averages and saved kilometres only count completed rides")
    void statsQueries() {
        UUID pool = UUID.randomUUID();
        save(pool, "rider-1", PassengerStatus.DROPPED_OFF, 20);
        save(pool, "rider-2", PassengerStatus.DROPPED_OFF, 30);
        save(pool, "rider-3", PassengerStatus.CANCELLED, 90);

        assertThat(passengerRepository.averageSavingsPercent(PassengerStatus.DROPPED_OFF)).isCloseTo(25.0, within(1e-9));
        // 10 km * 20% + 10 km * 30%
        assertThat(passengerRepository.sumKilometresSaved(PassengerStatus.DROPPED_OFF)).isCloseTo(5.0, within(1e-9));
        assertThat(passengerRepository.countByStatusNot(PassengerStatus.CANCELLED)).isEqualTo(2);
    }

    private PassengerStatus statusOf(PoolPassenger passenger) {
        return passengerRepository.findById(passenger.getId()).orElseThrow().getStatus();
    }

    private PoolPassenger save(UUID poolRideId, String riderId, PassengerStatus status, double savingsPercent) {
        return passengerRepository.saveAndFlush(PoolPassenger.builder()
                .poolRideId(poolRideId)
                .riderId(riderId)
                .status(status)
                .seatCount(1)
                .pickupLat(37.77)
                .pickupLng(-122.42)
                .dropoffLat(37.80)
                .dropoffLng(-122.43)
                .directDistanceKm(10.0)
                .directDurationMinutes(20)
                .originalFare(new BigDecimal("22.00"))
                .poolFare(new BigDecimal("17.60"))
                .savingsPercent(savingsPercent)
                .build());
    }
}
