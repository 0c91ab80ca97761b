package com.ridematch.pool.entity;

import com.ridematch.pool.model.PoolStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PoolRideTest {

    @Test
    @DisplayName("Seats can be added up to capacity and no further")
    void capacityEnforced() {
        PoolRide pool = pool(1, 4);

        pool.addPassengers(3);
        assertThat(pool.getCurrentPassengers()).isEqualTo(4);

        assertThatThrownBy(() -> pool.addPassengers(1)).isInstanceOf(IllegalStateException.class);
        assertThat(pool.getCurrentPassengers()).isEqualTo(4);
    }

    @Test
    void seatCountMustBePositive() {
        assertThatThrownBy(() -> pool(0, 4).addPassengers(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Releasing seats never drops below zero")
    void releaseFloorsAtZero() {
        PoolRide pool = pool(2, 4);

        pool.releaseSeats(1);
        assertThat(pool.getCurrentPassengers()).isEqualTo(1);

        pool.releaseSeats(5);
        assertThat(pool.getCurrentPassengers()).isZero();
    }

    @Test
    void hasRoomFor() {
        PoolRide pool = pool(3, 4);
        assertThat(pool.hasRoomFor(1)).isTrue();
        assertThat(pool.hasRoomFor(2)).isFalse();
    }

    @Test
    void isDrivenBy() {
        PoolRide pool = pool(1, 4);
        assertThat(pool.isDrivenBy("driver-1")).isFalse();

        pool.setDriverId("driver-1");
        assertThat(pool.isDrivenBy("driver-1")).isTrue();
        assertThat(pool.isDrivenBy("driver-2")).isFalse();
    }

    private static PoolRide pool(int current, int max) {
        return PoolRide.builder()
                .id(UUID.randomUUID())
                .status(PoolStatus.MATCHING)
                .currentPassengers(current)
                .maxPassengers(max)
                .build();
    }
}
