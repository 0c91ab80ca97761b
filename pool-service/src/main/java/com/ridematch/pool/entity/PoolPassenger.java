package com.ridematch.pool.entity;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.ridematch.pool.model.PassengerStatus;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "pool_passengers",
        indexes = {
                @Index(name = "idx_pool_passenger_rider_status", columnList = "rider_id, status"),
                @Index(name = "idx_pool_passenger_pool", columnList = "pool_ride_id")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "id")
public class PoolPassenger {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "pool_ride_id", nullable = false)
    private UUID poolRideId;

    @Column(name = "rider_id", nullable = false)
    private String riderId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PassengerStatus status;

    @Column(name = "seat_count", nullable = false)
    private int seatCount;

    @Column(name = "pickup_lat", nullable = false)
    private double pickupLat;

    @Column(name = "pickup_lng", nullable = false)
    private double pickupLng;

    @Column(name = "dropoff_lat", nullable = false)
    private double dropoffLat;

    @Column(name = "dropoff_lng", nullable = false)
    private double dropoffLng;

    @Column(name = "pickup_address")
    private String pickupAddress;

    @Column(name = "dropoff_address")
    private String dropoffAddress;

    /** Solo trip, used for the unpooled fare and CO2 estimates. */
    @Column(name = "direct_distance_km")
    private double directDistanceKm;

    @Column(name = "direct_duration_minutes")
    private int directDurationMinutes;

    @Column(name = "original_fare", precision = 10, scale = 2)
    private BigDecimal originalFare;

    @Column(name = "pool_fare", precision = 10, scale = 2)
    private BigDecimal poolFare;

    @Column(name = "savings_percent")
    private double savingsPercent;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    @Column(name = "estimated_pickup")
    private Instant estimatedPickup;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    @Column(name = "estimated_dropoff")
    private Instant estimatedDropoff;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    @Column(name = "picked_up_at")
    private Instant pickedUpAt;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    @Column(name = "dropped_off_at")
    private Instant droppedOffAt;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    public boolean isOwnedBy(String candidateRiderId) {
        return riderId.equals(candidateRiderId);
    }
}
