package com.ridematch.pool.entity;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.ridematch.pool.model.PoolStatus;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "pool_rides",
        indexes = {
                @Index(name = "idx_pool_ride_cell_status", columnList = "h3_index, status"),
                @Index(name = "idx_pool_ride_driver", columnList = "driver_id"),
                @Index(name = "idx_pool_ride_deadline", columnList = "match_deadline")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "id")
public class PoolRide {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    /**
     * Two riders joining the same pool at once both pass the capacity query;
     * the second flush fails on a stale version instead of overbooking seats.
     */
    @Version
    @Column(nullable = false)
    private Long version;

    @Column(name = "driver_id")
    private String driverId;

    @Column(name = "vehicle_id")
    private String vehicleId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PoolStatus status;

    @Column(name = "max_passengers", nullable = false)
    private int maxPassengers;

    @Column(name = "current_passengers", nullable = false)
    private int currentPassengers;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "pool_route_stops", joinColumns = @JoinColumn(name = "pool_ride_id"))
    @OrderBy("sequenceOrder ASC")
    @Builder.Default
    private List<RouteStop> route = new ArrayList<>();

    @Column(name = "total_distance_km")
    private double totalDistanceKm;

    @Column(name = "total_duration_minutes")
    private int totalDurationMinutes;

    @Column(name = "center_lat", nullable = false)
    private double centerLat;

    @Column(name = "center_lng", nullable = false)
    private double centerLng;

    @Column(name = "radius_km")
    private double radiusKm;

    @Column(name = "h3_index", nullable = false, length = 20)
    private String h3Index;

    @Column(name = "base_fare", precision = 10, scale = 2)
    private BigDecimal baseFare;

    @Column(name = "per_km_rate", precision = 10, scale = 2)
    private BigDecimal perKmRate;

    @Column(name = "per_minute_rate", precision = 10, scale = 2)
    private BigDecimal perMinuteRate;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    @Column(name = "match_deadline", nullable = false)
    private Instant matchDeadline;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    @Column(name = "started_at")
    private Instant startedAt;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    @Column(name = "completed_at")
    private Instant completedAt;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    public boolean hasRoomFor(int seats) {
        return currentPassengers + seats <= maxPassengers;
    }

    /**
     * @throws IllegalArgumentException if {@code seats} is not positive
     * @throws IllegalStateException    if the seats would exceed {@code maxPassengers}
     */
    public void addPassengers(int seats) {
        if (seats < 1) {
            throw new IllegalArgumentException("Seat count must be positive: " + seats);
        }
        if (!hasRoomFor(seats)) {
            throw new IllegalStateException("Pool " + id + " has " + (maxPassengers - currentPassengers)
                    + " free seats, " + seats + " requested");
        }
        currentPassengers += seats;
    }

    public void releaseSeats(int seats) {
        currentPassengers = Math.max(0, currentPassengers - Math.max(0, seats));
    }

    public void replaceRoute(List<RouteStop> stops, double distanceKm, int durationMinutes) {
        route.clear();
        route.addAll(stops);
        totalDistanceKm = distanceKm;
        totalDurationMinutes = durationMinutes;
    }

    public boolean isDrivenBy(String candidateDriverId) {
        return driverId != null && driverId.equals(candidateDriverId);
    }
}
