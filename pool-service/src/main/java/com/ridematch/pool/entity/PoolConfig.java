package com.ridematch.pool.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.UUID;

/**
 * Operator-managed matching parameters. A row with {@code city_id} null is the global default.
 */
@Entity
@Table(name = "pool_configs",
        indexes = @Index(name = "idx_pool_config_city_active", columnList = "city_id, is_active"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "id")
public class PoolConfig {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "city_id")
    private String cityId;

    @Column(name = "max_detour_percent", nullable = false)
    private double maxDetourPercent;

    @Column(name = "max_detour_minutes", nullable = false)
    private int maxDetourMinutes;

    @Column(name = "max_wait_minutes", nullable = false)
    private int maxWaitMinutes;

    @Column(name = "max_passengers_per_ride", nullable = false)
    private int maxPassengersPerRide;

    @Column(name = "min_match_score", nullable = false)
    private double minMatchScore;

    @Column(name = "match_radius_km", nullable = false)
    private double matchRadiusKm;

    @Column(name = "h3_resolution", nullable = false)
    private int h3Resolution;

    @Column(name = "discount_percent", nullable = false)
    private double discountPercent;

    @Column(name = "min_savings_percent", nullable = false)
    private double minSavingsPercent;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;
}
