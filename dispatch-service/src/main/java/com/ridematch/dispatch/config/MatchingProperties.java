package com.ridematch.dispatch.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Dispatch tuning, bound from {@code dispatch.matching.*}.
 *
 * The radius settings bound what the candidate locator may return; the rest
 * shape the offer fan-out.
 */
@Validated
@ConfigurationProperties(prefix = "dispatch.matching")
public record MatchingProperties(
        @DefaultValue("5.0") @Positive double searchRadiusKm,
        @DefaultValue("20.0") @Positive double maxSearchRadiusKm,
        @DefaultValue("5.0") @Positive double radiusIncrementKm,
        @DefaultValue("10") @Positive int maxDriversToNotify,
        @DefaultValue("3") @Positive int firstBatchSize,
        @DefaultValue("30") @Positive int offerTimeoutSeconds,
        @DefaultValue("10") @PositiveOrZero int retryDelaySeconds,
        @DefaultValue("default") @NotBlank String regionId) {

    public static MatchingProperties defaults() {
        return new MatchingProperties(5.0, 20.0, 5.0, 10, 3, 30, 10, "default");
    }

    public Duration offerTimeout() {
        return Duration.ofSeconds(offerTimeoutSeconds);
    }

    public Duration retryDelay() {
        return Duration.ofSeconds(retryDelaySeconds);
    }
}
