package com.ridematch.dispatch.config;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "dispatch.eta")
public record EtaTrackingProperties(
        @DefaultValue("5") @Positive int updateIntervalSeconds,
        @DefaultValue("2") @Positive int registrationTtlHours,
        @DefaultValue("30.0") @Positive double defaultSpeedKmh,
        @DefaultValue("5.0") @Positive double minReportedSpeedKmh) {

    public static EtaTrackingProperties defaults() {
        return new EtaTrackingProperties(5, 2, 30.0, 5.0);
    }

    public Duration updateInterval() {
        return Duration.ofSeconds(updateIntervalSeconds);
    }

    public Duration registrationTtl() {
        return Duration.ofHours(registrationTtlHours);
    }
}
