package com.ridematch.shared.enums;

import java.util.Locale;
import java.util.Optional;

public enum RideStatus {
    PENDING,
    SEARCHING,
    ACCEPTED,
    DRIVER_ARRIVED,
    IN_PROGRESS,
    COMPLETED,
    CANCELLED,
    NO_DRIVER_FOUND;

    /**
     * True while the ride can still be offered to drivers.
     */
    public boolean isAwaitingDriver() {
        return this == PENDING || this == SEARCHING;
    }

    /** Lower-case form used for the cached status hint. */
    public String hintValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<RideStatus> fromHint(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(RideStatus.valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
