package com.ridematch.pool.model;

import java.util.EnumSet;
import java.util.Set;

public enum PassengerStatus {
    PENDING,
    CONFIRMED,
    PICKED_UP,
    DROPPED_OFF,
    CANCELLED,
    NO_SHOW;

    public static final Set<PassengerStatus> TERMINAL = EnumSet.of(DROPPED_OFF, CANCELLED, NO_SHOW);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    /**
     * pending → confirmed → picked_up → dropped_off; cancelled and no_show only
     * before pickup.
     */
    public boolean canTransitionTo(PassengerStatus next) {
        return switch (next) {
            case CONFIRMED -> this == PENDING;
            case PICKED_UP -> this == CONFIRMED;
            case DROPPED_OFF -> this == PICKED_UP;
            case CANCELLED, NO_SHOW -> this == PENDING || this == CONFIRMED;
            case PENDING -> false;
        };
    }
}
