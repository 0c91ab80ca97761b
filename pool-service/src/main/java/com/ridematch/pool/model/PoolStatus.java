package com.ridematch.pool.model;

import java.util.EnumSet;
import java.util.Set;

public enum PoolStatus {
    MATCHING,
    CONFIRMED,
    IN_PROGRESS,
    COMPLETED,
    CANCELLED;

    public static final Set<PoolStatus> ACTIVE = EnumSet.of(MATCHING, CONFIRMED, IN_PROGRESS);
    public static final Set<PoolStatus> DRIVER_ACTIVE = EnumSet.of(CONFIRMED, IN_PROGRESS);

    /** Forward-only: matching → confirmed → in_progress → completed, or matching → cancelled. */
    public boolean canTransitionTo(PoolStatus next) {
        return switch (this) {
            case MATCHING -> next == CONFIRMED || next == CANCELLED;
            case CONFIRMED -> next == IN_PROGRESS;
            case IN_PROGRESS -> next == COMPLETED;
            case COMPLETED, CANCELLED -> false;
        };
    }
}
