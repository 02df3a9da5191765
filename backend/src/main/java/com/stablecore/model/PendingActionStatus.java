package com.stablecore.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Saga marker states. STARTED is the only state an in-flight action can be in;
 * everything else is terminal except NEEDS_RECOVERY, which only the owner resolves.
 */
public enum PendingActionStatus {
    STARTED,
    COMPLETED,
    COMPENSATED,
    NEEDS_RECOVERY,
    RESOLVED;

    public boolean canMoveTo(PendingActionStatus next) {
        return allowedNext().contains(next);
    }

    private Set<PendingActionStatus> allowedNext() {
        return switch (this) {
            case STARTED -> EnumSet.of(COMPLETED, COMPENSATED, NEEDS_RECOVERY);
            case NEEDS_RECOVERY -> EnumSet.of(RESOLVED);
            default -> EnumSet.noneOf(PendingActionStatus.class);
        };
    }
}
