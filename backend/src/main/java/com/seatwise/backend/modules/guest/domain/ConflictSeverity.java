package com.seatwise.backend.modules.guest.domain;

public enum ConflictSeverity {
    LOW,
    MODERATE,
    HIGH,
    CRITICAL;

    public boolean isAtLeast(ConflictSeverity other) {
        return compareTo(other) >= 0;
    }
}
