package com.seatwise.backend.modules.version.domain;

import java.util.UUID;

import com.seatwise.backend.modules.seating.domain.GuestAssignment;

public record AssignmentSnapshot(UUID guestId, UUID tableId, Integer seatNumber) {

    public static AssignmentSnapshot of(GuestAssignment assignment) {
        return new AssignmentSnapshot(assignment.getGuestId(), assignment.getTableId(), assignment.getSeatNumber());
    }
}
