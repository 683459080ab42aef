package com.seatwise.backend.modules.seating.presentation.dto;

import java.util.UUID;

import com.seatwise.backend.modules.seating.domain.GuestAssignment;

public record AssignmentResponse(UUID id, UUID floorPlanId, UUID tableId, UUID guestId, Integer seatNumber) {

    public static AssignmentResponse from(GuestAssignment assignment) {
        return new AssignmentResponse(
                assignment.getId(),
                assignment.getFloorPlanId(),
                assignment.getTableId(),
                assignment.getGuestId(),
                assignment.getSeatNumber()
        );
    }
}
