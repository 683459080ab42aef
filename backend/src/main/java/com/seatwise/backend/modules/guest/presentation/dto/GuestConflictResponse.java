package com.seatwise.backend.modules.guest.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.seatwise.backend.modules.guest.domain.ConflictSeverity;
import com.seatwise.backend.modules.guest.domain.ConflictType;
import com.seatwise.backend.modules.guest.domain.GuestConflict;

public record GuestConflictResponse(
        UUID id,
        UUID clientId,
        UUID guestOneId,
        UUID guestTwoId,
        ConflictType conflictType,
        ConflictSeverity severity,
        String reason,
        boolean active,
        UUID createdBy,
        OffsetDateTime createdAt
) {

    public static GuestConflictResponse from(GuestConflict conflict) {
        return new GuestConflictResponse(
                conflict.getId(),
                conflict.getClientId(),
                conflict.getGuestOneId(),
                conflict.getGuestTwoId(),
                conflict.getConflictType(),
                conflict.getSeverity(),
                conflict.getReason(),
                conflict.isActive(),
                conflict.getCreatedBy(),
                conflict.getCreatedAt()
        );
    }
}
