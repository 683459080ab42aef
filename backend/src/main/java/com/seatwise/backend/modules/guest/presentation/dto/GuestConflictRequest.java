package com.seatwise.backend.modules.guest.presentation.dto;

import java.util.UUID;

import com.seatwise.backend.modules.guest.domain.ConflictSeverity;
import com.seatwise.backend.modules.guest.domain.ConflictType;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record GuestConflictRequest(
        @NotNull UUID guestOneId,
        @NotNull UUID guestTwoId,
        ConflictType conflictType,
        ConflictSeverity severity,
        @Size(max = 500) String reason
) {
}
