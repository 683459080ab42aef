package com.seatwise.backend.modules.seating.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/**
 * {@code force} skips the advisory conflict check. It never bypasses capacity.
 */
public record AssignGuestRequest(
        @NotNull UUID tableId,
        @NotNull UUID guestId,
        @Min(1) Integer seatNumber,
        boolean force
) {
}
