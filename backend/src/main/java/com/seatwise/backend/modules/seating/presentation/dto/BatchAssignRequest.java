package com.seatwise.backend.modules.seating.presentation.dto;

import java.util.List;
import java.util.UUID;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

public record BatchAssignRequest(
        @NotNull List<@Valid Item> assignments
) {

    public record Item(
            @NotNull UUID tableId,
            @NotNull UUID guestId,
            @Min(1) Integer seatNumber
    ) {
    }
}
