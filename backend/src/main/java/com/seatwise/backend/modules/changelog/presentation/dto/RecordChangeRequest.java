package com.seatwise.backend.modules.changelog.presentation.dto;

import java.util.Map;
import java.util.UUID;

import com.seatwise.backend.modules.changelog.domain.ChangeAction;

import jakarta.validation.constraints.NotNull;

public record RecordChangeRequest(
        @NotNull ChangeAction action,
        UUID guestId,
        UUID tableId,
        Map<String, Object> previousState,
        Map<String, Object> newState
) {
}
