package com.seatwise.backend.modules.changelog.presentation.dto;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import com.seatwise.backend.modules.changelog.domain.ChangeAction;
import com.seatwise.backend.modules.changelog.domain.SeatingChangeLogEntry;

public record ChangeLogEntryResponse(
        UUID id,
        UUID floorPlanId,
        ChangeAction action,
        UUID guestId,
        UUID tableId,
        Map<String, Object> previousState,
        Map<String, Object> newState,
        UUID changedBy,
        OffsetDateTime changedAt
) {

    public static ChangeLogEntryResponse from(SeatingChangeLogEntry entry) {
        return new ChangeLogEntryResponse(
                entry.getId(),
                entry.getFloorPlanId(),
                entry.getAction(),
                entry.getGuestId(),
                entry.getTableId(),
                entry.getPreviousState(),
                entry.getNewState(),
                entry.getChangedBy(),
                entry.getChangedAt()
        );
    }
}
