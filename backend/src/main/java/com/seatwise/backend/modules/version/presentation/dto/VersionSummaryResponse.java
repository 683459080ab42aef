package com.seatwise.backend.modules.version.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.seatwise.backend.modules.version.domain.SeatingVersion;

public record VersionSummaryResponse(
        UUID id,
        UUID floorPlanId,
        int versionNumber,
        String name,
        String description,
        int totalGuests,
        int assignedGuests,
        int totalTables,
        boolean current,
        boolean autoSave,
        UUID createdBy,
        OffsetDateTime createdAt
) {

    public static VersionSummaryResponse from(SeatingVersion version) {
        return new VersionSummaryResponse(
                version.getId(),
                version.getFloorPlanId(),
                version.getVersionNumber(),
                version.getName(),
                version.getDescription(),
                version.getTotalGuests(),
                version.getAssignedGuests(),
                version.getTotalTables(),
                version.isCurrent(),
                version.isAutoSave(),
                version.getCreatedBy(),
                version.getCreatedAt()
        );
    }
}
