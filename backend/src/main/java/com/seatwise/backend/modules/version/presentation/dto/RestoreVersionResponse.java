package com.seatwise.backend.modules.version.presentation.dto;

import java.util.UUID;

public record RestoreVersionResponse(
        UUID versionId,
        int versionNumber,
        int restoredTables,
        int restoredAssignments,
        int skippedTables
) {
}
