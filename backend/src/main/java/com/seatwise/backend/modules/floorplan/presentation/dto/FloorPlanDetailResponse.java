package com.seatwise.backend.modules.floorplan.presentation.dto;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.seatwise.backend.modules.seating.presentation.dto.AssignmentResponse;

public record FloorPlanDetailResponse(
        FloorPlanResponse floorPlan,
        List<SeatingTableResponse> tables,
        List<AssignmentResponse> assignments,
        Map<UUID, List<String>> tableConflicts
) {
}
