package com.seatwise.backend.modules.floorplan.presentation.dto;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.seatwise.backend.modules.floorplan.domain.FloorPlan;

public record FloorPlanResponse(
        UUID id,
        UUID clientId,
        String name,
        int canvasWidth,
        int canvasHeight,
        String backgroundImageUrl,
        String venueName,
        LocalDate eventDate,
        DisplaySettingsPayload displaySettings,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static FloorPlanResponse from(FloorPlan floorPlan) {
        return new FloorPlanResponse(
                floorPlan.getId(),
                floorPlan.getClientId(),
                floorPlan.getName(),
                floorPlan.getCanvasWidth(),
                floorPlan.getCanvasHeight(),
                floorPlan.getBackgroundImageUrl(),
                floorPlan.getVenueName(),
                floorPlan.getEventDate(),
                DisplaySettingsPayload.from(floorPlan.getDisplaySettings()),
                floorPlan.getCreatedAt(),
                floorPlan.getUpdatedAt()
        );
    }
}
