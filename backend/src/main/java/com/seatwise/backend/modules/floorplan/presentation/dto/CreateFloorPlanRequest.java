package com.seatwise.backend.modules.floorplan.presentation.dto;

import java.time.LocalDate;
import java.util.UUID;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CreateFloorPlanRequest(
        @NotNull UUID clientId,
        @NotBlank @Size(max = 100) String name,
        @Size(max = 200) String venueName,
        LocalDate eventDate,
        @Min(800) @Max(2400) Integer canvasWidth,
        @Min(600) @Max(1600) Integer canvasHeight,
        @Valid DisplaySettingsPayload displaySettings
) {
}
