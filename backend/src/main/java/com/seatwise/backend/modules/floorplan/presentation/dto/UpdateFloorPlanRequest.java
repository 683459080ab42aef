package com.seatwise.backend.modules.floorplan.presentation.dto;

import java.time.LocalDate;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record UpdateFloorPlanRequest(
        @Size(min = 1, max = 100) String name,
        @Size(max = 200) String venueName,
        LocalDate eventDate,
        @Size(max = 2048) @Pattern(regexp = "^https?://.+", message = "must be an http(s) URL") String backgroundImageUrl,
        @Min(400) @Max(5000) Integer canvasWidth,
        @Min(300) @Max(4000) Integer canvasHeight,
        @Valid DisplaySettingsPayload displaySettings
) {
}
