package com.seatwise.backend.modules.floorplan.presentation.dto;

import com.seatwise.backend.modules.floorplan.domain.SeatingTable;
import com.seatwise.backend.modules.floorplan.domain.TableShape;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Omitted numbers fall back to the table defaults; an omitted table number takes the next free one.
 */
public record AddTableRequest(
        @Min(1) Integer tableNumber,
        @Size(max = 100) String tableName,
        @NotNull TableShape shape,
        @NotNull Integer x,
        @NotNull Integer y,
        @Min(1) Integer width,
        @Min(1) Integer height,
        @Min(-180) @Max(180) Integer rotation,
        @Min(SeatingTable.MIN_CAPACITY) @Max(SeatingTable.MAX_CAPACITY) Integer capacity,
        @Min(1) Integer minCapacity,
        @Pattern(regexp = "^#[0-9A-Fa-f]{6}$") String fillColor,
        Boolean vip
) {
}
