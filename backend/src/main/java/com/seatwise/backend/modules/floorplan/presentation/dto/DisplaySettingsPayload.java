package com.seatwise.backend.modules.floorplan.presentation.dto;

import com.seatwise.backend.modules.floorplan.domain.DimensionUnit;
import com.seatwise.backend.modules.floorplan.domain.FloorPlanDisplaySettings;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

public record DisplaySettingsPayload(
        Boolean showGrid,
        @Min(10) @Max(100) Integer gridSize,
        @DecimalMin("0.1") @DecimalMax("5.0") Double zoomLevel,
        Integer panX,
        Integer panY,
        DimensionUnit dimensionUnit,
        @DecimalMin("1") @DecimalMax("500") Double hallWidth,
        @DecimalMin("1") @DecimalMax("500") Double hallHeight,
        @DecimalMin("10") @DecimalMax("100") Double pixelsPerUnit
) {

    public static DisplaySettingsPayload from(FloorPlanDisplaySettings settings) {
        return new DisplaySettingsPayload(
                settings.isShowGrid(),
                settings.getGridSize(),
                settings.getZoomLevel(),
                settings.getPanX(),
                settings.getPanY(),
                settings.getDimensionUnit(),
                settings.getHallWidth(),
                settings.getHallHeight(),
                settings.getPixelsPerUnit()
        );
    }

    /**
     * Copies the non-null fields onto {@code target}.
     */
    public void applyTo(FloorPlanDisplaySettings target) {
        if (showGrid != null) {
            target.setShowGrid(showGrid);
        }
        if (gridSize != null) {
            target.setGridSize(gridSize);
        }
        if (zoomLevel != null) {
            target.setZoomLevel(zoomLevel);
        }
        if (panX != null) {
            target.setPanX(panX);
        }
        if (panY != null) {
            target.setPanY(panY);
        }
        if (dimensionUnit != null) {
            target.setDimensionUnit(dimensionUnit);
        }
        if (hallWidth != null) {
            target.setHallWidth(hallWidth);
        }
        if (hallHeight != null) {
            target.setHallHeight(hallHeight);
        }
        if (pixelsPerUnit != null) {
            target.setPixelsPerUnit(pixelsPerUnit);
        }
    }
}
