package com.seatwise.backend.modules.floorplan.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;

/**
 * Editor canvas preferences stored alongside the floor plan. Never interpreted by the engine.
 */
@Embeddable
public class FloorPlanDisplaySettings {

    @Column(name = "show_grid", nullable = false)
    private boolean showGrid = true;

    @Column(name = "grid_size", nullable = false)
    private int gridSize = 20;

    @Column(name = "zoom_level", nullable = false)
    private double zoomLevel = 1.0;

    @Column(name = "pan_x", nullable = false)
    private int panX;

    @Column(name = "pan_y", nullable = false)
    private int panY;

    @Enumerated(EnumType.STRING)
    @Column(name = "dimension_unit", nullable = false, length = 16)
    private DimensionUnit dimensionUnit = DimensionUnit.FEET;

    @Column(name = "hall_width")
    private Double hallWidth;

    @Column(name = "hall_height")
    private Double hallHeight;

    @Column(name = "pixels_per_unit")
    private Double pixelsPerUnit;

    public boolean isShowGrid() {
        return showGrid;
    }

    public void setShowGrid(boolean showGrid) {
        this.showGrid = showGrid;
    }

    public int getGridSize() {
        return gridSize;
    }

    public void setGridSize(int gridSize) {
        this.gridSize = gridSize;
    }

    public double getZoomLevel() {
        return zoomLevel;
    }

    public void setZoomLevel(double zoomLevel) {
        this.zoomLevel = zoomLevel;
    }

    public int getPanX() {
        return panX;
    }

    public void setPanX(int panX) {
        this.panX = panX;
    }

    public int getPanY() {
        return panY;
    }

    public void setPanY(int panY) {
        this.panY = panY;
    }

    public DimensionUnit getDimensionUnit() {
        return dimensionUnit;
    }

    public void setDimensionUnit(DimensionUnit dimensionUnit) {
        this.dimensionUnit = dimensionUnit;
    }

    public Double getHallWidth() {
        return hallWidth;
    }

    public void setHallWidth(Double hallWidth) {
        this.hallWidth = hallWidth;
    }

    public Double getHallHeight() {
        return hallHeight;
    }

    public void setHallHeight(Double hallHeight) {
        this.hallHeight = hallHeight;
    }

    public Double getPixelsPerUnit() {
        return pixelsPerUnit;
    }

    public void setPixelsPerUnit(Double pixelsPerUnit) {
        this.pixelsPerUnit = pixelsPerUnit;
    }
}
