package com.seatwise.backend.modules.floorplan.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

@Embeddable
public class TableStyle {

    public static final int DEFAULT_MIN_CAPACITY = 4;
    public static final String DEFAULT_FILL_COLOR = "#3B82F6";

    @Column(name = "min_capacity", nullable = false)
    private int minCapacity = DEFAULT_MIN_CAPACITY;

    @Column(name = "fill_color", nullable = false, length = 7)
    private String fillColor = DEFAULT_FILL_COLOR;

    @Column(name = "is_vip", nullable = false)
    private boolean vip;

    protected TableStyle() {
    }

    public TableStyle(int minCapacity, String fillColor, boolean vip) {
        this.minCapacity = minCapacity;
        this.fillColor = fillColor;
        this.vip = vip;
    }

    public static TableStyle defaults() {
        return new TableStyle(DEFAULT_MIN_CAPACITY, DEFAULT_FILL_COLOR, false);
    }

    public int getMinCapacity() {
        return minCapacity;
    }

    public String getFillColor() {
        return fillColor;
    }

    public boolean isVip() {
        return vip;
    }

    public TableStyle withMinCapacity(int value) {
        return new TableStyle(value, fillColor, vip);
    }

    public TableStyle withFillColor(String value) {
        return new TableStyle(minCapacity, value, vip);
    }

    public TableStyle withVip(boolean value) {
        return new TableStyle(minCapacity, fillColor, value);
    }
}
