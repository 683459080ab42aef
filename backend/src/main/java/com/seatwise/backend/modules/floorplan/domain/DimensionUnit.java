package com.seatwise.backend.modules.floorplan.domain;

public enum DimensionUnit {
    FEET,
    METERS
}
