package com.seatwise.backend.modules.floorplan.domain;

public enum TableShape {
    ROUND,
    RECTANGLE,
    SQUARE
}
