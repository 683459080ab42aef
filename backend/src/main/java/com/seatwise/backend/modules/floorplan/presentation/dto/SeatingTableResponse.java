package com.seatwise.backend.modules.floorplan.presentation.dto;

import java.util.UUID;

import com.seatwise.backend.modules.floorplan.domain.SeatingTable;
import com.seatwise.backend.modules.floorplan.domain.TableShape;

public record SeatingTableResponse(
        UUID id,
        UUID floorPlanId,
        int tableNumber,
        String tableName,
        TableShape shape,
        int x,
        int y,
        int width,
        int height,
        int rotation,
        int capacity,
        int minCapacity,
        String fillColor,
        boolean vip
) {

    public static SeatingTableResponse from(SeatingTable table) {
        return new SeatingTableResponse(
                table.getId(),
                table.getFloorPlanId(),
                table.getTableNumber(),
                table.getTableName(),
                table.getShape(),
                table.getX(),
                table.getY(),
                table.getWidth(),
                table.getHeight(),
                table.getRotation(),
                table.getCapacity(),
                table.getStyle().getMinCapacity(),
                table.getStyle().getFillColor(),
                table.getStyle().isVip()
        );
    }
}
