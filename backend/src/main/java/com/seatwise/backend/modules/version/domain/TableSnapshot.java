package com.seatwise.backend.modules.version.domain;

import java.util.UUID;

import com.seatwise.backend.modules.floorplan.domain.SeatingTable;
import com.seatwise.backend.modules.floorplan.domain.TableShape;

public record TableSnapshot(
        UUID id,
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

    public static TableSnapshot of(SeatingTable table) {
        return new TableSnapshot(
                table.getId(),
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
