package com.seatwise.backend.modules.seating.application;

import java.util.UUID;

import com.seatwise.backend.global.error.ProblemException;
import com.seatwise.backend.modules.floorplan.domain.SeatingTable;

import org.springframework.http.HttpStatus;

/**
 * Error codes shared by every path that places guests at tables.
 */
public final class SeatingProblems {

    public static final String TABLE_CAPACITY_EXCEEDED = "TABLE_CAPACITY_EXCEEDED";

    private SeatingProblems() {
    }

    public static ProblemException floorPlanNotFound(UUID floorPlanId) {
        return new ProblemException(HttpStatus.NOT_FOUND, "FLOOR_PLAN_NOT_FOUND",
                "Floor plan " + floorPlanId + " not found");
    }

    public static ProblemException tableNotFound(UUID tableId) {
        return new ProblemException(HttpStatus.NOT_FOUND, "TABLE_NOT_FOUND",
                "Table " + tableId + " not found on this floor plan");
    }

    public static ProblemException guestNotFound(UUID guestId) {
        return new ProblemException(HttpStatus.NOT_FOUND, "GUEST_NOT_FOUND", "Guest " + guestId + " not found");
    }

    public static ProblemException capacityExceeded(SeatingTable table) {
        return new ProblemException(HttpStatus.CONFLICT, TABLE_CAPACITY_EXCEEDED,
                table.getDisplayLabel() + " is at full capacity (" + table.getCapacity() + " seats)");
    }
}
