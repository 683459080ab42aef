package com.seatwise.backend.modules.seating.domain;

import java.util.UUID;

import com.seatwise.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * Seats one guest at one table of a floor plan. A guest has at most one row per floor plan.
 */
@Entity
@Table(name = "guest_assignment")
public class GuestAssignment extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "floor_plan_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID floorPlanId;

    @Column(name = "table_id", nullable = false, columnDefinition = "uuid")
    private UUID tableId;

    @Column(name = "guest_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID guestId;

    @Column(name = "seat_number")
    private Integer seatNumber;

    protected GuestAssignment() {
    }

    public GuestAssignment(UUID floorPlanId, UUID tableId, UUID guestId, Integer seatNumber) {
        this.floorPlanId = floorPlanId;
        this.tableId = tableId;
        this.guestId = guestId;
        this.seatNumber = seatNumber;
    }

    public UUID getId() {
        return id;
    }

    public UUID getFloorPlanId() {
        return floorPlanId;
    }

    public UUID getTableId() {
        return tableId;
    }

    public UUID getGuestId() {
        return guestId;
    }

    public Integer getSeatNumber() {
        return seatNumber;
    }
}
