package com.seatwise.backend.modules.changelog.domain;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

/**
 * Append-only audit row. Ids are plain columns so entries outlive the floor plan, table or guest they mention.
 */
@Entity
@Table(name = "seating_change_log")
public class SeatingChangeLogEntry {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "floor_plan_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID floorPlanId;

    @Enumerated(EnumType.STRING)
    @Column(name = "action", nullable = false, updatable = false, length = 32)
    private ChangeAction action;

    @Column(name = "guest_id", updatable = false, columnDefinition = "uuid")
    private UUID guestId;

    @Column(name = "table_id", updatable = false, columnDefinition = "uuid")
    private UUID tableId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "previous_state", updatable = false, columnDefinition = "jsonb")
    private Map<String, Object> previousState;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "new_state", updatable = false, columnDefinition = "jsonb")
    private Map<String, Object> newState;

    @Column(name = "changed_by", updatable = false, columnDefinition = "uuid")
    private UUID changedBy;

    @Column(name = "changed_at", nullable = false, updatable = false)
    private OffsetDateTime changedAt;

    public UUID getId() {
        return id;
    }

    public UUID getFloorPlanId() {
        return floorPlanId;
    }

    public void setFloorPlanId(UUID floorPlanId) {
        this.floorPlanId = floorPlanId;
    }

    public ChangeAction getAction() {
        return action;
    }

    public void setAction(ChangeAction action) {
        this.action = action;
    }

    public UUID getGuestId() {
        return guestId;
    }

    public void setGuestId(UUID guestId) {
        this.guestId = guestId;
    }

    public UUID getTableId() {
        return tableId;
    }

    public void setTableId(UUID tableId) {
        this.tableId = tableId;
    }

    public Map<String, Object> getPreviousState() {
        return previousState;
    }

    public void setPreviousState(Map<String, Object> previousState) {
        this.previousState = previousState;
    }

    public Map<String, Object> getNewState() {
        return newState;
    }

    public void setNewState(Map<String, Object> newState) {
        this.newState = newState;
    }

    public UUID getChangedBy() {
        return changedBy;
    }

    public void setChangedBy(UUID changedBy) {
        this.changedBy = changedBy;
    }

    public OffsetDateTime getChangedAt() {
        return changedAt;
    }

    public void setChangedAt(OffsetDateTime changedAt) {
        this.changedAt = changedAt;
    }
}
