package com.seatwise.backend.modules.version.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

/**
 * Named snapshot of a floor plan's tables and assignments. Rows never change after insert
 * except for the current-version flag.
 */
@Entity
@Table(name = "seating_version")
public class SeatingVersion {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "floor_plan_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID floorPlanId;

    @Column(name = "version_number", nullable = false, updatable = false)
    private int versionNumber;

    @Column(name = "name", nullable = false, updatable = false, length = 100)
    private String name;

    @Column(name = "description", updatable = false, length = 1000)
    private String description;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "table_snapshot", nullable = false, updatable = false, columnDefinition = "jsonb")
    private TableLayoutSnapshot tableSnapshot;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "assignment_snapshot", nullable = false, updatable = false, columnDefinition = "jsonb")
    private AssignmentLayoutSnapshot assignmentSnapshot;

    @Column(name = "total_guests", nullable = false, updatable = false)
    private int totalGuests;

    @Column(name = "assigned_guests", nullable = false, updatable = false)
    private int assignedGuests;

    @Column(name = "total_tables", nullable = false, updatable = false)
    private int totalTables;

    @Column(name = "is_current", nullable = false)
    private boolean currentVersion;

    @Column(name = "is_auto_save", nullable = false, updatable = false)
    private boolean autoSave;

    @Column(name = "created_by", updatable = false, columnDefinition = "uuid")
    private UUID createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    public UUID getId() {
        return id;
    }

    public UUID getFloorPlanId() {
        return floorPlanId;
    }

    public void setFloorPlanId(UUID floorPlanId) {
        this.floorPlanId = floorPlanId;
    }

    public int getVersionNumber() {
        return versionNumber;
    }

    public void setVersionNumber(int versionNumber) {
        this.versionNumber = versionNumber;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public TableLayoutSnapshot getTableSnapshot() {
        return tableSnapshot;
    }

    public void setTableSnapshot(TableLayoutSnapshot tableSnapshot) {
        this.tableSnapshot = tableSnapshot;
    }

    public AssignmentLayoutSnapshot getAssignmentSnapshot() {
        return assignmentSnapshot;
    }

    public void setAssignmentSnapshot(AssignmentLayoutSnapshot assignmentSnapshot) {
        this.assignmentSnapshot = assignmentSnapshot;
    }

    public int getTotalGuests() {
        return totalGuests;
    }

    public void setTotalGuests(int totalGuests) {
        this.totalGuests = totalGuests;
    }

    public int getAssignedGuests() {
        return assignedGuests;
    }

    public void setAssignedGuests(int assignedGuests) {
        this.assignedGuests = assignedGuests;
    }

    public int getTotalTables() {
        return totalTables;
    }

    public void setTotalTables(int totalTables) {
        this.totalTables = totalTables;
    }

    public boolean isCurrent() {
        return currentVersion;
    }

    public void setCurrent(boolean current) {
        this.currentVersion = current;
    }

    public boolean isAutoSave() {
        return autoSave;
    }

    public void setAutoSave(boolean autoSave) {
        this.autoSave = autoSave;
    }

    public UUID getCreatedBy() {
        return createdBy;
    }

    public void setCreatedBy(UUID createdBy) {
        this.createdBy = createdBy;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(OffsetDateTime createdAt) {
        this.createdAt = createdAt;
    }
}
