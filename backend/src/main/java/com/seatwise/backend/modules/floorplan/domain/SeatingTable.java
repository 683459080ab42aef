package com.seatwise.backend.modules.floorplan.domain;

import java.util.UUID;

import com.seatwise.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * A table placed on a floor plan. {@code capacity} is the hard seat limit every assignment path enforces.
 */
@Entity
@Table(name = "seating_table")
public class SeatingTable extends AbstractTimestampedEntity {

    public static final int MIN_CAPACITY = 1;
    public static final int MAX_CAPACITY = 20;
    public static final int DEFAULT_CAPACITY = 8;
    public static final int DEFAULT_SIZE = 100;

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "floor_plan_id", nullable = false, updatable = false)
    private FloorPlan floorPlan;

    @Column(name = "table_number", nullable = false)
    private int tableNumber;

    @Column(name = "table_name", length = 100)
    private String tableName;

    @Enumerated(EnumType.STRING)
    @Column(name = "shape", nullable = false, length = 16)
    private TableShape shape = TableShape.ROUND;

    @Column(name = "x", nullable = false)
    private int x;

    @Column(name = "y", nullable = false)
    private int y;

    @Column(name = "width", nullable = false)
    private int width = DEFAULT_SIZE;

    @Column(name = "height", nullable = false)
    private int height = DEFAULT_SIZE;

    @Column(name = "rotation", nullable = false)
    private int rotation;

    @Column(name = "capacity", nullable = false)
    private int capacity = DEFAULT_CAPACITY;

    @Embedded
    private TableStyle style = TableStyle.defaults();

    public UUID getId() {
        return id;
    }

    public FloorPlan getFloorPlan() {
        return floorPlan;
    }

    public void setFloorPlan(FloorPlan floorPlan) {
        this.floorPlan = floorPlan;
    }

    public UUID getFloorPlanId() {
        return floorPlan != null ? floorPlan.getId() : null;
    }

    public boolean belongsTo(UUID floorPlanId) {
        return floorPlanId != null && floorPlanId.equals(getFloorPlanId());
    }

    public int getTableNumber() {
        return tableNumber;
    }

    public void setTableNumber(int tableNumber) {
        this.tableNumber = tableNumber;
    }

    public String getTableName() {
        return tableName;
    }

    public void setTableName(String tableName) {
        this.tableName = tableName;
    }

    /**
     * Name shown in capacity errors: the custom name, else "Table N".
     */
    public String getDisplayLabel() {
        if (tableName != null && !tableName.isBlank()) {
            return tableName;
        }
        return "Table " + tableNumber;
    }

    public TableShape getShape() {
        return shape;
    }

    public void setShape(TableShape shape) {
        this.shape = shape;
    }

    public int getX() {
        return x;
    }

    public int getY() {
        return y;
    }

    public void moveTo(int x, int y) {
        this.x = x;
        this.y = y;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public void resize(int width, int height) {
        this.width = width;
        this.height = height;
    }

    public int getRotation() {
        return rotation;
    }

    public void setRotation(int rotation) {
        this.rotation = rotation;
    }

    public int getCapacity() {
        return capacity;
    }

    public void setCapacity(int capacity) {
        if (capacity < MIN_CAPACITY) {
            throw new IllegalArgumentException("capacity must be at least " + MIN_CAPACITY);
        }
        this.capacity = capacity;
    }

    public TableStyle getStyle() {
        if (style == null) {
            style = TableStyle.defaults();
        }
        return style;
    }

    public void setStyle(TableStyle style) {
        this.style = style;
    }
}
