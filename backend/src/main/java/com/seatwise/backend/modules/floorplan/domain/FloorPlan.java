package com.seatwise.backend.modules.floorplan.domain;

import java.time.LocalDate;
import java.util.UUID;

import com.seatwise.backend.global.jpa.AbstractTimestampedEntity;
import com.seatwise.backend.modules.client.domain.Client;

import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "floor_plan")
public class FloorPlan extends AbstractTimestampedEntity {

    public static final int DEFAULT_CANVAS_WIDTH = 1200;
    public static final int DEFAULT_CANVAS_HEIGHT = 800;

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "client_id", nullable = false, updatable = false)
    private Client client;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Column(name = "canvas_width", nullable = false)
    private int canvasWidth = DEFAULT_CANVAS_WIDTH;

    @Column(name = "canvas_height", nullable = false)
    private int canvasHeight = DEFAULT_CANVAS_HEIGHT;

    @Column(name = "background_image_url", length = 2048)
    private String backgroundImageUrl;

    @Column(name = "venue_name", length = 200)
    private String venueName;

    @Column(name = "event_date")
    private LocalDate eventDate;

    @Embedded
    private FloorPlanDisplaySettings displaySettings = new FloorPlanDisplaySettings();

    public UUID getId() {
        return id;
    }

    public Client getClient() {
        return client;
    }

    public void setClient(Client client) {
        this.client = client;
    }

    public UUID getClientId() {
        return client != null ? client.getId() : null;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public int getCanvasWidth() {
        return canvasWidth;
    }

    public void setCanvasWidth(int canvasWidth) {
        this.canvasWidth = canvasWidth;
    }

    public int getCanvasHeight() {
        return canvasHeight;
    }

    public void setCanvasHeight(int canvasHeight) {
        this.canvasHeight = canvasHeight;
    }

    public String getBackgroundImageUrl() {
        return backgroundImageUrl;
    }

    public void setBackgroundImageUrl(String backgroundImageUrl) {
        this.backgroundImageUrl = backgroundImageUrl;
    }

    public String getVenueName() {
        return venueName;
    }

    public void setVenueName(String venueName) {
        this.venueName = venueName;
    }

    public LocalDate getEventDate() {
        return eventDate;
    }

    public void setEventDate(LocalDate eventDate) {
        this.eventDate = eventDate;
    }

    public FloorPlanDisplaySettings getDisplaySettings() {
        if (displaySettings == null) {
            displaySettings = new FloorPlanDisplaySettings();
        }
        return displaySettings;
    }
}
