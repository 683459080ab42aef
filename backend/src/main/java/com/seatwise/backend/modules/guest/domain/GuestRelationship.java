package com.seatwise.backend.modules.guest.domain;

import java.util.UUID;

import com.seatwise.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Id;
import jakarta.persistence.MappedSuperclass;

import org.hibernate.annotations.UuidGenerator;

/**
 * Undirected edge between two guests of one client. Rows are never hard-deleted;
 * removal flips {@code active} so that history survives and re-adding reactivates the same row.
 */
@MappedSuperclass
public abstract class GuestRelationship extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "client_id", nullable = false, columnDefinition = "uuid")
    private UUID clientId;

    @Column(name = "guest_one_id", nullable = false, columnDefinition = "uuid")
    private UUID guestOneId;

    @Column(name = "guest_two_id", nullable = false, columnDefinition = "uuid")
    private UUID guestTwoId;

    @Column(name = "reason")
    private String reason;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "created_by", columnDefinition = "uuid")
    private UUID createdBy;

    public UUID getId() {
        return id;
    }

    public UUID getClientId() {
        return clientId;
    }

    public void setClientId(UUID clientId) {
        this.clientId = clientId;
    }

    public UUID getGuestOneId() {
        return guestOneId;
    }

    public UUID getGuestTwoId() {
        return guestTwoId;
    }

    public GuestPair getPair() {
        return new GuestPair(guestOneId, guestTwoId);
    }

    public void setPair(GuestPair pair) {
        this.guestOneId = pair.first();
        this.guestTwoId = pair.second();
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public UUID getCreatedBy() {
        return createdBy;
    }

    public void setCreatedBy(UUID createdBy) {
        this.createdBy = createdBy;
    }

    public UUID otherGuest(UUID guestId) {
        return getPair().other(guestId);
    }
}
