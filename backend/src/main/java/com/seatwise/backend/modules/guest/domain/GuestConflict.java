package com.seatwise.backend.modules.guest.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Table;

/**
 * "Must not be seated together."
 */
@Entity
@Table(name = "guest_conflict")
public class GuestConflict extends GuestRelationship {

    @Enumerated(EnumType.STRING)
    @Column(name = "conflict_type", nullable = false, length = 32)
    private ConflictType conflictType = ConflictType.GENERAL;

    @Enumerated(EnumType.STRING)
    @Column(name = "severity", nullable = false, length = 16)
    private ConflictSeverity severity = ConflictSeverity.MODERATE;

    public ConflictType getConflictType() {
        return conflictType;
    }

    public void setConflictType(ConflictType conflictType) {
        this.conflictType = conflictType;
    }

    public ConflictSeverity getSeverity() {
        return severity;
    }

    public void setSeverity(ConflictSeverity severity) {
        this.severity = severity;
    }
}
