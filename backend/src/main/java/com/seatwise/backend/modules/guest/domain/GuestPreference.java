package com.seatwise.backend.modules.guest.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Table;

/**
 * "Should be seated together or near each other."
 */
@Entity
@Table(name = "guest_preference")
public class GuestPreference extends GuestRelationship {

    @Enumerated(EnumType.STRING)
    @Column(name = "preference_type", nullable = false, length = 32)
    private PreferenceType preferenceType = PreferenceType.TOGETHER;

    @Enumerated(EnumType.STRING)
    @Column(name = "strength", nullable = false, length = 16)
    private PreferenceStrength strength = PreferenceStrength.PREFERRED;

    public PreferenceType getPreferenceType() {
        return preferenceType;
    }

    public void setPreferenceType(PreferenceType preferenceType) {
        this.preferenceType = preferenceType;
    }

    public PreferenceStrength getStrength() {
        return strength;
    }

    public void setStrength(PreferenceStrength strength) {
        this.strength = strength;
    }
}
