package com.seatwise.backend.modules.guest.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.seatwise.backend.modules.guest.domain.GuestPreference;
import com.seatwise.backend.modules.guest.domain.PreferenceStrength;
import com.seatwise.backend.modules.guest.domain.PreferenceType;

public record GuestPreferenceResponse(
        UUID id,
        UUID clientId,
        UUID guestOneId,
        UUID guestTwoId,
        PreferenceType preferenceType,
        PreferenceStrength strength,
        String reason,
        boolean active,
        UUID createdBy,
        OffsetDateTime createdAt
) {

    public static GuestPreferenceResponse from(GuestPreference preference) {
        return new GuestPreferenceResponse(
                preference.getId(),
                preference.getClientId(),
                preference.getGuestOneId(),
                preference.getGuestTwoId(),
                preference.getPreferenceType(),
                preference.getStrength(),
                preference.getReason(),
                preference.isActive(),
                preference.getCreatedBy(),
                preference.getCreatedAt()
        );
    }
}
