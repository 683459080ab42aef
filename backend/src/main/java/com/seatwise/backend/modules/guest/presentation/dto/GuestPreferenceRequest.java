package com.seatwise.backend.modules.guest.presentation.dto;

import java.util.UUID;

import com.seatwise.backend.modules.guest.domain.PreferenceStrength;
import com.seatwise.backend.modules.guest.domain.PreferenceType;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record GuestPreferenceRequest(
        @NotNull UUID guestOneId,
        @NotNull UUID guestTwoId,
        PreferenceType preferenceType,
        PreferenceStrength strength,
        @Size(max = 500) String reason
) {
}
