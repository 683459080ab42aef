package com.seatwise.backend.modules.seating.presentation.dto;

import java.util.UUID;

import com.seatwise.backend.modules.guest.domain.Guest;

public record UnassignedGuestResponse(UUID id, String firstName, String lastName, String displayName) {

    public static UnassignedGuestResponse from(Guest guest) {
        return new UnassignedGuestResponse(guest.getId(), guest.getFirstName(), guest.getLastName(), guest.getDisplayName());
    }
}
