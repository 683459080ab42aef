package com.seatwise.backend.modules.seating.presentation.dto;

import java.util.UUID;

import com.seatwise.backend.modules.guest.domain.Guest;

public record SeatedGuest(UUID guestId, String name) {

    public static SeatedGuest from(Guest guest) {
        return new SeatedGuest(guest.getId(), guest.getDisplayName());
    }
}
