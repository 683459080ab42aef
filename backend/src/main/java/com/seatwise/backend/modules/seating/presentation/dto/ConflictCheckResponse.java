package com.seatwise.backend.modules.seating.presentation.dto;

import java.util.List;

public record ConflictCheckResponse(
        List<SeatedGuest> conflicts,
        List<SeatedGuest> preferences,
        boolean hasConflicts,
        boolean hasPreferences
) {

    public static ConflictCheckResponse of(List<SeatedGuest> conflicts, List<SeatedGuest> preferences) {
        return new ConflictCheckResponse(
                List.copyOf(conflicts),
                List.copyOf(preferences),
                !conflicts.isEmpty(),
                !preferences.isEmpty()
        );
    }

    public static ConflictCheckResponse empty() {
        return of(List.of(), List.of());
    }
}
