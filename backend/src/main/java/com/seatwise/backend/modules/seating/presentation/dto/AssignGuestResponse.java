package com.seatwise.backend.modules.seating.presentation.dto;

import java.util.List;

public record AssignGuestResponse(
        AssignmentResponse assignment,
        List<SeatedGuest> conflicts,
        boolean hasConflicts
) {
}
