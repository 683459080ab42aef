package com.seatwise.backend.modules.version.domain;

import java.util.List;

public record AssignmentLayoutSnapshot(List<AssignmentSnapshot> assignments) {

    public AssignmentLayoutSnapshot {
        assignments = assignments == null ? List.of() : List.copyOf(assignments);
    }
}
