package com.seatwise.backend.modules.version.presentation.dto;

import java.util.List;

import com.seatwise.backend.modules.version.domain.AssignmentSnapshot;
import com.seatwise.backend.modules.version.domain.SeatingVersion;
import com.seatwise.backend.modules.version.domain.TableSnapshot;

public record VersionDetailResponse(
        VersionSummaryResponse version,
        List<TableSnapshot> tables,
        List<AssignmentSnapshot> assignments
) {

    public static VersionDetailResponse from(SeatingVersion version) {
        return new VersionDetailResponse(
                VersionSummaryResponse.from(version),
                version.getTableSnapshot().tables(),
                version.getAssignmentSnapshot().assignments()
        );
    }
}
