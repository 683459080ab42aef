package com.seatwise.backend.modules.changelog.presentation.dto;

import java.util.UUID;

import com.seatwise.backend.modules.changelog.application.ChangeLogResult;

public record RecordChangeResponse(boolean recorded, UUID entryId, String skipReason) {

    public static RecordChangeResponse from(ChangeLogResult result) {
        return new RecordChangeResponse(result.recorded(), result.entryId(), result.skipReason());
    }
}
