package com.seatwise.backend.modules.changelog.application;

import java.util.UUID;

/**
 * Outcome of a change-log write. A skipped write never fails the seating operation that requested it.
 */
public record ChangeLogResult(boolean recorded, UUID entryId, String skipReason) {

    public static ChangeLogResult recorded(UUID entryId) {
        return new ChangeLogResult(true, entryId, null);
    }

    public static ChangeLogResult skipped(String reason) {
        return new ChangeLogResult(false, null, reason);
    }
}
