package com.seatwise.backend.modules.version.domain;

import java.util.List;

/**
 * JSON column wrapper; a top-level object keeps the column readable if fields are added later.
 */
public record TableLayoutSnapshot(List<TableSnapshot> tables) {

    public TableLayoutSnapshot {
        tables = tables == null ? List.of() : List.copyOf(tables);
    }
}
