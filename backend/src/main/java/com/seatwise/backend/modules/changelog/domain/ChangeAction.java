package com.seatwise.backend.modules.changelog.domain;

public enum ChangeAction {
    ASSIGN,
    UNASSIGN,
    MOVE_TABLE,
    ADD_TABLE,
    DELETE_TABLE,
    BATCH_ASSIGN,
    RESTORE_VERSION,
    SEATING_CONFLICT
}
