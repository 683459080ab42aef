package com.seatwise.backend.modules.guest.domain;

public enum ConflictType {
    GENERAL,
    FAMILY_DRAMA,
    EX_PARTNER,
    BUSINESS_DISPUTE,
    PERSONAL
}
