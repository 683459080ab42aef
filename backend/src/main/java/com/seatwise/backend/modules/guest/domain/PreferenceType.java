package com.seatwise.backend.modules.guest.domain;

public enum PreferenceType {
    TOGETHER,
    NEARBY,
    SAME_AREA
}
