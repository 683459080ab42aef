package com.seatwise.backend.modules.guest.domain;

public enum PreferenceStrength {
    REQUIRED,
    PREFERRED,
    NICE_TO_HAVE
}
