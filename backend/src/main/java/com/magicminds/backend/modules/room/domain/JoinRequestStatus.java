package com.magicminds.backend.modules.room.domain;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

public enum JoinRequestStatus {
    PENDING,
    APPROVED,
    DENIED;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
