package com.magicminds.backend.modules.friend.domain;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FriendEdgeStatus {
    PENDING,
    ACCEPTED,
    BLOCKED;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
