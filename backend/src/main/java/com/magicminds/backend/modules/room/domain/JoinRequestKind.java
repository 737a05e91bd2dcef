package com.magicminds.backend.modules.room.domain;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

public enum JoinRequestKind {
    /** Issued by the host to a friend. */
    INVITATION,
    /** Asked for by a child who knows the room code. */
    REQUEST;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
