package com.magicminds.backend.modules.room.domain;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Stored lifecycle of a room. Transitions only move forward; a deleted room has no stored status.
 */
public enum RoomStatus {
    WAITING,
    PLAYING,
    FINISHED;

    public boolean canTransitionTo(RoomStatus next) {
        return next != null && next.ordinal() > ordinal();
    }

    public boolean isTerminal() {
        return this == FINISHED;
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RoomStatus fromWireValue(String value) {
        if (value == null) {
            return null;
        }
        return RoomStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
