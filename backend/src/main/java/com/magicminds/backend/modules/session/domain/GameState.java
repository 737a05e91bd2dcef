package com.magicminds.backend.modules.session.domain;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum GameState {
    ACTIVE,
    PAUSED,
    FINISHED;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static GameState fromWireValue(String value) {
        if (value == null) {
            return null;
        }
        return GameState.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
