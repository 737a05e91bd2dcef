package com.magicminds.backend.modules.voice.domain;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SubscriptionStatus {
    ACTIVE,
    INACTIVE,
    CANCELLED,
    PAST_DUE;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SubscriptionStatus fromWireValue(String value) {
        if (value == null) {
            return null;
        }
        return SubscriptionStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
