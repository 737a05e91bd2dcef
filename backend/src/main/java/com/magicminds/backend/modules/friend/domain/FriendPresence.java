package com.magicminds.backend.modules.friend.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import com.magicminds.backend.modules.profile.domain.ChildProfile;

/**
 * Presence of a friend, derived on every read from the stored online flag and room pointer.
 */
public enum FriendPresence {
    OFFLINE("offline"),
    ONLINE("online"),
    IN_GAME("in-game");

    private final String wireValue;

    FriendPresence(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    public static FriendPresence of(ChildProfile child) {
        if (!child.isOnline()) {
            return OFFLINE;
        }
        return child.isInRoom() ? IN_GAME : ONLINE;
    }
}
