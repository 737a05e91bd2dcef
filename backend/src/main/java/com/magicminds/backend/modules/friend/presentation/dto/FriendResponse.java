package com.magicminds.backend.modules.friend.presentation.dto;

import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.magicminds.backend.modules.friend.domain.FriendPresence;
import com.magicminds.backend.modules.profile.domain.ChildProfile;

public record FriendResponse(
        UUID id,
        String name,
        String avatar,
        String ageGroup,
        @JsonProperty("isOnline") boolean online,
        FriendPresence status
) {

    public static FriendResponse from(ChildProfile friend) {
        return new FriendResponse(
                friend.getId(),
                friend.getName(),
                friend.getAvatar(),
                friend.getAgeGroup(),
                friend.isOnline(),
                FriendPresence.of(friend)
        );
    }
}
