package com.magicminds.backend.modules.room.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RoomParticipantResponse(
        UUID id,
        UUID roomId,
        UUID childId,
        String playerName,
        String playerAvatar,
        @JsonProperty("isAi") boolean ai,
        OffsetDateTime joinedAt
) {
}
