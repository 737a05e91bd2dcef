package com.magicminds.backend.modules.profile.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ChildProfileResponse(
        UUID id,
        UUID parentId,
        String name,
        String ageGroup,
        String avatar,
        boolean voiceCloneEnabled,
        String voiceCloneUrl,
        @JsonProperty("isOnline") boolean online,
        OffsetDateTime lastSeenAt,
        boolean inRoom,
        UUID roomId,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
}
