package com.magicminds.backend.modules.room.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.magicminds.backend.modules.room.domain.JoinRequestKind;
import com.magicminds.backend.modules.room.domain.JoinRequestStatus;

public record JoinRequestResponse(
        UUID id,
        UUID roomId,
        String roomCode,
        UUID childId,
        String playerName,
        String playerAvatar,
        JoinRequestKind kind,
        JoinRequestStatus status,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
}
