package com.magicminds.backend.modules.room.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.magicminds.backend.modules.room.domain.RoomStatus;

public record RoomResponse(
        UUID id,
        String roomCode,
        UUID hostChildId,
        String gameId,
        String difficulty,
        int maxPlayers,
        int currentPlayers,
        RoomStatus status,
        boolean hasAiPlayer,
        String aiPlayerName,
        String aiPlayerAvatar,
        String selectedCategory,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt,
        List<RoomParticipantResponse> participants
) {
}
