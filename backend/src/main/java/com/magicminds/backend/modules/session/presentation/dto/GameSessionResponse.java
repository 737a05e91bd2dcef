package com.magicminds.backend.modules.session.presentation.dto;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import com.magicminds.backend.modules.session.domain.GameSession;
import com.magicminds.backend.modules.session.domain.GameState;

public record GameSessionResponse(
        UUID id,
        UUID roomId,
        Map<String, Object> gameData,
        UUID currentTurnPlayerId,
        GameState gameState,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static GameSessionResponse from(GameSession session) {
        return new GameSessionResponse(
                session.getId(),
                session.getRoomId(),
                session.getGameData(),
                session.getCurrentTurnPlayerId(),
                session.getGameState(),
                session.getCreatedAt(),
                session.getUpdatedAt()
        );
    }
}
