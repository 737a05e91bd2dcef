package com.magicminds.backend.modules.session.presentation.dto;

import java.util.Map;
import java.util.UUID;

import com.magicminds.backend.modules.session.domain.GameState;

public record UpdateGameSessionRequest(
        Map<String, Object> gameData,
        UUID currentTurnPlayerId,
        GameState gameState
) {
}
