package com.magicminds.backend.modules.session.presentation.dto;

import java.util.Map;
import java.util.UUID;

import jakarta.validation.constraints.NotNull;

public record CreateGameSessionRequest(
        @NotNull UUID roomId,
        Map<String, Object> gameData
) {
}
