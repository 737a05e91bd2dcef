package com.magicminds.backend.modules.session.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.magicminds.backend.modules.session.domain.GameScore;

public record GameScoreResponse(
        UUID id,
        UUID roomId,
        UUID sessionId,
        UUID childId,
        String playerName,
        String playerAvatar,
        @JsonProperty("isAi") boolean ai,
        int score,
        int totalQuestions,
        OffsetDateTime createdAt
) {

    public static GameScoreResponse from(GameScore score) {
        return new GameScoreResponse(
                score.getId(),
                score.getRoomId(),
                score.getSessionId(),
                score.getChildId(),
                score.getPlayerName(),
                score.getPlayerAvatar(),
                score.isAi(),
                score.getScore(),
                score.getTotalQuestions(),
                score.getCreatedAt()
        );
    }
}
