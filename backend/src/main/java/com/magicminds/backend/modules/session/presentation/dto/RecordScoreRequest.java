package com.magicminds.backend.modules.session.presentation.dto;

import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record RecordScoreRequest(
        @NotNull UUID roomId,
        @NotNull UUID sessionId,
        UUID childId,
        @NotBlank @Size(max = 80) String playerName,
        @Size(max = 255) String playerAvatar,
        @JsonProperty("isAi") boolean ai,
        @Min(0) int score,
        @Min(0) int totalQuestions
) {
}
