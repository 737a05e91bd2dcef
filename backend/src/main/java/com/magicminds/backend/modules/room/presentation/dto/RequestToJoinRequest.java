package com.magicminds.backend.modules.room.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record RequestToJoinRequest(
        @NotBlank String roomCode,
        @NotNull UUID childId
) {
}
