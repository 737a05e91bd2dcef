package com.magicminds.backend.modules.room.presentation.dto;

import java.util.List;
import java.util.UUID;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

public record InviteFriendsRequest(
        @NotBlank String roomCode,
        @NotEmpty List<@NotNull UUID> friendIds
) {
}
