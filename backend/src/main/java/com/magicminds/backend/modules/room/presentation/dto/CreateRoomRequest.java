package com.magicminds.backend.modules.room.presentation.dto;

import java.util.List;
import java.util.UUID;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CreateRoomRequest(
        @NotNull UUID hostChildId,
        @NotBlank @Size(max = 64) String gameId,
        @NotBlank @Size(max = 32) String difficulty,
        @Min(2) @Max(8) Integer maxPlayers,
        @Size(max = 64) String selectedCategory,
        List<@NotNull UUID> friendIds
) {
}
