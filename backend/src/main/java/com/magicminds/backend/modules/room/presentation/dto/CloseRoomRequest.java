package com.magicminds.backend.modules.room.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotNull;

public record CloseRoomRequest(@NotNull UUID roomId) {
}
