package com.magicminds.backend.modules.room.presentation.dto;

import com.magicminds.backend.modules.room.domain.RoomStatus;

import jakarta.validation.constraints.NotNull;

public record UpdateRoomStatusRequest(@NotNull RoomStatus status) {
}
