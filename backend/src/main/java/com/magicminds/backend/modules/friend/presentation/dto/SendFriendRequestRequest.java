package com.magicminds.backend.modules.friend.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotNull;

public record SendFriendRequestRequest(
        @NotNull UUID requesterId,
        @NotNull UUID addresseeId
) {
}
