package com.magicminds.backend.modules.room.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotNull;

/**
 * Body of both accept-invitation and decline-invitation.
 */
public record InvitationActionRequest(
        @NotNull UUID invitationId,
        @NotNull UUID childId
) {
}
