package com.magicminds.backend.modules.room.presentation.dto;

import java.util.List;

public record InviteFriendsResponse(
        int invitationsSent,
        List<JoinRequestResponse> invitations
) {
}
