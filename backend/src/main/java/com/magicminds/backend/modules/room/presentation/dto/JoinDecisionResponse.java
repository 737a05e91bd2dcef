package com.magicminds.backend.modules.room.presentation.dto;

/**
 * Outcome of a host decision or an invitation acceptance. {@code room} reflects occupancy after the decision.
 */
public record JoinDecisionResponse(
        boolean approved,
        JoinRequestResponse request,
        RoomResponse room
) {
}
