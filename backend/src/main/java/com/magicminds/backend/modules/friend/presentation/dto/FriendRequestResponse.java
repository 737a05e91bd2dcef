package com.magicminds.backend.modules.friend.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.magicminds.backend.modules.friend.domain.FriendEdge;
import com.magicminds.backend.modules.friend.domain.FriendEdgeStatus;

public record FriendRequestResponse(
        UUID id,
        UUID requesterId,
        UUID addresseeId,
        FriendEdgeStatus status,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static FriendRequestResponse from(FriendEdge edge) {
        return new FriendRequestResponse(
                edge.getId(),
                edge.getRequesterId(),
                edge.getAddresseeId(),
                edge.getStatus(),
                edge.getCreatedAt(),
                edge.getUpdatedAt()
        );
    }
}
