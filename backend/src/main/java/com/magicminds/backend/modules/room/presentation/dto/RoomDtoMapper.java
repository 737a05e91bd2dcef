package com.magicminds.backend.modules.room.presentation.dto;

import java.util.List;

import com.magicminds.backend.modules.room.domain.GameRoom;
import com.magicminds.backend.modules.room.domain.JoinRequest;
import com.magicminds.backend.modules.room.domain.RoomParticipant;

public final class RoomDtoMapper {

    private RoomDtoMapper() {
    }

    public static RoomResponse toRoomResponse(GameRoom room, List<RoomParticipant> participants) {
        return new RoomResponse(
                room.getId(),
                room.getRoomCode(),
                room.getHostChildId(),
                room.getGameId(),
                room.getDifficulty(),
                room.getMaxPlayers(),
                room.getCurrentPlayers(),
                room.getStatus(),
                room.isHasAiPlayer(),
                room.getAiPlayerName(),
                room.getAiPlayerAvatar(),
                room.getSelectedCategory(),
                room.getCreatedAt(),
                room.getUpdatedAt(),
                participants.stream().map(RoomDtoMapper::toParticipantResponse).toList()
        );
    }

    public static RoomParticipantResponse toParticipantResponse(RoomParticipant participant) {
        return new RoomParticipantResponse(
                participant.getId(),
                participant.getRoomId(),
                participant.getChildId(),
                participant.getPlayerName(),
                participant.getPlayerAvatar(),
                participant.isAi(),
                participant.getJoinedAt()
        );
    }

    public static JoinRequestResponse toJoinRequestResponse(JoinRequest request) {
        return new JoinRequestResponse(
                request.getId(),
                request.getRoomId(),
                request.getRoomCode(),
                request.getChildId(),
                request.getPlayerName(),
                request.getPlayerAvatar(),
                request.getKind(),
                request.getStatus(),
                request.getCreatedAt(),
                request.getUpdatedAt()
        );
    }
}
