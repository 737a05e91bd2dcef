package com.magicminds.backend.modules.room.domain;

import java.util.UUID;

import com.magicminds.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Table;


/**
 * Invitation from a host or request from a child to take a seat in a room. Status changes go through
 * {@code JoinRequestRepository.transition} so two handlers cannot both act on the same pending row.
 */
@Entity
@Table(name = "join_requests")
public class JoinRequest extends AbstractTimestampedEntity {

    @Column(name = "room_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID roomId;

    @Column(name = "room_code", nullable = false, updatable = false, length = 6)
    private String roomCode;

    @Column(name = "child_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID childId;

    @Column(name = "player_name", nullable = false, length = 80)
    private String playerName;

    @Column(name = "player_avatar", length = 32)
    private String playerAvatar;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, updatable = false, length = 16)
    private JoinRequestKind kind;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private JoinRequestStatus status = JoinRequestStatus.PENDING;

    protected JoinRequest() {
    }

    public JoinRequest(GameRoom room, UUID childId, String playerName, String playerAvatar, JoinRequestKind kind) {
        this.roomId = room.getId();
        this.roomCode = room.getRoomCode();
        this.childId = childId;
        this.playerName = playerName;
        this.playerAvatar = playerAvatar == null || playerAvatar.isBlank() ? RoomParticipant.DEFAULT_AVATAR : playerAvatar;
        this.kind = kind;
    }

    public UUID getRoomId() {
        return roomId;
    }

    public String getRoomCode() {
        return roomCode;
    }

    public UUID getChildId() {
        return childId;
    }

    public String getPlayerName() {
        return playerName;
    }

    public String getPlayerAvatar() {
        return playerAvatar;
    }

    public JoinRequestKind getKind() {
        return kind;
    }

    public JoinRequestStatus getStatus() {
        return status;
    }

    public boolean isPending() {
        return status == JoinRequestStatus.PENDING;
    }
}
