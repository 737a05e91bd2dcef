package com.magicminds.backend.modules.room.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EntityListeners;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

@Entity
@EntityListeners(AuditingEntityListener.class)
@Table(name = "room_participants")
public class RoomParticipant {

    public static final String DEFAULT_AVATAR = "👤";

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "room_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID roomId;

    /** Null for AI participants. */
    @Column(name = "child_id", updatable = false, columnDefinition = "uuid")
    private UUID childId;

    @Column(name = "player_name", nullable = false, length = 80)
    private String playerName;

    @Column(name = "player_avatar", length = 32)
    private String playerAvatar;

    @Column(name = "is_ai", nullable = false)
    private boolean ai;

    @CreatedDate
    @Column(name = "joined_at", nullable = false, updatable = false)
    private OffsetDateTime joinedAt;

    protected RoomParticipant() {
    }

    private RoomParticipant(UUID roomId, UUID childId, String playerName, String playerAvatar, boolean ai) {
        this.roomId = roomId;
        this.childId = childId;
        this.playerName = playerName;
        this.playerAvatar = playerAvatar == null || playerAvatar.isBlank() ? DEFAULT_AVATAR : playerAvatar;
        this.ai = ai;
    }

    public static RoomParticipant human(UUID roomId, UUID childId, String playerName, String playerAvatar) {
        return new RoomParticipant(roomId, childId, playerName, playerAvatar, false);
    }

    public static RoomParticipant ai(UUID roomId, AiPlayerRoster.AiPlayer aiPlayer) {
        return new RoomParticipant(roomId, null, aiPlayer.name(), aiPlayer.avatar(), true);
    }

    public UUID getId() {
        return id;
    }

    public UUID getRoomId() {
        return roomId;
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

    public boolean isAi() {
        return ai;
    }

    public OffsetDateTime getJoinedAt() {
        return joinedAt;
    }
}
