package com.magicminds.backend.modules.room.domain;

import java.util.UUID;

import com.magicminds.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Table;

import org.hibernate.annotations.DynamicUpdate;

/**
 * A multiplayer room. {@code currentPlayers} is changed only by the conditional seat updates in
 * {@code GameRoomRepository} once the room exists, which keeps it within {@code maxPlayers}.
 */
@Entity
@DynamicUpdate
@Table(name = "game_rooms")
public class GameRoom extends AbstractTimestampedEntity {

    public static final int MIN_PLAYERS = 2;
    public static final int MAX_PLAYERS = 8;
    public static final int DEFAULT_MAX_PLAYERS = 4;

    @Column(name = "room_code", nullable = false, unique = true, updatable = false, length = 6)
    private String roomCode;

    @Column(name = "host_child_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID hostChildId;

    @Column(name = "game_id", nullable = false, updatable = false, length = 64)
    private String gameId;

    @Column(name = "difficulty", nullable = false, length = 32)
    private String difficulty;

    @Column(name = "max_players", nullable = false, updatable = false)
    private int maxPlayers;

    @Column(name = "current_players", nullable = false)
    private int currentPlayers;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private RoomStatus status = RoomStatus.WAITING;

    @Column(name = "has_ai_player", nullable = false)
    private boolean hasAiPlayer;

    @Column(name = "ai_player_name", length = 80)
    private String aiPlayerName;

    @Column(name = "ai_player_avatar", length = 32)
    private String aiPlayerAvatar;

    @Column(name = "selected_category", length = 64)
    private String selectedCategory;

    protected GameRoom() {
    }

    public GameRoom(String roomCode, UUID hostChildId, String gameId, String difficulty, int maxPlayers,
                    String selectedCategory) {
        if (maxPlayers < MIN_PLAYERS || maxPlayers > MAX_PLAYERS) {
            throw new IllegalArgumentException("maxPlayers must be between " + MIN_PLAYERS + " and " + MAX_PLAYERS);
        }
        this.roomCode = roomCode;
        this.hostChildId = hostChildId;
        this.gameId = gameId;
        this.difficulty = difficulty;
        this.maxPlayers = maxPlayers;
        this.selectedCategory = selectedCategory;
        this.currentPlayers = 1;
    }

    /**
     * Seats an AI companion before the room is first persisted.
     */
    public void seatAiPlayer(AiPlayerRoster.AiPlayer aiPlayer) {
        if (getId() != null) {
            throw new IllegalStateException("AI players are only seated while creating the room");
        }
        this.hasAiPlayer = true;
        this.aiPlayerName = aiPlayer.name();
        this.aiPlayerAvatar = aiPlayer.avatar();
        this.currentPlayers++;
    }

    public String getRoomCode() {
        return roomCode;
    }

    public UUID getHostChildId() {
        return hostChildId;
    }

    public boolean isHostedBy(UUID childId) {
        return hostChildId.equals(childId);
    }

    public String getGameId() {
        return gameId;
    }

    public String getDifficulty() {
        return difficulty;
    }

    public int getMaxPlayers() {
        return maxPlayers;
    }

    public int getCurrentPlayers() {
        return currentPlayers;
    }

    public RoomStatus getStatus() {
        return status;
    }

    public void setStatus(RoomStatus status) {
        this.status = status;
    }

    public boolean isAcceptingPlayers() {
        return status == RoomStatus.WAITING;
    }

    public boolean isHasAiPlayer() {
        return hasAiPlayer;
    }

    public String getAiPlayerName() {
        return aiPlayerName;
    }

    public String getAiPlayerAvatar() {
        return aiPlayerAvatar;
    }

    public String getSelectedCategory() {
        return selectedCategory;
    }
}
