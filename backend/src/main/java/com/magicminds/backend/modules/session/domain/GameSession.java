package com.magicminds.backend.modules.session.domain;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

import com.magicminds.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Table;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

@Entity
@Table(name = "multiplayer_game_sessions")
public class GameSession extends AbstractTimestampedEntity {

    @Column(name = "room_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID roomId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "game_data", columnDefinition = "jsonb")
    private Map<String, Object> gameData;

    @Column(name = "current_turn_player_id", columnDefinition = "uuid")
    private UUID currentTurnPlayerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "game_state", nullable = false, length = 16)
    private GameState gameState = GameState.ACTIVE;

    protected GameSession() {
    }

    public GameSession(UUID roomId, Map<String, Object> gameData) {
        this.roomId = roomId;
        this.gameData = gameData == null ? null : new HashMap<>(gameData);
    }

    public UUID getRoomId() {
        return roomId;
    }

    public Map<String, Object> getGameData() {
        return gameData;
    }

    public void setGameData(Map<String, Object> gameData) {
        this.gameData = gameData == null ? null : new HashMap<>(gameData);
    }

    public UUID getCurrentTurnPlayerId() {
        return currentTurnPlayerId;
    }

    public void setCurrentTurnPlayerId(UUID currentTurnPlayerId) {
        this.currentTurnPlayerId = currentTurnPlayerId;
    }

    public GameState getGameState() {
        return gameState;
    }

    public void setGameState(GameState gameState) {
        this.gameState = gameState;
    }
}
