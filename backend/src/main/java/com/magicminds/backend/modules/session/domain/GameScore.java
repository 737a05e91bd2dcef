package com.magicminds.backend.modules.session.domain;

import java.util.UUID;

import com.magicminds.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;

import org.hibernate.annotations.Immutable;

/**
 * One player's result in a session. Scores are appended and never edited.
 */
@Entity
@Immutable
@Table(name = "multiplayer_game_scores")
public class GameScore extends AbstractTimestampedEntity {

    @Column(name = "room_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID roomId;

    @Column(name = "session_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID sessionId;

    @Column(name = "child_id", updatable = false, columnDefinition = "uuid")
    private UUID childId;

    @Column(name = "player_name", nullable = false, updatable = false, length = 80)
    private String playerName;

    @Column(name = "player_avatar", updatable = false, length = 32)
    private String playerAvatar;

    @Column(name = "is_ai", nullable = false, updatable = false)
    private boolean ai;

    @Column(name = "score", nullable = false, updatable = false)
    private int score;

    @Column(name = "total_questions", nullable = false, updatable = false)
    private int totalQuestions;

    protected GameScore() {
    }

    public GameScore(UUID roomId, UUID sessionId, UUID childId, String playerName, String playerAvatar,
                     boolean ai, int score, int totalQuestions) {
        this.roomId = roomId;
        this.sessionId = sessionId;
        this.childId = childId;
        this.playerName = playerName;
        this.playerAvatar = playerAvatar;
        this.ai = ai;
        this.score = score;
        this.totalQuestions = totalQuestions;
    }

    public UUID getRoomId() {
        return roomId;
    }

    public UUID getSessionId() {
        return sessionId;
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

    public int getScore() {
        return score;
    }

    public int getTotalQuestions() {
        return totalQuestions;
    }
}
