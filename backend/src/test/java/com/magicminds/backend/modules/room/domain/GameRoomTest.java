package com.magicminds.backend.modules.room.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Random;
import java.util.UUID;

import org.junit.jupiter.api.Test;

class GameRoomTest {

    private final UUID hostId = UUID.randomUUID();

    @Test
    void newRoomSeatsOnlyTheHost() {
        GameRoom room = new GameRoom("ABC123", hostId, "quiz", "easy", 4, "animals");

        assertThat(room.getCurrentPlayers()).isEqualTo(1);
        assertThat(room.getStatus()).isEqualTo(RoomStatus.WAITING);
        assertThat(room.isAcceptingPlayers()).isTrue();
        assertThat(room.isHostedBy(hostId)).isTrue();
        assertThat(room.isHasAiPlayer()).isFalse();
    }

    @Test
    void capacityMustStayWithinBounds() {
        assertThatThrownBy(() -> new GameRoom("ABC123", hostId, "quiz", "easy", 1, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new GameRoom("ABC123", hostId, "quiz", "easy", 9, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void aiCompanionTakesASeat() {
        GameRoom room = new GameRoom("ABC123", hostId, "quiz", "easy", 2, null);
        AiPlayerRoster.AiPlayer ai = new AiPlayerRoster(new Random(3)).pick();

        room.seatAiPlayer(ai);

        assertThat(AiPlayerRoster.PLAYERS).contains(ai);
        assertThat(room.isHasAiPlayer()).isTrue();
        assertThat(room.getAiPlayerName()).isEqualTo(ai.name());
        assertThat(room.getCurrentPlayers()).isEqualTo(2);
    }

    @Test
    void roomStopsAcceptingOnceStarted() {
        GameRoom room = new GameRoom("ABC123", hostId, "quiz", "easy", 4, null);

        room.setStatus(RoomStatus.PLAYING);

        assertThat(room.isAcceptingPlayers()).isFalse();
    }
}
