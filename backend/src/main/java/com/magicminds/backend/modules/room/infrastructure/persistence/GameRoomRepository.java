package com.magicminds.backend.modules.room.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.magicminds.backend.modules.room.domain.GameRoom;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface GameRoomRepository extends JpaRepository<GameRoom, UUID> {

    Optional<GameRoom> findByRoomCode(String roomCode);

    boolean existsByRoomCode(String roomCode);

    /**
     * Takes one seat while the room is waiting and below capacity. Concurrent callers serialize on the row
     * lock, so the last open seat is handed out once.
     *
     * @return 1 when a seat was reserved, 0 when the room is full or no longer waiting
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update GameRoom r
               set r.currentPlayers = r.currentPlayers + 1,
                   r.updatedAt = :now
             where r.id = :roomId
               and r.status = com.magicminds.backend.modules.room.domain.RoomStatus.WAITING
               and r.currentPlayers < r.maxPlayers
            """)
    int reserveSeat(@Param("roomId") UUID roomId, @Param("now") OffsetDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update GameRoom r
               set r.currentPlayers = r.currentPlayers - 1,
                   r.updatedAt = :now
             where r.id = :roomId
               and r.currentPlayers > 0
            """)
    int releaseSeat(@Param("roomId") UUID roomId, @Param("now") OffsetDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from GameRoom r where r.id = :roomId")
    int deleteRoom(@Param("roomId") UUID roomId);
}
