package com.magicminds.backend.modules.room.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.magicminds.backend.modules.room.domain.RoomParticipant;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RoomParticipantRepository extends JpaRepository<RoomParticipant, UUID> {

    List<RoomParticipant> findByRoomIdOrderByJoinedAtAsc(UUID roomId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from RoomParticipant p where p.roomId = :roomId and p.childId = :childId")
    int deleteByRoomAndChild(@Param("roomId") UUID roomId, @Param("childId") UUID childId);
}
