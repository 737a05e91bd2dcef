package com.magicminds.backend.modules.profile.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.magicminds.backend.modules.profile.domain.ChildProfile;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ChildProfileRepository extends JpaRepository<ChildProfile, UUID> {

    List<ChildProfile> findByParent_IdOrderByCreatedAtAsc(UUID parentId);

    Optional<ChildProfile> findByIdAndParent_Id(UUID id, UUID parentId);

    List<ChildProfile> findByIdIn(Collection<UUID> ids);

    /**
     * Points the child at a room only when it is not already in one.
     *
     * @return 1 when the slot was claimed, 0 when the child already had a room
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update ChildProfile c
               set c.currentRoomId = :roomId
             where c.id = :childId
               and c.currentRoomId is null
            """)
    int claimRoomSlot(@Param("childId") UUID childId, @Param("roomId") UUID roomId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update ChildProfile c set c.currentRoomId = null where c.id = :childId")
    int clearRoom(@Param("childId") UUID childId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update ChildProfile c set c.currentRoomId = null where c.currentRoomId = :roomId")
    int clearRoomForAll(@Param("roomId") UUID roomId);
}
