package com.magicminds.backend.modules.room.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.magicminds.backend.modules.room.domain.JoinRequest;
import com.magicminds.backend.modules.room.domain.JoinRequestKind;
import com.magicminds.backend.modules.room.domain.JoinRequestStatus;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface JoinRequestRepository extends JpaRepository<JoinRequest, UUID> {

    Optional<JoinRequest> findByIdAndChildId(UUID id, UUID childId);

    List<JoinRequest> findByChildIdAndKindAndStatusOrderByCreatedAtDesc(UUID childId, JoinRequestKind kind,
                                                                       JoinRequestStatus status);

    List<JoinRequest> findByRoomIdAndKindAndStatusOrderByCreatedAtAsc(UUID roomId, JoinRequestKind kind,
                                                                     JoinRequestStatus status);

    boolean existsByRoomIdAndChildIdAndKindAndStatus(UUID roomId, UUID childId, JoinRequestKind kind,
                                                     JoinRequestStatus status);

    /**
     * Moves a request out of {@code from} only if it is still there.
     *
     * @return 1 when this caller made the transition, 0 when the request had already moved on
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update JoinRequest jr
               set jr.status = :to,
                   jr.updatedAt = :now
             where jr.id = :requestId
               and jr.status = :from
            """)
    int transition(@Param("requestId") UUID requestId,
                   @Param("from") JoinRequestStatus from,
                   @Param("to") JoinRequestStatus to,
                   @Param("now") OffsetDateTime now);
}
