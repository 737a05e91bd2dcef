package com.magicminds.backend.modules.friend.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.magicminds.backend.modules.friend.domain.FriendEdge;
import com.magicminds.backend.modules.friend.domain.FriendEdgeStatus;
import com.magicminds.backend.modules.profile.domain.ChildProfile;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface FriendEdgeRepository extends JpaRepository<FriendEdge, UUID> {

    @Query("""
            select f
              from FriendEdge f
             where (f.requesterId = :first and f.addresseeId = :second)
                or (f.requesterId = :second and f.addresseeId = :first)
            """)
    Optional<FriendEdge> findBetween(@Param("first") UUID first, @Param("second") UUID second);

    List<FriendEdge> findByAddresseeIdAndStatusOrderByCreatedAtDesc(UUID addresseeId, FriendEdgeStatus status);

    @Query("""
            select c
              from ChildProfile c, FriendEdge f
             where f.status = com.magicminds.backend.modules.friend.domain.FriendEdgeStatus.ACCEPTED
               and ((f.requesterId = :childId and f.addresseeId = c.id)
                 or (f.addresseeId = :childId and f.requesterId = c.id))
             order by c.name
            """)
    List<ChildProfile> findAcceptedPartners(@Param("childId") UUID childId);

    @Query("""
            select c
              from ChildProfile c
             where lower(c.name) like :pattern escape '!'
             order by c.name
            """)
    List<ChildProfile> searchByName(@Param("pattern") String pattern, Pageable pageable);

    @Query("""
            select c
              from ChildProfile c
             where lower(c.name) like :pattern escape '!'
               and c.id <> :childId
               and not exists (
                   select f.id
                     from FriendEdge f
                    where (f.requesterId = :childId and f.addresseeId = c.id)
                       or (f.addresseeId = :childId and f.requesterId = c.id)
               )
             order by c.name
            """)
    List<ChildProfile> searchUnconnected(@Param("pattern") String pattern,
                                         @Param("childId") UUID childId,
                                         Pageable pageable);
}
