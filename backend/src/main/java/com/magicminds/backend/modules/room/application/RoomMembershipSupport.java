package com.magicminds.backend.modules.room.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Locale;
import java.util.UUID;

import com.magicminds.backend.global.error.ProblemException;
import com.magicminds.backend.global.security.AuthenticatedSubject;
import com.magicminds.backend.modules.profile.application.ProfileLookup;
import com.magicminds.backend.modules.profile.domain.ChildProfile;
import com.magicminds.backend.modules.profile.infrastructure.persistence.ChildProfileRepository;
import com.magicminds.backend.modules.room.domain.GameRoom;
import com.magicminds.backend.modules.room.domain.RoomParticipant;
import com.magicminds.backend.modules.room.infrastructure.persistence.GameRoomRepository;
import com.magicminds.backend.modules.room.infrastructure.persistence.RoomParticipantRepository;
import com.magicminds.backend.modules.room.presentation.dto.RoomDtoMapper;
import com.magicminds.backend.modules.room.presentation.dto.RoomResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Seat and teardown primitives shared by direct joins, host approvals and accepted invitations.
 *
 * <p>Every method must run inside a unit of work. The conditional updates clear the persistence context, so
 * entities loaded before a call are detached afterwards and must be reloaded before they are changed.</p>
 */
@Component
public class RoomMembershipSupport {

    private static final Logger log = LoggerFactory.getLogger(RoomMembershipSupport.class);

    private final GameRoomRepository gameRoomRepository;
    private final RoomParticipantRepository roomParticipantRepository;
    private final ChildProfileRepository childProfileRepository;
    private final ProfileLookup profileLookup;
    private final Clock clock;

    public RoomMembershipSupport(
            GameRoomRepository gameRoomRepository,
            RoomParticipantRepository roomParticipantRepository,
            ChildProfileRepository childProfileRepository,
            ProfileLookup profileLookup,
            Clock clock
    ) {
        this.gameRoomRepository = gameRoomRepository;
        this.roomParticipantRepository = roomParticipantRepository;
        this.childProfileRepository = childProfileRepository;
        this.profileLookup = profileLookup;
        this.clock = clock;
    }

    public GameRoom requireRoom(UUID roomId) {
        return gameRoomRepository.findById(roomId)
                .orElseThrow(() -> ProblemException.notFound("room.not_found", "Room not found"));
    }

    public GameRoom requireRoomByCode(String roomCode) {
        return gameRoomRepository.findByRoomCode(normalizeCode(roomCode))
                .orElseThrow(() -> ProblemException.notFound("room.not_found", "Room not found"));
    }

    public void requireHost(AuthenticatedSubject subject, GameRoom room) {
        if (!profileLookup.isOwnedBy(subject, room.getHostChildId())) {
            throw ProblemException.forbidden("room.not_host", "Only the host can manage this room");
        }
    }

    /**
     * Gives the child a seat: claims its room pointer, reserves a seat and records the participant.
     * Any failure leaves the caller's transaction to roll back the partial work.
     */
    public void seat(ChildProfile child, GameRoom room) {
        if (child.isInRoom()) {
            throw ProblemException.badRequest("room.already_in_room", "Already in a room. Leave current room first.");
        }
        if (!room.isAcceptingPlayers()) {
            throw ProblemException.badRequest("room.not_accepting", "Room is not accepting new players");
        }
        if (childProfileRepository.claimRoomSlot(child.getId(), room.getId()) == 0) {
            throw ProblemException.badRequest("room.already_in_room", "Already in a room. Leave current room first.");
        }
        if (gameRoomRepository.reserveSeat(room.getId(), now()) == 0) {
            GameRoom current = requireRoom(room.getId());
            if (!current.isAcceptingPlayers()) {
                throw ProblemException.badRequest("room.not_accepting", "Room is not accepting new players");
            }
            throw ProblemException.badRequest("room.full", "Room is full");
        }
        roomParticipantRepository.save(RoomParticipant.human(room.getId(), child.getId(), child.getName(), child.getAvatar()));
        log.info("Child {} took a seat in room {}", child.getId(), room.getRoomCode());
    }

    /**
     * Releases every participant's room pointer and deletes the room. Participants, join requests,
     * sessions and scores go with it through foreign-key cascades.
     */
    public void teardown(GameRoom room) {
        int released = childProfileRepository.clearRoomForAll(room.getId());
        gameRoomRepository.deleteRoom(room.getId());
        log.info("Room {} closed; released {} participants", room.getRoomCode(), released);
    }

    /**
     * Removes a non-host child from the room and frees its seat.
     */
    public void vacate(ChildProfile child, GameRoom room) {
        if (roomParticipantRepository.deleteByRoomAndChild(room.getId(), child.getId()) > 0) {
            gameRoomRepository.releaseSeat(room.getId(), now());
        }
        childProfileRepository.clearRoom(child.getId());
    }

    public RoomResponse describe(UUID roomId) {
        GameRoom room = requireRoom(roomId);
        return RoomDtoMapper.toRoomResponse(room, roomParticipantRepository.findByRoomIdOrderByJoinedAtAsc(roomId));
    }

    OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }

    static String normalizeCode(String roomCode) {
        return roomCode == null ? null : roomCode.trim().toUpperCase(Locale.ROOT);
    }
}
