package com.magicminds.backend.modules.room.application;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.magicminds.backend.global.error.ProblemException;
import com.magicminds.backend.global.persistence.SubjectUnitOfWork;
import com.magicminds.backend.global.security.AuthenticatedSubject;
import com.magicminds.backend.modules.profile.application.ProfileLookup;
import com.magicminds.backend.modules.profile.domain.ChildProfile;
import com.magicminds.backend.modules.profile.infrastructure.persistence.ChildProfileRepository;
import com.magicminds.backend.modules.room.domain.AiPlayerRoster;
import com.magicminds.backend.modules.room.domain.GameRoom;
import com.magicminds.backend.modules.room.domain.RoomCodeGenerator;
import com.magicminds.backend.modules.room.domain.RoomParticipant;
import com.magicminds.backend.modules.room.domain.RoomStatus;
import com.magicminds.backend.modules.room.infrastructure.persistence.GameRoomRepository;
import com.magicminds.backend.modules.room.infrastructure.persistence.RoomParticipantRepository;
import com.magicminds.backend.modules.room.presentation.dto.CreateRoomRequest;
import com.magicminds.backend.modules.room.presentation.dto.RoomDtoMapper;
import com.magicminds.backend.modules.room.presentation.dto.RoomParticipantResponse;
import com.magicminds.backend.modules.room.presentation.dto.RoomResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

@Service
public class RoomService {

    private static final Logger log = LoggerFactory.getLogger(RoomService.class);
    static final int MAX_CODE_ATTEMPTS = 10;

    private final SubjectUnitOfWork unitOfWork;
    private final GameRoomRepository gameRoomRepository;
    private final RoomParticipantRepository roomParticipantRepository;
    private final ChildProfileRepository childProfileRepository;
    private final ProfileLookup profileLookup;
    private final RoomMembershipSupport membership;
    private final RoomInvitationService invitationService;
    private final RoomCodeGenerator roomCodeGenerator;
    private final AiPlayerRoster aiPlayerRoster;

    public RoomService(
            SubjectUnitOfWork unitOfWork,
            GameRoomRepository gameRoomRepository,
            RoomParticipantRepository roomParticipantRepository,
            ChildProfileRepository childProfileRepository,
            ProfileLookup profileLookup,
            RoomMembershipSupport membership,
            RoomInvitationService invitationService,
            RoomCodeGenerator roomCodeGenerator,
            AiPlayerRoster aiPlayerRoster
    ) {
        this.unitOfWork = unitOfWork;
        this.gameRoomRepository = gameRoomRepository;
        this.roomParticipantRepository = roomParticipantRepository;
        this.childProfileRepository = childProfileRepository;
        this.profileLookup = profileLookup;
        this.membership = membership;
        this.invitationService = invitationService;
        this.roomCodeGenerator = roomCodeGenerator;
        this.aiPlayerRoster = aiPlayerRoster;
    }

    /**
     * Opens a room hosted by one of the caller's children. Without invited friends an AI companion takes
     * the second seat; with friends, each resolvable friend receives a pending invitation.
     */
    public RoomResponse createRoom(AuthenticatedSubject subject, CreateRoomRequest request) {
        return unitOfWork.execute(subject, () -> {
            ChildProfile host = profileLookup.requireOwnedChild(subject, request.hostChildId());
            if (host.isInRoom()) {
                throw ProblemException.badRequest("room.already_in_room", "Child is already in a room");
            }

            int maxPlayers = request.maxPlayers() != null ? request.maxPlayers() : GameRoom.DEFAULT_MAX_PLAYERS;
            GameRoom room = new GameRoom(allocateRoomCode(), host.getId(), request.gameId().trim(),
                    request.difficulty().trim(), maxPlayers, request.selectedCategory());
            List<UUID> friendIds = request.friendIds() == null ? List.of() : request.friendIds();
            AiPlayerRoster.AiPlayer aiPlayer = null;
            if (friendIds.isEmpty()) {
                aiPlayer = aiPlayerRoster.pick();
                room.seatAiPlayer(aiPlayer);
            }

            try {
                room = gameRoomRepository.saveAndFlush(room);
            } catch (DataIntegrityViolationException ex) {
                throw new ProblemException(HttpStatus.SERVICE_UNAVAILABLE, "room.code_exhausted",
                        "Could not allocate a unique room code; try again");
            }

            roomParticipantRepository.save(RoomParticipant.human(room.getId(), host.getId(), host.getName(), host.getAvatar()));
            if (aiPlayer != null) {
                roomParticipantRepository.save(RoomParticipant.ai(room.getId(), aiPlayer));
            }
            if (childProfileRepository.claimRoomSlot(host.getId(), room.getId()) == 0) {
                throw ProblemException.badRequest("room.already_in_room", "Child is already in a room");
            }
            if (!friendIds.isEmpty()) {
                invitationService.issueInvitations(membership.requireRoom(room.getId()), friendIds);
            }

            log.info("Room {} created by child {} (maxPlayers={}, ai={})",
                    room.getRoomCode(), host.getId(), maxPlayers, aiPlayer != null);
            return membership.describe(room.getId());
        });
    }

    public RoomResponse joinRoom(AuthenticatedSubject subject, String roomCode, UUID childId) {
        return unitOfWork.execute(subject, () -> {
            ChildProfile child = profileLookup.requireOwnedChild(subject, childId);
            GameRoom room = membership.requireRoomByCode(roomCode);
            membership.seat(child, room);
            return membership.describe(room.getId());
        });
    }

    /**
     * A leaving host tears the room down for everyone; any other child just gives up its seat.
     */
    public void leaveRoom(AuthenticatedSubject subject, UUID childId) {
        unitOfWork.run(subject, () -> {
            ChildProfile child = profileLookup.requireOwnedChild(subject, childId);
            UUID roomId = child.getCurrentRoomId();
            if (roomId == null) {
                throw ProblemException.notFound("room.not_in_room", "Child not in a room");
            }
            Optional<GameRoom> room = gameRoomRepository.findById(roomId);
            if (room.isEmpty()) {
                childProfileRepository.clearRoom(child.getId());
                return;
            }
            if (room.get().isHostedBy(child.getId())) {
                membership.teardown(room.get());
            } else {
                membership.vacate(child, room.get());
            }
        });
    }

    public void closeRoom(AuthenticatedSubject subject, UUID roomId) {
        unitOfWork.run(subject, () -> {
            GameRoom room = membership.requireRoom(roomId);
            membership.requireHost(subject, room);
            membership.teardown(room);
        });
    }

    /**
     * Moves the room forward through waiting, playing and finished. Finishing releases every human
     * participant so they can join another room; the finished room keeps its participants as a record.
     */
    public RoomResponse updateStatus(AuthenticatedSubject subject, UUID roomId, RoomStatus next) {
        return unitOfWork.execute(subject, () -> {
            GameRoom room = membership.requireRoom(roomId);
            membership.requireHost(subject, room);
            if (!room.getStatus().canTransitionTo(next)) {
                throw ProblemException.badRequest("room.invalid_transition",
                        "Cannot move room from " + room.getStatus().wireValue() + " to " + next.wireValue());
            }
            room.setStatus(next);
            gameRoomRepository.saveAndFlush(room);
            if (next.isTerminal()) {
                childProfileRepository.clearRoomForAll(roomId);
            }
            log.info("Room {} moved to {}", room.getRoomCode(), next);
            return membership.describe(roomId);
        });
    }

    /**
     * @return the child's room, or empty when the child is not in one; a pointer to a vanished room is cleared
     */
    public Optional<RoomResponse> currentRoom(AuthenticatedSubject subject, UUID childId) {
        return unitOfWork.execute(subject, () -> {
            ChildProfile child = profileLookup.requireOwnedChild(subject, childId);
            UUID roomId = child.getCurrentRoomId();
            if (roomId == null) {
                return Optional.empty();
            }
            Optional<GameRoom> room = gameRoomRepository.findById(roomId);
            if (room.isEmpty()) {
                childProfileRepository.clearRoom(child.getId());
                return Optional.empty();
            }
            return Optional.of(RoomDtoMapper.toRoomResponse(room.get(),
                    roomParticipantRepository.findByRoomIdOrderByJoinedAtAsc(roomId)));
        });
    }

    public List<RoomParticipantResponse> participants(AuthenticatedSubject subject, UUID roomId) {
        return unitOfWork.read(subject, () -> {
            membership.requireRoom(roomId);
            return roomParticipantRepository.findByRoomIdOrderByJoinedAtAsc(roomId).stream()
                    .map(RoomDtoMapper::toParticipantResponse)
                    .toList();
        });
    }

    private String allocateRoomCode() {
        for (int attempt = 0; attempt < MAX_CODE_ATTEMPTS; attempt++) {
            String code = roomCodeGenerator.next();
            if (!gameRoomRepository.existsByRoomCode(code)) {
                return code;
            }
        }
        log.warn("Room code allocation gave up after {} attempts", MAX_CODE_ATTEMPTS);
        throw new ProblemException(HttpStatus.SERVICE_UNAVAILABLE, "room.code_exhausted",
                "Could not allocate a unique room code; try again");
    }
}
