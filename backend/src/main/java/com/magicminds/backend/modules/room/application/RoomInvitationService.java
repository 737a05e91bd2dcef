package com.magicminds.backend.modules.room.application;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.UUID;

import com.magicminds.backend.global.error.ProblemException;
import com.magicminds.backend.global.persistence.SubjectUnitOfWork;
import com.magicminds.backend.global.security.AuthenticatedSubject;
import com.magicminds.backend.modules.profile.application.ProfileLookup;
import com.magicminds.backend.modules.profile.domain.ChildProfile;
import com.magicminds.backend.modules.profile.infrastructure.persistence.ChildProfileRepository;
import com.magicminds.backend.modules.room.domain.GameRoom;
import com.magicminds.backend.modules.room.domain.JoinRequest;
import com.magicminds.backend.modules.room.domain.JoinRequestKind;
import com.magicminds.backend.modules.room.domain.JoinRequestStatus;
import com.magicminds.backend.modules.room.infrastructure.persistence.JoinRequestRepository;
import com.magicminds.backend.modules.room.presentation.dto.InviteFriendsResponse;
import com.magicminds.backend.modules.room.presentation.dto.JoinDecisionResponse;
import com.magicminds.backend.modules.room.presentation.dto.JoinRequestResponse;
import com.magicminds.backend.modules.room.presentation.dto.RoomDtoMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Invitations issued by hosts and join requests raised by children.
 *
 * <p>Accepting an invitation and approving a request share one seat policy: when the room is full the whole
 * operation fails with {@code room.full} and the request stays pending.</p>
 */
@Service
public class RoomInvitationService {

    private static final Logger log = LoggerFactory.getLogger(RoomInvitationService.class);

    private final SubjectUnitOfWork unitOfWork;
    private final JoinRequestRepository joinRequestRepository;
    private final ChildProfileRepository childProfileRepository;
    private final ProfileLookup profileLookup;
    private final RoomMembershipSupport membership;

    public RoomInvitationService(
            SubjectUnitOfWork unitOfWork,
            JoinRequestRepository joinRequestRepository,
            ChildProfileRepository childProfileRepository,
            ProfileLookup profileLookup,
            RoomMembershipSupport membership
    ) {
        this.unitOfWork = unitOfWork;
        this.joinRequestRepository = joinRequestRepository;
        this.childProfileRepository = childProfileRepository;
        this.profileLookup = profileLookup;
        this.membership = membership;
    }

    public InviteFriendsResponse invite(AuthenticatedSubject subject, String roomCode, List<UUID> friendIds) {
        return unitOfWork.execute(subject, () -> {
            GameRoom room = membership.requireRoomByCode(roomCode);
            membership.requireHost(subject, room);
            List<JoinRequestResponse> invitations = issueInvitations(room, friendIds);
            if (invitations.isEmpty()) {
                throw ProblemException.notFound("room.no_valid_friends", "No valid friends found");
            }
            return new InviteFriendsResponse(invitations.size(), invitations);
        });
    }

    /**
     * Creates pending invitations for the resolvable children in {@code friendIds}. The host and children
     * that already hold a pending invitation to this room are skipped. Must run inside a unit of work.
     */
    List<JoinRequestResponse> issueInvitations(GameRoom room, List<UUID> friendIds) {
        List<ChildProfile> friends = childProfileRepository.findByIdIn(new LinkedHashSet<>(friendIds));
        List<JoinRequestResponse> created = new ArrayList<>();
        for (ChildProfile friend : friends) {
            if (room.isHostedBy(friend.getId())
                    || joinRequestRepository.existsByRoomIdAndChildIdAndKindAndStatus(
                    room.getId(), friend.getId(), JoinRequestKind.INVITATION, JoinRequestStatus.PENDING)) {
                continue;
            }
            JoinRequest invitation = joinRequestRepository.save(new JoinRequest(room, friend.getId(), friend.getName(),
                    friend.getAvatar(), JoinRequestKind.INVITATION));
            created.add(RoomDtoMapper.toJoinRequestResponse(invitation));
        }
        joinRequestRepository.flush();
        if (!created.isEmpty()) {
            log.info("Room {} sent {} invitations", room.getRoomCode(), created.size());
        }
        return created;
    }

    public JoinRequestResponse requestToJoin(AuthenticatedSubject subject, String roomCode, UUID childId) {
        return unitOfWork.execute(subject, () -> {
            GameRoom room = membership.requireRoomByCode(roomCode);
            ChildProfile child = profileLookup.requireOwnedChild(subject, childId);
            if (joinRequestRepository.existsByRoomIdAndChildIdAndKindAndStatus(
                    room.getId(), child.getId(), JoinRequestKind.REQUEST, JoinRequestStatus.PENDING)) {
                throw ProblemException.badRequest("room.request_exists", "A join request for this room is already pending");
            }
            JoinRequest request = joinRequestRepository.saveAndFlush(new JoinRequest(room, child.getId(), child.getName(),
                    child.getAvatar(), JoinRequestKind.REQUEST));
            return RoomDtoMapper.toJoinRequestResponse(request);
        });
    }

    public List<JoinRequestResponse> pendingJoinRequests(AuthenticatedSubject subject, UUID roomId) {
        return unitOfWork.read(subject, () -> {
            GameRoom room = membership.requireRoom(roomId);
            membership.requireHost(subject, room);
            return joinRequestRepository.findByRoomIdAndKindAndStatusOrderByCreatedAtAsc(
                            roomId, JoinRequestKind.REQUEST, JoinRequestStatus.PENDING).stream()
                    .map(RoomDtoMapper::toJoinRequestResponse)
                    .toList();
        });
    }

    public JoinDecisionResponse handleJoinRequest(AuthenticatedSubject subject, UUID requestId, boolean approve) {
        return unitOfWork.execute(subject, () -> {
            JoinRequest request = joinRequestRepository.findById(requestId)
                    .orElseThrow(() -> ProblemException.notFound("room.request_not_found", "Request not found"));
            requireKind(request, JoinRequestKind.REQUEST);
            requirePending(request);
            GameRoom room = membership.requireRoom(request.getRoomId());
            membership.requireHost(subject, room);

            if (approve) {
                ChildProfile child = profileLookup.requireChild(request.getChildId());
                transition(request, JoinRequestStatus.APPROVED);
                membership.seat(child, room);
            } else {
                transition(request, JoinRequestStatus.DENIED);
            }
            return decision(approve, request.getId(), room.getId());
        });
    }

    public List<JoinRequestResponse> pendingInvitations(AuthenticatedSubject subject, UUID childId) {
        return unitOfWork.read(subject, () -> {
            ChildProfile child = profileLookup.requireOwnedChild(subject, childId);
            return joinRequestRepository.findByChildIdAndKindAndStatusOrderByCreatedAtDesc(
                            child.getId(), JoinRequestKind.INVITATION, JoinRequestStatus.PENDING).stream()
                    .map(RoomDtoMapper::toJoinRequestResponse)
                    .toList();
        });
    }

    public JoinDecisionResponse acceptInvitation(AuthenticatedSubject subject, UUID invitationId, UUID childId) {
        return unitOfWork.execute(subject, () -> {
            ChildProfile child = profileLookup.requireOwnedChild(subject, childId);
            JoinRequest invitation = requireInvitation(invitationId, child.getId());
            GameRoom room = membership.requireRoom(invitation.getRoomId());
            transition(invitation, JoinRequestStatus.APPROVED);
            membership.seat(child, room);
            return decision(true, invitation.getId(), room.getId());
        });
    }

    /**
     * Marks the invitation denied. Room occupancy is never touched.
     */
    public JoinRequestResponse declineInvitation(AuthenticatedSubject subject, UUID invitationId, UUID childId) {
        return unitOfWork.execute(subject, () -> {
            ChildProfile child = profileLookup.requireOwnedChild(subject, childId);
            JoinRequest invitation = requireInvitation(invitationId, child.getId());
            transition(invitation, JoinRequestStatus.DENIED);
            return RoomDtoMapper.toJoinRequestResponse(reload(invitation.getId()));
        });
    }

    private JoinRequest requireInvitation(UUID invitationId, UUID childId) {
        JoinRequest invitation = joinRequestRepository.findByIdAndChildId(invitationId, childId)
                .orElseThrow(() -> ProblemException.notFound("room.invitation_not_found", "Invitation not found"));
        requireKind(invitation, JoinRequestKind.INVITATION);
        requirePending(invitation);
        return invitation;
    }

    private void requireKind(JoinRequest request, JoinRequestKind kind) {
        if (request.getKind() != kind) {
            throw ProblemException.badRequest("room.request_kind_mismatch",
                    "Expected a " + kind.wireValue() + " but found a " + request.getKind().wireValue());
        }
    }

    private void requirePending(JoinRequest request) {
        if (!request.isPending()) {
            throw ProblemException.badRequest("room.request_not_pending", "Request has already been handled");
        }
    }

    private void transition(JoinRequest request, JoinRequestStatus to) {
        if (joinRequestRepository.transition(request.getId(), JoinRequestStatus.PENDING, to, membership.now()) == 0) {
            throw ProblemException.badRequest("room.request_not_pending", "Request has already been handled");
        }
    }

    private JoinRequest reload(UUID requestId) {
        return joinRequestRepository.findById(requestId)
                .orElseThrow(() -> ProblemException.notFound("room.request_not_found", "Request not found"));
    }

    private JoinDecisionResponse decision(boolean approved, UUID requestId, UUID roomId) {
        return new JoinDecisionResponse(approved, RoomDtoMapper.toJoinRequestResponse(reload(requestId)),
                membership.describe(roomId));
    }
}
