package com.magicminds.backend.modules.friend.application;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

import com.magicminds.backend.global.error.ProblemException;
import com.magicminds.backend.global.persistence.SubjectUnitOfWork;
import com.magicminds.backend.global.security.AuthenticatedSubject;
import com.magicminds.backend.modules.friend.domain.FriendEdge;
import com.magicminds.backend.modules.friend.domain.FriendEdgeStatus;
import com.magicminds.backend.modules.friend.infrastructure.persistence.FriendEdgeRepository;
import com.magicminds.backend.modules.friend.presentation.dto.FriendRequestResponse;
import com.magicminds.backend.modules.friend.presentation.dto.FriendResponse;
import com.magicminds.backend.modules.friend.presentation.dto.SendFriendRequestRequest;
import com.magicminds.backend.modules.profile.application.ProfileLookup;
import com.magicminds.backend.modules.profile.domain.ChildProfile;
import com.magicminds.backend.modules.profile.presentation.dto.ChildProfileResponse;
import com.magicminds.backend.modules.profile.presentation.dto.ProfileDtoMapper;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
public class FriendService {

    static final int SEARCH_LIMIT = 20;

    private final SubjectUnitOfWork unitOfWork;
    private final FriendEdgeRepository friendEdgeRepository;
    private final ProfileLookup profileLookup;

    public FriendService(SubjectUnitOfWork unitOfWork,
                         FriendEdgeRepository friendEdgeRepository,
                         ProfileLookup profileLookup) {
        this.unitOfWork = unitOfWork;
        this.friendEdgeRepository = friendEdgeRepository;
        this.profileLookup = profileLookup;
    }

    public FriendRequestResponse sendRequest(AuthenticatedSubject subject, SendFriendRequestRequest request) {
        return unitOfWork.execute(subject, () -> {
            ChildProfile requester = profileLookup.requireOwnedChild(subject, request.requesterId());
            if (requester.getId().equals(request.addresseeId())) {
                throw ProblemException.badRequest("friend.self_request", "A child cannot send a friend request to itself");
            }
            ChildProfile addressee = profileLookup.requireChild(request.addresseeId());

            Optional<FriendEdge> existing = friendEdgeRepository.findBetween(requester.getId(), addressee.getId());
            if (existing.isPresent()) {
                if (existing.get().getStatus() == FriendEdgeStatus.BLOCKED) {
                    throw ProblemException.badRequest("friend.blocked", "These children cannot become friends");
                }
                throw ProblemException.badRequest("friend.request_exists", "Friend request already exists");
            }

            try {
                FriendEdge edge = friendEdgeRepository.saveAndFlush(new FriendEdge(requester.getId(), addressee.getId()));
                return FriendRequestResponse.from(edge);
            } catch (DataIntegrityViolationException ex) {
                throw ProblemException.badRequest("friend.request_exists", "Friend request already exists");
            }
        });
    }

    public List<FriendRequestResponse> listIncomingRequests(AuthenticatedSubject subject, UUID childId) {
        return unitOfWork.read(subject, () -> {
            ChildProfile child = profileLookup.requireOwnedChild(subject, childId);
            return friendEdgeRepository.findByAddresseeIdAndStatusOrderByCreatedAtDesc(child.getId(), FriendEdgeStatus.PENDING)
                    .stream()
                    .map(FriendRequestResponse::from)
                    .toList();
        });
    }

    public FriendRequestResponse accept(AuthenticatedSubject subject, UUID requestId) {
        return unitOfWork.execute(subject, () -> {
            FriendEdge edge = requireEdge(requestId);
            if (!profileLookup.isOwnedBy(subject, edge.getAddresseeId())) {
                throw ProblemException.forbidden("friend.not_addressee", "Only the addressee can accept this request");
            }
            if (!edge.isPending()) {
                throw ProblemException.badRequest("friend.request_not_pending", "Friend request is not pending");
            }
            edge.accept();
            return FriendRequestResponse.from(friendEdgeRepository.saveAndFlush(edge));
        });
    }

    public void decline(AuthenticatedSubject subject, UUID requestId) {
        unitOfWork.run(subject, () -> {
            FriendEdge edge = requireEdge(requestId);
            if (!profileLookup.isOwnedBy(subject, edge.getAddresseeId())
                    && !profileLookup.isOwnedBy(subject, edge.getRequesterId())) {
                throw ProblemException.forbidden("friend.not_participant", "Only the children involved can decline this request");
            }
            if (!edge.isPending()) {
                throw ProblemException.badRequest("friend.request_not_pending", "Friend request is not pending");
            }
            friendEdgeRepository.delete(edge);
        });
    }

    public List<FriendResponse> listFriends(AuthenticatedSubject subject, UUID childId) {
        return unitOfWork.read(subject, () -> {
            ChildProfile child = profileLookup.requireOwnedChild(subject, childId);
            return friendEdgeRepository.findAcceptedPartners(child.getId()).stream()
                    .map(FriendResponse::from)
                    .toList();
        });
    }

    public void unfriend(AuthenticatedSubject subject, UUID childId, UUID friendChildId) {
        unitOfWork.run(subject, () -> {
            ChildProfile child = profileLookup.requireOwnedChild(subject, childId);
            FriendEdge edge = friendEdgeRepository.findBetween(child.getId(), friendChildId)
                    .filter(found -> found.getStatus() == FriendEdgeStatus.ACCEPTED)
                    .orElseThrow(() -> ProblemException.notFound("friend.not_found", "Friendship not found"));
            friendEdgeRepository.delete(edge);
        });
    }

    public List<ChildProfileResponse> search(AuthenticatedSubject subject, String query, UUID childId) {
        if (!StringUtils.hasText(query)) {
            throw ProblemException.badRequest("friend.search_query_required", "Search query must not be blank");
        }
        String pattern = "%" + escapeLike(query.trim().toLowerCase(Locale.ROOT)) + "%";
        PageRequest limit = PageRequest.of(0, SEARCH_LIMIT);
        return unitOfWork.read(subject, () -> {
            List<ChildProfile> matches;
            if (childId == null) {
                matches = friendEdgeRepository.searchByName(pattern, limit);
            } else {
                ChildProfile child = profileLookup.requireOwnedChild(subject, childId);
                matches = friendEdgeRepository.searchUnconnected(pattern, child.getId(), limit);
            }
            return matches.stream().map(ProfileDtoMapper::toChildResponse).toList();
        });
    }

    private FriendEdge requireEdge(UUID requestId) {
        return friendEdgeRepository.findById(requestId)
                .orElseThrow(() -> ProblemException.notFound("friend.request_not_found", "Friend request not found"));
    }

    static String escapeLike(String value) {
        return value.replace("!", "!!").replace("%", "!%").replace("_", "!_");
    }
}
