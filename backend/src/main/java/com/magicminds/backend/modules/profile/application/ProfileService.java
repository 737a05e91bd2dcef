package com.magicminds.backend.modules.profile.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.magicminds.backend.global.error.ProblemException;
import com.magicminds.backend.global.persistence.SubjectUnitOfWork;
import com.magicminds.backend.global.security.AuthenticatedSubject;
import com.magicminds.backend.modules.profile.domain.ChildProfile;
import com.magicminds.backend.modules.profile.domain.ParentAccount;
import com.magicminds.backend.modules.profile.infrastructure.persistence.ChildProfileRepository;
import com.magicminds.backend.modules.profile.infrastructure.persistence.ParentAccountRepository;
import com.magicminds.backend.modules.profile.presentation.dto.ChildProfileResponse;
import com.magicminds.backend.modules.profile.presentation.dto.CreateChildProfileRequest;
import com.magicminds.backend.modules.profile.presentation.dto.CreateParentProfileRequest;
import com.magicminds.backend.modules.profile.presentation.dto.ParentProfileResponse;
import com.magicminds.backend.modules.profile.presentation.dto.ProfileDtoMapper;
import com.magicminds.backend.modules.profile.presentation.dto.UpdateChildProfileRequest;
import com.magicminds.backend.modules.profile.presentation.dto.UpdateChildStatusRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

@Service
public class ProfileService {

    private static final Logger log = LoggerFactory.getLogger(ProfileService.class);
    private static final String PLACEHOLDER_EMAIL_DOMAIN = "@auth0.user";

    private final SubjectUnitOfWork unitOfWork;
    private final ParentAccountRepository parentAccountRepository;
    private final ChildProfileRepository childProfileRepository;
    private final ProfileLookup profileLookup;
    private final Clock clock;

    public ProfileService(
            SubjectUnitOfWork unitOfWork,
            ParentAccountRepository parentAccountRepository,
            ChildProfileRepository childProfileRepository,
            ProfileLookup profileLookup,
            Clock clock
    ) {
        this.unitOfWork = unitOfWork;
        this.parentAccountRepository = parentAccountRepository;
        this.childProfileRepository = childProfileRepository;
        this.profileLookup = profileLookup;
        this.clock = clock;
    }

    /**
     * Returns the caller's parent account, creating it on first call. An existing account is returned
     * unchanged, including when a concurrent call created it first.
     */
    public ParentProfileResponse createOrFetchParent(AuthenticatedSubject subject, CreateParentProfileRequest request) {
        try {
            return unitOfWork.execute(subject, () -> parentAccountRepository.findByAuth0UserId(subject.subject())
                    .map(ProfileDtoMapper::toParentResponse)
                    .orElseGet(() -> {
                        String email = subject.hasEmail() ? subject.email() : subject.subject() + PLACEHOLDER_EMAIL_DOMAIN;
                        ParentAccount parent = parentAccountRepository.saveAndFlush(
                                new ParentAccount(subject.subject(), email, request.name()));
                        log.info("Created parent profile {} for subject {}", parent.getId(), subject.subject());
                        return ProfileDtoMapper.toParentResponse(parent);
                    }));
        } catch (DataIntegrityViolationException ex) {
            log.info("Parent profile for subject {} was created concurrently; returning existing", subject.subject());
            return unitOfWork.read(subject, () -> ProfileDtoMapper.toParentResponse(profileLookup.requireParent(subject)));
        }
    }

    public ParentProfileResponse getParent(AuthenticatedSubject subject) {
        return unitOfWork.read(subject, () -> ProfileDtoMapper.toParentResponse(profileLookup.requireParent(subject)));
    }

    public ChildProfileResponse createChild(AuthenticatedSubject subject, CreateChildProfileRequest request) {
        return unitOfWork.execute(subject, () -> {
            ParentAccount parent = profileLookup.requireParent(subject);
            ChildProfile child = childProfileRepository.saveAndFlush(
                    new ChildProfile(parent, request.name().trim(), request.ageGroup().trim(), request.avatar()));
            return ProfileDtoMapper.toChildResponse(child);
        });
    }

    public List<ChildProfileResponse> listChildren(AuthenticatedSubject subject) {
        return unitOfWork.read(subject, () -> {
            ParentAccount parent = profileLookup.requireParent(subject);
            return childProfileRepository.findByParent_IdOrderByCreatedAtAsc(parent.getId()).stream()
                    .map(ProfileDtoMapper::toChildResponse)
                    .toList();
        });
    }

    public ChildProfileResponse getChild(AuthenticatedSubject subject, UUID childId) {
        return unitOfWork.read(subject, () -> ProfileDtoMapper.toChildResponse(profileLookup.requireOwnedChild(subject, childId)));
    }

    public ChildProfileResponse updateChild(AuthenticatedSubject subject, UUID childId, UpdateChildProfileRequest request) {
        return unitOfWork.execute(subject, () -> {
            ChildProfile child = profileLookup.requireOwnedChild(subject, childId);
            if (request.name() != null) {
                child.setName(request.name().trim());
            }
            if (request.ageGroup() != null) {
                child.setAgeGroup(request.ageGroup().trim());
            }
            if (request.avatar() != null) {
                child.setAvatar(request.avatar());
            }
            if (request.voiceCloneEnabled() != null) {
                child.setVoiceCloneEnabled(request.voiceCloneEnabled());
            }
            if (request.voiceCloneUrl() != null) {
                child.setVoiceCloneUrl(request.voiceCloneUrl());
            }
            return ProfileDtoMapper.toChildResponse(childProfileRepository.saveAndFlush(child));
        });
    }

    public void deleteChild(AuthenticatedSubject subject, UUID childId) {
        unitOfWork.run(subject, () -> {
            ChildProfile child = profileLookup.requireOwnedChild(subject, childId);
            if (child.isInRoom()) {
                throw new ProblemException(HttpStatus.BAD_REQUEST, "profile.child_in_room",
                        "Leave the current room before deleting this child");
            }
            childProfileRepository.delete(child);
            log.info("Deleted child profile {} of subject {}", childId, subject.subject());
        });
    }

    public ChildProfileResponse updateStatus(AuthenticatedSubject subject, UUID childId, UpdateChildStatusRequest request) {
        return unitOfWork.execute(subject, () -> {
            ChildProfile child = profileLookup.requireOwnedChild(subject, childId);
            if (request.online() != null) {
                child.setOnline(request.online());
            }
            child.setLastSeenAt(OffsetDateTime.now(clock));
            return ProfileDtoMapper.toChildResponse(childProfileRepository.saveAndFlush(child));
        });
    }
}
