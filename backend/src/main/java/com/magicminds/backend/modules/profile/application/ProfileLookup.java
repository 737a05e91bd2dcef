package com.magicminds.backend.modules.profile.application;

import java.util.UUID;

import com.magicminds.backend.global.error.ProblemException;
import com.magicminds.backend.global.security.AuthenticatedSubject;
import com.magicminds.backend.modules.profile.domain.ChildProfile;
import com.magicminds.backend.modules.profile.domain.ParentAccount;
import com.magicminds.backend.modules.profile.infrastructure.persistence.ChildProfileRepository;
import com.magicminds.backend.modules.profile.infrastructure.persistence.ParentAccountRepository;

import org.springframework.stereotype.Component;

/**
 * Ownership lookups shared by every module that acts on behalf of a child.
 * Callers must already be inside a unit of work.
 */
@Component
public class ProfileLookup {

    private final ParentAccountRepository parentAccountRepository;
    private final ChildProfileRepository childProfileRepository;

    public ProfileLookup(ParentAccountRepository parentAccountRepository,
                         ChildProfileRepository childProfileRepository) {
        this.parentAccountRepository = parentAccountRepository;
        this.childProfileRepository = childProfileRepository;
    }

    public ParentAccount requireParent(AuthenticatedSubject subject) {
        return parentAccountRepository.findByAuth0UserId(subject.subject())
                .orElseThrow(() -> ProblemException.notFound("profile.parent_not_found",
                        "Parent profile not found. Create a parent profile first."));
    }

    public ChildProfile requireOwnedChild(AuthenticatedSubject subject, UUID childId) {
        ParentAccount parent = requireParent(subject);
        return childProfileRepository.findByIdAndParent_Id(childId, parent.getId())
                .orElseThrow(() -> ProblemException.notFound("profile.child_not_found", "Child profile not found"));
    }

    public ChildProfile requireChild(UUID childId) {
        return childProfileRepository.findById(childId)
                .orElseThrow(() -> ProblemException.notFound("profile.child_not_found", "Child profile not found"));
    }

    public boolean isOwnedBy(AuthenticatedSubject subject, UUID childId) {
        return parentAccountRepository.findByAuth0UserId(subject.subject())
                .flatMap(parent -> childProfileRepository.findByIdAndParent_Id(childId, parent.getId()))
                .isPresent();
    }
}
