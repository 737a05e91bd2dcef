package com.magicminds.backend.modules.profile.presentation.dto;

import com.magicminds.backend.modules.profile.domain.ChildProfile;
import com.magicminds.backend.modules.profile.domain.ParentAccount;

public final class ProfileDtoMapper {

    private ProfileDtoMapper() {
    }

    public static ParentProfileResponse toParentResponse(ParentAccount parent) {
        return new ParentProfileResponse(
                parent.getId(),
                parent.getAuth0UserId(),
                parent.getEmail(),
                parent.getName(),
                parent.getCreatedAt(),
                parent.getUpdatedAt()
        );
    }

    public static ChildProfileResponse toChildResponse(ChildProfile child) {
        return new ChildProfileResponse(
                child.getId(),
                child.getParentId(),
                child.getName(),
                child.getAgeGroup(),
                child.getAvatar(),
                child.isVoiceCloneEnabled(),
                child.getVoiceCloneUrl(),
                child.isOnline(),
                child.getLastSeenAt(),
                child.isInRoom(),
                child.getCurrentRoomId(),
                child.getCreatedAt(),
                child.getUpdatedAt()
        );
    }
}
