package com.magicminds.backend.modules.profile.presentation.dto;

import jakarta.validation.constraints.Size;

/**
 * Partial update; a null component leaves the stored value untouched.
 */
public record UpdateChildProfileRequest(
        @Size(min = 1, max = 80) String name,
        @Size(min = 1, max = 32) String ageGroup,
        @Size(max = 255) String avatar,
        Boolean voiceCloneEnabled,
        @Size(max = 255) String voiceCloneUrl
) {
}
