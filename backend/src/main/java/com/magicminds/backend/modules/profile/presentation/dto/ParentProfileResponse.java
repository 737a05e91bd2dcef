package com.magicminds.backend.modules.profile.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record ParentProfileResponse(
        UUID id,
        String auth0UserId,
        String email,
        String name,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
}
