package com.magicminds.backend.modules.profile.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateChildProfileRequest(
        @NotBlank @Size(max = 80) String name,
        @NotBlank @Size(max = 32) String ageGroup,
        @Size(max = 255) String avatar
) {
}
