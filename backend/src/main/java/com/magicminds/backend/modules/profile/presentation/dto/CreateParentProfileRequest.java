package com.magicminds.backend.modules.profile.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateParentProfileRequest(
        @NotBlank @Size(max = 120) String name
) {
}
