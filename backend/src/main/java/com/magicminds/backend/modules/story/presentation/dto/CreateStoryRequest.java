package com.magicminds.backend.modules.story.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CreateStoryRequest(
        @NotNull UUID childId,
        @Size(max = 200) String title,
        @NotBlank String content,
        String promptUsed,
        String audioUrl
) {
}
