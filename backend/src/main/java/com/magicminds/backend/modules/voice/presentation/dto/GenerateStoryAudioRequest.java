package com.magicminds.backend.modules.voice.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record GenerateStoryAudioRequest(
        @NotBlank String storyText,
        @NotBlank String voiceId
) {
}
