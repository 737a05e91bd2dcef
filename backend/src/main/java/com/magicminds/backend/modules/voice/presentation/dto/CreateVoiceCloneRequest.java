package com.magicminds.backend.modules.voice.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * @param audioData base64-encoded voice sample
 */
public record CreateVoiceCloneRequest(
        @NotNull UUID childId,
        @NotBlank String audioData,
        @Size(max = 255) String fileName
) {
}
