package com.magicminds.backend.modules.voice.presentation.dto;

import java.util.UUID;

public record VoiceCloneResponse(
        boolean success,
        String voiceId,
        UUID childId
) {
}
