package com.magicminds.backend.modules.voice.presentation.dto;

/**
 * @param audioContent base64-encoded MPEG audio
 */
public record StoryAudioResponse(
        boolean success,
        String audioContent
) {
}
