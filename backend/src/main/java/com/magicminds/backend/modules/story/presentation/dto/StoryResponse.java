package com.magicminds.backend.modules.story.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.magicminds.backend.modules.story.domain.GeneratedStory;

public record StoryResponse(
        UUID id,
        UUID childId,
        String title,
        String content,
        String promptUsed,
        String audioUrl,
        OffsetDateTime createdAt
) {

    public static StoryResponse from(GeneratedStory story) {
        return new StoryResponse(
                story.getId(),
                story.getChildId(),
                story.getTitle(),
                story.getContent(),
                story.getPromptUsed(),
                story.getAudioUrl(),
                story.getCreatedAt()
        );
    }
}
