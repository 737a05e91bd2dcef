package com.magicminds.backend.modules.story.domain;

import java.util.UUID;

import com.magicminds.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;

import org.hibernate.annotations.Immutable;

@Entity
@Immutable
@Table(name = "generated_stories")
public class GeneratedStory extends AbstractTimestampedEntity {

    @Column(name = "child_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID childId;

    @Column(name = "title", length = 200)
    private String title;

    @Column(name = "content", nullable = false, columnDefinition = "text")
    private String content;

    @Column(name = "prompt_used", columnDefinition = "text")
    private String promptUsed;

    @Column(name = "audio_url", columnDefinition = "text")
    private String audioUrl;

    protected GeneratedStory() {
    }

    public GeneratedStory(UUID childId, String title, String content, String promptUsed, String audioUrl) {
        this.childId = childId;
        this.title = title;
        this.content = content;
        this.promptUsed = promptUsed;
        this.audioUrl = audioUrl;
    }

    public UUID getChildId() {
        return childId;
    }

    public String getTitle() {
        return title;
    }

    public String getContent() {
        return content;
    }

    public String getPromptUsed() {
        return promptUsed;
    }

    public String getAudioUrl() {
        return audioUrl;
    }
}
