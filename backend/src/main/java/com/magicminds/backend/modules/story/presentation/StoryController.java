package com.magicminds.backend.modules.story.presentation;

import java.util.List;
import java.util.UUID;

import com.magicminds.backend.global.security.AuthenticatedSubject;
import com.magicminds.backend.modules.story.application.StoryService;
import com.magicminds.backend.modules.story.presentation.dto.CreateStoryRequest;
import com.magicminds.backend.modules.story.presentation.dto.StoryResponse;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/stories")
public class StoryController {

    private final StoryService storyService;

    public StoryController(StoryService storyService) {
        this.storyService = storyService;
    }

    @PostMapping
    public ResponseEntity<StoryResponse> createStory(
            @AuthenticationPrincipal AuthenticatedSubject subject,
            @Valid @RequestBody CreateStoryRequest request
    ) {
        return ResponseEntity.status(201).body(storyService.createStory(subject, request));
    }

    @GetMapping
    public ResponseEntity<List<StoryResponse>> listStories(
            @AuthenticationPrincipal AuthenticatedSubject subject,
            @RequestParam("childId") UUID childId
    ) {
        return ResponseEntity.ok(storyService.listStories(subject, childId));
    }

    @GetMapping("/{storyId}")
    public ResponseEntity<StoryResponse> getStory(
            @AuthenticationPrincipal AuthenticatedSubject subject,
            @PathVariable("storyId") UUID storyId
    ) {
        return ResponseEntity.ok(storyService.getStory(subject, storyId));
    }

    @DeleteMapping("/{storyId}")
    public ResponseEntity<Void> deleteStory(
            @AuthenticationPrincipal AuthenticatedSubject subject,
            @PathVariable("storyId") UUID storyId
    ) {
        storyService.deleteStory(subject, storyId);
        return ResponseEntity.noContent().build();
    }
}
