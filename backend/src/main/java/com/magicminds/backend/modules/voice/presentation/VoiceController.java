package com.magicminds.backend.modules.voice.presentation;

import com.magicminds.backend.global.security.AuthenticatedSubject;
import com.magicminds.backend.modules.voice.application.VoiceService;
import com.magicminds.backend.modules.voice.presentation.dto.CreateVoiceCloneRequest;
import com.magicminds.backend.modules.voice.presentation.dto.GenerateStoryAudioRequest;
import com.magicminds.backend.modules.voice.presentation.dto.StoryAudioResponse;
import com.magicminds.backend.modules.voice.presentation.dto.VoiceCloneResponse;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/voice")
public class VoiceController {

    private final VoiceService voiceService;

    public VoiceController(VoiceService voiceService) {
        this.voiceService = voiceService;
    }

    @PostMapping("/create-voice-clone")
    public ResponseEntity<VoiceCloneResponse> createVoiceClone(
            @AuthenticationPrincipal AuthenticatedSubject subject,
            @Valid @RequestBody CreateVoiceCloneRequest request
    ) {
        return ResponseEntity.ok(voiceService.createVoiceClone(subject, request));
    }

    @PostMapping("/generate-story-audio")
    public ResponseEntity<StoryAudioResponse> generateStoryAudio(@Valid @RequestBody GenerateStoryAudioRequest request) {
        return ResponseEntity.ok(voiceService.generateStoryAudio(request));
    }
}
