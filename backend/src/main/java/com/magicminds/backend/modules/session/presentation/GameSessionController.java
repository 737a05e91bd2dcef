package com.magicminds.backend.modules.session.presentation;

import java.util.List;
import java.util.UUID;

import com.magicminds.backend.global.security.AuthenticatedSubject;
import com.magicminds.backend.modules.session.application.GameSessionService;
import com.magicminds.backend.modules.session.presentation.dto.CreateGameSessionRequest;
import com.magicminds.backend.modules.session.presentation.dto.GameScoreResponse;
import com.magicminds.backend.modules.session.presentation.dto.GameSessionResponse;
import com.magicminds.backend.modules.session.presentation.dto.RecordScoreRequest;
import com.magicminds.backend.modules.session.presentation.dto.UpdateGameSessionRequest;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/sessions")
public class GameSessionController {

    private final GameSessionService gameSessionService;

    public GameSessionController(GameSessionService gameSessionService) {
        this.gameSessionService = gameSessionService;
    }

    @PostMapping
    public ResponseEntity<GameSessionResponse> createSession(
            @AuthenticationPrincipal AuthenticatedSubject subject,
            @Valid @RequestBody CreateGameSessionRequest request
    ) {
        return ResponseEntity.status(201).body(gameSessionService.createSession(subject, request));
    }

    @GetMapping("/{sessionId}")
    public ResponseEntity<GameSessionResponse> getSession(
            @AuthenticationPrincipal AuthenticatedSubject subject,
            @PathVariable("sessionId") UUID sessionId
    ) {
        return ResponseEntity.ok(gameSessionService.getSession(subject, sessionId));
    }

    @PatchMapping("/{sessionId}")
    public ResponseEntity<GameSessionResponse> updateSession(
            @AuthenticationPrincipal AuthenticatedSubject subject,
            @PathVariable("sessionId") UUID sessionId,
            @RequestBody UpdateGameSessionRequest request
    ) {
        return ResponseEntity.ok(gameSessionService.updateSession(subject, sessionId, request));
    }

    @PostMapping("/scores")
    public ResponseEntity<GameScoreResponse> recordScore(
            @AuthenticationPrincipal AuthenticatedSubject subject,
            @Valid @RequestBody RecordScoreRequest request
    ) {
        return ResponseEntity.status(201).body(gameSessionService.recordScore(subject, request));
    }

    @GetMapping("/room/{roomId}/scores")
    public ResponseEntity<List<GameScoreResponse>> roomScores(
            @AuthenticationPrincipal AuthenticatedSubject subject,
            @PathVariable("roomId") UUID roomId
    ) {
        return ResponseEntity.ok(gameSessionService.roomScores(subject, roomId));
    }
}
