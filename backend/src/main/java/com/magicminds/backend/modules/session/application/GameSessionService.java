package com.magicminds.backend.modules.session.application;

import java.util.List;
import java.util.UUID;

import com.magicminds.backend.global.error.ProblemException;
import com.magicminds.backend.global.persistence.SubjectUnitOfWork;
import com.magicminds.backend.global.security.AuthenticatedSubject;
import com.magicminds.backend.modules.room.infrastructure.persistence.GameRoomRepository;
import com.magicminds.backend.modules.session.domain.GameScore;
import com.magicminds.backend.modules.session.domain.GameSession;
import com.magicminds.backend.modules.session.infrastructure.persistence.GameScoreRepository;
import com.magicminds.backend.modules.session.infrastructure.persistence.GameSessionRepository;
import com.magicminds.backend.modules.session.presentation.dto.CreateGameSessionRequest;
import com.magicminds.backend.modules.session.presentation.dto.GameScoreResponse;
import com.magicminds.backend.modules.session.presentation.dto.GameSessionResponse;
import com.magicminds.backend.modules.session.presentation.dto.RecordScoreRequest;
import com.magicminds.backend.modules.session.presentation.dto.UpdateGameSessionRequest;

import org.springframework.stereotype.Service;

@Service
public class GameSessionService {

    private final SubjectUnitOfWork unitOfWork;
    private final GameSessionRepository gameSessionRepository;
    private final GameScoreRepository gameScoreRepository;
    private final GameRoomRepository gameRoomRepository;

    public GameSessionService(
            SubjectUnitOfWork unitOfWork,
            GameSessionRepository gameSessionRepository,
            GameScoreRepository gameScoreRepository,
            GameRoomRepository gameRoomRepository
    ) {
        this.unitOfWork = unitOfWork;
        this.gameSessionRepository = gameSessionRepository;
        this.gameScoreRepository = gameScoreRepository;
        this.gameRoomRepository = gameRoomRepository;
    }

    public GameSessionResponse createSession(AuthenticatedSubject subject, CreateGameSessionRequest request) {
        return unitOfWork.execute(subject, () -> {
            requireRoom(request.roomId());
            GameSession session = gameSessionRepository.saveAndFlush(new GameSession(request.roomId(), request.gameData()));
            return GameSessionResponse.from(session);
        });
    }

    public GameSessionResponse getSession(AuthenticatedSubject subject, UUID sessionId) {
        return unitOfWork.read(subject, () -> GameSessionResponse.from(requireSession(sessionId)));
    }

    public GameSessionResponse updateSession(AuthenticatedSubject subject, UUID sessionId, UpdateGameSessionRequest request) {
        return unitOfWork.execute(subject, () -> {
            GameSession session = requireSession(sessionId);
            if (request.gameData() != null) {
                session.setGameData(request.gameData());
            }
            if (request.currentTurnPlayerId() != null) {
                session.setCurrentTurnPlayerId(request.currentTurnPlayerId());
            }
            if (request.gameState() != null) {
                session.setGameState(request.gameState());
            }
            return GameSessionResponse.from(gameSessionRepository.saveAndFlush(session));
        });
    }

    /**
     * Appends a score. The room and session must both exist; whether the session belongs to that room is
     * not checked.
     */
    public GameScoreResponse recordScore(AuthenticatedSubject subject, RecordScoreRequest request) {
        return unitOfWork.execute(subject, () -> {
            requireRoom(request.roomId());
            requireSession(request.sessionId());
            GameScore score = gameScoreRepository.saveAndFlush(new GameScore(
                    request.roomId(),
                    request.sessionId(),
                    request.childId(),
                    request.playerName().trim(),
                    request.playerAvatar(),
                    request.ai(),
                    request.score(),
                    request.totalQuestions()
            ));
            return GameScoreResponse.from(score);
        });
    }

    public List<GameScoreResponse> roomScores(AuthenticatedSubject subject, UUID roomId) {
        return unitOfWork.read(subject, () -> gameScoreRepository.findByRoomIdOrderByScoreDescCreatedAtAsc(roomId).stream()
                .map(GameScoreResponse::from)
                .toList());
    }

    private void requireRoom(UUID roomId) {
        if (!gameRoomRepository.existsById(roomId)) {
            throw ProblemException.notFound("room.not_found", "Room not found");
        }
    }

    private GameSession requireSession(UUID sessionId) {
        return gameSessionRepository.findById(sessionId)
                .orElseThrow(() -> ProblemException.notFound("session.not_found", "Session not found"));
    }
}
