package com.magicminds.backend.modules.session.infrastructure.persistence;

import java.util.UUID;

import com.magicminds.backend.modules.session.domain.GameSession;

import org.springframework.data.jpa.repository.JpaRepository;

public interface GameSessionRepository extends JpaRepository<GameSession, UUID> {
}
