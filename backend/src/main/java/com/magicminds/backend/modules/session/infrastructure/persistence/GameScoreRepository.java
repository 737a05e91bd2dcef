package com.magicminds.backend.modules.session.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.magicminds.backend.modules.session.domain.GameScore;

import org.springframework.data.jpa.repository.JpaRepository;

public interface GameScoreRepository extends JpaRepository<GameScore, UUID> {

    List<GameScore> findByRoomIdOrderByScoreDescCreatedAtAsc(UUID roomId);
}
