package com.magicminds.backend.modules.voice.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.magicminds.backend.modules.voice.domain.VoiceSubscription;

import org.springframework.data.jpa.repository.JpaRepository;

public interface VoiceSubscriptionRepository extends JpaRepository<VoiceSubscription, UUID> {

    Optional<VoiceSubscription> findByParentId(UUID parentId);
}
