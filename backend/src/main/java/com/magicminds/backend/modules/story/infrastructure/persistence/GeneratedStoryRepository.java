package com.magicminds.backend.modules.story.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.magicminds.backend.modules.story.domain.GeneratedStory;

import org.springframework.data.jpa.repository.JpaRepository;

public interface GeneratedStoryRepository extends JpaRepository<GeneratedStory, UUID> {

    List<GeneratedStory> findByChildIdOrderByCreatedAtDesc(UUID childId);
}
