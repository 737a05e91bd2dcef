package com.magicminds.backend.modules.story.application;

import java.util.List;
import java.util.UUID;

import com.magicminds.backend.global.error.ProblemException;
import com.magicminds.backend.global.persistence.SubjectUnitOfWork;
import com.magicminds.backend.global.security.AuthenticatedSubject;
import com.magicminds.backend.modules.profile.application.ProfileLookup;
import com.magicminds.backend.modules.profile.domain.ChildProfile;
import com.magicminds.backend.modules.story.domain.GeneratedStory;
import com.magicminds.backend.modules.story.infrastructure.persistence.GeneratedStoryRepository;
import com.magicminds.backend.modules.story.presentation.dto.CreateStoryRequest;
import com.magicminds.backend.modules.story.presentation.dto.StoryResponse;

import org.springframework.stereotype.Service;

@Service
public class StoryService {

    private final SubjectUnitOfWork unitOfWork;
    private final GeneratedStoryRepository generatedStoryRepository;
    private final ProfileLookup profileLookup;

    public StoryService(SubjectUnitOfWork unitOfWork,
                        GeneratedStoryRepository generatedStoryRepository,
                        ProfileLookup profileLookup) {
        this.unitOfWork = unitOfWork;
        this.generatedStoryRepository = generatedStoryRepository;
        this.profileLookup = profileLookup;
    }

    public StoryResponse createStory(AuthenticatedSubject subject, CreateStoryRequest request) {
        return unitOfWork.execute(subject, () -> {
            ChildProfile child = profileLookup.requireOwnedChild(subject, request.childId());
            GeneratedStory story = generatedStoryRepository.saveAndFlush(new GeneratedStory(
                    child.getId(), request.title(), request.content(), request.promptUsed(), request.audioUrl()));
            return StoryResponse.from(story);
        });
    }

    public List<StoryResponse> listStories(AuthenticatedSubject subject, UUID childId) {
        return unitOfWork.read(subject, () -> {
            ChildProfile child = profileLookup.requireOwnedChild(subject, childId);
            return generatedStoryRepository.findByChildIdOrderByCreatedAtDesc(child.getId()).stream()
                    .map(StoryResponse::from)
                    .toList();
        });
    }

    public StoryResponse getStory(AuthenticatedSubject subject, UUID storyId) {
        return unitOfWork.read(subject, () -> StoryResponse.from(requireOwnedStory(subject, storyId)));
    }

    public void deleteStory(AuthenticatedSubject subject, UUID storyId) {
        unitOfWork.run(subject, () -> generatedStoryRepository.delete(requireOwnedStory(subject, storyId)));
    }

    private GeneratedStory requireOwnedStory(AuthenticatedSubject subject, UUID storyId) {
        return generatedStoryRepository.findById(storyId)
                .filter(story -> profileLookup.isOwnedBy(subject, story.getChildId()))
                .orElseThrow(() -> ProblemException.notFound("story.not_found", "Story not found"));
    }
}
