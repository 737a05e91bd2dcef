package com.magicminds.backend.modules.voice.application;

import java.util.Base64;
import java.util.UUID;

import com.magicminds.backend.global.error.ProblemException;
import com.magicminds.backend.global.persistence.SubjectUnitOfWork;
import com.magicminds.backend.global.security.AuthenticatedSubject;
import com.magicminds.backend.modules.profile.application.ProfileLookup;
import com.magicminds.backend.modules.profile.domain.ChildProfile;
import com.magicminds.backend.modules.profile.domain.ParentAccount;
import com.magicminds.backend.modules.profile.infrastructure.persistence.ChildProfileRepository;
import com.magicminds.backend.modules.voice.domain.VoiceSubscription;
import com.magicminds.backend.modules.voice.infrastructure.elevenlabs.ElevenLabsClient;
import com.magicminds.backend.modules.voice.infrastructure.persistence.VoiceSubscriptionRepository;
import com.magicminds.backend.modules.voice.presentation.dto.CreateVoiceCloneRequest;
import com.magicminds.backend.modules.voice.presentation.dto.GenerateStoryAudioRequest;
import com.magicminds.backend.modules.voice.presentation.dto.StoryAudioResponse;
import com.magicminds.backend.modules.voice.presentation.dto.VoiceCloneResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
public class VoiceService {

    private static final Logger log = LoggerFactory.getLogger(VoiceService.class);
    static final String DEFAULT_FILE_NAME = "voice_sample.wav";
    private static final String VOICE_DESCRIPTION = "AI cloned voice for storytelling";

    private final SubjectUnitOfWork unitOfWork;
    private final VoiceSubscriptionRepository voiceSubscriptionRepository;
    private final ChildProfileRepository childProfileRepository;
    private final ProfileLookup profileLookup;
    private final ElevenLabsClient elevenLabsClient;

    public VoiceService(SubjectUnitOfWork unitOfWork,
                        VoiceSubscriptionRepository voiceSubscriptionRepository,
                        ChildProfileRepository childProfileRepository,
                        ProfileLookup profileLookup,
                        ElevenLabsClient elevenLabsClient) {
        this.unitOfWork = unitOfWork;
        this.voiceSubscriptionRepository = voiceSubscriptionRepository;
        this.childProfileRepository = childProfileRepository;
        this.profileLookup = profileLookup;
        this.elevenLabsClient = elevenLabsClient;
    }

    /**
     * Clones a child's voice from one sample. Entitlement and ownership are checked before the upload;
     * the returned voice id is stored on the child in a second unit of work once the provider answers.
     */
    public VoiceCloneResponse createVoiceClone(AuthenticatedSubject subject, CreateVoiceCloneRequest request) {
        UUID childId = unitOfWork.read(subject, () -> {
            ParentAccount parent = profileLookup.requireParent(subject);
            boolean entitled = voiceSubscriptionRepository.findByParentId(parent.getId())
                    .map(VoiceSubscription::isActive)
                    .orElse(false);
            if (!entitled) {
                throw ProblemException.forbidden("voice.subscription_required",
                        "Active subscription required for voice cloning");
            }
            return profileLookup.requireOwnedChild(subject, request.childId()).getId();
        });
        if (!elevenLabsClient.isConfigured()) {
            throw new ProblemException(HttpStatus.SERVICE_UNAVAILABLE, "voice.provider_not_configured",
                    "ElevenLabs API key not configured");
        }
        byte[] sample = decodeSample(request.audioData());
        String fileName = StringUtils.hasText(request.fileName()) ? request.fileName() : DEFAULT_FILE_NAME;

        String voiceId = elevenLabsClient.addVoice("Child_" + childId + "_Voice", VOICE_DESCRIPTION, fileName, sample);

        unitOfWork.run(subject, () -> {
            ChildProfile child = profileLookup.requireOwnedChild(subject, childId);
            child.setVoiceCloneEnabled(true);
            child.setVoiceCloneUrl(voiceId);
            childProfileRepository.save(child);
        });
        log.info("Stored cloned voice {} for child {}", voiceId, childId);
        return new VoiceCloneResponse(true, voiceId, childId);
    }

    public StoryAudioResponse generateStoryAudio(GenerateStoryAudioRequest request) {
        byte[] audio = elevenLabsClient.textToSpeech(request.voiceId(), request.storyText());
        return new StoryAudioResponse(true, Base64.getEncoder().encodeToString(audio));
    }

    static byte[] decodeSample(String audioData) {
        byte[] decoded;
        try {
            decoded = Base64.getDecoder().decode(audioData.trim());
        } catch (IllegalArgumentException ex) {
            throw ProblemException.badRequest("voice.invalid_audio", "Invalid base64 audio data");
        }
        if (decoded.length == 0) {
            throw ProblemException.badRequest("voice.invalid_audio", "Audio sample is empty");
        }
        return decoded;
    }
}
