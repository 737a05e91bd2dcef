package com.magicminds.backend.modules.voice.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Optional;
import java.util.UUID;

import com.magicminds.backend.global.error.ProblemException;
import com.magicminds.backend.global.persistence.SubjectUnitOfWork;
import com.magicminds.backend.global.security.AuthenticatedSubject;
import com.magicminds.backend.modules.profile.application.ProfileLookup;
import com.magicminds.backend.modules.profile.domain.ChildProfile;
import com.magicminds.backend.modules.profile.domain.ParentAccount;
import com.magicminds.backend.modules.profile.infrastructure.persistence.ChildProfileRepository;
import com.magicminds.backend.modules.voice.domain.SubscriptionStatus;
import com.magicminds.backend.modules.voice.domain.VoiceSubscription;
import com.magicminds.backend.modules.voice.infrastructure.elevenlabs.ElevenLabsClient;
import com.magicminds.backend.modules.voice.infrastructure.persistence.VoiceSubscriptionRepository;
import com.magicminds.backend.modules.voice.presentation.dto.CreateVoiceCloneRequest;
import com.magicminds.backend.modules.voice.presentation.dto.GenerateStoryAudioRequest;
import com.magicminds.backend.modules.voice.presentation.dto.StoryAudioResponse;
import com.magicminds.backend.modules.voice.presentation.dto.VoiceCloneResponse;
import com.magicminds.backend.support.UnitOfWorkStubs;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class VoiceServiceTest {

    private static final AuthenticatedSubject SUBJECT = new AuthenticatedSubject("auth0|parent", "parent@example.com");
    private static final String SAMPLE = Base64.getEncoder().encodeToString("RIFF....WAVE".getBytes(StandardCharsets.US_ASCII));

    @Mock
    private SubjectUnitOfWork unitOfWork;

    @Mock
    private VoiceSubscriptionRepository voiceSubscriptionRepository;

    @Mock
    private ChildProfileRepository childProfileRepository;

    @Mock
    private ProfileLookup profileLookup;

    @Mock
    private ElevenLabsClient elevenLabsClient;

    private VoiceService voiceService;
    private ParentAccount parent;
    private ChildProfile child;

    @BeforeEach
    void setUp() {
        UnitOfWorkStubs.runInline(unitOfWork);
        voiceService = new VoiceService(unitOfWork, voiceSubscriptionRepository, childProfileRepository,
                profileLookup, elevenLabsClient);
        parent = new ParentAccount("auth0|parent", "parent@example.com", "Parent");
        ReflectionTestUtils.setField(parent, "id", UUID.randomUUID());
        child = new ChildProfile(parent, "Mia", "7-9", null);
        ReflectionTestUtils.setField(child, "id", UUID.randomUUID());
        lenient().when(profileLookup.requireParent(SUBJECT)).thenReturn(parent);
    }

    @Test
    void cloningRequiresAnActiveSubscription() {
        when(voiceSubscriptionRepository.findByParentId(parent.getId())).thenReturn(Optional.empty());

        assertProblem(() -> voiceService.createVoiceClone(SUBJECT, request(SAMPLE)),
                HttpStatus.FORBIDDEN, "voice.subscription_required");
        verify(elevenLabsClient, never()).addVoice(anyString(), anyString(), anyString(), any());
    }

    @Test
    void cancelledSubscriptionDoesNotEntitle() {
        when(voiceSubscriptionRepository.findByParentId(parent.getId())).thenReturn(Optional.of(subscription(SubscriptionStatus.CANCELLED)));

        assertProblem(() -> voiceService.createVoiceClone(SUBJECT, request(SAMPLE)),
                HttpStatus.FORBIDDEN, "voice.subscription_required");
    }

    @Test
    void unconfiguredProviderAnswersServiceUnavailable() {
        entitle();
        when(elevenLabsClient.isConfigured()).thenReturn(false);

        assertProblem(() -> voiceService.createVoiceClone(SUBJECT, request(SAMPLE)),
                HttpStatus.SERVICE_UNAVAILABLE, "voice.provider_not_configured");
    }

    @Test
    void invalidBase64IsRejected() {
        entitle();
        when(elevenLabsClient.isConfigured()).thenReturn(true);

        assertProblem(() -> voiceService.createVoiceClone(SUBJECT, request("not base64 at all!")),
                HttpStatus.BAD_REQUEST, "voice.invalid_audio");
        verify(elevenLabsClient, never()).addVoice(anyString(), anyString(), anyString(), any());
    }

    @Test
    void storesProviderVoiceIdOnTheChild() {
        entitle();
        when(elevenLabsClient.isConfigured()).thenReturn(true);
        when(elevenLabsClient.addVoice(eq("Child_" + child.getId() + "_Voice"), anyString(),
                eq(VoiceService.DEFAULT_FILE_NAME), any())).thenReturn("voice-123");

        VoiceCloneResponse response = voiceService.createVoiceClone(SUBJECT, request(SAMPLE));

        assertThat(response.success()).isTrue();
        assertThat(response.voiceId()).isEqualTo("voice-123");
        assertThat(child.isVoiceCloneEnabled()).isTrue();
        assertThat(child.getVoiceCloneUrl()).isEqualTo("voice-123");
        verify(childProfileRepository).save(child);
    }

    @Test
    void storyAudioIsReturnedAsBase64() {
        when(elevenLabsClient.textToSpeech("voice-123", "Once upon a time")).thenReturn(new byte[]{1, 2, 3});

        StoryAudioResponse response = voiceService.generateStoryAudio(
                new GenerateStoryAudioRequest("Once upon a time", "voice-123"));

        assertThat(response.audioContent()).isEqualTo(Base64.getEncoder().encodeToString(new byte[]{1, 2, 3}));
    }

    private void entitle() {
        when(voiceSubscriptionRepository.findByParentId(parent.getId()))
                .thenReturn(Optional.of(subscription(SubscriptionStatus.ACTIVE)));
        when(profileLookup.requireOwnedChild(SUBJECT, child.getId())).thenReturn(child);
    }

    private VoiceSubscription subscription(SubscriptionStatus status) {
        VoiceSubscription subscription = new VoiceSubscription(parent.getId());
        subscription.apply("sub_123", "cus_123", status, "voice-monthly");
        return subscription;
    }

    private CreateVoiceCloneRequest request(String audio) {
        return new CreateVoiceCloneRequest(child.getId(), audio, null);
    }

    private static void assertProblem(Runnable call, HttpStatus status, String code) {
        assertThatThrownBy(call::run)
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(status);
                    assertThat(ex.getCode()).isEqualTo(code);
                });
    }
}
