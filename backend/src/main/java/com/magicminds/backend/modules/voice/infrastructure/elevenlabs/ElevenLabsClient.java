package com.magicminds.backend.modules.voice.infrastructure.elevenlabs;

import java.net.URI;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.magicminds.backend.global.error.ProblemException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Client for the ElevenLabs voice endpoints: instant voice cloning and text to speech.
 */
@Component
public class ElevenLabsClient {

    private static final Logger log = LoggerFactory.getLogger(ElevenLabsClient.class);
    private static final String API_KEY_HEADER = "xi-api-key";
    private static final MediaType AUDIO_WAV = MediaType.parseMediaType("audio/wav");
    private static final MediaType AUDIO_MPEG = MediaType.parseMediaType("audio/mpeg");

    private final RestTemplate restTemplate;
    private final String apiKey;
    private final String apiBaseUrl;
    private final String modelId;

    public ElevenLabsClient(
            @Qualifier("externalRestTemplate") RestTemplate restTemplate,
            @Value("${magicminds.voice.elevenlabs.api-key:}") String apiKey,
            @Value("${magicminds.voice.elevenlabs.api-base-url:https://api.elevenlabs.io}") String apiBaseUrl,
            @Value("${magicminds.voice.elevenlabs.model-id:eleven_multilingual_v2}") String modelId
    ) {
        this.restTemplate = restTemplate;
        this.apiKey = apiKey;
        this.apiBaseUrl = apiBaseUrl;
        this.modelId = modelId;
    }

    public boolean isConfigured() {
        return StringUtils.hasText(apiKey);
    }

    /**
     * Uploads one audio sample and returns the provider's id for the new voice.
     */
    public String addVoice(String voiceName, String description, String fileName, byte[] sample) {
        requireConfigured();
        HttpHeaders fileHeaders = new HttpHeaders();
        fileHeaders.setContentType(AUDIO_WAV);
        ByteArrayResource file = new ByteArrayResource(sample) {
            @Override
            public String getFilename() {
                return fileName;
            }
        };

        MultiValueMap<String, Object> parts = new LinkedMultiValueMap<>();
        parts.add("name", voiceName);
        parts.add("description", description);
        parts.add("files", new HttpEntity<>(file, fileHeaders));

        HttpHeaders headers = headers();
        headers.setContentType(MediaType.MULTIPART_FORM_DATA);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        URI uri = UriComponentsBuilder.fromHttpUrl(apiBaseUrl).path("/v1/voices/add").build().toUri();
        JsonNode body;
        try {
            body = restTemplate.exchange(uri, HttpMethod.POST, new HttpEntity<>(parts, headers), JsonNode.class)
                    .getBody();
        } catch (RestClientException ex) {
            log.warn("ElevenLabs voice clone failed: {}", ex.getMessage());
            throw providerError("ElevenLabs voice clone request failed");
        }
        String voiceId = body == null ? null : body.path("voice_id").asText(null);
        if (!StringUtils.hasText(voiceId)) {
            throw providerError("ElevenLabs response is missing 'voice_id'");
        }
        return voiceId;
    }

    public byte[] textToSpeech(String voiceId, String text) {
        requireConfigured();
        HttpHeaders headers = headers();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(AUDIO_MPEG));

        Map<String, Object> payload = Map.of(
                "text", text,
                "model_id", modelId,
                "voice_settings", Map.of("stability", 0.5, "similarity_boost", 0.8)
        );
        URI uri = UriComponentsBuilder.fromHttpUrl(apiBaseUrl)
                .path("/v1/text-to-speech/{voiceId}")
                .encode()
                .buildAndExpand(voiceId)
                .toUri();
        byte[] audio;
        try {
            audio = restTemplate.exchange(uri, HttpMethod.POST, new HttpEntity<>(payload, headers), byte[].class)
                    .getBody();
        } catch (RestClientException ex) {
            log.warn("ElevenLabs text to speech failed for voice {}: {}", voiceId, ex.getMessage());
            throw providerError("ElevenLabs text to speech request failed");
        }
        if (audio == null || audio.length == 0) {
            throw providerError("ElevenLabs returned no audio");
        }
        return audio;
    }

    private void requireConfigured() {
        if (!isConfigured()) {
            throw new ProblemException(HttpStatus.SERVICE_UNAVAILABLE, "voice.provider_not_configured",
                    "ElevenLabs API key not configured");
        }
    }

    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(API_KEY_HEADER, apiKey);
        return headers;
    }

    private static ProblemException providerError(String detail) {
        return new ProblemException(HttpStatus.BAD_GATEWAY, "voice.provider_error", detail);
    }
}
