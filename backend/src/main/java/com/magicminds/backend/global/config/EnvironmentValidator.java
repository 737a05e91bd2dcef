package com.magicminds.backend.global.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Fails fast at startup when mandatory settings are missing.
 */
@Component
@ConditionalOnProperty(value = "magicminds.env-validation.enabled", havingValue = "true", matchIfMissing = true)
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    private static final String[] REQUIRED_PROPERTIES = {
            "spring.datasource.url",
            "magicminds.auth.issuer",
            "magicminds.auth.audience",
            "magicminds.auth.client-id",
            "magicminds.auth.jwks-url",
            "app.cors.allowed-origins",
            "server.port"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> missingVars = new ArrayList<>();
        List<String> invalidVars = new ArrayList<>();

        for (String property : REQUIRED_PROPERTIES) {
            Optional<String> value = Optional.ofNullable(environment.getProperty(property));
            if (value.map(String::trim).orElse("").isEmpty()) {
                missingVars.add(property);
            }
        }

        Optional<String> jwksUrl = Optional.ofNullable(environment.getProperty("magicminds.auth.jwks-url"));
        if (jwksUrl.filter(url -> !url.isBlank() && !url.startsWith("https://") && !url.startsWith("http://")).isPresent()) {
            invalidVars.add("magicminds.auth.jwks-url: must be an http(s) URL");
        }

        Optional<String> port = Optional.ofNullable(environment.getProperty("server.port"));
        if (port.isPresent() && !port.get().isBlank()) {
            try {
                int value = Integer.parseInt(port.get().trim());
                if (value < 0 || value > 65535) {
                    invalidVars.add("server.port: must be between 0 and 65535");
                }
            } catch (NumberFormatException e) {
                invalidVars.add("server.port: must be numeric");
            }
        }

        if (!missingVars.isEmpty() || !invalidVars.isEmpty()) {
            if (!missingVars.isEmpty()) {
                log.error("Missing required settings: {}", String.join(", ", missingVars));
            }
            invalidVars.forEach(v -> log.error("Invalid setting - {}", v));
            throw new IllegalStateException("Environment validation failed; see the log for the offending settings");
        }

        if (environment.getProperty("magicminds.billing.stripe.secret-key", "").isBlank()) {
            log.warn("Stripe secret key is not configured; checkout endpoints will answer 503");
        }
        if (environment.getProperty("magicminds.voice.elevenlabs.api-key", "").isBlank()) {
            log.warn("ElevenLabs API key is not configured; voice endpoints will answer 503");
        }
        log.info("Environment validation completed (gcp project '{}', region '{}')",
                environment.getProperty("magicminds.gcp.project-id", ""),
                environment.getProperty("magicminds.gcp.region", ""));
    }
}
