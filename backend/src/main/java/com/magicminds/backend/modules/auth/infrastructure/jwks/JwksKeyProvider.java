package com.magicminds.backend.modules.auth.infrastructure.jwks;

import java.security.Key;
import java.security.PublicKey;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import com.magicminds.backend.modules.auth.application.IdentityVerificationException;
import com.magicminds.backend.modules.auth.application.IdentityVerificationException.Reason;

import io.jsonwebtoken.security.Jwk;
import io.jsonwebtoken.security.JwkSet;
import io.jsonwebtoken.security.Jwks;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Time-boxed cache of the identity provider's signing keys.
 *
 * <p>The key set is refetched once it is older than the configured TTL, or when a token names a key id that
 * is not cached. Every fetch attempt, successful or not, starts the minimum refresh interval, so at most one
 * request per interval waits on the provider. When a refresh fails the previous key set keeps being served
 * until it is older than TTL plus the maximum staleness.</p>
 */
@Component
public class JwksKeyProvider {

    private static final Logger log = LoggerFactory.getLogger(JwksKeyProvider.class);

    private final RestTemplate restTemplate;
    private final String jwksUrl;
    private final Duration cacheTtl;
    private final Duration minRefreshInterval;
    private final Duration maxStaleness;
    private final Clock clock;

    private Map<String, PublicKey> keys = Map.of();
    private Instant fetchedAt;
    private Instant lastRefreshAttempt;

    public JwksKeyProvider(
            @Qualifier("externalRestTemplate") RestTemplate restTemplate,
            @Value("${magicminds.auth.jwks-url}") String jwksUrl,
            @Value("${magicminds.auth.jwks-cache-ttl:10m}") Duration cacheTtl,
            @Value("${magicminds.auth.jwks-min-refresh-interval:30s}") Duration minRefreshInterval,
            @Value("${magicminds.auth.jwks-max-staleness:1h}") Duration maxStaleness,
            Clock clock
    ) {
        this.restTemplate = restTemplate;
        this.jwksUrl = jwksUrl;
        this.cacheTtl = cacheTtl;
        this.minRefreshInterval = minRefreshInterval;
        this.maxStaleness = maxStaleness;
        this.clock = clock;
    }

    public synchronized PublicKey findKey(String keyId) {
        Instant now = clock.instant();
        if (isExpired(now) && refreshAllowed(now)) {
            refreshOrKeepCached(now);
        }
        if (!isUsable(now)) {
            throw new IdentityVerificationException(Reason.SERVICE_UNAVAILABLE, "Signing keys are unavailable");
        }
        PublicKey key = keys.get(keyId);
        if (key == null && refreshAllowed(now)) {
            log.info("Signing key {} not cached; refreshing key set", keyId);
            refreshOrKeepCached(now);
            key = keys.get(keyId);
        }
        if (key == null) {
            throw new IdentityVerificationException(Reason.SERVICE_UNAVAILABLE,
                    "No signing key matches the token key id");
        }
        return key;
    }

    private boolean isExpired(Instant now) {
        return fetchedAt == null || !now.isBefore(fetchedAt.plus(cacheTtl));
    }

    private boolean isUsable(Instant now) {
        return fetchedAt != null && now.isBefore(fetchedAt.plus(cacheTtl).plus(maxStaleness));
    }

    private void refreshOrKeepCached(Instant now) {
        try {
            refresh(now);
        } catch (IdentityVerificationException ex) {
            if (!isUsable(now)) {
                throw ex;
            }
            log.warn("Keeping signing keys fetched at {} after a failed refresh", fetchedAt);
        }
    }

    private boolean refreshAllowed(Instant now) {
        return lastRefreshAttempt == null || !now.isBefore(lastRefreshAttempt.plus(minRefreshInterval));
    }

    private void refresh(Instant now) {
        lastRefreshAttempt = now;
        String body;
        try {
            body = restTemplate.getForObject(jwksUrl, String.class);
        } catch (RestClientException ex) {
            log.warn("Failed to fetch signing keys from {}: {}", jwksUrl, ex.getMessage());
            throw new IdentityVerificationException(Reason.SERVICE_UNAVAILABLE,
                    "Signing keys could not be fetched", ex);
        }
        if (!StringUtils.hasText(body)) {
            throw new IdentityVerificationException(Reason.SERVICE_UNAVAILABLE, "Signing key set is empty");
        }

        Map<String, PublicKey> parsed = new HashMap<>();
        try {
            JwkSet jwkSet = Jwks.setParser().build().parse(body);
            for (Jwk<?> jwk : jwkSet.getKeys()) {
                Key key = jwk.toKey();
                if (jwk.getId() != null && key instanceof PublicKey publicKey) {
                    parsed.put(jwk.getId(), publicKey);
                }
            }
        } catch (RuntimeException ex) {
            log.warn("Signing key set from {} could not be parsed: {}", jwksUrl, ex.getMessage());
            throw new IdentityVerificationException(Reason.SERVICE_UNAVAILABLE,
                    "Signing key set could not be parsed", ex);
        }

        keys = Map.copyOf(parsed);
        fetchedAt = now;
        log.info("Refreshed signing key set: {} keys", keys.size());
    }
}
