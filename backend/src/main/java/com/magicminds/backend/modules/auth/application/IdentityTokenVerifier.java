package com.magicminds.backend.modules.auth.application;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.PublicKey;
import java.time.Clock;
import java.util.Base64;
import java.util.Date;
import java.util.List;
import java.util.Set;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.magicminds.backend.global.security.AuthenticatedSubject;
import com.magicminds.backend.modules.auth.application.IdentityVerificationException.Reason;
import com.magicminds.backend.modules.auth.infrastructure.jwks.JwksKeyProvider;

import io.jsonwebtoken.ClaimJwtException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Verifies identity provider access tokens (RS256) and extracts the caller's subject and email.
 */
@Service
public class IdentityTokenVerifier {

    private final JwksKeyProvider keyProvider;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String issuer;
    private final List<String> acceptedAudiences;
    private final String emailClaim;
    private final long clockSkewSeconds;

    public IdentityTokenVerifier(
            JwksKeyProvider keyProvider,
            ObjectMapper objectMapper,
            Clock clock,
            @Value("${magicminds.auth.issuer}") String issuer,
            @Value("${magicminds.auth.audience}") String audience,
            @Value("${magicminds.auth.client-id}") String clientId,
            @Value("${magicminds.auth.email-claim:https://magicminds.app/email}") String emailClaim,
            @Value("${magicminds.auth.clock-skew-seconds:0}") long clockSkewSeconds
    ) {
        this.keyProvider = keyProvider;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.issuer = issuer;
        this.acceptedAudiences = List.of(audience, clientId);
        this.emailClaim = emailClaim;
        this.clockSkewSeconds = clockSkewSeconds;
    }

    public AuthenticatedSubject verify(String token) {
        if (!StringUtils.hasText(token)) {
            throw new IdentityVerificationException(Reason.INVALID_TOKEN, "Token is empty");
        }
        String keyId = readKeyId(token);
        PublicKey key = keyProvider.findKey(keyId);

        Claims claims = parseClaims(token, key);
        requireAcceptedAudience(claims);

        String subject = claims.getSubject();
        if (!StringUtils.hasText(subject)) {
            throw new IdentityVerificationException(Reason.INVALID_CLAIMS, "Token has no subject");
        }
        return new AuthenticatedSubject(subject, resolveEmail(claims));
    }

    private Claims parseClaims(String token, PublicKey key) {
        JwtParser parser = Jwts.parser()
                .verifyWith(key)
                .requireIssuer(issuer)
                .clockSkewSeconds(clockSkewSeconds)
                .clock(() -> Date.from(clock.instant()))
                .build();
        try {
            return parser.parseSignedClaims(token).getPayload();
        } catch (ExpiredJwtException ex) {
            throw new IdentityVerificationException(Reason.TOKEN_EXPIRED, "Token has expired", ex);
        } catch (ClaimJwtException ex) {
            throw new IdentityVerificationException(Reason.INVALID_CLAIMS, "Token claims are invalid", ex);
        } catch (JwtException | IllegalArgumentException ex) {
            throw new IdentityVerificationException(Reason.INVALID_TOKEN, "Token is invalid", ex);
        }
    }

    private void requireAcceptedAudience(Claims claims) {
        Set<String> audiences = claims.getAudience();
        if (audiences == null) {
            throw new IdentityVerificationException(Reason.INVALID_CLAIMS, "Token has no audience");
        }
        for (String accepted : acceptedAudiences) {
            if (audiences.contains(accepted)) {
                return;
            }
        }
        throw new IdentityVerificationException(Reason.INVALID_CLAIMS, "Token audience is not accepted");
    }

    private String resolveEmail(Claims claims) {
        String email = textClaim(claims, "email");
        return email != null ? email : textClaim(claims, emailClaim);
    }

    // non-string email claims are ignored rather than rejected
    private static String textClaim(Claims claims, String name) {
        Object value = claims.get(name);
        return value instanceof String text && StringUtils.hasText(text) ? text : null;
    }

    private String readKeyId(String token) {
        String[] parts = token.split("\\.");
        if (parts.length != 3) {
            throw new IdentityVerificationException(Reason.INVALID_TOKEN, "Token is not a compact JWS");
        }
        try {
            byte[] headerBytes = Base64.getUrlDecoder().decode(parts[0]);
            JsonNode header = objectMapper.readTree(new String(headerBytes, StandardCharsets.UTF_8));
            JsonNode kid = header == null ? null : header.get("kid");
            if (kid == null || !kid.isTextual() || kid.asText().isBlank()) {
                throw new IdentityVerificationException(Reason.INVALID_TOKEN, "Token header has no key id");
            }
            return kid.asText();
        } catch (IllegalArgumentException | IOException ex) {
            throw new IdentityVerificationException(Reason.INVALID_TOKEN, "Token header is malformed", ex);
        }
    }
}
