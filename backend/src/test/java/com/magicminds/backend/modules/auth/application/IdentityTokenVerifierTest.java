package com.magicminds.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Date;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.magicminds.backend.global.security.AuthenticatedSubject;
import com.magicminds.backend.modules.auth.application.IdentityVerificationException.Reason;
import com.magicminds.backend.modules.auth.infrastructure.jwks.JwksKeyProvider;
import com.magicminds.backend.support.TestTokens;

import io.jsonwebtoken.Jwts;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class IdentityTokenVerifierTest {

    private static final String EMAIL_CLAIM = "https://magicminds.app/email";

    @Mock
    private JwksKeyProvider keyProvider;

    private IdentityTokenVerifier verifier;

    @BeforeEach
    void setUp() {
        verifier = new IdentityTokenVerifier(keyProvider, new ObjectMapper(), Clock.systemUTC(),
                TestTokens.ISSUER, TestTokens.AUDIENCE, TestTokens.CLIENT_ID, EMAIL_CLAIM, 0);
    }

    @Test
    void acceptsValidTokenAndExtractsSubjectAndEmail() {
        serveTestKey();

        AuthenticatedSubject subject = verifier.verify(TestTokens.token("auth0|parent-1", "parent@example.com"));

        assertThat(subject.subject()).isEqualTo("auth0|parent-1");
        assertThat(subject.email()).isEqualTo("parent@example.com");
    }

    @Test
    void fallsBackToNamespacedEmailClaim() {
        serveTestKey();
        String token = TestTokens.builder("auth0|parent-2", Instant.now(), Instant.now().plusSeconds(300))
                .claim(EMAIL_CLAIM, "namespaced@example.com")
                .compact();

        assertThat(verifier.verify(token).email()).isEqualTo("namespaced@example.com");
    }

    @Test
    void emailIsAbsentWhenNoClaimCarriesIt() {
        serveTestKey();
        String token = TestTokens.builder("auth0|parent-3", Instant.now(), Instant.now().plusSeconds(300)).compact();

        AuthenticatedSubject subject = verifier.verify(token);

        assertThat(subject.email()).isNull();
        assertThat(subject.hasEmail()).isFalse();
    }

    @Test
    void nonStringEmailClaimIsIgnored() {
        serveTestKey();
        String token = TestTokens.builder("auth0|parent-4", Instant.now(), Instant.now().plusSeconds(300))
                .claim("email", 42)
                .claim(EMAIL_CLAIM, "namespaced@example.com")
                .compact();

        AuthenticatedSubject subject = verifier.verify(token);

        assertThat(subject.subject()).isEqualTo("auth0|parent-4");
        assertThat(subject.email()).isEqualTo("namespaced@example.com");
    }

    @Test
    void acceptsClientIdAsAudience() {
        serveTestKey();
        String token = Jwts.builder()
                .header().keyId(TestTokens.KEY_ID).and()
                .issuer(TestTokens.ISSUER)
                .audience().add(TestTokens.CLIENT_ID).and()
                .subject("auth0|spa-user")
                .expiration(Date.from(Instant.now().plusSeconds(300)))
                .signWith(signingKey().getPrivate(), Jwts.SIG.RS256)
                .compact();

        assertThat(verifier.verify(token).subject()).isEqualTo("auth0|spa-user");
    }

    @Test
    void expiredTokenIsReportedAsExpired() {
        serveTestKey();

        assertReason(TestTokens.expired("auth0|late"), Reason.TOKEN_EXPIRED);
    }

    @Test
    void foreignIssuerIsRejectedAsInvalidClaims() {
        serveTestKey();
        String token = TestTokens.builder("auth0|parent", Instant.now(), Instant.now().plusSeconds(300))
                .issuer("https://evil.example.com/")
                .compact();

        assertReason(token, Reason.INVALID_CLAIMS);
    }

    @Test
    void unknownAudienceIsRejectedAsInvalidClaims() {
        serveTestKey();
        String token = Jwts.builder()
                .header().keyId(TestTokens.KEY_ID).and()
                .issuer(TestTokens.ISSUER)
                .audience().add("https://another-api.example.com").and()
                .subject("auth0|parent")
                .expiration(Date.from(Instant.now().plusSeconds(300)))
                .signWith(signingKey().getPrivate(), Jwts.SIG.RS256)
                .compact();

        assertReason(token, Reason.INVALID_CLAIMS);
    }

    @Test
    void tokenSignedByAnotherKeyIsInvalid() {
        serveTestKey();
        KeyPair otherKey = Jwts.SIG.RS256.keyPair().build();
        String token = Jwts.builder()
                .header().keyId(TestTokens.KEY_ID).and()
                .issuer(TestTokens.ISSUER)
                .audience().add(TestTokens.AUDIENCE).and()
                .subject("auth0|forged")
                .expiration(Date.from(Instant.now().plus(Duration.ofMinutes(5))))
                .signWith(otherKey.getPrivate(), Jwts.SIG.RS256)
                .compact();

        assertReason(token, Reason.INVALID_TOKEN);
    }

    @Test
    void missingSubjectIsRejectedAsInvalidClaims() {
        serveTestKey();
        String token = Jwts.builder()
                .header().keyId(TestTokens.KEY_ID).and()
                .issuer(TestTokens.ISSUER)
                .audience().add(TestTokens.AUDIENCE).and()
                .expiration(Date.from(Instant.now().plusSeconds(300)))
                .signWith(signingKey().getPrivate(), Jwts.SIG.RS256)
                .compact();

        assertReason(token, Reason.INVALID_CLAIMS);
    }

    @Test
    void headerWithoutKeyIdIsRejectedBeforeKeyLookup() {
        String header = Base64.getUrlEncoder().withoutPadding()
                .encodeToString("{\"alg\":\"RS256\",\"typ\":\"JWT\"}".getBytes(StandardCharsets.UTF_8));

        assertReason(header + ".e30.c2ln", Reason.INVALID_TOKEN);
        verify(keyProvider, never()).findKey(anyString());
    }

    @Test
    void malformedTokenIsInvalid() {
        assertReason("not-a-jwt", Reason.INVALID_TOKEN);
        assertReason("%%%.%%%.%%%", Reason.INVALID_TOKEN);
        assertReason("", Reason.INVALID_TOKEN);
    }

    @Test
    void signingKeyOutageSurfacesAsServiceUnavailable() {
        when(keyProvider.findKey(TestTokens.KEY_ID)).thenThrow(
                new IdentityVerificationException(Reason.SERVICE_UNAVAILABLE, "Signing keys could not be fetched"));

        assertReason(TestTokens.token("auth0|parent", "parent@example.com"), Reason.SERVICE_UNAVAILABLE);
    }

    private void serveTestKey() {
        when(keyProvider.findKey(TestTokens.KEY_ID)).thenReturn(TestTokens.publicKey());
    }

    private static KeyPair signingKey() {
        return TestTokens.keyPair();
    }

    private void assertReason(String token, Reason reason) {
        assertThatThrownBy(() -> verifier.verify(token))
                .isInstanceOf(IdentityVerificationException.class)
                .extracting(ex -> ((IdentityVerificationException) ex).getReason())
                .isEqualTo(reason);
    }
}
