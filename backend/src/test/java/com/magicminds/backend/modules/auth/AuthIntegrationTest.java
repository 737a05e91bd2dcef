package com.magicminds.backend.modules.auth;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.magicminds.backend.modules.auth.application.IdentityVerificationException;
import com.magicminds.backend.modules.auth.application.IdentityVerificationException.Reason;
import com.magicminds.backend.support.AbstractPostgresIntegrationTest;
import com.magicminds.backend.support.TestTokens;

import java.time.Instant;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class AuthIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void missingBearerTokenIsUnauthorized() throws Exception {
        mockMvc.perform(get("/profiles/parent"))
                .andExpect(status().isUnauthorized())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_PROBLEM_JSON))
                .andExpect(jsonPath("$.code").value("unauthorized"));
    }

    @Test
    void expiredTokenIsReportedAsExpired() throws Exception {
        mockMvc.perform(get("/profiles/parent")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + TestTokens.expired("auth0|late-parent")))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("auth.token_expired"))
                .andExpect(jsonPath("$.status").value(401));
    }

    @Test
    void garbageTokenIsInvalid() throws Exception {
        mockMvc.perform(get("/profiles/parent")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer not.a.token"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("auth.invalid_token"));
    }

    @Test
    void signingKeyOutageAnswersServiceUnavailable() throws Exception {
        when(jwksKeyProvider.findKey("rotated-key")).thenThrow(
                new IdentityVerificationException(Reason.SERVICE_UNAVAILABLE, "Signing keys could not be fetched"));
        String token = TestTokens.builder("auth0|parent", Instant.now(), Instant.now().plusSeconds(300))
                .header().keyId("rotated-key").and()
                .compact();

        mockMvc.perform(get("/profiles/parent")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + token))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("auth.signing_keys_unavailable"));
    }

    @Test
    void validTokenReachesTheApplication() throws Exception {
        mockMvc.perform(get("/profiles/parent")
                        .header(HttpHeaders.AUTHORIZATION, TestTokens.bearer("auth0|no-profile-yet")))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("profile.parent_not_found"));
    }
}
