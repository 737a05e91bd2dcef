package com.magicminds.backend.modules.friend;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.Map;
import java.util.UUID;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.magicminds.backend.support.AbstractPostgresIntegrationTest;
import com.magicminds.backend.support.ProfileFixtures;
import com.magicminds.backend.support.TestTokens;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class FriendIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final String ALICE_PARENT = "auth0|alice-parent";
    private static final String BOB_PARENT = "auth0|bob-parent";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private ProfileFixtures fixtures;
    private UUID alice;
    private UUID bob;

    @BeforeEach
    void setUp() throws Exception {
        fixtures = new ProfileFixtures(mockMvc, objectMapper);
        alice = fixtures.parentWithChild(ALICE_PARENT, "Alice");
        bob = fixtures.parentWithChild(BOB_PARENT, "Bobby");
    }

    @Test
    void requestIsPendingUntilAddresseeAccepts() throws Exception {
        JsonNode request = sendRequest(ALICE_PARENT, alice, bob, 201);
        assertThat(request.get("status").asText()).isEqualTo("pending");

        mockMvc.perform(get("/friends/requests").param("childId", bob.toString())
                        .header(HttpHeaders.AUTHORIZATION, TestTokens.bearer(BOB_PARENT)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].requesterId").value(alice.toString()));

        JsonNode accepted = fixtures.postJson(BOB_PARENT,
                "/friends/requests/" + request.get("id").asText() + "/accept", Map.of(), 200);
        assertThat(accepted.get("status").asText()).isEqualTo("accepted");

        mockMvc.perform(get("/friends").param("childId", alice.toString())
                        .header(HttpHeaders.AUTHORIZATION, TestTokens.bearer(ALICE_PARENT)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value(bob.toString()))
                .andExpect(jsonPath("$[0].status").value("offline"))
                .andExpect(jsonPath("$[0].isOnline").value(false));
    }

    @Test
    void onlyTheAddresseeMayAccept() throws Exception {
        JsonNode request = sendRequest(ALICE_PARENT, alice, bob, 201);

        JsonNode problem = fixtures.postJson(ALICE_PARENT,
                "/friends/requests/" + request.get("id").asText() + "/accept", Map.of(), 403);

        assertThat(problem.get("code").asText()).isEqualTo("friend.not_addressee");
    }

    @Test
    void reverseRequestIsRejectedAsDuplicate() throws Exception {
        sendRequest(ALICE_PARENT, alice, bob, 201);

        JsonNode problem = sendRequest(BOB_PARENT, bob, alice, 400);

        assertThat(problem.get("code").asText()).isEqualTo("friend.request_exists");
    }

    @Test
    void requestFromAnotherParentsChildIsNotFound() throws Exception {
        JsonNode problem = sendRequest(BOB_PARENT, alice, bob, 404);

        assertThat(problem.get("code").asText()).isEqualTo("profile.child_not_found");
    }

    @Test
    void declineRemovesThePendingRequest() throws Exception {
        JsonNode request = sendRequest(ALICE_PARENT, alice, bob, 201);

        fixtures.postJson(BOB_PARENT, "/friends/requests/" + request.get("id").asText() + "/decline", Map.of(), 204);

        Integer rows = jdbcTemplate.queryForObject("select count(*) from friends", Integer.class);
        assertThat(rows).isZero();
    }

    @Test
    void presenceReflectsOnlineFlag() throws Exception {
        befriend();
        fixtures.postJson(BOB_PARENT, "/profiles/children/" + bob + "/status", Map.of("isOnline", true), 200);

        mockMvc.perform(get("/friends").param("childId", alice.toString())
                        .header(HttpHeaders.AUTHORIZATION, TestTokens.bearer(ALICE_PARENT)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].status").value("online"));
    }

    @Test
    void searchExcludesSelfAndConnectedChildren() throws Exception {
        UUID bonnie = fixtures.createChild(BOB_PARENT, "Bonnie");
        befriend();

        mockMvc.perform(get("/friends/children/search").param("q", "b").param("childId", alice.toString())
                        .header(HttpHeaders.AUTHORIZATION, TestTokens.bearer(ALICE_PARENT)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].id").value(bonnie.toString()));
    }

    @Test
    void blankSearchIsRejected() throws Exception {
        mockMvc.perform(get("/friends/children/search").param("q", "  ")
                        .header(HttpHeaders.AUTHORIZATION, TestTokens.bearer(ALICE_PARENT)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("friend.search_query_required"));
    }

    @Test
    void unfriendTwiceReportsMissingFriendship() throws Exception {
        befriend();

        mockMvc.perform(delete("/friends/{childId}", alice).param("friendChildId", bob.toString())
                        .header(HttpHeaders.AUTHORIZATION, TestTokens.bearer(ALICE_PARENT)))
                .andExpect(status().isNoContent());

        mockMvc.perform(delete("/friends/{childId}", alice).param("friendChildId", bob.toString())
                        .header(HttpHeaders.AUTHORIZATION, TestTokens.bearer(ALICE_PARENT)))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("friend.not_found"));
    }

    private void befriend() throws Exception {
        JsonNode request = sendRequest(ALICE_PARENT, alice, bob, 201);
        fixtures.postJson(BOB_PARENT, "/friends/requests/" + request.get("id").asText() + "/accept", Map.of(), 200);
    }

    private JsonNode sendRequest(String parent, UUID requester, UUID addressee, int expectedStatus) throws Exception {
        return fixtures.postJson(parent, "/friends/requests",
                Map.of("requesterId", requester, "addresseeId", addressee), expectedStatus);
    }
}
