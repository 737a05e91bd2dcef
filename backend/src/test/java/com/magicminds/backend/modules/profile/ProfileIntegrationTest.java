package com.magicminds.backend.modules.profile;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
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
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class ProfileIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final String PARENT = "auth0|profile-parent";
    private static final String OTHER_PARENT = "auth0|profile-other";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private ProfileFixtures fixtures;

    @BeforeEach
    void setUp() {
        fixtures = new ProfileFixtures(mockMvc, objectMapper);
    }

    @Test
    void createParentIsIdempotentAndUsesTokenEmail() throws Exception {
        JsonNode first = fixtures.postJson(PARENT, "/profiles/parent", Map.of("name", "Ada"), 201);
        JsonNode second = fixtures.postJson(PARENT, "/profiles/parent", Map.of("name", "Renamed"), 201);

        assertThat(second.get("id").asText()).isEqualTo(first.get("id").asText());
        assertThat(second.get("name").asText()).isEqualTo("Ada");
        assertThat(first.get("email").asText()).isEqualTo(PARENT + "@example.com");
        assertThat(first.get("auth0UserId").asText()).isEqualTo(PARENT);
        Integer rows = jdbcTemplate.queryForObject(
                "select count(*) from parent_profiles where auth0_user_id = ?", Integer.class, PARENT);
        assertThat(rows).isEqualTo(1);
    }

    @Test
    void childrenRequireAParentProfile() throws Exception {
        fixtures.postJson(PARENT, "/profiles/children",
                Map.of("name", "Mia", "ageGroup", "4-6"), 404);
    }

    @Test
    void listChildrenStartsEmpty() throws Exception {
        fixtures.createParent(PARENT);

        mockMvc.perform(get("/profiles/children").header(HttpHeaders.AUTHORIZATION, TestTokens.bearer(PARENT)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));
    }

    @Test
    void createdChildStartsOfflineAndOutsideARoom() throws Exception {
        fixtures.createParent(PARENT);

        JsonNode child = fixtures.postJson(PARENT, "/profiles/children",
                Map.of("name", "  Mia  ", "ageGroup", "4-6", "avatar", "🐼"), 201);

        assertThat(child.get("name").asText()).isEqualTo("Mia");
        assertThat(child.get("isOnline").asBoolean()).isFalse();
        assertThat(child.get("inRoom").asBoolean()).isFalse();
        assertThat(child.get("roomId").isNull()).isTrue();
        assertThat(child.get("voiceCloneEnabled").asBoolean()).isFalse();
    }

    @Test
    void anotherParentsChildIsNotVisible() throws Exception {
        UUID childId = fixtures.parentWithChild(PARENT, "Mia");
        fixtures.createParent(OTHER_PARENT);

        mockMvc.perform(get("/profiles/children/{id}", childId)
                        .header(HttpHeaders.AUTHORIZATION, TestTokens.bearer(OTHER_PARENT)))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("profile.child_not_found"));

        mockMvc.perform(delete("/profiles/children/{id}", childId)
                        .header(HttpHeaders.AUTHORIZATION, TestTokens.bearer(OTHER_PARENT)))
                .andExpect(status().isNotFound());
    }

    @Test
    void patchAppliesOnlySuppliedFields() throws Exception {
        UUID childId = fixtures.parentWithChild(PARENT, "Mia");

        mockMvc.perform(patch("/profiles/children/{id}", childId)
                        .header(HttpHeaders.AUTHORIZATION, TestTokens.bearer(PARENT))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"avatar\":\"🐯\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Mia"))
                .andExpect(jsonPath("$.ageGroup").value("7-9"))
                .andExpect(jsonPath("$.avatar").value("🐯"));
    }

    @Test
    void statusUpdateStampsLastSeen() throws Exception {
        UUID childId = fixtures.parentWithChild(PARENT, "Mia");

        JsonNode updated = fixtures.postJson(PARENT, "/profiles/children/" + childId + "/status",
                Map.of("isOnline", true), 200);

        assertThat(updated.get("isOnline").asBoolean()).isTrue();
        assertThat(updated.get("lastSeenAt").isNull()).isFalse();
    }

    @Test
    void deleteRemovesChild() throws Exception {
        UUID childId = fixtures.parentWithChild(PARENT, "Mia");

        mockMvc.perform(delete("/profiles/children/{id}", childId)
                        .header(HttpHeaders.AUTHORIZATION, TestTokens.bearer(PARENT)))
                .andExpect(status().isNoContent());

        Integer rows = jdbcTemplate.queryForObject(
                "select count(*) from children_profiles where id = ?", Integer.class, childId);
        assertThat(rows).isZero();
    }

    @Test
    void blankChildNameIsRejected() throws Exception {
        fixtures.createParent(PARENT);

        JsonNode problem = fixtures.postJson(PARENT, "/profiles/children",
                Map.of("name", " ", "ageGroup", "4-6"), 422);

        assertThat(problem.get("code").asText()).isEqualTo("validation_error");
    }
}
