package com.magicminds.backend.support;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.UUID;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

/**
 * Creates parents and children through the public API so integration tests start from real rows.
 */
public final class ProfileFixtures {

    private final MockMvc mockMvc;
    private final ObjectMapper objectMapper;

    public ProfileFixtures(MockMvc mockMvc, ObjectMapper objectMapper) {
        this.mockMvc = mockMvc;
        this.objectMapper = objectMapper;
    }

    public UUID createParent(String subject) throws Exception {
        JsonNode body = postJson(subject, "/profiles/parent", Map.of("name", "Parent " + subject), 201);
        return UUID.fromString(body.get("id").asText());
    }

    public UUID createChild(String subject, String name) throws Exception {
        JsonNode body = postJson(subject, "/profiles/children",
                Map.of("name", name, "ageGroup", "7-9", "avatar", "🦊"), 201);
        return UUID.fromString(body.get("id").asText());
    }

    public UUID parentWithChild(String subject, String childName) throws Exception {
        createParent(subject);
        return createChild(subject, childName);
    }

    public JsonNode postJson(String subject, String path, Object payload, int expectedStatus) throws Exception {
        MvcResult result = mockMvc.perform(post(path)
                        .header(HttpHeaders.AUTHORIZATION, TestTokens.bearer(subject))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(payload)))
                .andExpect(status().is(expectedStatus))
                .andReturn();
        String content = result.getResponse().getContentAsString(StandardCharsets.UTF_8);
        return content.isEmpty() ? objectMapper.nullNode() : objectMapper.readTree(content);
    }
}
