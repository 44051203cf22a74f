package com.prmanager.backend.support;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

/**
 * Creates teams, users and pull requests through the HTTP surface.
 */
public final class ReviewFixtures {

    private final MockMvc mockMvc;
    private final ObjectMapper objectMapper;

    public ReviewFixtures(MockMvc mockMvc, ObjectMapper objectMapper) {
        this.mockMvc = mockMvc;
        this.objectMapper = objectMapper;
    }

    public long createTeam(String name) throws Exception {
        ObjectNode body = objectMapper.createObjectNode().put("name", name);
        return postCreated("/teams", body).path("id").asLong();
    }

    public long createUser(long teamId, String name) throws Exception {
        ObjectNode body = objectMapper.createObjectNode().put("name", name);
        return postCreated("/teams/" + teamId + "/users", body).path("id").asLong();
    }

    public JsonNode createPullRequest(String title, long authorId) throws Exception {
        ObjectNode body = objectMapper.createObjectNode()
                .put("title", title)
                .put("authorId", authorId);
        return postCreated("/prs", body);
    }

    public JsonNode read(MvcResult result) throws Exception {
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    private JsonNode postCreated(String path, ObjectNode body) throws Exception {
        MvcResult result = mockMvc.perform(post(path)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body.toString()))
                .andExpect(status().isCreated())
                .andReturn();
        return read(result);
    }
}
