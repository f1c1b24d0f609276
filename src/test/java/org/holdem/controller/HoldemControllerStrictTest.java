package org.holdem.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@TestPropertySource(properties = {
        "holdem.strict-actions=true",
        "holdem.small-blind=50",
        "holdem.big-blind=100"
})
class HoldemControllerStrictTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void street_checkFaceAUneMise_422() throws Exception {
        Map<String, Object> body = Map.of(
                "players", List.of(Map.of("id", "A", "stack", 5000), Map.of("id", "B", "stack", 5000)),
                "actions", List.of(Map.of("player", "A", "action", "CHECK")));

        mockMvc.perform(post("/api/holdem/street")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(body)))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").exists());
    }

    @Test
    void street_blindesDeConfiguration() throws Exception {
        Map<String, Object> body = Map.of(
                "players", List.of(Map.of("id", "A", "stack", 5000), Map.of("id", "B", "stack", 5000)),
                "actions", List.of(Map.of("player", "A", "action", "CALL")));

        mockMvc.perform(post("/api/holdem/street")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(body)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.potTotal").value(200))
                .andExpect(jsonPath("$.nextToAct").value("B"));
    }
}
