package com.teamflow.dispatch.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.teamflow.core.agent.AgentRegistry;
import com.teamflow.core.error.NotFoundException;
import com.teamflow.core.model.AgentProfile;
import com.teamflow.core.model.Capability;
import com.teamflow.core.model.PerformanceMetrics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AgentController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class AgentControllerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private AgentRegistry agents;

    private static AgentProfile profile(String id, int cap, Capability... capabilities) {
        return new AgentProfile(id, "coder", Set.of(capabilities), 0.0, 1.0, 1.0, PerformanceMetrics.fresh(),
                cap, 0, 1, NOW);
    }

    // ── POST /api/v1/agents ──────────────────────────────────────────

    @Test
    @DisplayName("POST /agents registers the agent with parsed capabilities and returns 201")
    void register() throws Exception {
        Set<Capability> parsed = Set.of(Capability.language("java"), Capability.of("jwt"));
        when(agents.register("alice", "coder", parsed, 2)).thenReturn(profile("alice", 2,
                Capability.language("java"), Capability.of("jwt")));

        String body = objectMapper.writeValueAsString(
                new AgentRegistrationRequest("alice", null, List.of("lang:java", "jwt"), 2));

        mockMvc.perform(post("/api/v1/agents")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("alice"))
                .andExpect(jsonPath("$.maxConcurrentTasks").value(2))
                .andExpect(jsonPath("$.capabilities", hasSize(2)));
    }

    @Test
    @DisplayName("POST /agents without a cap leaves it to the configured default")
    void registerDefaultCap() throws Exception {
        when(agents.register(eq("bob"), eq("reviewer"), any(), isNull())).thenReturn(profile("bob", 3));

        mockMvc.perform(post("/api/v1/agents")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"id":"bob","type":"reviewer","capabilities":[]}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.maxConcurrentTasks").value(3));
    }

    @Test
    @DisplayName("POST /agents with a blank id returns 400")
    void registerBlankId() throws Exception {
        mockMvc.perform(post("/api/v1/agents")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"id":" ","capabilities":["lang:java"]}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", containsString("required")));

        verify(agents, never()).register(anyString(), anyString(), any(), any());
    }

    @Test
    @DisplayName("POST /agents with a zero cap returns 400")
    void registerZeroCap() throws Exception {
        mockMvc.perform(post("/api/v1/agents")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"id":"carol","maxConcurrentTasks":0}
                                """))
                .andExpect(status().isBadRequest());
    }

    // ── GET / health / DELETE ────────────────────────────────────────

    @Test
    @DisplayName("GET /agents lists the pool")
    void list() throws Exception {
        when(agents.all()).thenReturn(List.of(profile("alice", 3), profile("bob", 3)));

        mockMvc.perform(get("/api/v1/agents"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[1].id").value("bob"));
    }

    @Test
    @DisplayName("GET /agents/{id} returns 404 for an unknown agent")
    void unknown() throws Exception {
        when(agents.get("ghost")).thenThrow(new NotFoundException("Unknown agent: ghost"));

        mockMvc.perform(get("/api/v1/agents/ghost"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Unknown agent: ghost"));
    }

    @Test
    @DisplayName("POST /agents/{id}/health passes both readings through")
    void health() throws Exception {
        when(agents.updateHealth("alice", 0.8, 0.25)).thenReturn(profile("alice", 3));

        mockMvc.perform(post("/api/v1/agents/alice/health")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"health":0.8,"resourceHealth":0.25}
                                """))
                .andExpect(status().isOk());

        verify(agents).updateHealth("alice", 0.8, 0.25);
    }

    @Test
    @DisplayName("DELETE /agents/{id} returns 204, or 404 when nothing was removed")
    void remove() throws Exception {
        when(agents.remove("alice")).thenReturn(true);

        mockMvc.perform(delete("/api/v1/agents/alice"))
                .andExpect(status().isNoContent());
        mockMvc.perform(delete("/api/v1/agents/ghost"))
                .andExpect(status().isNotFound());
    }
}
