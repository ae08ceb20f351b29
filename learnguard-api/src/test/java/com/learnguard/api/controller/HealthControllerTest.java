package com.learnguard.api.controller;

import com.learnguard.llm.router.ProviderOrchestrator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ProviderOrchestrator orchestrator;

    @Test
    void basicHealthIsUp() throws Exception {
        mockMvc.perform(get("/api/v1/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("UP"))
            .andExpect(jsonPath("$.service").value("learnguard"));

        mockMvc.perform(get("/api/v1/health/ping"))
            .andExpect(content().string("pong"));
    }

    @Test
    void detailedHealthReflectsProviders() throws Exception {
        when(orchestrator.getProviderHealth()).thenReturn(Map.of("openai", true, "gemini", false));

        mockMvc.perform(get("/api/v1/health/detailed"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("DEGRADED"))
            .andExpect(jsonPath("$.providers.openai").value(true))
            .andExpect(jsonPath("$.cache.available").value(true));
    }

    @Test
    void llmHealthIsDownWithoutHealthyProvider() throws Exception {
        when(orchestrator.getProviderHealth()).thenReturn(Map.of("openai", false));

        mockMvc.perform(get("/api/v1/llm/health"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.status").value("DOWN"));
    }

    @Test
    void moderationCheckersCanBeToggled() throws Exception {
        mockMvc.perform(patch("/api/v1/moderation/checkers")
                .contentType("application/json")
                .content("{\"bias\": false}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.bias.enabled").value(false));

        mockMvc.perform(patch("/api/v1/moderation/checkers")
                .contentType("application/json")
                .content("{\"bias\": true}"))
            .andExpect(jsonPath("$.bias.enabled").value(true));
    }
}
