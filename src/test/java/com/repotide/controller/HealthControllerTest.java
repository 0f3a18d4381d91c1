package com.repotide.controller;

import com.repotide.config.RepoTideProperties;
import com.repotide.store.EventStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(HealthController.class)
@Import(RepoTideProperties.class)
class HealthControllerTest {

    @Autowired private MockMvc mockMvc;

    @MockBean private EventStore eventStore;

    @Test
    @DisplayName("Reachable store reports healthy/connected")
    void health_connected() throws Exception {
        when(eventStore.isAvailable()).thenReturn(true);

        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.database").value("connected"));
    }

    @Test
    @DisplayName("Unreachable store reports 503 unhealthy/disconnected")
    void health_disconnected() throws Exception {
        when(eventStore.isAvailable()).thenReturn(false);

        mockMvc.perform(get("/health"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value("unhealthy"))
                .andExpect(jsonPath("$.database").value("disconnected"));
    }
}
