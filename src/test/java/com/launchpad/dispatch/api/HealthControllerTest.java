package com.launchpad.dispatch.api;

import com.launchpad.core.health.HealthCheckService;
import com.launchpad.core.health.HealthStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.is;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(HealthController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private HealthCheckService healthCheckService;

    @Test
    @DisplayName("degraded components report DEGRADED with 200")
    void degraded() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("registry", HealthStatus.Status.UP, "15 handlers registered", Map.of()),
                new HealthStatus("database", HealthStatus.Status.DEGRADED, "In-memory store", Map.of("store", "memory"))));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status", is("DEGRADED")))
                .andExpect(jsonPath("$.components.database.metadata.store", is("memory")));
    }

    @Test
    @DisplayName("a DOWN component returns 503")
    void down() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("llm", HealthStatus.Status.DOWN, "No API key configured", Map.of())));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status", is("DOWN")))
                .andExpect(jsonPath("$.components.llm.detail", is("No API key configured")));
    }

    @Test
    @DisplayName("all components up returns UP")
    void up() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("registry", HealthStatus.Status.UP, "15 handlers registered", Map.of())));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status", is("UP")));
    }
}
