package com.smartroute.dispatch.api;

import com.smartroute.core.health.HealthCheckService;
import com.smartroute.core.health.HealthStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

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
    @DisplayName("GET /health is 200 and DEGRADED when only remote venues are missing")
    void degraded() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("venue.local", HealthStatus.Status.UP, "Backend registered", Map.of()),
                new HealthStatus("venue.cloud_direct", HealthStatus.Status.DEGRADED, "No backend registered",
                        Map.of())));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("DEGRADED"))
                .andExpect(jsonPath("$.components['venue.local'].status").value("UP"));
    }

    @Test
    @DisplayName("GET /health is 503 when a component is DOWN")
    void down() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("venue.local", HealthStatus.Status.DOWN, "No backend registered", Map.of())));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value("DOWN"));
    }

    @Test
    @DisplayName("GET /health is UP when everything is UP")
    void up() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("accounting", HealthStatus.Status.UP, "0 requests recorded",
                        Map.of("total_requests", 0L))));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.components.accounting.metadata.total_requests").value(0));
    }
}
