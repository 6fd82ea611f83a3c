package com.chaincheck.config;

import com.chaincheck.TestBase;
import org.junit.jupiter.api.Test;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class SecurityConfigTest extends TestBase {

    @Test
    public void health_ShouldBePublic() throws Exception {
        mockMvc.perform(get("/actuator/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"));
    }

    @Test
    public void apiDocs_OutsideDevProfile_ShouldBeDenied() throws Exception {
        mockMvc.perform(get("/v3/api-docs"))
                .andExpect(status().is4xxClientError());
    }

    @Test
    public void metrics_ShouldBeDenied() throws Exception {
        mockMvc.perform(get("/actuator/metrics"))
                .andExpect(status().is4xxClientError());
    }

    @Test
    public void unmappedRoute_ShouldBeDenied() throws Exception {
        mockMvc.perform(get("/internal/settlements"))
                .andExpect(status().is4xxClientError());
    }

    @Test
    public void deliveryRoutes_ShouldBePublic() throws Exception {
        mockMvc.perform(get("/api/v1/deliveries/{deliveryId}", "00000000-0000-0000-0000-000000000000"))
                .andExpect(status().isNotFound());
    }
}
