package com.chaincheck.controller;

import com.chaincheck.TestBase;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MvcResult;

import java.util.UUID;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Integration tests for ProofController. The witness ledger is unreachable and the
 * archivist and diviner are disabled in the test profile.
 */
public class ProofControllerTest extends TestBase {

    private static final String UNKNOWN_HASH = "f".repeat(64);

    @Test
    public void verifyProof_WhenLedgerUnreachable_ShouldReportNotFound() throws Exception {
        mockMvc.perform(get("/api/v1/proofs/{proofHash}/verify", UNKNOWN_HASH))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(false))
                .andExpect(jsonPath("$.errors[1]").value("Archivist is disabled and ledger query failed"));
    }

    @Test
    public void verifyProof_WithMalformedHash_ShouldReturn400() throws Exception {
        mockMvc.perform(get("/api/v1/proofs/{proofHash}/verify", "xyz"))
                .andExpect(status().isBadRequest());
    }

    @Test
    public void validateProof_WhenArchivistDisabled_ShouldBeInvalid() throws Exception {
        mockMvc.perform(get("/api/v1/proofs/{proofHash}/validate", UNKNOWN_HASH))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(false))
                .andExpect(jsonPath("$.errors[0]").value("Archivist is disabled"));
    }

    @Test
    public void getWitnessChain_ShouldStartFromStoredRecord() throws Exception {
        UUID deliveryId = createDelivery(false);
        MvcResult verified = mockMvc.perform(post("/api/v1/deliveries/{deliveryId}/verify", deliveryId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(verifyRequest())))
                .andExpect(status().isOk())
                .andReturn();
        String proofHash = json(verified).path("proof").path("proofHash").asText();

        mockMvc.perform(get("/api/v1/proofs/{proofHash}/chain", proofHash).param("maxDepth", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length").value(1))
                .andExpect(jsonPath("$.records[0].hash").value(proofHash));
    }

    @Test
    public void getWitnessChain_WhenUnknown_ShouldBeEmpty() throws Exception {
        mockMvc.perform(get("/api/v1/proofs/{proofHash}/chain", UNKNOWN_HASH))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length").value(0));
    }

    @Test
    public void queryDiviner_WhenDisabled_ShouldReturnMock() throws Exception {
        mockMvc.perform(get("/api/v1/proofs/diviner")
                        .param("lat", "40.7484")
                        .param("lon", "-73.9857")
                        .param("timestamp", "1700000000000"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.mocked").value(true))
                .andExpect(jsonPath("$.source").value("mock"))
                .andExpect(jsonPath("$.consensus").value(1.0));
    }
}
