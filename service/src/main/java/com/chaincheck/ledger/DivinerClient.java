package com.chaincheck.ledger;

import com.chaincheck.error.LedgerUnavailableException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import reactor.core.Exceptions;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Location consensus query ({@code POST {diviner}/location/query}).
 */
@Slf4j
public class DivinerClient {

    private final WebClient webClient;
    private final Duration timeout;

    public DivinerClient(WebClient webClient, Duration timeout) {
        this.webClient = webClient;
        this.timeout = timeout;
    }

    /**
     * @return Consensus result; empty when the diviner has no observations for the point
     * @throws LedgerUnavailableException when the diviner is unreachable or times out
     */
    public Optional<DivinerResult> queryLocation(double latitude, double longitude, long timestamp) {
        JsonNode response;
        try {
            response = webClient.post()
                    .uri("/location/query")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("latitude", latitude, "longitude", longitude, "timestamp", timestamp))
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .timeout(timeout)
                    .block();
        } catch (WebClientException e) {
            throw new LedgerUnavailableException("Diviner query failed: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            if (Exceptions.unwrap(e) instanceof TimeoutException) {
                throw new LedgerUnavailableException("Diviner query timed out after " + timeout, e);
            }
            throw e;
        }

        if (response == null || response.isNull() || response.path("nodeCount").asInt(0) == 0) {
            return Optional.empty();
        }

        int nodeCount = response.path("nodeCount").asInt();
        int confidence = response.path("confidence").asInt(0);
        List<WitnessNode> witnessNodes = new ArrayList<>();
        response.path("witnessNodes").forEach(node -> witnessNodes.add(new WitnessNode(
                node.path("address").asText(),
                node.path("type").asText("sentinel"),
                node.path("verified").asBoolean(false))));

        return Optional.of(new DivinerResult(
                response.path("verified").asBoolean(confidence > 0),
                confidence,
                nodeCount,
                DivinerResult.consensusLevel(confidence),
                response.path("consensus").isNumber() ? response.path("consensus").asDouble() : confidence / 100.0,
                response.path("locationMatch").asBoolean(true),
                response.path("distanceFromClaimed").isNumber() ? response.path("distanceFromClaimed").asDouble() : null,
                false,
                "diviner",
                List.copyOf(witnessNodes)
        ));
    }
}
