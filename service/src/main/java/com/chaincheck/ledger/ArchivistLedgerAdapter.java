package com.chaincheck.ledger;

import com.chaincheck.error.LedgerUnavailableException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Archival index of witness records and payloads, accessed over HTTP.
 *
 * <pre>
 * POST {archivist}/{archive}/insert   body: [boundWitness, ...payloads]
 * GET  {archivist}/get/{hash}
 * </pre>
 */
@Slf4j
public class ArchivistLedgerAdapter implements ProofLedgerAdapter {

    private final WebClient webClient;
    private final String archive;
    private final Duration timeout;
    private final ObjectMapper objectMapper;

    public ArchivistLedgerAdapter(WebClient webClient, String archive, Duration timeout, ObjectMapper objectMapper) {
        this.webClient = webClient;
        this.archive = archive;
        this.timeout = timeout;
        this.objectMapper = objectMapper;
    }

    @Override
    public LedgerInsertResult insert(WitnessSubmission submission) {
        ArrayNode body = objectMapper.createArrayNode();
        body.add(submission.boundWitness());
        body.addAll(submission.payloads());

        JsonNode response = execute("insert into archive " + archive, webClient.post()
                .uri("/{archive}/insert", archive)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class));

        String hash = submission.hash();
        if (response != null && response.isArray() && !response.isEmpty()) {
            hash = response.get(0).path("_hash").asText(hash);
        }
        log.info("Witness record archived: archive={}, hash={}", archive, hash);
        return new LedgerInsertResult(hash, submission.nbf(), submission.boundWitness());
    }

    @Override
    public Optional<JsonNode> fetch(String hash) {
        JsonNode response = execute("get " + hash, webClient.get()
                .uri("/get/{hash}", hash)
                .exchangeToMono(clientResponse -> {
                    if (clientResponse.statusCode().isSameCodeAs(HttpStatus.NOT_FOUND)) {
                        return Mono.empty();
                    }
                    if (clientResponse.statusCode().isError()) {
                        return clientResponse.createException().flatMap(Mono::error);
                    }
                    return clientResponse.bodyToMono(JsonNode.class);
                }));

        if (response == null || response.isNull() || (response.isArray() && response.isEmpty())) {
            log.debug("Witness record not found in archivist: {}", hash);
            return Optional.empty();
        }
        return Optional.of(response.isArray() ? response.get(0) : response);
    }

    @Override
    public ProofValidationResult validate(String hash) {
        return fetch(hash)
                .map(BoundWitnessValidator::validate)
                .orElseGet(() -> ProofValidationResult.invalid("Proof not found in archivist: " + hash));
    }

    private JsonNode execute(String description, Mono<JsonNode> call) {
        try {
            return call.timeout(timeout).block();
        } catch (WebClientException e) {
            throw new LedgerUnavailableException("Archivist " + description + " failed: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            if (Exceptions.unwrap(e) instanceof TimeoutException) {
                throw new LedgerUnavailableException("Archivist " + description + " timed out after " + timeout, e);
            }
            throw e;
        }
    }
}
