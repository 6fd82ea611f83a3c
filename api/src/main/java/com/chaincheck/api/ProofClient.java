package com.chaincheck.api;

import com.chaincheck.api.response.DivinerVerificationResponse;
import com.chaincheck.api.response.ProofVerificationResponse;
import com.chaincheck.api.response.ValidationResponse;
import com.chaincheck.api.response.WitnessChainResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * WebClient-based implementation of ProofApi.
 *
 * <p>Not a Spring @Component; register it as a bean in the consuming service,
 * the same way as {@link DeliveryClient}.
 */
@RequiredArgsConstructor
@Slf4j
public class ProofClient implements ProofApi {

    private static final String BASE_PATH = "/api/v1/proofs";

    private final WebClient webClient;

    @Override
    public ResponseEntity<ProofVerificationResponse> verifyProof(String proofHash) {
        log.debug("Calling verifyProof: proofHash={}", proofHash);

        return webClient.get()
                .uri(BASE_PATH + "/{proofHash}/verify", proofHash)
                .retrieve()
                .toEntity(ProofVerificationResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<WitnessChainResponse> getWitnessChain(String proofHash, int maxDepth) {
        log.debug("Calling getWitnessChain: proofHash={}, maxDepth={}", proofHash, maxDepth);

        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path(BASE_PATH + "/{proofHash}/chain")
                        .queryParam("maxDepth", maxDepth)
                        .build(proofHash))
                .retrieve()
                .toEntity(WitnessChainResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<ValidationResponse> validateProof(String proofHash) {
        log.debug("Calling validateProof: proofHash={}", proofHash);

        return webClient.get()
                .uri(BASE_PATH + "/{proofHash}/validate", proofHash)
                .retrieve()
                .toEntity(ValidationResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<DivinerVerificationResponse> queryDiviner(double latitude, double longitude, long timestamp) {
        log.debug("Calling queryDiviner: lat={}, lon={}, timestamp={}", latitude, longitude, timestamp);

        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path(BASE_PATH + "/diviner")
                        .queryParam("lat", latitude)
                        .queryParam("lon", longitude)
                        .queryParam("timestamp", timestamp)
                        .build())
                .retrieve()
                .toEntity(DivinerVerificationResponse.class)
                .block();
    }
}
