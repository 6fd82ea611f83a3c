package com.chaincheck.controller;

import com.chaincheck.api.ProofApi;
import com.chaincheck.api.response.DivinerVerificationResponse;
import com.chaincheck.api.response.ProofVerificationResponse;
import com.chaincheck.api.response.ValidationResponse;
import com.chaincheck.api.response.WitnessChainResponse;
import com.chaincheck.api.response.WitnessRecordResponse;
import com.chaincheck.ledger.ProofValidationResult;
import com.chaincheck.ledger.WitnessRecord;
import com.chaincheck.mapper.DeliveryMapper;
import com.chaincheck.service.ProofService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * REST controller for proof ledger queries. Implements {@link ProofApi}.
 */
@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class ProofController implements ProofApi {

    private final ProofService proofService;

    @Override
    public ResponseEntity<ProofVerificationResponse> verifyProof(String proofHash) {
        return ResponseEntity.ok(DeliveryMapper.INSTANCE.toProofVerificationResponse(
                proofService.verifyLocationProof(proofHash)));
    }

    @Override
    public ResponseEntity<WitnessChainResponse> getWitnessChain(String proofHash, int maxDepth) {
        List<WitnessRecord> records;
        try (Stream<WitnessRecord> chain = proofService.getBoundWitnessChain(proofHash, maxDepth)) {
            records = chain.collect(Collectors.toList());
        }
        List<WitnessRecordResponse> responses = DeliveryMapper.INSTANCE.toWitnessRecordResponses(records);
        return ResponseEntity.ok(new WitnessChainResponse(proofHash, maxDepth, responses.size(), responses));
    }

    @Override
    public ResponseEntity<ValidationResponse> validateProof(String proofHash) {
        ProofValidationResult result = proofService.validateWitnessRecord(proofHash);
        return ResponseEntity.ok(new ValidationResponse(proofHash, result.valid(), result.errors()));
    }

    @Override
    public ResponseEntity<DivinerVerificationResponse> queryDiviner(double latitude, double longitude, long timestamp) {
        return ResponseEntity.ok(DeliveryMapper.INSTANCE.toDivinerVerificationResponse(
                proofService.queryLocationDiviner(latitude, longitude, timestamp)));
    }
}
