package com.chaincheck.ledger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Submits witness records straight to the witness ledger and reads them back through
 * the ledger's {@link ChainReader}.
 */
@RequiredArgsConstructor
@Slf4j
public class DirectLedgerAdapter implements ProofLedgerAdapter {

    static final String BROADCAST_TRANSACTION = "xyoRunner_broadcastTransaction";

    private final JsonRpcClient rpcClient;
    private final ChainReader chainReader;
    private final ObjectMapper objectMapper;

    @Override
    public LedgerInsertResult insert(WitnessSubmission submission) {
        ArrayNode transaction = objectMapper.createArrayNode();
        transaction.add(submission.boundWitness());
        transaction.add(objectMapper.createArrayNode().addAll(submission.payloads()));

        JsonNode result = rpcClient.call(BROADCAST_TRANSACTION, transaction);
        String hash = result.isTextual() ? result.asText() : submission.hash();

        log.info("Witness record broadcast to ledger: hash={}, nbf={}", hash, submission.nbf());
        return new LedgerInsertResult(hash, submission.nbf(), submission.boundWitness());
    }

    @Override
    public Optional<JsonNode> fetch(String hash) {
        return chainReader.getWitnessRecord(hash).map(WitnessRecord::raw);
    }

    @Override
    public ProofValidationResult validate(String hash) {
        return fetch(hash)
                .map(BoundWitnessValidator::validate)
                .orElseGet(() -> ProofValidationResult.invalid("Witness record not found on ledger: " + hash));
    }
}
