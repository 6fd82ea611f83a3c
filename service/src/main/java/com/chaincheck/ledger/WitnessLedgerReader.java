package com.chaincheck.ledger;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link ChainReader} for the witness ledger, backed by its viewer JSON-RPC interface.
 *
 * <p>Transactions are returned by the viewer as {@code [boundWitness, payloads]}; the
 * bound witness is the witness record itself.
 */
@RequiredArgsConstructor
@Slf4j
public class WitnessLedgerReader implements ChainReader {

    static final String TRANSACTION_BY_HASH = "xyoViewer_transactionByHash";
    static final String BLOCK_BY_NUMBER = "xyoViewer_blockByNumber";
    static final String CURRENT_BLOCK_NUMBER = "xyoViewer_currentBlockNumber";

    /**
     * Upper bound of blocks scanned when a record does not report its block.
     */
    static final int MAX_BLOCKS_TO_SCAN = 100;

    private final JsonRpcClient rpcClient;

    @Override
    public Optional<WitnessRecord> getWitnessRecord(String hash) {
        JsonNode result = rpcClient.call(TRANSACTION_BY_HASH, hash);
        if (result.isNull() || result.isMissingNode() || (result.isArray() && result.isEmpty())) {
            log.debug("Witness record not found on ledger: {}", hash);
            return Optional.empty();
        }

        JsonNode boundWitness = result.isArray() ? result.get(0) : result;
        List<JsonNode> payloads = new ArrayList<>();
        if (result.isArray() && result.size() > 1 && result.get(1).isArray()) {
            result.get(1).forEach(payloads::add);
        }
        return Optional.of(WitnessRecord.fromJson(hash, boundWitness, payloads));
    }

    /**
     * Block number of a witness transaction. Uses the block reported by the record when
     * it differs from {@code nbf}; otherwise scans blocks from {@code nbf} up to
     * {@code exp} (or the current block, whichever is lower).
     */
    @Override
    public Optional<Long> getTransactionBlockNumber(String transactionRef) {
        Optional<WitnessRecord> record = getWitnessRecord(transactionRef);
        if (record.isEmpty()) {
            return Optional.empty();
        }
        Optional<Long> committed = record.get().committedBlockNumber();
        if (committed.isPresent()) {
            return committed;
        }

        Long nbf = record.get().nbf();
        Long exp = record.get().exp();
        if (nbf == null || exp == null) {
            return Optional.empty();
        }
        long endBlock = Math.min(exp, getCurrentBlockNumber().orElse(exp));
        long lastBlock = Math.min(endBlock, nbf + MAX_BLOCKS_TO_SCAN - 1);

        for (long number = nbf; number <= lastBlock; number++) {
            Optional<LedgerBlock> block = getBlock(number);
            if (block.isPresent() && block.get().containsTransaction(transactionRef)) {
                return Optional.of(number);
            }
        }
        log.debug("Transaction {} not found in blocks {}..{}", transactionRef, nbf, lastBlock);
        return Optional.empty();
    }

    @Override
    public Optional<LedgerBlock> getBlock(long number) {
        JsonNode result = rpcClient.call(BLOCK_BY_NUMBER, number);
        if (result.isNull() || result.isMissingNode() || (result.isArray() && result.isEmpty())) {
            return Optional.empty();
        }

        JsonNode block = result.isArray() ? result.get(0) : result;
        List<String> transactionHashes = new ArrayList<>();
        if (result.isArray() && result.size() > 1 && result.get(1).isArray()) {
            for (JsonNode transaction : result.get(1)) {
                JsonNode boundWitness = transaction.isArray() ? transaction.path(0) : transaction;
                String hash = boundWitness.path("_hash").asText(null);
                if (hash != null) {
                    transactionHashes.add(hash);
                }
            }
        }
        block.path("transactions").forEach(hash -> {
            if (hash.isTextual()) {
                transactionHashes.add(hash.asText());
            }
        });

        return Optional.of(new LedgerBlock(number, block.path("_hash").asText(null),
                List.copyOf(transactionHashes), block));
    }

    /**
     * Witness transactions carry no execution status: once found in a block they
     * count as successful.
     */
    @Override
    public Optional<ChainReceipt> getTransactionReceipt(String transactionRef) {
        return getTransactionBlockNumber(transactionRef)
                .map(blockNumber -> new ChainReceipt(transactionRef, blockNumber, true, null));
    }

    @Override
    public Optional<Long> getCurrentBlockNumber() {
        JsonNode result = rpcClient.call(CURRENT_BLOCK_NUMBER);
        return result.isNumber() ? Optional.of(result.asLong()) : Optional.empty();
    }
}
