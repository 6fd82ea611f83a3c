package com.chaincheck.ledger;

import com.chaincheck.error.LedgerUnavailableException;

import java.util.Optional;

/**
 * Read-only access to a ledger.
 *
 * <p>An empty result means "not found". Unreachable endpoints, timeouts and transport
 * errors raise {@link LedgerUnavailableException}.
 */
public interface ChainReader {

    Optional<Long> getTransactionBlockNumber(String transactionRef);

    Optional<LedgerBlock> getBlock(long number);

    Optional<WitnessRecord> getWitnessRecord(String hash);

    Optional<ChainReceipt> getTransactionReceipt(String transactionRef);

    Optional<Long> getCurrentBlockNumber();
}
