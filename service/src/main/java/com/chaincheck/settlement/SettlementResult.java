package com.chaincheck.settlement;

/**
 * Outcome of a settlement operation. Failures are values, not exceptions.
 *
 * @param success         Transaction confirmed (or nothing to settle)
 * @param transactionHash Settlement transaction, if any
 * @param blockNumber     Block of the confirmed transaction
 * @param error           Failure reason
 * @param inProgress      Submitted or claimed by another request, not confirmed yet
 */
public record SettlementResult(
        boolean success,
        String transactionHash,
        Long blockNumber,
        String error,
        boolean inProgress
) {

    public static SettlementResult confirmed(String transactionHash, Long blockNumber) {
        return new SettlementResult(true, transactionHash, blockNumber, null, false);
    }

    public static SettlementResult noPaymentRequired() {
        return new SettlementResult(true, null, null, null, false);
    }

    public static SettlementResult failure(String error) {
        return new SettlementResult(false, null, null, error, false);
    }

    public static SettlementResult failure(String error, String transactionHash) {
        return new SettlementResult(false, transactionHash, null, error, false);
    }

    public static SettlementResult inProgress(String transactionHash) {
        return new SettlementResult(false, transactionHash, null, null, true);
    }
}
