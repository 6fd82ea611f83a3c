package com.chaincheck.api.response;

import com.chaincheck.api.model.PaymentStatus;

import java.math.BigDecimal;

/**
 * Payment state of a delivery, including the on-chain escrow mirror.
 *
 * <p>{@code escrow} is only populated by the payment status endpoint, when the
 * escrow can be read from the settlement chain.
 */
public record PaymentStateResponse(
        boolean requiresPaymentOnDelivery,
        String currency,
        String buyerAddress,
        String sellerAddress,
        BigDecimal amount,
        PaymentStatus paymentStatus,
        String transactionHash,
        Long blockNumber,
        String error,
        String escrowContractAddress,
        String escrowDepositTxHash,
        Long escrowDepositBlock,
        String escrowReleaseTxHash,
        Long escrowReleaseBlock,
        String escrowRefundTxHash,
        Long escrowRefundBlock,
        String pendingTransactionHash,
        EscrowStatusResponse escrow
) {
}
