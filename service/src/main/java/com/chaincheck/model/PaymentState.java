package com.chaincheck.model;

import com.chaincheck.api.model.PaymentStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;

/**
 * Payment terms and settlement outcome of a delivery.
 *
 * <p>Status changes go through {@link com.chaincheck.service.PaymentStatusStateMachine}.
 */
@Embeddable
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class PaymentState {

    @Column(name = "requires_payment_on_delivery", nullable = false)
    private boolean requiresPaymentOnDelivery;

    /**
     * Settlement currency. Only the configured settlement asset is accepted.
     */
    @Column(name = "currency", length = 10)
    private String currency;

    @Column(name = "buyer_address", length = 42)
    private String buyerAddress;

    @Column(name = "seller_address", length = 42)
    private String sellerAddress;

    /**
     * Amount in ETH.
     */
    @Column(name = "amount", precision = 36, scale = 18)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_status", nullable = false, length = 20)
    private PaymentStatus paymentStatus = PaymentStatus.PENDING;

    /**
     * Hash of the transaction that produced the current status (deposit, release,
     * refund or direct transfer).
     */
    @Column(name = "payment_transaction_hash", unique = true, length = 66)
    private String transactionHash;

    @Column(name = "payment_block_number")
    private Long blockNumber;

    @Column(name = "payment_error", length = 1000)
    private String error;
}
