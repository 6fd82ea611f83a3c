package com.chaincheck.model;

import com.chaincheck.api.model.DeliveryStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.GenericGenerator;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Delivery entity - the relational record of a delivery's lifecycle.
 *
 * <p>Lifecycle:
 * <pre>
 * 1. Order registered → Delivery created (PENDING, payment PENDING)
 * 2. Optional escrow deposit → payment ESCROWED
 * 3. Driver verifies at drop-off → location proof created → DELIVERED
 * 4. Payment released once → payment PAID (or REFUNDED)
 * </pre>
 *
 * <p>Settlement claim fields ({@code settlementOperation}, {@code settlementClaimedAt},
 * {@code pendingTransactionHash}) serialize concurrent settlement requests without
 * holding a row lock across network calls.
 */
@Entity
@Table(name = "delivery")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class Delivery {

    @Id
    @GeneratedValue(generator = "UUID")
    @GenericGenerator(
            name = "UUID",
            strategy = "org.hibernate.id.UUIDGenerator"
    )
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "order_id", nullable = false, unique = true, length = 100)
    private String orderId;

    @Column(name = "driver_id", nullable = false)
    private String driverId;

    @Column(name = "recipient_name", nullable = false)
    private String recipientName;

    @Column(name = "recipient_phone")
    private String recipientPhone;

    @Column(name = "delivery_address", nullable = false)
    private String deliveryAddress;

    @Column(name = "destination_lat", nullable = false)
    private Double destinationLat;

    @Column(name = "destination_lon", nullable = false)
    private Double destinationLon;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private DeliveryStatus status;

    // ==================== Proof ====================

    @Column(name = "proof_hash", unique = true, length = 66)
    private String proofHash;

    @Column(name = "block_number")
    private Long blockNumber;

    /**
     * Raw witness record JSON as submitted to the ledger.
     */
    @Column(name = "witness_record", columnDefinition = "TEXT")
    private String witnessRecord;

    @Column(name = "proof_mocked")
    private Boolean proofMocked;

    @Column(name = "verified_at")
    private LocalDateTime verifiedAt;

    @Column(name = "actual_lat")
    private Double actualLat;

    @Column(name = "actual_lon")
    private Double actualLon;

    /**
     * Haversine distance between the verification point and the destination, in meters.
     */
    @Column(name = "distance_from_dest")
    private Double distanceFromDest;

    @Column(name = "notes", columnDefinition = "TEXT")
    private String notes;

    // ==================== Payment ====================

    @Embedded
    private PaymentState paymentState = new PaymentState();

    @Column(name = "escrow_contract_address", length = 42)
    private String escrowContractAddress;

    @Column(name = "escrow_deposit_tx_hash", length = 66)
    private String escrowDepositTxHash;

    @Column(name = "escrow_deposit_block")
    private Long escrowDepositBlock;

    @Column(name = "escrow_release_tx_hash", length = 66)
    private String escrowReleaseTxHash;

    @Column(name = "escrow_release_block")
    private Long escrowReleaseBlock;

    @Column(name = "escrow_refund_tx_hash", length = 66)
    private String escrowRefundTxHash;

    @Column(name = "escrow_refund_block")
    private Long escrowRefundBlock;

    // ==================== Settlement claim ====================

    @Enumerated(EnumType.STRING)
    @Column(name = "settlement_operation", length = 20)
    private SettlementOperation settlementOperation;

    /**
     * Set while a request owns the settlement. Null once the claim is released,
     * even if a submitted transaction is still unconfirmed.
     */
    @Column(name = "settlement_claimed_at")
    private LocalDateTime settlementClaimedAt;

    /**
     * Submitted, not yet confirmed settlement transaction.
     */
    @Column(name = "pending_transaction_hash", length = 66)
    private String pendingTransactionHash;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @Version
    @Column(name = "version")
    private Long version;

    public boolean hasActiveClaim(LocalDateTime now, Duration claimTtl) {
        return settlementClaimedAt != null && settlementClaimedAt.plus(claimTtl).isAfter(now);
    }

    public void clearClaim() {
        settlementOperation = null;
        settlementClaimedAt = null;
        pendingTransactionHash = null;
    }

    public void appendNote(String note) {
        notes = notes == null || notes.isBlank() ? note : notes + "\n" + note;
    }
}
