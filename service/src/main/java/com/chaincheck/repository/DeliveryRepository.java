package com.chaincheck.repository;

import com.chaincheck.api.model.PaymentStatus;
import com.chaincheck.model.Delivery;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for {@link Delivery} entity operations.
 *
 * <p>Provides:
 * <ul>
 *   <li>Row-locked reads for settlement claims</li>
 *   <li>Driver proof lineage lookup (previous proof of the same driver)</li>
 *   <li>Reconciliation queries (pending transactions, expired escrows)</li>
 * </ul>
 */
@Repository
public interface DeliveryRepository extends JpaRepository<Delivery, UUID> {

    /**
     * Loads a delivery with a pessimistic write lock. Only used inside short
     * claim transactions; never held across a network call.
     *
     * @param id Delivery ID
     * @return Locked delivery
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT d FROM Delivery d WHERE d.id = :id")
    Optional<Delivery> findByIdForUpdate(@Param("id") UUID id);

    boolean existsByOrderId(String orderId);

    Optional<Delivery> findByOrderId(String orderId);

    Optional<Delivery> findByProofHash(String proofHash);

    /**
     * Finds the most recent verified delivery of a driver, excluding the given one.
     * Its proof hash links the driver's next witness record to the previous one.
     *
     * @param driverId          Driver ID
     * @param excludeDeliveryId Delivery being verified
     * @return Most recent verified delivery, if any
     */
    Optional<Delivery> findFirstByDriverIdAndProofHashIsNotNullAndIdNotOrderByVerifiedAtDesc(
            String driverId, UUID excludeDeliveryId);

    /**
     * Finds deliveries with a submitted but unconfirmed settlement transaction
     * whose claim has been released or has expired.
     *
     * @param claimedBefore Claims older than this are considered abandoned
     * @return Deliveries to reconcile
     */
    @Query("""
            SELECT d.id
            FROM Delivery d
            WHERE d.pendingTransactionHash IS NOT NULL
              AND (d.settlementClaimedAt IS NULL OR d.settlementClaimedAt < :claimedBefore)
            """)
    List<UUID> findPendingSettlementIds(@Param("claimedBefore") LocalDateTime claimedBefore);

    /**
     * Finds escrowed deliveries whose escrow was deposited before the given time.
     * Candidates for the auto-refund sweep.
     *
     * @param depositedBefore Threshold (now minus the auto-refund window)
     * @return Candidate delivery IDs
     */
    @Query("""
            SELECT d.id
            FROM Delivery d
            WHERE d.paymentState.paymentStatus = :status
              AND d.escrowDepositTxHash IS NOT NULL
              AND d.createdAt < :depositedBefore
            """)
    List<UUID> findEscrowedIdsCreatedBefore(@Param("status") PaymentStatus status,
                                            @Param("depositedBefore") LocalDateTime depositedBefore);
}
