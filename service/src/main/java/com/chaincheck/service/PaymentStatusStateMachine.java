package com.chaincheck.service;

import com.chaincheck.api.model.PaymentStatus;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * State machine for validating PaymentStatus transitions.
 *
 * <p>State diagram:
 * <pre>
 *        PENDING ──────────────┐
 *           |                  |  (direct transfer)
 *        ESCROWED ─────┐       |
 *        |      |      |       |
 *    REFUNDED  PAID ◄──┴───────┘
 *
 *   PENDING / ESCROWED → FAILED → ESCROWED | PAID | REFUNDED  (retry)
 * </pre>
 *
 * <p>PAID and REFUNDED are final.
 */
@Component
public class PaymentStatusStateMachine {

    private static final Map<PaymentStatus, Set<PaymentStatus>> ALLOWED_TRANSITIONS = Map.of(
            PaymentStatus.PENDING, EnumSet.of(
                    PaymentStatus.ESCROWED,
                    PaymentStatus.PAID,
                    PaymentStatus.FAILED
            ),
            PaymentStatus.ESCROWED, EnumSet.of(
                    PaymentStatus.PAID,
                    PaymentStatus.REFUNDED,
                    PaymentStatus.FAILED
            ),
            // FAILED is retryable: the settlement that failed may still go through
            PaymentStatus.FAILED, EnumSet.of(
                    PaymentStatus.ESCROWED,
                    PaymentStatus.PAID,
                    PaymentStatus.REFUNDED
            )
            // PAID, REFUNDED are final states - no transitions allowed
    );

    /**
     * Validates if a status transition is allowed.
     *
     * @param fromStatus Current status
     * @param toStatus   Target status
     * @return true if transition is allowed, false otherwise
     */
    public boolean isTransitionAllowed(PaymentStatus fromStatus, PaymentStatus toStatus) {
        if (fromStatus == null || toStatus == null) {
            return false;
        }

        // Same status is always allowed (no-op)
        if (fromStatus == toStatus) {
            return true;
        }

        Set<PaymentStatus> allowedTargets = ALLOWED_TRANSITIONS.get(fromStatus);
        return allowedTargets != null && allowedTargets.contains(toStatus);
    }

    /**
     * Validates if a status transition is allowed, throwing exception if not.
     *
     * @param fromStatus Current status
     * @param toStatus   Target status
     * @throws IllegalStateException if transition is not allowed
     */
    public void validateTransition(PaymentStatus fromStatus, PaymentStatus toStatus) {
        if (!isTransitionAllowed(fromStatus, toStatus)) {
            throw new IllegalStateException(
                    String.format("Invalid payment status transition: %s → %s. " +
                                    "Allowed transitions from %s: %s",
                            fromStatus, toStatus, fromStatus,
                            ALLOWED_TRANSITIONS.getOrDefault(fromStatus, Set.of()))
            );
        }
    }

    public boolean isFinalState(PaymentStatus status) {
        return status == PaymentStatus.PAID || status == PaymentStatus.REFUNDED;
    }

    public Set<PaymentStatus> getAllowedTransitions(PaymentStatus fromStatus) {
        return ALLOWED_TRANSITIONS.getOrDefault(fromStatus, Set.of());
    }
}
