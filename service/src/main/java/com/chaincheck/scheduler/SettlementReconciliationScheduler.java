package com.chaincheck.scheduler;

import com.chaincheck.service.DeliveryPaymentStateMachine;
import com.chaincheck.service.SettlementExecutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Scheduled jobs for settlement reconciliation.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>Confirm settlement transactions left pending by a request (cron: every minute)</li>
 *   <li>Auto-refund escrows past their release deadline (cron: every hour)</li>
 * </ul>
 *
 * <p>Configuration:
 * <pre>
 * scheduler:
 *   settlement-reconciliation:
 *     enabled: true                      # enable/disable scheduler
 *     reconcile-cron: "0 * * * * *"      # every minute
 *     auto-refund-cron: "0 0 * * * *"    # every hour
 * </pre>
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(
        value = "scheduler.settlement-reconciliation.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class SettlementReconciliationScheduler {

    private final SettlementExecutor settlementExecutor;
    private final DeliveryPaymentStateMachine deliveryPaymentStateMachine;

    /**
     * Confirms pending settlement transactions whose claim was released or has expired.
     * Confirmed transactions become PAID / REFUNDED / ESCROWED, reverted ones FAILED.
     */
    @Scheduled(cron = "${scheduler.settlement-reconciliation.reconcile-cron:0 * * * * *}")
    public void reconcilePendingSettlements() {
        log.debug("Starting scheduled job: reconcile pending settlements");

        try {
            int settledCount = settlementExecutor.reconcilePendingSettlements();

            if (settledCount > 0) {
                log.info("Reconciled {} pending settlements", settledCount);
            }

        } catch (Exception e) {
            log.error("Failed to reconcile pending settlements: {}", e.getMessage(), e);
        }
    }

    @Scheduled(cron = "${scheduler.settlement-reconciliation.auto-refund-cron:0 0 * * * *}")
    public void autoRefundExpiredEscrows() {
        log.info("Starting scheduled job: auto-refund expired escrows");

        try {
            int refundedCount = deliveryPaymentStateMachine.autoRefundExpiredEscrows();

            if (refundedCount > 0) {
                log.info("Auto-refunded {} expired escrows", refundedCount);
            } else {
                log.debug("No expired escrows found");
            }

        } catch (Exception e) {
            log.error("Failed to auto-refund expired escrows: {}", e.getMessage(), e);
        }
    }
}
