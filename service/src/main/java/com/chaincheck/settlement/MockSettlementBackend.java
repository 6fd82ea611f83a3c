package com.chaincheck.settlement;

import com.chaincheck.error.SettlementRevertedException;
import com.chaincheck.ledger.ChainReceipt;
import com.chaincheck.model.SettlementOperation;
import lombok.extern.slf4j.Slf4j;
import org.web3j.crypto.Hash;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * In-memory settlement backend for environments without a funded authority wallet.
 *
 * <p>Emulates the escrow contract rules (one escrow per key, settle once, auto-refund
 * only after the deadline) and confirms every accepted transaction immediately.
 */
@Slf4j
public class MockSettlementBackend implements SettlementBackend {

    static final String MOCK_AUTHORITY = "0x000000000000000000000000000000000000c0de";

    private static final Pattern ADDRESS = Pattern.compile("^0x[a-fA-F0-9]{40}$");
    private static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";

    private final Clock clock;
    private final Duration autoRefundWindow;
    private final String contractAddress;

    private final Map<String, EscrowState> escrows = new ConcurrentHashMap<>();
    private final Map<String, ChainReceipt> receipts = new ConcurrentHashMap<>();
    private final AtomicLong nonce = new AtomicLong();
    private final AtomicLong blockNumber;

    public MockSettlementBackend(Clock clock, Duration autoRefundWindow, String contractAddress) {
        this.clock = clock;
        this.autoRefundWindow = autoRefundWindow;
        this.contractAddress = contractAddress;
        this.blockNumber = new AtomicLong(Instant.now(clock).getEpochSecond() % 1_000_000);
    }

    @Override
    public boolean isMock() {
        return true;
    }

    @Override
    public String contractAddress() {
        return contractAddress;
    }

    @Override
    public synchronized SubmittedTransaction submitDeposit(String deliveryId, String sellerAddress, BigInteger amountWei) {
        String key = DeliveryKeys.deterministicHash(deliveryId);
        if (escrows.containsKey(key)) {
            throw new SettlementRevertedException("Escrow already exists");
        }
        if (sellerAddress == null || !ADDRESS.matcher(sellerAddress).matches() || ZERO_ADDRESS.equals(sellerAddress)) {
            throw new SettlementRevertedException("Invalid seller address");
        }
        if (amountWei == null || amountWei.signum() <= 0) {
            throw new SettlementRevertedException("Amount must be greater than 0");
        }

        Instant createdAt = Instant.now(clock);
        escrows.put(key, new EscrowState(key, MOCK_AUTHORITY, sellerAddress, amountWei, false, false,
                createdAt, createdAt.plus(autoRefundWindow)));
        return confirm(SettlementOperation.DEPOSIT, key);
    }

    @Override
    public synchronized SubmittedTransaction submitRelease(String deliveryId) {
        String key = DeliveryKeys.deterministicHash(deliveryId);
        EscrowState escrow = requireUnsettled(key);
        escrows.put(key, escrow.markReleased());
        return confirm(SettlementOperation.RELEASE, key);
    }

    @Override
    public synchronized SubmittedTransaction submitRefund(String deliveryId) {
        String key = DeliveryKeys.deterministicHash(deliveryId);
        EscrowState escrow = requireUnsettled(key);
        escrows.put(key, escrow.markRefunded());
        return confirm(SettlementOperation.REFUND, key);
    }

    @Override
    public synchronized SubmittedTransaction submitAutoRefund(String deliveryId) {
        String key = DeliveryKeys.deterministicHash(deliveryId);
        EscrowState escrow = requireEscrow(key);
        if (Instant.now(clock).isBefore(escrow.releaseDeadline())) {
            throw new SettlementRevertedException("Release deadline not reached");
        }
        if (escrow.settled()) {
            throw new SettlementRevertedException("Escrow already settled");
        }
        escrows.put(key, escrow.markRefunded());
        return confirm(SettlementOperation.AUTO_REFUND, key);
    }

    @Override
    public synchronized SubmittedTransaction submitTransfer(String toAddress, BigInteger amountWei) {
        if (toAddress == null || !ADDRESS.matcher(toAddress).matches()) {
            throw new SettlementRevertedException("Invalid recipient address");
        }
        if (amountWei == null || amountWei.signum() <= 0) {
            throw new SettlementRevertedException("Amount must be greater than 0");
        }
        return confirm(SettlementOperation.TRANSFER, toAddress.toLowerCase());
    }

    @Override
    public Optional<ChainReceipt> awaitReceipt(String transactionHash, Duration timeout) {
        return getReceipt(transactionHash);
    }

    @Override
    public Optional<ChainReceipt> getReceipt(String transactionHash) {
        return Optional.ofNullable(receipts.get(transactionHash));
    }

    @Override
    public Optional<EscrowState> getEscrow(String deliveryId) {
        return Optional.ofNullable(escrows.get(DeliveryKeys.deterministicHash(deliveryId)));
    }

    @Override
    public boolean canAutoRefund(String deliveryId) {
        return getEscrow(deliveryId)
                .map(escrow -> !escrow.settled() && !Instant.now(clock).isBefore(escrow.releaseDeadline()))
                .orElse(false);
    }

    private EscrowState requireEscrow(String key) {
        EscrowState escrow = escrows.get(key);
        if (escrow == null) {
            throw new SettlementRevertedException("Escrow does not exist");
        }
        return escrow;
    }

    private EscrowState requireUnsettled(String key) {
        EscrowState escrow = requireEscrow(key);
        if (escrow.settled()) {
            throw new SettlementRevertedException("Escrow already settled");
        }
        return escrow;
    }

    private SubmittedTransaction confirm(SettlementOperation operation, String subject) {
        String transactionHash = Hash.sha3String(operation + ":" + subject + ":" + nonce.incrementAndGet());
        long block = blockNumber.incrementAndGet();
        receipts.put(transactionHash, new ChainReceipt(transactionHash, block, true, null));

        log.info("Mock settlement {} confirmed: tx={}, block={}", operation, transactionHash, block);
        return new SubmittedTransaction(transactionHash, operation);
    }
}
