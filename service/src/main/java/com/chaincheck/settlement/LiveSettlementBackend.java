package com.chaincheck.settlement;

import com.chaincheck.error.LedgerUnavailableException;
import com.chaincheck.error.SettlementRevertedException;
import com.chaincheck.ledger.ChainReceipt;
import com.chaincheck.model.SettlementOperation;
import lombok.extern.slf4j.Slf4j;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthCall;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.tx.RawTransactionManager;

import java.io.IOException;
import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Settlement backend talking to the escrow contract on a live chain.
 *
 * <p>Every write is first simulated with {@code eth_call} so that contract rejections
 * surface as {@link SettlementRevertedException} before anything is broadcast. Writes are
 * signed locally by the settlement authority and sent as raw transactions.
 */
@Slf4j
public class LiveSettlementBackend implements SettlementBackend {

    static final BigInteger TRANSFER_GAS_LIMIT = BigInteger.valueOf(21_000);
    static final long RECEIPT_POLL_INTERVAL_MS = 500;

    private static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";

    private final SettlementContext context;
    private final Web3j web3j;
    private final EthereumChainReader chainReader;
    private final RawTransactionManager transactionManager;

    public LiveSettlementBackend(SettlementContext context, Web3j web3j, EthereumChainReader chainReader) {
        this.context = context;
        this.web3j = web3j;
        this.chainReader = chainReader;
        this.transactionManager = new RawTransactionManager(web3j, context.credentials(), context.chainId());
    }

    @Override
    public boolean isMock() {
        return false;
    }

    @Override
    public String contractAddress() {
        return context.contractAddress();
    }

    @Override
    public SubmittedTransaction submitDeposit(String deliveryId, String sellerAddress, BigInteger amountWei) {
        Function function = EscrowContractFunctions.deposit(DeliveryKeys.keyBytes(deliveryId), sellerAddress);
        return sendContractTransaction(function, amountWei, SettlementOperation.DEPOSIT);
    }

    @Override
    public SubmittedTransaction submitRelease(String deliveryId) {
        Function function = EscrowContractFunctions.release(DeliveryKeys.keyBytes(deliveryId));
        return sendContractTransaction(function, BigInteger.ZERO, SettlementOperation.RELEASE);
    }

    @Override
    public SubmittedTransaction submitRefund(String deliveryId) {
        Function function = EscrowContractFunctions.refund(DeliveryKeys.keyBytes(deliveryId));
        return sendContractTransaction(function, BigInteger.ZERO, SettlementOperation.REFUND);
    }

    @Override
    public SubmittedTransaction submitAutoRefund(String deliveryId) {
        Function function = EscrowContractFunctions.autoRefund(DeliveryKeys.keyBytes(deliveryId));
        return sendContractTransaction(function, BigInteger.ZERO, SettlementOperation.AUTO_REFUND);
    }

    @Override
    public SubmittedTransaction submitTransfer(String toAddress, BigInteger amountWei) {
        try {
            EthSendTransaction sent = transactionManager.sendTransaction(
                    gasPrice(), TRANSFER_GAS_LIMIT, toAddress, "", amountWei);
            return accepted(sent, SettlementOperation.TRANSFER);
        } catch (IOException e) {
            throw new LedgerUnavailableException("Transfer submission failed: " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<ChainReceipt> awaitReceipt(String transactionHash, Duration timeout) {
        Instant deadline = Instant.now().plus(timeout);
        while (true) {
            Optional<ChainReceipt> receipt = chainReader.getTransactionReceipt(transactionHash);
            if (receipt.isPresent() || !Instant.now().isBefore(deadline)) {
                return receipt;
            }
            try {
                Thread.sleep(RECEIPT_POLL_INTERVAL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Optional.empty();
            }
        }
    }

    @Override
    public Optional<ChainReceipt> getReceipt(String transactionHash) {
        return chainReader.getTransactionReceipt(transactionHash);
    }

    @Override
    @SuppressWarnings("rawtypes")
    public Optional<EscrowState> getEscrow(String deliveryId) {
        Function function = EscrowContractFunctions.getEscrow(DeliveryKeys.keyBytes(deliveryId));
        List<Type> values = FunctionReturnDecoder.decode(call(function, BigInteger.ZERO).getValue(),
                function.getOutputParameters());
        if (values.size() != 7) {
            return Optional.empty();
        }

        String buyer = ((Address) values.get(0)).getValue();
        if (ZERO_ADDRESS.equalsIgnoreCase(buyer)) {
            return Optional.empty();
        }
        return Optional.of(new EscrowState(
                DeliveryKeys.deterministicHash(deliveryId),
                buyer,
                ((Address) values.get(1)).getValue(),
                ((Uint256) values.get(2)).getValue(),
                ((Bool) values.get(3)).getValue(),
                ((Bool) values.get(4)).getValue(),
                Instant.ofEpochSecond(((Uint256) values.get(5)).getValue().longValue()),
                Instant.ofEpochSecond(((Uint256) values.get(6)).getValue().longValue())));
    }

    @Override
    @SuppressWarnings("rawtypes")
    public boolean canAutoRefund(String deliveryId) {
        Function function = EscrowContractFunctions.canAutoRefund(DeliveryKeys.keyBytes(deliveryId));
        List<Type> values = FunctionReturnDecoder.decode(call(function, BigInteger.ZERO).getValue(),
                function.getOutputParameters());
        return !values.isEmpty() && ((Bool) values.get(0)).getValue();
    }

    public void shutdown() {
        web3j.shutdown();
    }

    private SubmittedTransaction sendContractTransaction(Function function, BigInteger value,
                                                         SettlementOperation operation) {
        String data = FunctionEncoder.encode(function);
        EthCall simulation = call(data, value);
        if (simulation.isReverted()) {
            throw new SettlementRevertedException(simulation.getRevertReason() != null
                    ? simulation.getRevertReason()
                    : operation + " reverted");
        }

        try {
            EthSendTransaction sent = transactionManager.sendTransaction(
                    gasPrice(), context.gasLimit(), context.contractAddress(), data, value);
            return accepted(sent, operation);
        } catch (IOException e) {
            throw new LedgerUnavailableException(operation + " submission failed: " + e.getMessage(), e);
        }
    }

    private EthCall call(Function function, BigInteger value) {
        EthCall response = call(FunctionEncoder.encode(function), value);
        if (response.isReverted()) {
            throw new SettlementRevertedException(function.getName() + " reverted: " + response.getRevertReason());
        }
        return response;
    }

    private EthCall call(String data, BigInteger value) {
        Transaction transaction = Transaction.createFunctionCallTransaction(
                context.credentials().getAddress(), null, null, null, context.contractAddress(), value, data);
        try {
            EthCall response = web3j.ethCall(transaction, DefaultBlockParameterName.LATEST).send();
            if (response.hasError() && !response.isReverted()) {
                throw new LedgerUnavailableException("eth_call failed: " + response.getError().getMessage());
            }
            return response;
        } catch (IOException e) {
            throw new LedgerUnavailableException("eth_call failed: " + e.getMessage(), e);
        }
    }

    private BigInteger gasPrice() throws IOException {
        return web3j.ethGasPrice().send().getGasPrice();
    }

    private SubmittedTransaction accepted(EthSendTransaction sent, SettlementOperation operation) {
        if (sent.hasError()) {
            throw new SettlementRevertedException(operation + " rejected: " + sent.getError().getMessage());
        }
        log.info("Settlement {} submitted: tx={}", operation, sent.getTransactionHash());
        return new SubmittedTransaction(sent.getTransactionHash(), operation);
    }
}
