package com.chaincheck.settlement;

import com.chaincheck.error.LedgerUnavailableException;
import com.chaincheck.ledger.ChainReader;
import com.chaincheck.ledger.ChainReceipt;
import com.chaincheck.ledger.LedgerBlock;
import com.chaincheck.ledger.WitnessRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameter;
import org.web3j.protocol.core.Response;
import org.web3j.protocol.core.methods.response.EthBlock;
import org.web3j.protocol.core.methods.response.EthBlockNumber;
import org.web3j.protocol.core.methods.response.EthGetTransactionReceipt;
import org.web3j.protocol.core.methods.response.TransactionReceipt;

import java.io.IOException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link ChainReader} for the settlement chain (Ethereum JSON-RPC via web3j).
 *
 * <p>The settlement chain holds no witness records.
 */
@RequiredArgsConstructor
@Slf4j
public class EthereumChainReader implements ChainReader {

    private final Web3j web3j;

    @Override
    public Optional<ChainReceipt> getTransactionReceipt(String transactionRef) {
        EthGetTransactionReceipt response = send("eth_getTransactionReceipt", () ->
                web3j.ethGetTransactionReceipt(transactionRef).send());
        return response.getTransactionReceipt().map(EthereumChainReader::toChainReceipt);
    }

    @Override
    public Optional<Long> getTransactionBlockNumber(String transactionRef) {
        return getTransactionReceipt(transactionRef).map(ChainReceipt::blockNumber);
    }

    @Override
    public Optional<LedgerBlock> getBlock(long number) {
        EthBlock response = send("eth_getBlockByNumber", () -> web3j.ethGetBlockByNumber(
                DefaultBlockParameter.valueOf(BigInteger.valueOf(number)), false).send());
        EthBlock.Block block = response.getBlock();
        if (block == null) {
            return Optional.empty();
        }

        List<String> transactionHashes = new ArrayList<>();
        for (EthBlock.TransactionResult<?> transaction : block.getTransactions()) {
            Object value = transaction.get();
            if (value instanceof String) {
                transactionHashes.add((String) value);
            }
        }
        return Optional.of(new LedgerBlock(number, block.getHash(), List.copyOf(transactionHashes), null));
    }

    @Override
    public Optional<WitnessRecord> getWitnessRecord(String hash) {
        return Optional.empty();
    }

    @Override
    public Optional<Long> getCurrentBlockNumber() {
        EthBlockNumber response = send("eth_blockNumber", () -> web3j.ethBlockNumber().send());
        return Optional.ofNullable(response.getBlockNumber()).map(BigInteger::longValue);
    }

    static ChainReceipt toChainReceipt(TransactionReceipt receipt) {
        Long blockNumber = receipt.getBlockNumber() == null ? null : receipt.getBlockNumber().longValue();
        return new ChainReceipt(receipt.getTransactionHash(), blockNumber, receipt.isStatusOK(),
                receipt.isStatusOK() ? null : revertReason(receipt));
    }

    private static String revertReason(TransactionReceipt receipt) {
        return receipt.getRevertReason() != null ? receipt.getRevertReason() : "Transaction reverted";
    }

    private <T extends Response<?>> T send(String method, RpcCall<T> call) {
        T response;
        try {
            response = call.send();
        } catch (IOException e) {
            throw new LedgerUnavailableException("Settlement chain call " + method + " failed: " + e.getMessage(), e);
        }
        if (response.hasError()) {
            throw new LedgerUnavailableException("Settlement chain call " + method + " returned error: "
                    + response.getError().getMessage());
        }
        return response;
    }

    @FunctionalInterface
    interface RpcCall<T> {
        T send() throws IOException;
    }
}
