package com.chaincheck.settlement;

import org.web3j.crypto.Credentials;

import java.math.BigInteger;
import java.time.Duration;

/**
 * Settlement settings resolved once at start-up.
 *
 * @param mockMode            Mock settlement backend forced by configuration
 * @param escrowEnabled       Escrow contract path; direct transfers otherwise
 * @param asset               The only supported settlement currency
 * @param autoRefundWindow    Time after deposit when anyone may trigger a refund
 * @param rpcUrl              Settlement chain JSON-RPC endpoint
 * @param contractAddress     Escrow contract address
 * @param chainId             Settlement chain id
 * @param credentials         Settlement authority credential, null when not configured
 * @param gasLimit            Gas limit for contract calls
 * @param confirmationTimeout Receipt wait per request
 * @param concurrentWait      How long a concurrent request waits for the winner
 * @param claimTtl            Age after which a settlement claim is considered abandoned
 */
public record SettlementContext(
        boolean mockMode,
        boolean escrowEnabled,
        String asset,
        Duration autoRefundWindow,
        String rpcUrl,
        String contractAddress,
        long chainId,
        Credentials credentials,
        BigInteger gasLimit,
        Duration confirmationTimeout,
        Duration concurrentWait,
        Duration claimTtl
) {

    public boolean liveConfigured() {
        return credentials != null
                && rpcUrl != null && !rpcUrl.isBlank()
                && (!escrowEnabled || (contractAddress != null && !contractAddress.isBlank()));
    }

    @Override
    public String toString() {
        return "SettlementContext[mockMode=" + mockMode
                + ", escrowEnabled=" + escrowEnabled
                + ", asset=" + asset
                + ", autoRefundWindow=" + autoRefundWindow
                + ", rpcUrl=" + rpcUrl
                + ", contractAddress=" + contractAddress
                + ", chainId=" + chainId
                + ", authority=" + (credentials == null ? null : credentials.getAddress()) + "]";
    }
}
