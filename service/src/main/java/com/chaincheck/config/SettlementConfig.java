package com.chaincheck.config;

import com.chaincheck.settlement.EthereumChainReader;
import com.chaincheck.settlement.LiveSettlementBackend;
import com.chaincheck.settlement.MockSettlementBackend;
import com.chaincheck.settlement.SettlementBackend;
import com.chaincheck.settlement.SettlementContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;

/**
 * Settlement configuration.
 *
 * <p>Settings are resolved once into a {@link SettlementContext}; the
 * {@link SettlementBackend} is selected once from it:
 * <ul>
 *   <li>mock-mode=true → {@link MockSettlementBackend}</li>
 *   <li>mock-mode=false without authority key, RPC URL or contract → {@link MockSettlementBackend} (warning)</li>
 *   <li>otherwise → {@link LiveSettlementBackend}</li>
 * </ul>
 */
@Configuration
@Slf4j
public class SettlementConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SettlementContext settlementContext(
            @Value("${settlement.mock-mode:true}") boolean mockMode,
            @Value("${settlement.escrow-enabled:true}") boolean escrowEnabled,
            @Value("${settlement.asset:ETH}") String asset,
            @Value("${settlement.auto-refund-window:30d}") Duration autoRefundWindow,
            @Value("${settlement.rpc-url:}") String rpcUrl,
            @Value("${settlement.private-key:}") String privateKey,
            @Value("${settlement.contract-address:}") String contractAddress,
            @Value("${settlement.chain-id:31337}") long chainId,
            @Value("${settlement.gas-limit:300000}") BigInteger gasLimit,
            @Value("${settlement.confirmation-timeout:8s}") Duration confirmationTimeout,
            @Value("${settlement.concurrent-wait:5s}") Duration concurrentWait,
            @Value("${settlement.claim-ttl:2m}") Duration claimTtl) {
        Credentials credentials = privateKey.isBlank() ? null : Credentials.create(privateKey);
        SettlementContext context = new SettlementContext(mockMode, escrowEnabled, asset, autoRefundWindow,
                rpcUrl, contractAddress.isBlank() ? null : contractAddress, chainId, credentials, gasLimit,
                confirmationTimeout, concurrentWait, claimTtl);
        log.info("Settlement configured: {}", context);
        return context;
    }

    @Bean
    public SettlementBackend settlementBackend(SettlementContext context, Clock clock) {
        if (context.mockMode()) {
            log.info("Settlement backend: mock (settlement.mock-mode=true)");
            return new MockSettlementBackend(clock, context.autoRefundWindow(), context.contractAddress());
        }
        if (!context.liveConfigured()) {
            log.warn("Settlement backend: mock. settlement.mock-mode=false but private key, RPC URL "
                    + "or escrow contract address is missing");
            return new MockSettlementBackend(clock, context.autoRefundWindow(), context.contractAddress());
        }

        Web3j web3j = Web3j.build(new HttpService(context.rpcUrl()));
        log.info("Settlement backend: live (rpc={}, contract={}, authority={})",
                context.rpcUrl(), context.contractAddress(), context.credentials().getAddress());
        return new LiveSettlementBackend(context, web3j, new EthereumChainReader(web3j));
    }
}
