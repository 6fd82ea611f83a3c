package com.chaincheck.config;

import com.chaincheck.ledger.ArchivistLedgerAdapter;
import com.chaincheck.ledger.DirectLedgerAdapter;
import com.chaincheck.ledger.DivinerClient;
import com.chaincheck.ledger.JsonRpcClient;
import com.chaincheck.ledger.WitnessLedgerReader;
import com.chaincheck.ledger.WitnessNetworkContext;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.WalletUtils;

import java.time.Duration;

/**
 * Witness network configuration: ledger JSON-RPC, archival index and diviner clients.
 *
 * <p>Without a wallet mnemonic (or with ledger.mock-mode=true) proofs are synthesized
 * locally. A blank diviner URL disables the diviner.
 */
@Configuration
@Slf4j
public class LedgerConfig {

    @Bean
    public WitnessNetworkContext witnessNetworkContext(
            @Value("${ledger.mock-mode:true}") boolean mockMode,
            @Value("${ledger.rpc-url:http://localhost:8081/rpc}") String rpcUrl,
            @Value("${ledger.wallet-mnemonic:}") String walletMnemonic,
            @Value("${ledger.chain-id:}") String chainId,
            @Value("${ledger.rpc-timeout:5s}") Duration rpcTimeout,
            @Value("${ledger.archivist.url:http://localhost:8888}") String archivistUrl,
            @Value("${ledger.archivist.archive:chaincheck}") String archive,
            @Value("${ledger.archivist.disabled:false}") boolean archivistDisabled,
            @Value("${ledger.diviner.url:}") String divinerUrl,
            @Value("${ledger.diviner.disabled:false}") boolean divinerDisabled) {
        Credentials witnessCredentials = walletMnemonic.isBlank()
                ? null
                : WalletUtils.loadBip39Credentials("", walletMnemonic.trim());
        if (!mockMode && witnessCredentials == null) {
            log.warn("ledger.mock-mode=false but no ledger.wallet-mnemonic configured; proofs will be mocked");
        }

        WitnessNetworkContext context = new WitnessNetworkContext(mockMode, rpcUrl, witnessCredentials, chainId,
                rpcTimeout, archivistUrl, archive, archivistDisabled, divinerUrl,
                divinerDisabled || divinerUrl.isBlank());
        log.info("Witness network configured: {}", context);
        return context;
    }

    @Bean
    public JsonRpcClient witnessRpcClient(WitnessNetworkContext context, WebClient.Builder webClientBuilder) {
        return new JsonRpcClient(webClientBuilder.clone().baseUrl(context.rpcUrl()).build(), context.rpcTimeout());
    }

    @Bean
    public WitnessLedgerReader witnessLedgerReader(JsonRpcClient witnessRpcClient) {
        return new WitnessLedgerReader(witnessRpcClient);
    }

    @Bean
    public DirectLedgerAdapter directLedgerAdapter(JsonRpcClient witnessRpcClient,
                                                   WitnessLedgerReader witnessLedgerReader,
                                                   ObjectMapper objectMapper) {
        return new DirectLedgerAdapter(witnessRpcClient, witnessLedgerReader, objectMapper);
    }

    @Bean
    public ArchivistLedgerAdapter archivistLedgerAdapter(WitnessNetworkContext context,
                                                         WebClient.Builder webClientBuilder,
                                                         ObjectMapper objectMapper) {
        WebClient webClient = webClientBuilder.clone().baseUrl(context.archivistUrl()).build();
        return new ArchivistLedgerAdapter(webClient, context.archive(), context.rpcTimeout(), objectMapper);
    }

    @Bean
    public DivinerClient divinerClient(WitnessNetworkContext context, WebClient.Builder webClientBuilder) {
        WebClient.Builder builder = webClientBuilder.clone();
        if (!context.divinerUrl().isBlank()) {
            builder.baseUrl(context.divinerUrl());
        }
        return new DivinerClient(builder.build(), context.rpcTimeout());
    }
}
