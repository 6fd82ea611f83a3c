package com.chaincheck.ledger;

import org.web3j.crypto.Credentials;

import java.time.Duration;

/**
 * Witness network settings resolved once at start-up.
 *
 * @param mockMode           Proof mock mode forced by configuration
 * @param rpcUrl             Witness ledger JSON-RPC endpoint
 * @param witnessCredentials Witness wallet credential, null when no mnemonic is configured
 * @param chainId            Witness ledger chain id
 * @param rpcTimeout         Timeout of every ledger, archivist and diviner call
 * @param archivistUrl       Archival index base URL
 * @param archive            Archive name
 * @param archivistDisabled  Archival index disabled
 * @param divinerUrl         Consensus query base URL
 * @param divinerDisabled    Consensus query disabled
 */
public record WitnessNetworkContext(
        boolean mockMode,
        String rpcUrl,
        Credentials witnessCredentials,
        String chainId,
        Duration rpcTimeout,
        String archivistUrl,
        String archive,
        boolean archivistDisabled,
        String divinerUrl,
        boolean divinerDisabled
) {

    /**
     * Proofs are synthesized locally when mock mode is forced or no witness wallet is configured.
     */
    public boolean proofsMocked() {
        return mockMode || witnessCredentials == null;
    }

    /**
     * Witness address as used in bound witnesses (lowercase hex, no prefix).
     */
    public String witnessAddress() {
        return witnessCredentials == null ? null : witnessCredentials.getAddress().substring(2).toLowerCase();
    }

    @Override
    public String toString() {
        return "WitnessNetworkContext[mockMode=" + mockMode
                + ", rpcUrl=" + rpcUrl
                + ", witnessAddress=" + witnessAddress()
                + ", chainId=" + chainId
                + ", archivistDisabled=" + archivistDisabled
                + ", divinerDisabled=" + divinerDisabled + "]";
    }
}
