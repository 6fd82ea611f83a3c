package com.chaincheck.settlement;

import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint256;

import java.util.Arrays;
import java.util.Collections;

/**
 * ABI of the custodial escrow contract.
 *
 * <pre>
 * deposit(bytes32 deliveryId, address seller) payable
 * release(bytes32 deliveryId)
 * refund(bytes32 deliveryId)
 * autoRefund(bytes32 deliveryId)
 * getEscrow(bytes32 deliveryId) view returns
 *     (address buyer, address seller, uint256 amount, bool released, bool refunded,
 *      uint256 createdAt, uint256 releaseDeadline)
 * canAutoRefund(bytes32 deliveryId) view returns (bool)
 * </pre>
 */
final class EscrowContractFunctions {

    static final String FUNC_DEPOSIT = "deposit";
    static final String FUNC_RELEASE = "release";
    static final String FUNC_REFUND = "refund";
    static final String FUNC_AUTO_REFUND = "autoRefund";
    static final String FUNC_GET_ESCROW = "getEscrow";
    static final String FUNC_CAN_AUTO_REFUND = "canAutoRefund";

    private EscrowContractFunctions() {
    }

    static Function deposit(byte[] key, String seller) {
        return new Function(
                FUNC_DEPOSIT,
                Arrays.<Type>asList(new Bytes32(key), new Address(160, seller)),
                Collections.<TypeReference<?>>emptyList());
    }

    static Function release(byte[] key) {
        return keyOnly(FUNC_RELEASE, key);
    }

    static Function refund(byte[] key) {
        return keyOnly(FUNC_REFUND, key);
    }

    static Function autoRefund(byte[] key) {
        return keyOnly(FUNC_AUTO_REFUND, key);
    }

    static Function getEscrow(byte[] key) {
        return new Function(
                FUNC_GET_ESCROW,
                Arrays.<Type>asList(new Bytes32(key)),
                Arrays.<TypeReference<?>>asList(
                        new TypeReference<Address>() {},
                        new TypeReference<Address>() {},
                        new TypeReference<Uint256>() {},
                        new TypeReference<Bool>() {},
                        new TypeReference<Bool>() {},
                        new TypeReference<Uint256>() {},
                        new TypeReference<Uint256>() {}));
    }

    static Function canAutoRefund(byte[] key) {
        return new Function(
                FUNC_CAN_AUTO_REFUND,
                Arrays.<Type>asList(new Bytes32(key)),
                Arrays.<TypeReference<?>>asList(new TypeReference<Bool>() {}));
    }

    private static Function keyOnly(String name, byte[] key) {
        return new Function(name, Arrays.<Type>asList(new Bytes32(key)), Collections.<TypeReference<?>>emptyList());
    }
}
