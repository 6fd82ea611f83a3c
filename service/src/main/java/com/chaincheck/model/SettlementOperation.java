package com.chaincheck.model;

/**
 * Settlement operation that currently holds (or last held) the claim on a delivery.
 */
public enum SettlementOperation {
    DEPOSIT,
    RELEASE,
    REFUND,
    AUTO_REFUND,
    TRANSFER
}
