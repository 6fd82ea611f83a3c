package com.chaincheck.service;

import com.chaincheck.model.PaymentState;
import com.chaincheck.settlement.SettlementContext;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * Checks payment terms before anything is sent to the settlement chain.
 */
@Component
@RequiredArgsConstructor
public class PaymentTermsValidator {

    private static final Pattern ADDRESS = Pattern.compile("^0x[a-fA-F0-9]{40}$");

    private final SettlementContext settlementContext;

    /**
     * @throws IllegalArgumentException if currency, addresses or amount are invalid
     */
    public void validate(PaymentState paymentState) {
        validate(paymentState.getCurrency(), paymentState.getBuyerAddress(),
                paymentState.getSellerAddress(), paymentState.getAmount());
    }

    public void validate(String currency, String buyerAddress, String sellerAddress, BigDecimal amount) {
        if (currency == null || !currency.equalsIgnoreCase(settlementContext.asset())) {
            throw new IllegalArgumentException(
                    "Unsupported currency: " + currency + ". Only " + settlementContext.asset() + " is supported");
        }
        if (buyerAddress != null && !ADDRESS.matcher(buyerAddress).matches()) {
            throw new IllegalArgumentException("Invalid buyer address: " + buyerAddress);
        }
        if (sellerAddress == null || !ADDRESS.matcher(sellerAddress).matches()) {
            throw new IllegalArgumentException("Invalid seller address: " + sellerAddress);
        }
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Amount must be greater than 0");
        }
    }
}
