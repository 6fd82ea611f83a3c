package com.chaincheck.mapper;

import com.chaincheck.api.response.DeliveryResponse;
import com.chaincheck.api.response.DivinerVerificationResponse;
import com.chaincheck.api.response.EscrowStatusResponse;
import com.chaincheck.api.response.LocationProofResponse;
import com.chaincheck.api.response.PaymentStateResponse;
import com.chaincheck.api.response.ProofVerificationResponse;
import com.chaincheck.api.response.SettlementResponse;
import com.chaincheck.api.response.WitnessNodeResponse;
import com.chaincheck.api.response.WitnessRecordResponse;
import com.chaincheck.ledger.DivinerResult;
import com.chaincheck.ledger.LocationProof;
import com.chaincheck.ledger.ProofVerification;
import com.chaincheck.ledger.WitnessNode;
import com.chaincheck.ledger.WitnessRecord;
import com.chaincheck.model.Delivery;
import com.chaincheck.settlement.EscrowState;
import com.chaincheck.settlement.SettlementResult;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.factory.Mappers;

import java.util.List;

/**
 * MapStruct mapper for deliveries, proofs and settlement results to API responses.
 */
@Mapper
public interface DeliveryMapper {

    DeliveryMapper INSTANCE = Mappers.getMapper(DeliveryMapper.class);

    @Mapping(target = "payment", expression = "java(toPaymentStateResponse(delivery))")
    DeliveryResponse toDeliveryResponse(Delivery delivery);

    /**
     * Maps the payment part of a delivery. The on-chain escrow is not included.
     */
    @Mapping(target = "requiresPaymentOnDelivery", source = "paymentState.requiresPaymentOnDelivery")
    @Mapping(target = "currency", source = "paymentState.currency")
    @Mapping(target = "buyerAddress", source = "paymentState.buyerAddress")
    @Mapping(target = "sellerAddress", source = "paymentState.sellerAddress")
    @Mapping(target = "amount", source = "paymentState.amount")
    @Mapping(target = "paymentStatus", source = "paymentState.paymentStatus")
    @Mapping(target = "transactionHash", source = "paymentState.transactionHash")
    @Mapping(target = "blockNumber", source = "paymentState.blockNumber")
    @Mapping(target = "error", source = "paymentState.error")
    @Mapping(target = "escrow", ignore = true)
    PaymentStateResponse toPaymentStateResponse(Delivery delivery);

    /**
     * Maps the payment part of a delivery together with its on-chain escrow.
     */
    @Mapping(target = "requiresPaymentOnDelivery", source = "delivery.paymentState.requiresPaymentOnDelivery")
    @Mapping(target = "currency", source = "delivery.paymentState.currency")
    @Mapping(target = "buyerAddress", source = "delivery.paymentState.buyerAddress")
    @Mapping(target = "sellerAddress", source = "delivery.paymentState.sellerAddress")
    @Mapping(target = "amount", source = "delivery.paymentState.amount")
    @Mapping(target = "paymentStatus", source = "delivery.paymentState.paymentStatus")
    @Mapping(target = "transactionHash", source = "delivery.paymentState.transactionHash")
    @Mapping(target = "blockNumber", source = "delivery.paymentState.blockNumber")
    @Mapping(target = "error", source = "delivery.paymentState.error")
    @Mapping(target = "escrowContractAddress", source = "delivery.escrowContractAddress")
    @Mapping(target = "escrowDepositTxHash", source = "delivery.escrowDepositTxHash")
    @Mapping(target = "escrowDepositBlock", source = "delivery.escrowDepositBlock")
    @Mapping(target = "escrowReleaseTxHash", source = "delivery.escrowReleaseTxHash")
    @Mapping(target = "escrowReleaseBlock", source = "delivery.escrowReleaseBlock")
    @Mapping(target = "escrowRefundTxHash", source = "delivery.escrowRefundTxHash")
    @Mapping(target = "escrowRefundBlock", source = "delivery.escrowRefundBlock")
    @Mapping(target = "pendingTransactionHash", source = "delivery.pendingTransactionHash")
    @Mapping(target = "escrow", source = "escrow")
    PaymentStateResponse toPaymentStateResponse(Delivery delivery, EscrowStatusResponse escrow);

    default EscrowStatusResponse toEscrowStatusResponse(EscrowState escrow, boolean canAutoRefund) {
        if (escrow == null) {
            return null;
        }
        return new EscrowStatusResponse(
                escrow.key(),
                escrow.buyer(),
                escrow.seller(),
                escrow.amountEth(),
                escrow.released(),
                escrow.refunded(),
                escrow.createdAt(),
                escrow.releaseDeadline(),
                canAutoRefund
        );
    }

    LocationProofResponse toLocationProofResponse(LocationProof proof);

    WitnessRecordResponse toWitnessRecordResponse(WitnessRecord record);

    List<WitnessRecordResponse> toWitnessRecordResponses(List<WitnessRecord> records);

    ProofVerificationResponse toProofVerificationResponse(ProofVerification verification);

    WitnessNodeResponse toWitnessNodeResponse(WitnessNode node);

    DivinerVerificationResponse toDivinerVerificationResponse(DivinerResult result);

    default SettlementResponse toSettlementResponse(Delivery delivery, String operation, SettlementResult result) {
        return new SettlementResponse(
                delivery.getId(),
                operation,
                result.success(),
                result.transactionHash(),
                result.blockNumber(),
                result.error(),
                result.inProgress(),
                delivery.getPaymentState().getPaymentStatus()
        );
    }
}
