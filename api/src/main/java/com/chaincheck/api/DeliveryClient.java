package com.chaincheck.api;

import com.chaincheck.api.request.CreateDeliveryRequest;
import com.chaincheck.api.request.VerifyDeliveryRequest;
import com.chaincheck.api.response.DeliveryResponse;
import com.chaincheck.api.response.PaymentStateResponse;
import com.chaincheck.api.response.SettlementResponse;
import com.chaincheck.api.response.VerifyDeliveryResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.UUID;

/**
 * WebClient-based implementation of DeliveryApi for consuming the chaincheck service.
 *
 * <p><b>IMPORTANT:</b> This client is NOT a Spring @Component. Consuming services must
 * register it as a bean themselves:
 * <pre>
 * {@code
 * @Bean
 * public DeliveryClient deliveryClient(WebClient.Builder builder,
 *                                      @Value("${services.chaincheck.url}") String baseUrl) {
 *     return new DeliveryClient(builder.baseUrl(baseUrl).build());
 * }
 * }
 * </pre>
 */
@RequiredArgsConstructor
@Slf4j
public class DeliveryClient implements DeliveryApi {

    private static final String BASE_PATH = "/api/v1/deliveries";

    private final WebClient webClient;

    // ==================== Delivery Operations ====================

    @Override
    public ResponseEntity<DeliveryResponse> createDelivery(CreateDeliveryRequest request) {
        log.debug("Calling createDelivery: orderId={}", request.orderId());

        return webClient.post()
                .uri(BASE_PATH)
                .bodyValue(request)
                .retrieve()
                .toEntity(DeliveryResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<DeliveryResponse> getDelivery(UUID deliveryId) {
        log.debug("Calling getDelivery: deliveryId={}", deliveryId);

        return webClient.get()
                .uri(BASE_PATH + "/{deliveryId}", deliveryId)
                .retrieve()
                .toEntity(DeliveryResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<VerifyDeliveryResponse> verifyDelivery(UUID deliveryId, VerifyDeliveryRequest request) {
        log.debug("Calling verifyDelivery: deliveryId={}", deliveryId);

        return webClient.post()
                .uri(BASE_PATH + "/{deliveryId}/verify", deliveryId)
                .bodyValue(request)
                .retrieve()
                .toEntity(VerifyDeliveryResponse.class)
                .block();
    }

    // ==================== Payment Operations ====================

    @Override
    public ResponseEntity<PaymentStateResponse> getPaymentStatus(UUID deliveryId) {
        log.debug("Calling getPaymentStatus: deliveryId={}", deliveryId);

        return webClient.get()
                .uri(BASE_PATH + "/{deliveryId}/payment", deliveryId)
                .retrieve()
                .toEntity(PaymentStateResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<SettlementResponse> depositEscrow(UUID deliveryId) {
        return postSettlement(deliveryId, "deposit");
    }

    @Override
    public ResponseEntity<SettlementResponse> releasePayment(UUID deliveryId) {
        return postSettlement(deliveryId, "release");
    }

    @Override
    public ResponseEntity<SettlementResponse> refundPayment(UUID deliveryId) {
        return postSettlement(deliveryId, "refund");
    }

    @Override
    public ResponseEntity<SettlementResponse> autoRefund(UUID deliveryId) {
        return postSettlement(deliveryId, "auto-refund");
    }

    private ResponseEntity<SettlementResponse> postSettlement(UUID deliveryId, String operation) {
        log.debug("Calling payment {}: deliveryId={}", operation, deliveryId);

        return webClient.post()
                .uri(BASE_PATH + "/{deliveryId}/payment/{operation}", deliveryId, operation)
                .retrieve()
                .toEntity(SettlementResponse.class)
                .block();
    }
}
