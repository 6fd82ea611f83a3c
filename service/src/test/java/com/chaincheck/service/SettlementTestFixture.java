package com.chaincheck.service;

import com.chaincheck.api.model.DeliveryStatus;
import com.chaincheck.api.model.PaymentStatus;
import com.chaincheck.model.Delivery;
import com.chaincheck.model.PaymentState;
import com.chaincheck.repository.DeliveryRepository;
import com.chaincheck.settlement.SettlementBackend;
import com.chaincheck.settlement.SettlementContext;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Wires the settlement services without Spring, on top of an in-memory delivery repository.
 */
class SettlementTestFixture {

    static final String BUYER = "0x2222222222222222222222222222222222222222";
    static final String SELLER = "0x1111111111111111111111111111111111111111";
    static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    final Map<UUID, Delivery> deliveries = new ConcurrentHashMap<>();
    final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    final DeliveryRepository deliveryRepository = mock(DeliveryRepository.class);
    final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    final SettlementContext context;
    final SettlementBackend backend;
    final SettlementClaimService claimService;
    final SettlementExecutor executor;
    final PaymentTermsValidator paymentTermsValidator;
    final EscrowCoordinator escrowCoordinator;
    final DirectTransferService directTransferService;

    SettlementTestFixture(boolean escrowEnabled, SettlementBackend backend) {
        this.context = new SettlementContext(true, escrowEnabled, "ETH", Duration.ofDays(30), null, null,
                31337L, null, BigInteger.valueOf(300_000), Duration.ofSeconds(1), Duration.ofMillis(500),
                Duration.ofMinutes(2));
        this.backend = backend;

        when(deliveryRepository.findById(any(UUID.class)))
                .thenAnswer(invocation -> Optional.ofNullable(deliveries.get(invocation.<UUID>getArgument(0))));
        when(deliveryRepository.findByIdForUpdate(any(UUID.class)))
                .thenAnswer(invocation -> Optional.ofNullable(deliveries.get(invocation.<UUID>getArgument(0))));
        when(deliveryRepository.save(any(Delivery.class))).thenAnswer(invocation -> {
            Delivery delivery = invocation.getArgument(0);
            deliveries.put(delivery.getId(), delivery);
            return delivery;
        });

        this.claimService = new SettlementClaimService(deliveryRepository, new PaymentStatusStateMachine(),
                context, clock);
        this.executor = new SettlementExecutor(claimService, backend, context, deliveryRepository, meterRegistry,
                clock);
        this.paymentTermsValidator = new PaymentTermsValidator(context);
        this.escrowCoordinator = new EscrowCoordinator(executor, backend, paymentTermsValidator);
        this.directTransferService = new DirectTransferService(executor, backend, paymentTermsValidator);
    }

    Delivery paidDelivery(String amountEth) {
        PaymentState paymentState = new PaymentState();
        paymentState.setRequiresPaymentOnDelivery(true);
        paymentState.setCurrency("ETH");
        paymentState.setBuyerAddress(BUYER);
        paymentState.setSellerAddress(SELLER);
        paymentState.setAmount(new BigDecimal(amountEth));
        paymentState.setPaymentStatus(PaymentStatus.PENDING);

        Delivery delivery = new Delivery();
        delivery.setId(UUID.randomUUID());
        delivery.setOrderId("ORDER-" + delivery.getId());
        delivery.setDriverId("driver-1");
        delivery.setRecipientName("Recipient");
        delivery.setDeliveryAddress("1 Main St");
        delivery.setDestinationLat(40.7128);
        delivery.setDestinationLon(-74.0060);
        delivery.setStatus(DeliveryStatus.IN_TRANSIT);
        delivery.setPaymentState(paymentState);
        delivery.setCreatedAt(LocalDateTime.now(clock));
        deliveries.put(delivery.getId(), delivery);
        return delivery;
    }

    void markDelivered(Delivery delivery) {
        delivery.setStatus(DeliveryStatus.DELIVERED);
        delivery.setProofHash("ab".repeat(32));
    }

    Delivery reload(Delivery delivery) {
        return deliveries.get(delivery.getId());
    }
}
