package com.chaincheck.service;

import com.chaincheck.error.LedgerUnavailableException;
import com.chaincheck.ledger.ArchivistLedgerAdapter;
import com.chaincheck.ledger.ChainReader;
import com.chaincheck.ledger.DirectLedgerAdapter;
import com.chaincheck.ledger.DivinerClient;
import com.chaincheck.ledger.DivinerResult;
import com.chaincheck.ledger.LocationProof;
import com.chaincheck.ledger.LocationProofPayload;
import com.chaincheck.ledger.ProofValidationResult;
import com.chaincheck.ledger.ProofVerification;
import com.chaincheck.ledger.WitnessNetworkContext;
import com.chaincheck.ledger.WitnessRecord;
import com.chaincheck.ledger.WitnessRecordFactory;
import com.chaincheck.repository.DeliveryRepository;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

public class ProofServiceTest {

    private static final String HASH_A = "a".repeat(64);
    private static final String HASH_B = "b".repeat(64);
    private static final String HASH_C = "c".repeat(64);
    private static final String WITNESS = "0f1e2d3c4b5a69788796a5b4c3d2e1f00f1e2d3c";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Clock clock = Clock.fixed(Instant.parse("2026-01-15T10:00:00Z"), ZoneOffset.UTC);

    private ChainReader ledgerReader;
    private DirectLedgerAdapter directLedgerAdapter;
    private ArchivistLedgerAdapter archivistLedgerAdapter;
    private DivinerClient divinerClient;
    private DeliveryRepository deliveryRepository;
    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    public void setUp() {
        ledgerReader = mock(ChainReader.class);
        directLedgerAdapter = mock(DirectLedgerAdapter.class);
        archivistLedgerAdapter = mock(ArchivistLedgerAdapter.class);
        divinerClient = mock(DivinerClient.class);
        deliveryRepository = mock(DeliveryRepository.class);
        meterRegistry = new SimpleMeterRegistry();
    }

    private ProofService proofService(boolean archivistDisabled, boolean divinerDisabled) {
        WitnessNetworkContext context = new WitnessNetworkContext(true, "http://localhost:1", null, "dev",
                Duration.ofSeconds(1), "http://localhost:2", "chaincheck", archivistDisabled,
                "http://localhost:3", divinerDisabled);
        WitnessRecordFactory factory = new WitnessRecordFactory(context, objectMapper, clock);
        return new ProofService(context, ledgerReader, directLedgerAdapter, archivistLedgerAdapter, divinerClient,
                factory, deliveryRepository, objectMapper, meterRegistry);
    }

    private WitnessRecord record(String hash, String previousHash) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("schema", WitnessRecordFactory.BOUND_WITNESS_SCHEMA);
        node.putArray("addresses").add(WITNESS);
        node.putArray("payload_hashes").add("d".repeat(64));
        node.putArray("previous_hashes").add(previousHash);
        node.putArray("$signatures").add("signature");
        node.put("nbf", 100);
        node.put("exp", 1100);
        node.put("_hash", hash);
        return WitnessRecord.fromJson(hash, node);
    }

    private static LocationProofPayload payload(UUID deliveryId) {
        return new LocationProofPayload("driver-7", deliveryId, 40.7128, -74.0060, 1_700_000_000_000L,
                null, null, null, null, null, Map.of());
    }

    // ==================== Proof creation ====================

    @Test
    public void createLocationProof_InMockMode_ShouldBeDeterministicAndSkipLedger() {
        ProofService proofService = proofService(true, true);
        UUID deliveryId = UUID.randomUUID();

        LocationProof first = proofService.createLocationProof(payload(deliveryId));
        LocationProof second = proofService.createLocationProof(payload(deliveryId));

        assertThat(first.mocked()).isTrue();
        assertThat(first.proofHash()).matches("[0-9a-f]{64}");
        assertThat(second.proofHash()).isEqualTo(first.proofHash());
        assertThat(first.rawWitnessRecord().path("_hash").asText()).isEqualTo(first.proofHash());
        assertThat(first.rawWitnessRecord().path("$signatures").size()).isEqualTo(1);

        LocationProof other = proofService.createLocationProof(payload(UUID.randomUUID()));
        assertThat(other.proofHash()).isNotEqualTo(first.proofHash());

        verifyNoInteractions(ledgerReader, directLedgerAdapter, archivistLedgerAdapter);
        assertThat(meterRegistry.counter("chaincheck.proofs.created", "mocked", "true").count()).isEqualTo(3.0);
    }

    // ==================== Verification ====================

    @Test
    public void verifyLocationProof_WhenOnLedger_ShouldReportLedgerSource() {
        ProofService proofService = proofService(true, true);
        when(ledgerReader.getWitnessRecord(HASH_A)).thenReturn(Optional.of(record(HASH_A, null)));

        ProofVerification verification = proofService.verifyLocationProof(HASH_A);

        assertThat(verification.valid()).isTrue();
        assertThat(verification.source()).isEqualTo("ledger");
        assertThat(verification.blockNumber()).isEqualTo(100L);
    }

    @Test
    public void verifyLocationProof_WhenArchivistDisabled_ShouldNeverCallArchivist() {
        ProofService proofService = proofService(true, true);
        when(ledgerReader.getWitnessRecord(HASH_A)).thenThrow(new LedgerUnavailableException("connection refused"));

        ProofVerification verification = proofService.verifyLocationProof(HASH_A);

        assertThat(verification.valid()).isFalse();
        assertThat(verification.source()).isNull();
        assertThat(verification.errors()).contains("Archivist is disabled and ledger query failed");
        verifyNoInteractions(archivistLedgerAdapter);
    }

    @Test
    public void verifyLocationProof_WhenLedgerUnavailable_ShouldFallBackToArchivist() {
        ProofService proofService = proofService(false, true);
        when(ledgerReader.getWitnessRecord(HASH_A)).thenThrow(new LedgerUnavailableException("timeout"));
        when(archivistLedgerAdapter.fetch(HASH_A)).thenReturn(Optional.of(record(HASH_A, null).raw()));

        ProofVerification verification = proofService.verifyLocationProof(HASH_A);

        assertThat(verification.valid()).isTrue();
        assertThat(verification.source()).isEqualTo("archivist");
    }

    @Test
    public void verifyLocationProof_WithMalformedHash_ShouldRejectInput() {
        ProofService proofService = proofService(true, true);

        assertThatThrownBy(() -> proofService.verifyLocationProof("not-a-hash"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> proofService.verifyLocationProof("0x" + "a".repeat(63)))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(ledgerReader);
    }

    @Test
    public void validateWitnessRecord_WhenArchivistDisabled_ShouldBeInvalid() {
        ProofService proofService = proofService(true, true);

        ProofValidationResult result = proofService.validateWitnessRecord(HASH_A);

        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).containsExactly("Archivist is disabled");
        verifyNoInteractions(archivistLedgerAdapter);
    }

    // ==================== Chain traversal ====================

    @Test
    public void getBoundWitnessChain_WithCycle_ShouldStopAtVisitedHash() {
        ProofService proofService = proofService(true, true);
        when(ledgerReader.getWitnessRecord(HASH_A)).thenReturn(Optional.of(record(HASH_A, HASH_B)));
        when(ledgerReader.getWitnessRecord(HASH_B)).thenReturn(Optional.of(record(HASH_B, HASH_A.toUpperCase())));

        List<String> chain = proofService.getBoundWitnessChain(HASH_A, 50, Optional.empty())
                .map(WitnessRecord::hash)
                .collect(Collectors.toList());

        assertThat(chain).containsExactly(HASH_A, HASH_B);
        assertThat(meterRegistry.counter(ProofService.NULL_LINKS_METRIC).count()).isZero();
    }

    @Test
    public void getBoundWitnessChain_WithPrefixedLinkBackToStart_ShouldStopAtVisitedHash() {
        ProofService proofService = proofService(true, true);
        when(ledgerReader.getWitnessRecord(HASH_A)).thenReturn(Optional.of(record(HASH_A, HASH_B)));
        when(ledgerReader.getWitnessRecord(HASH_B)).thenReturn(Optional.of(record(HASH_B, "0x" + HASH_A)));
        when(ledgerReader.getWitnessRecord("0x" + HASH_A)).thenReturn(Optional.of(record(HASH_A, HASH_B)));

        List<String> chain = proofService.getBoundWitnessChain(HASH_A, 50, Optional.empty())
                .map(WitnessRecord::hash)
                .collect(Collectors.toList());

        assertThat(chain).containsExactly(HASH_A, HASH_B);
        verify(ledgerReader, never()).getWitnessRecord("0x" + HASH_A);
    }

    @Test
    public void getBoundWitnessChain_WithNullLink_ShouldEndAndCountIt() {
        ProofService proofService = proofService(true, true);
        when(ledgerReader.getWitnessRecord(HASH_B)).thenReturn(Optional.of(record(HASH_B, HASH_C)));
        when(ledgerReader.getWitnessRecord(HASH_C)).thenReturn(Optional.of(record(HASH_C, null)));

        List<String> chain = proofService.getBoundWitnessChain(HASH_A, 10, Optional.of(record(HASH_A, HASH_B)))
                .map(WitnessRecord::hash)
                .collect(Collectors.toList());

        assertThat(chain).containsExactly(HASH_A, HASH_B, HASH_C);
        assertThat(meterRegistry.counter(ProofService.NULL_LINKS_METRIC).count()).isEqualTo(1.0);
        verify(ledgerReader, never()).getWitnessRecord(HASH_A);
    }

    @Test
    public void getBoundWitnessChain_WithMissingRecord_ShouldEndQuietly() {
        ProofService proofService = proofService(true, true);
        when(ledgerReader.getWitnessRecord(HASH_A)).thenReturn(Optional.of(record(HASH_A, HASH_B)));
        when(ledgerReader.getWitnessRecord(HASH_B)).thenReturn(Optional.empty());

        assertThat(proofService.getBoundWitnessChain(HASH_A, 10, Optional.empty()).count()).isEqualTo(1);
    }

    @Test
    public void getBoundWitnessChain_ShouldClampDepth() {
        ProofService proofService = proofService(true, true);
        when(ledgerReader.getWitnessRecord(HASH_A)).thenReturn(Optional.of(record(HASH_A, HASH_B)));
        when(ledgerReader.getWitnessRecord(HASH_B)).thenReturn(Optional.of(record(HASH_B, HASH_C)));

        assertThat(proofService.getBoundWitnessChain(HASH_A, 0, Optional.empty()).count()).isEqualTo(1);
        assertThat(proofService.getBoundWitnessChain(HASH_A, 2, Optional.empty()).count()).isEqualTo(2);
    }

    // ==================== Location corroboration ====================

    @Test
    public void queryLocationDiviner_WhenDisabled_ShouldReturnDeterministicMock() {
        ProofService proofService = proofService(true, true);

        DivinerResult first = proofService.queryLocationDiviner(40.7128, -74.0060, 1_700_000_000_000L);
        DivinerResult second = proofService.queryLocationDiviner(40.7128, -74.0060, 1_700_000_000_000L);

        assertThat(first.mocked()).isTrue();
        assertThat(first.source()).isEqualTo("mock");
        assertThat(first.consensus()).isEqualTo(1.0);
        assertThat(first.nodeCount()).isBetween(3, 7);
        assertThat(first.witnessNodes()).hasSize(first.nodeCount());
        assertThat(first.witnessNodes().get(0).type()).isEqualTo("bridge");
        assertThat(second).isEqualTo(first);
        verifyNoInteractions(divinerClient);
    }

    @Test
    public void queryLocationDiviner_WhenUnreachable_ShouldFallBackToMock() {
        ProofService proofService = proofService(true, false);
        when(divinerClient.queryLocation(anyDouble(), anyDouble(), anyLong()))
                .thenThrow(new LedgerUnavailableException("timeout"));

        DivinerResult result = proofService.queryLocationDiviner(1.0, 2.0, 3L);

        assertThat(result.mocked()).isTrue();
    }

    @Test
    public void verifyLocationWithDiviner_WhenDivinerMocked_ShouldCorroborateFromLedger() {
        ProofService proofService = proofService(true, true);
        ObjectNode witnessedPayload = objectMapper.createObjectNode();
        witnessedPayload.put("schema", WitnessRecordFactory.PAYLOAD_SCHEMA);
        witnessedPayload.putObject("data").put("latitude", 40.7128).put("longitude", -74.0060);
        WitnessRecord record = WitnessRecord.fromJson(HASH_A, record(HASH_A, null).raw(),
                List.<JsonNode>of(witnessedPayload));
        when(ledgerReader.getWitnessRecord(HASH_A)).thenReturn(Optional.of(record));

        DivinerResult result = proofService.verifyLocationWithDiviner(HASH_A, 40.7129, -74.0060, 1L);

        assertThat(result.mocked()).isFalse();
        assertThat(result.source()).isEqualTo("ledger");
        assertThat(result.confidence()).isEqualTo(70);
        assertThat(result.nodeCount()).isEqualTo(1);
        assertThat(result.locationMatch()).isTrue();
        assertThat(result.distanceFromClaimed()).isLessThan(100.0);
    }
}
