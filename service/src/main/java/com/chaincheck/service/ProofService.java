package com.chaincheck.service;

import com.chaincheck.error.LedgerUnavailableException;
import com.chaincheck.ledger.ArchivistLedgerAdapter;
import com.chaincheck.ledger.ChainReader;
import com.chaincheck.ledger.DirectLedgerAdapter;
import com.chaincheck.ledger.DivinerClient;
import com.chaincheck.ledger.DivinerResult;
import com.chaincheck.ledger.LedgerInsertResult;
import com.chaincheck.ledger.LocationProof;
import com.chaincheck.ledger.LocationProofPayload;
import com.chaincheck.ledger.ProofValidationResult;
import com.chaincheck.ledger.ProofVerification;
import com.chaincheck.ledger.WitnessHashing;
import com.chaincheck.ledger.WitnessNetworkContext;
import com.chaincheck.ledger.WitnessNode;
import com.chaincheck.ledger.WitnessRecord;
import com.chaincheck.ledger.WitnessRecordFactory;
import com.chaincheck.ledger.WitnessSubmission;
import com.chaincheck.model.Delivery;
import com.chaincheck.repository.DeliveryRepository;
import com.chaincheck.util.GeoDistance;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.web3j.utils.Numeric;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.UUID;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Location proofs: creation, verification, chain traversal and location corroboration.
 *
 * <p>Lookup priority for witness records:
 * <ol>
 *   <li>Witness ledger (direct)</li>
 *   <li>Archival index, unless disabled</li>
 * </ol>
 *
 * <p>Lookups never throw for a missing record or an unreachable source; they report
 * the failure in the result instead.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProofService {

    public static final int MAX_CHAIN_DEPTH = 100;

    static final double LOCATION_MATCH_METERS = 100;
    static final String NULL_LINKS_METRIC = "chaincheck.witness.chain.null_links";

    private static final Pattern PROOF_HASH = Pattern.compile("^(0x)?[0-9a-fA-F]{64}$");

    private final WitnessNetworkContext networkContext;
    private final ChainReader ledgerReader;
    private final DirectLedgerAdapter directLedgerAdapter;
    private final ArchivistLedgerAdapter archivistLedgerAdapter;
    private final DivinerClient divinerClient;
    private final WitnessRecordFactory witnessRecordFactory;
    private final DeliveryRepository deliveryRepository;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    // ==================== Proof creation ====================

    /**
     * Creates a location proof for a delivery.
     *
     * <p>The witness record links to the driver's previous proof when one is known.
     * With a witness wallet the record is signed and broadcast to the ledger, then copied
     * to the archival index (best-effort). Without one, or in mock mode, a deterministic
     * record of the same shape is synthesized locally.
     *
     * @param payload Location and sensor data
     * @return Created proof
     * @throws LedgerUnavailableException if the witness ledger cannot be reached
     */
    public LocationProof createLocationProof(LocationProofPayload payload) {
        Optional<String> previousHash = previousProofHash(payload.driverId(), payload.deliveryId());

        if (networkContext.proofsMocked()) {
            WitnessSubmission submission = witnessRecordFactory.buildMock(payload, previousHash);
            log.info("Mock location proof for delivery {}: hash={}", payload.deliveryId(), submission.hash());
            meterRegistry.counter("chaincheck.proofs.created", "mocked", "true").increment();
            return new LocationProof(submission.hash(), submission.nbf(), submission.boundWitness(), true, null);
        }

        long nbf = ledgerReader.getCurrentBlockNumber()
                .orElseThrow(() -> new LedgerUnavailableException("Witness ledger did not report a current block"));
        WitnessSubmission submission = witnessRecordFactory.build(payload, previousHash, nbf);
        LedgerInsertResult inserted = directLedgerAdapter.insert(submission);

        String archivalHash = null;
        if (!networkContext.archivistDisabled()) {
            try {
                archivalHash = archivistLedgerAdapter.insert(submission).hash();
            } catch (LedgerUnavailableException e) {
                log.warn("Archival copy of proof {} failed: {}", inserted.hash(), e.getMessage());
            }
        }

        log.info("Location proof for delivery {} on ledger: hash={}, nbf={}",
                payload.deliveryId(), inserted.hash(), inserted.blockNumber());
        meterRegistry.counter("chaincheck.proofs.created", "mocked", "false").increment();
        return new LocationProof(inserted.hash(), inserted.blockNumber(), submission.boundWitness(), false,
                archivalHash);
    }

    // ==================== Verification ====================

    /**
     * Looks a proof up on the ledger, then in the archival index.
     *
     * @param proofHash 64 hex characters, optionally 0x-prefixed
     * @return Verification result; {@code valid=false} with errors when no source has it
     * @throws IllegalArgumentException if the hash is malformed
     */
    public ProofVerification verifyLocationProof(String proofHash) {
        requireProofHash(proofHash);
        List<String> errors = new ArrayList<>();

        try {
            Optional<WitnessRecord> record = ledgerReader.getWitnessRecord(proofHash);
            if (record.isPresent()) {
                return ProofVerification.found(proofHash, "ledger", record.get());
            }
            errors.add("Proof not found on ledger");
        } catch (LedgerUnavailableException e) {
            log.warn("Ledger lookup of proof {} failed: {}", proofHash, e.getMessage());
            errors.add("Ledger query failed: " + e.getMessage());
        }

        if (networkContext.archivistDisabled()) {
            errors.add("Archivist is disabled and ledger query failed");
            return ProofVerification.notFound(proofHash, errors);
        }

        try {
            Optional<JsonNode> archived = archivistLedgerAdapter.fetch(proofHash);
            if (archived.isPresent()) {
                return ProofVerification.found(proofHash, "archivist", WitnessRecord.fromJson(proofHash, archived.get()));
            }
            errors.add("Proof not found in archivist");
        } catch (LedgerUnavailableException e) {
            log.warn("Archivist lookup of proof {} failed: {}", proofHash, e.getMessage());
            errors.add("Archivist query failed: " + e.getMessage());
        }
        return ProofVerification.notFound(proofHash, errors);
    }

    /**
     * Structural validation of a witness record held by the archival index.
     */
    public ProofValidationResult validateWitnessRecord(String proofHash) {
        requireProofHash(proofHash);
        if (networkContext.archivistDisabled()) {
            return ProofValidationResult.invalid("Archivist is disabled");
        }
        try {
            return archivistLedgerAdapter.validate(proofHash);
        } catch (LedgerUnavailableException e) {
            log.warn("Archivist validation of proof {} failed: {}", proofHash, e.getMessage());
            return ProofValidationResult.invalid("Archivist query failed: " + e.getMessage());
        }
    }

    /**
     * Block the witness transaction was committed in.
     *
     * @throws LedgerUnavailableException if the witness ledger cannot be reached
     */
    public Optional<Long> getActualBlockNumber(String transactionHash) {
        return ledgerReader.getTransactionBlockNumber(transactionHash);
    }

    // ==================== Chain traversal ====================

    /**
     * Walks the witness chain backwards from a proof, seeded with the record stored on
     * the delivery that owns the proof (if any).
     */
    public Stream<WitnessRecord> getBoundWitnessChain(String startHash, int maxDepth) {
        requireProofHash(startHash);
        return getBoundWitnessChain(startHash, maxDepth, storedWitnessRecord(startHash));
    }

    /**
     * Walks the witness chain backwards from {@code startHash}.
     *
     * <p>The stream is lazy and finite: it ends at a missing record, a null or all-zero
     * link, a hash already visited, or after {@code maxDepth} records (clamped to
     * 1..{@value #MAX_CHAIN_DEPTH}). Links are followed for the address that signed the
     * first record.
     *
     * @param seed Record to use for {@code startHash} instead of looking it up
     */
    public Stream<WitnessRecord> getBoundWitnessChain(String startHash, int maxDepth, Optional<WitnessRecord> seed) {
        int depth = Math.max(1, Math.min(maxDepth, MAX_CHAIN_DEPTH));
        Iterator<WitnessRecord> iterator = new WitnessChainIterator(startHash, depth, seed);
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    // ==================== Location corroboration ====================

    /**
     * Queries the diviner for witnesses of a location. Falls back to a deterministic mock
     * when the diviner is disabled, unreachable or has no observations.
     */
    public DivinerResult queryLocationDiviner(double latitude, double longitude, long timestamp) {
        if (networkContext.divinerDisabled()) {
            return mockDivinerResult(latitude, longitude, timestamp);
        }

        try {
            Optional<DivinerResult> result = divinerClient.queryLocation(latitude, longitude, timestamp);
            if (result.isPresent()) {
                return result.get();
            }
            log.info("Diviner has no observations near ({}, {}); using mock result", latitude, longitude);
        } catch (LedgerUnavailableException e) {
            log.warn("Diviner query failed, using mock result: {}", e.getMessage());
        }
        return mockDivinerResult(latitude, longitude, timestamp);
    }

    /**
     * Corroborates a proof's location. When the diviner only yields a mock, the witness
     * record on the ledger is used instead: more signing witnesses mean higher confidence.
     */
    public DivinerResult verifyLocationWithDiviner(String proofHash, double latitude, double longitude,
                                                   long timestamp) {
        DivinerResult diviner = queryLocationDiviner(latitude, longitude, timestamp);
        if (!diviner.mocked()) {
            return diviner;
        }

        ProofVerification verification = verifyLocationProof(proofHash);
        if (!verification.valid() || !"ledger".equals(verification.source())) {
            return diviner;
        }
        return ledgerCorroboration(verification.record(), latitude, longitude);
    }

    DivinerResult ledgerCorroboration(WitnessRecord record, double latitude, double longitude) {
        int nodeCount = record.addresses().size();
        boolean signaturesValid = record.signaturesPresent();

        int confidence;
        if (nodeCount >= 5 && signaturesValid) {
            confidence = 95;
        } else if (nodeCount >= 3) {
            confidence = 85;
        } else if (nodeCount >= 2) {
            confidence = 75;
        } else if (nodeCount >= 1) {
            confidence = 70;
        } else {
            confidence = 50;
        }

        List<WitnessNode> witnessNodes = new ArrayList<>(nodeCount);
        for (int i = 0; i < nodeCount; i++) {
            witnessNodes.add(new WitnessNode(record.addresses().get(i), i == 0 ? "bridge" : "sentinel",
                    signaturesValid));
        }

        Double distance = witnessedLocation(record)
                .map(point -> GeoDistance.haversineMeters(point[0], point[1], latitude, longitude))
                .orElse(null);

        return new DivinerResult(
                signaturesValid && nodeCount > 0,
                confidence,
                nodeCount,
                DivinerResult.consensusLevel(confidence),
                signaturesValid ? 1.0 : 0.0,
                distance != null && distance < LOCATION_MATCH_METERS,
                distance,
                false,
                "ledger",
                List.copyOf(witnessNodes));
    }

    DivinerResult mockDivinerResult(double latitude, double longitude, long timestamp) {
        String seed = latitude + "," + longitude + "," + timestamp;
        String digest = WitnessHashing.sha256Hex(seed);
        int nodeCount = 3 + Integer.parseInt(digest.substring(0, 2), 16) % 5;

        int confidence;
        if (nodeCount >= 6) {
            confidence = 95;
        } else if (nodeCount >= 4) {
            confidence = 85;
        } else {
            confidence = 75;
        }

        List<WitnessNode> witnessNodes = new ArrayList<>(nodeCount);
        for (int i = 0; i < nodeCount; i++) {
            String address = WitnessHashing.sha256Hex(seed + ":" + i).substring(0, 40);
            witnessNodes.add(new WitnessNode(address, i == 0 ? "bridge" : "sentinel", true));
        }

        return new DivinerResult(true, confidence, nodeCount, DivinerResult.consensusLevel(confidence), 1.0,
                true, 0.0, true, "mock", List.copyOf(witnessNodes));
    }

    // ==================== Internals ====================

    private Optional<String> previousProofHash(String driverId, UUID deliveryId) {
        try {
            return deliveryRepository
                    .findFirstByDriverIdAndProofHashIsNotNullAndIdNotOrderByVerifiedAtDesc(driverId, deliveryId)
                    .map(Delivery::getProofHash);
        } catch (RuntimeException e) {
            log.warn("Could not look up previous proof of driver {}: {}", driverId, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<WitnessRecord> storedWitnessRecord(String proofHash) {
        return deliveryRepository.findByProofHash(proofHash)
                .filter(delivery -> delivery.getWitnessRecord() != null)
                .flatMap(delivery -> {
                    try {
                        return Optional.of(WitnessRecord.fromJson(proofHash,
                                objectMapper.readTree(delivery.getWitnessRecord())));
                    } catch (JsonProcessingException e) {
                        log.warn("Stored witness record of delivery {} is not valid JSON: {}",
                                delivery.getId(), e.getMessage());
                        return Optional.empty();
                    }
                });
    }

    private Optional<WitnessRecord> resolve(String hash) {
        try {
            Optional<WitnessRecord> record = ledgerReader.getWitnessRecord(hash);
            if (record.isPresent()) {
                return record;
            }
        } catch (LedgerUnavailableException e) {
            log.warn("Ledger lookup of {} failed while walking witness chain: {}", hash, e.getMessage());
        }

        if (networkContext.archivistDisabled()) {
            return Optional.empty();
        }
        try {
            return archivistLedgerAdapter.fetch(hash).map(node -> WitnessRecord.fromJson(hash, node));
        } catch (LedgerUnavailableException e) {
            log.warn("Archivist lookup of {} failed while walking witness chain: {}", hash, e.getMessage());
            return Optional.empty();
        }
    }

    private static Optional<double[]> witnessedLocation(WitnessRecord record) {
        for (JsonNode payload : record.payloads()) {
            if (WitnessRecordFactory.PAYLOAD_SCHEMA.equals(payload.path("schema").asText())) {
                JsonNode data = payload.path("data");
                if (data.path("latitude").isNumber() && data.path("longitude").isNumber()) {
                    return Optional.of(new double[]{data.path("latitude").asDouble(), data.path("longitude").asDouble()});
                }
            }
        }
        return Optional.empty();
    }

    private static void requireProofHash(String proofHash) {
        if (proofHash == null || !PROOF_HASH.matcher(proofHash).matches()) {
            throw new IllegalArgumentException("Invalid proof hash: " + proofHash);
        }
    }

    private static String visitKey(String hash) {
        return Numeric.cleanHexPrefix(hash).toLowerCase(Locale.ROOT);
    }

    private class WitnessChainIterator implements Iterator<WitnessRecord> {

        private final int maxDepth;
        private final Set<String> visited = new HashSet<>();
        private Optional<WitnessRecord> seed;
        private String nextHash;
        private String address;
        private WitnessRecord next;
        private int emitted;

        WitnessChainIterator(String startHash, int maxDepth, Optional<WitnessRecord> seed) {
            this.nextHash = startHash;
            this.maxDepth = maxDepth;
            this.seed = seed;
        }

        @Override
        public boolean hasNext() {
            if (next == null) {
                next = advance();
            }
            return next != null;
        }

        @Override
        public WitnessRecord next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            WitnessRecord current = next;
            next = null;
            return current;
        }

        private WitnessRecord advance() {
            if (nextHash == null || emitted >= maxDepth) {
                return null;
            }
            if (!visited.add(visitKey(nextHash))) {
                log.warn("Witness chain cycle detected at {}", nextHash);
                nextHash = null;
                return null;
            }

            Optional<WitnessRecord> record = seed.isPresent() ? seed : resolve(nextHash);
            seed = Optional.empty();
            if (record.isEmpty()) {
                log.debug("Witness chain ends at missing record {}", nextHash);
                nextHash = null;
                return null;
            }

            WitnessRecord current = record.get();
            if (address == null) {
                address = current.addressAt(0);
            }
            Optional<String> previous = current.previousHashFor(address);
            if (previous.isEmpty()) {
                meterRegistry.counter(NULL_LINKS_METRIC).increment();
            }
            nextHash = previous.orElse(null);
            emitted++;
            return current;
        }
    }
}
