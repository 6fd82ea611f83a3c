package com.chaincheck.ledger;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds bound-witness records for location proofs.
 *
 * <p>A record witnesses one {@code network.xyo.chaincheck} payload and links to the
 * driver's previous proof through {@code previous_hashes}. It is valid for
 * {@value #VALIDITY_BLOCKS} blocks after {@code nbf}.
 */
@Component
@RequiredArgsConstructor
public class WitnessRecordFactory {

    public static final String BOUND_WITNESS_SCHEMA = "network.xyo.boundwitness";
    public static final String PAYLOAD_SCHEMA = "network.xyo.chaincheck";

    static final long VALIDITY_BLOCKS = 1000;
    static final String MOCK_ADDRESS = "mock_address";
    static final String MOCK_SIGNATURE = "mock_signature";

    private final WitnessNetworkContext context;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Builds a record signed with the witness wallet.
     *
     * @throws IllegalStateException when no witness wallet is configured
     */
    public WitnessSubmission build(LocationProofPayload proofPayload, Optional<String> previousHash, long nbf) {
        Credentials credentials = context.witnessCredentials();
        if (credentials == null) {
            throw new IllegalStateException("No witness wallet configured");
        }

        ObjectNode payload = payload(proofPayload);
        ObjectNode boundWitness = boundWitness(context.witnessAddress(), WitnessHashing.hash(payload),
                previousHash, nbf);
        String hash = WitnessHashing.hash(boundWitness);
        boundWitness.putArray("$signatures").add(sign(hash, credentials));
        boundWitness.put("_hash", hash);

        return new WitnessSubmission(hash, boundWitness, List.of(payload), nbf);
    }

    /**
     * Builds a record of the same shape without a ledger. The hash is derived from the
     * delivery id, timestamp and coordinates, so the same input yields the same proof.
     */
    public WitnessSubmission buildMock(LocationProofPayload proofPayload, Optional<String> previousHash) {
        String hash = mockProofHash(proofPayload);
        long nbf = Instant.now(clock).getEpochSecond() % 1_000_000;

        ObjectNode boundWitness = boundWitness(MOCK_ADDRESS, hash, previousHash, nbf);
        boundWitness.putArray("$signatures").add(MOCK_SIGNATURE);
        boundWitness.put("_hash", hash);

        return new WitnessSubmission(hash, boundWitness, List.of(payload(proofPayload)), nbf);
    }

    public String mockProofHash(LocationProofPayload proofPayload) {
        ObjectNode seed = objectMapper.createObjectNode();
        seed.put("deliveryId", proofPayload.deliveryId().toString());
        seed.put("timestamp", proofPayload.timestamp());
        seed.put("latitude", proofPayload.latitude());
        seed.put("longitude", proofPayload.longitude());
        return WitnessHashing.sha256Hex(seed.toString());
    }

    ObjectNode payload(LocationProofPayload proofPayload) {
        ObjectNode data = objectMapper.createObjectNode();
        data.put("deliveryId", proofPayload.deliveryId().toString());
        data.put("driverId", proofPayload.driverId());
        data.put("latitude", proofPayload.latitude());
        data.put("longitude", proofPayload.longitude());
        data.put("timestamp", proofPayload.timestamp());
        if (proofPayload.altitude() != null) {
            data.put("altitude", proofPayload.altitude());
        }
        if (proofPayload.barometricPressure() != null) {
            data.put("barometricPressure", proofPayload.barometricPressure());
        }
        if (proofPayload.accelerometer() != null) {
            ObjectNode accelerometer = data.putObject("accelerometer");
            accelerometer.put("x", proofPayload.accelerometer().x());
            accelerometer.put("y", proofPayload.accelerometer().y());
            accelerometer.put("z", proofPayload.accelerometer().z());
        }
        if (proofPayload.photoHash() != null) {
            data.put("photoHash", proofPayload.photoHash());
        }
        if (proofPayload.signatureHash() != null) {
            data.put("signatureHash", proofPayload.signatureHash());
        }
        if (proofPayload.metadata() != null && !proofPayload.metadata().isEmpty()) {
            ObjectNode metadata = data.putObject("metadata");
            for (Map.Entry<String, String> entry : proofPayload.metadata().entrySet()) {
                metadata.put(entry.getKey(), entry.getValue());
            }
        }

        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("schema", PAYLOAD_SCHEMA);
        payload.set("data", data);
        return payload;
    }

    private ObjectNode boundWitness(String address, String payloadHash, Optional<String> previousHash, long nbf) {
        ObjectNode boundWitness = objectMapper.createObjectNode();
        boundWitness.put("schema", BOUND_WITNESS_SCHEMA);
        boundWitness.putArray("addresses").add(address);
        boundWitness.putArray("payload_hashes").add(payloadHash);
        boundWitness.putArray("payload_schemas").add(PAYLOAD_SCHEMA);
        boundWitness.putArray("previous_hashes").add(previousHash.orElse(null));
        boundWitness.put("nbf", nbf);
        boundWitness.put("exp", nbf + VALIDITY_BLOCKS);
        return boundWitness;
    }

    private static String sign(String hash, Credentials credentials) {
        Sign.SignatureData signature = Sign.signMessage(
                Numeric.hexStringToByteArray(hash), credentials.getEcKeyPair(), false);
        byte[] compact = new byte[64];
        System.arraycopy(signature.getR(), 0, compact, 0, 32);
        System.arraycopy(signature.getS(), 0, compact, 32, 32);
        return Numeric.toHexStringNoPrefix(compact);
    }
}
