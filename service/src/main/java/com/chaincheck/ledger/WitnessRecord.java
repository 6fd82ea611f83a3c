package com.chaincheck.ledger;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Bound-witness record held by the proof ledger.
 *
 * <p>{@code previousHashes} is indexed by address: entry {@code i} links the record to the
 * previous record signed by {@code addresses[i]}. Entries may be null.
 *
 * @param hash           Record hash ({@code _hash})
 * @param schema         Record schema
 * @param addresses      Witness addresses
 * @param payloadHashes  Hashes of witnessed payloads
 * @param payloadSchemas Schemas of witnessed payloads
 * @param previousHashes Previous record hash per address
 * @param signatures     Signatures per address ({@code $signatures})
 * @param nbf            Not-before block
 * @param exp            Expiry block
 * @param blockNumber    Block the record was committed in, when reported
 * @param payloads       Payloads returned alongside the record (may be empty)
 * @param raw            Raw record JSON
 */
public record WitnessRecord(
        String hash,
        String schema,
        List<String> addresses,
        List<String> payloadHashes,
        List<String> payloadSchemas,
        List<String> previousHashes,
        List<String> signatures,
        Long nbf,
        Long exp,
        Long blockNumber,
        List<JsonNode> payloads,
        JsonNode raw
) {

    private static final Pattern ZERO_HASH = Pattern.compile("^(0x)?0+$");

    public static WitnessRecord fromJson(String fallbackHash, JsonNode node) {
        return fromJson(fallbackHash, node, List.of());
    }

    public static WitnessRecord fromJson(String fallbackHash, JsonNode node, List<JsonNode> payloads) {
        String hash = text(node, "_hash");
        if (hash == null) {
            hash = text(node, "hash");
        }
        List<String> signatures = node.has("$signatures")
                ? textList(node.get("$signatures"))
                : textList(node.get("_signatures"));

        return new WitnessRecord(
                hash != null ? hash : fallbackHash,
                text(node, "schema"),
                textList(node.get("addresses")),
                textList(node.get("payload_hashes")),
                textList(node.get("payload_schemas")),
                textList(node.get("previous_hashes")),
                signatures,
                number(node, "nbf"),
                number(node, "exp"),
                number(node, "blockNumber"),
                List.copyOf(payloads),
                node
        );
    }

    /**
     * Previous record of the first address.
     */
    public Optional<String> previousHash() {
        return previousHashFor(null);
    }

    /**
     * Previous record of the given address. Unknown addresses fall back to the first one.
     * A null, empty or all-zero link means the chain starts here.
     */
    public Optional<String> previousHashFor(String address) {
        int index = addressIndex(address);
        if (index >= previousHashes.size()) {
            return Optional.empty();
        }
        String link = previousHashes.get(index);
        return isTerminalLink(link) ? Optional.empty() : Optional.of(link);
    }

    /**
     * Index of an address in this record, case-insensitive; 0 when absent.
     */
    public int addressIndex(String address) {
        if (address == null) {
            return 0;
        }
        for (int i = 0; i < addresses.size(); i++) {
            if (address.equalsIgnoreCase(addresses.get(i))) {
                return i;
            }
        }
        return 0;
    }

    /**
     * Address at the given index, or null when the record has no addresses.
     */
    public String addressAt(int index) {
        return index < addresses.size() ? addresses.get(index) : null;
    }

    /**
     * Block number the record was actually committed in. {@code nbf} alone is only
     * the lower bound, so a block number equal to it does not count.
     */
    public Optional<Long> committedBlockNumber() {
        if (blockNumber != null && !blockNumber.equals(nbf)) {
            return Optional.of(blockNumber);
        }
        return Optional.empty();
    }

    public boolean signaturesPresent() {
        return !signatures.isEmpty() && signatures.size() >= addresses.size();
    }

    public static boolean isTerminalLink(String link) {
        return link == null || link.isBlank() || ZERO_HASH.matcher(link).matches();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static Long number(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isNumber() ? value.asLong() : null;
    }

    private static List<String> textList(JsonNode array) {
        if (array == null || !array.isArray()) {
            return List.of();
        }
        List<String> values = new ArrayList<>(array.size());
        array.forEach(element -> values.add(element.isNull() ? null : element.asText()));
        return Collections.unmodifiableList(values);
    }
}
