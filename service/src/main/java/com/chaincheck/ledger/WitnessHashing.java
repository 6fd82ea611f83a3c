package com.chaincheck.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Content hashing of witness records and payloads.
 *
 * <p>The hash is SHA-256 over the JSON with object keys sorted. Top-level meta fields
 * (names starting with {@code _} or {@code $}) are excluded.
 */
public final class WitnessHashing {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private WitnessHashing() {
    }

    /**
     * @return 64-character lowercase hex digest
     */
    public static String hash(JsonNode node) {
        return sha256Hex(canonicalJson(node));
    }

    public static String sha256Hex(String value) {
        return Numeric.toHexStringNoPrefix(Hash.sha256(value.getBytes(StandardCharsets.UTF_8)));
    }

    static String canonicalJson(JsonNode node) {
        JsonNode canonical = canonicalize(node, true);
        try {
            return MAPPER.writeValueAsString(canonical);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize witness JSON", e);
        }
    }

    private static JsonNode canonicalize(JsonNode node, boolean topLevel) {
        if (node.isObject()) {
            List<String> names = new ArrayList<>();
            node.fieldNames().forEachRemaining(names::add);
            Collections.sort(names);

            ObjectNode sorted = JsonNodeFactory.instance.objectNode();
            for (String name : names) {
                if (topLevel && (name.startsWith("_") || name.startsWith("$"))) {
                    continue;
                }
                sorted.set(name, canonicalize(node.get(name), false));
            }
            return sorted;
        }
        if (node.isArray()) {
            ArrayNode array = JsonNodeFactory.instance.arrayNode();
            node.forEach(element -> array.add(canonicalize(element, false)));
            return array;
        }
        return node;
    }
}
