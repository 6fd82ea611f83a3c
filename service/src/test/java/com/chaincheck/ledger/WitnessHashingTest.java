package com.chaincheck.ledger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class WitnessHashingTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    public void sha256Hex_ShouldMatchKnownDigest() {
        assertThat(WitnessHashing.sha256Hex("abc"))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }

    @Test
    public void hash_ShouldIgnoreKeyOrder() throws Exception {
        JsonNode first = objectMapper.readTree("""
                {"schema":"network.xyo.chaincheck","data":{"latitude":1.5,"longitude":2.5}}
                """);
        JsonNode second = objectMapper.readTree("""
                {"data":{"longitude":2.5,"latitude":1.5},"schema":"network.xyo.chaincheck"}
                """);

        assertThat(WitnessHashing.hash(first)).isEqualTo(WitnessHashing.hash(second));
        assertThat(WitnessHashing.hash(first)).matches("[0-9a-f]{64}");
    }

    @Test
    public void hash_ShouldExcludeTopLevelMetaFieldsOnly() throws Exception {
        JsonNode plain = objectMapper.readTree("""
                {"schema":"s","data":{"_note":"kept"}}
                """);
        JsonNode withMeta = objectMapper.readTree("""
                {"schema":"s","data":{"_note":"kept"},"_hash":"abc","$signatures":["sig"]}
                """);
        JsonNode nestedChanged = objectMapper.readTree("""
                {"schema":"s","data":{"_note":"changed"}}
                """);

        assertThat(WitnessHashing.hash(withMeta)).isEqualTo(WitnessHashing.hash(plain));
        assertThat(WitnessHashing.hash(nestedChanged)).isNotEqualTo(WitnessHashing.hash(plain));
        assertThat(WitnessHashing.canonicalJson(withMeta)).isEqualTo("{\"data\":{\"_note\":\"kept\"},\"schema\":\"s\"}");
    }
}
