package com.chaincheck.ledger;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class WitnessRecordTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private WitnessRecord parse(String json) throws Exception {
        return WitnessRecord.fromJson("fallback", objectMapper.readTree(json));
    }

    @Test
    public void previousHashFor_ShouldFollowTheAddressIndex() throws Exception {
        WitnessRecord record = parse("""
                {"_hash":"h1","addresses":["AA","bb"],"previous_hashes":["p0","p1"],"$signatures":["s","s"]}
                """);

        assertThat(record.hash()).isEqualTo("h1");
        assertThat(record.previousHashFor("aa")).contains("p0");
        assertThat(record.previousHashFor("BB")).contains("p1");
        assertThat(record.previousHashFor("unknown")).contains("p0");
        assertThat(record.previousHash()).contains("p0");
    }

    @Test
    public void previousHash_WhenTerminal_ShouldBeEmpty() throws Exception {
        assertThat(parse("""
                {"addresses":["a"],"previous_hashes":[null]}
                """).previousHash()).isEmpty();
        assertThat(parse("""
                {"addresses":["a"],"previous_hashes":["0x0000000000000000000000000000000000000000000000000000000000000000"]}
                """).previousHash()).isEmpty();
        assertThat(parse("""
                {"addresses":["a"],"previous_hashes":[]}
                """).previousHash()).isEmpty();
        assertThat(parse("""
                {"addresses":["a"]}
                """).hash()).isEqualTo("fallback");
    }

    @Test
    public void committedBlockNumber_ShouldIgnoreBlockEqualToNbf() throws Exception {
        assertThat(parse("""
                {"nbf":10,"exp":1010,"blockNumber":10}
                """).committedBlockNumber()).isEmpty();
        assertThat(parse("""
                {"nbf":10,"exp":1010,"blockNumber":12}
                """).committedBlockNumber()).contains(12L);
    }

    @Test
    public void signaturesPresent_ShouldCoverEveryAddress() throws Exception {
        assertThat(parse("""
                {"addresses":["a","b"],"_signatures":["s1","s2"]}
                """).signaturesPresent()).isTrue();
        assertThat(parse("""
                {"addresses":["a","b"],"$signatures":["s1"]}
                """).signaturesPresent()).isFalse();
    }
}
