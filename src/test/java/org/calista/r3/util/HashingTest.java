package org.calista.r3.util;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class HashingTest {

    @Test
    void digest_shouldNotDependOnMapInsertionOrder() {
        Map<String, Object> a = new LinkedHashMap<>();
        a.put("alpha", 1);
        a.put("beta", "two");
        Map<String, Object> b = new LinkedHashMap<>();
        b.put("beta", "two");
        b.put("alpha", 1);

        assertThat(Hashing.canonicalJson(a)).isEqualTo("{\"alpha\":1,\"beta\":\"two\"}");
        assertThat(Hashing.digest(a)).isEqualTo(Hashing.digest(b));
    }

    @Test
    void sha256Hex_shouldMatchKnownVector() {
        assertThat(Hashing.sha256Hex("abc"))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
        assertThat(Hashing.sha256Hex(null)).isEqualTo(Hashing.sha256Hex(""));
    }

    @Test
    void box_shouldFrameTitleLinesAndSeparators() {
        String box = LogFmt.box("Title", b -> b.kv("k", 1).sep().line("tail"));

        assertThat(box).startsWith("┌").endsWith("┘");
        assertThat(box).contains("│ Title").contains("│ k: 1").contains("│ tail");
        assertThat(box.lines()).hasSize(7);
        assertThat(LogFmt.f3(0.12345)).isEqualTo("0.123");
    }
}
