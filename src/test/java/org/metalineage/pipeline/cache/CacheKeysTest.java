package org.metalineage.pipeline.cache;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.List;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class CacheKeysTest {

    @Test
    void keyIgnoresOrderAndDuplicates() {
        String key = CacheKeys.stableHash(List.of("GCF_2.1", "GCF_1.1", "GCF_3.1"));

        assertThat(CacheKeys.stableHash(List.of("GCF_3.1", "GCF_1.1", "GCF_2.1", "GCF_1.1"))).isEqualTo(key);
        assertThat(CacheKeys.isCacheKey(key)).isTrue();
    }

    @Test
    void differentSetsGiveDifferentKeys() {
        assertThat(CacheKeys.stableHash(List.of("A", "B")))
                .isNotEqualTo(CacheKeys.stableHash(List.of("A", "B", "C")))
                .isNotEqualTo(CacheKeys.stableHash(List.of("AB")));
    }

    @Test
    void keyIsSha256OfNewlineJoinedSortedIds() throws Exception {
        MessageDigest digest = MessageDigest.getInstance("SHA-256");
        String expected = HexFormat.of().formatHex(digest.digest("A\nB".getBytes(StandardCharsets.UTF_8)));

        assertThat(CacheKeys.stableHash(List.of("B", "A"))).isEqualTo(expected);
        assertThat(CacheKeys.sorted(List.of("b", "a", "b"))).containsExactly("a", "b");
    }

    @Test
    void recognisesOnlyLowercaseHexOfFullLength() {
        assertThat(CacheKeys.isCacheKey("abc")).isFalse();
        assertThat(CacheKeys.isCacheKey("A".repeat(64))).isFalse();
        assertThat(CacheKeys.isCacheKey("0f".repeat(32))).isTrue();
        assertThat(CacheKeys.isCacheKey("." + "0f".repeat(32) + ".tmp")).isFalse();
    }
}
