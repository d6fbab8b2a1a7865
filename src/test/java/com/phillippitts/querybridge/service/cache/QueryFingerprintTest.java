package com.phillippitts.querybridge.service.cache;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueryFingerprintTest {

    @Test
    void equivalentTextSharesKey() {
        assertThat(QueryFingerprint.of("  What   IS\tthe deadline? "))
                .isEqualTo(QueryFingerprint.of("what is the deadline?"));
    }

    @Test
    void differentTextGetsDifferentKey() {
        assertThat(QueryFingerprint.of("what is the deadline?"))
                .isNotEqualTo(QueryFingerprint.of("what is the fee?"));
    }

    @Test
    void keyIsPrefixedMd5Hex() {
        // md5("hello")
        assertThat(QueryFingerprint.of("Hello")).isEqualTo("chat:5d41402abc4b2a76b9719d911017c592");
    }

    @Test
    void normalizeCollapsesWhitespace() {
        assertThat(QueryFingerprint.normalize("\n A \r\n  b  ")).isEqualTo("a b");
    }

    @Test
    void rejectsNull() {
        assertThatThrownBy(() -> QueryFingerprint.of(null)).isInstanceOf(NullPointerException.class);
    }
}
