package com.phillippitts.querybridge.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TimeUtilsTest {

    @Test
    void convertsNanosToMillis() {
        assertThat(TimeUtils.nanosToMillis(1_500_000L)).isEqualTo(1L);
        assertThat(TimeUtils.nanosToMillis(0L)).isZero();
    }

    @Test
    void elapsedMillisIsNonNegative() {
        assertThat(TimeUtils.elapsedMillis(System.nanoTime())).isGreaterThanOrEqualTo(0L);
    }

    @Test
    void backoffDoublesPerAttempt() {
        assertThat(TimeUtils.exponentialBackoff(1, 1000, 5000)).isEqualTo(1000);
        assertThat(TimeUtils.exponentialBackoff(2, 1000, 5000)).isEqualTo(2000);
        assertThat(TimeUtils.exponentialBackoff(3, 1000, 5000)).isEqualTo(4000);
    }

    @Test
    void backoffIsCappedAtMax() {
        assertThat(TimeUtils.exponentialBackoff(4, 1000, 5000)).isEqualTo(5000);
        assertThat(TimeUtils.exponentialBackoff(60, 1000, 5000)).isEqualTo(5000);
        assertThat(TimeUtils.exponentialBackoff(60, 2000, Long.MAX_VALUE)).isPositive();
    }

    @Test
    void backoffIsZeroForInvalidInput() {
        assertThat(TimeUtils.exponentialBackoff(0, 1000, 5000)).isZero();
        assertThat(TimeUtils.exponentialBackoff(1, 0, 5000)).isZero();
    }
}
