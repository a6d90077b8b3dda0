package com.phillippitts.sodam.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TimeUtilsTest {

    @Test
    void elapsedMillisIsNonNegative() {
        long start = System.nanoTime();
        assertThat(TimeUtils.elapsedMillis(start)).isGreaterThanOrEqualTo(0L);
    }

    @Test
    void sleepQuietlyRestoresInterruptFlag() {
        Thread.currentThread().interrupt();
        try {
            assertThat(TimeUtils.sleepQuietly(50)).isFalse();
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
        assertThat(TimeUtils.sleepQuietly(1)).isTrue();
    }
}
