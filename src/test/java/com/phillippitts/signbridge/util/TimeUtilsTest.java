package com.phillippitts.signbridge.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TimeUtilsTest {

    @Test
    void convertsNanosToMillisTruncating() {
        assertThat(TimeUtils.nanosToMillis(1_999_999L)).isEqualTo(1L);
        assertThat(TimeUtils.nanosToMillis(150_000_000L)).isEqualTo(150L);
    }

    @Test
    void convertsNanosToFractionalMicros() {
        assertThat(TimeUtils.nanosToMicros(1_500L)).isCloseTo(1.5, within(1e-9));
    }

    @Test
    void elapsedMillisIsNonNegative() throws InterruptedException {
        long start = System.nanoTime();
        Thread.sleep(5);
        assertThat(TimeUtils.elapsedMillis(start)).isGreaterThanOrEqualTo(4L);
    }
}
