package com.infrasentinel.core.stats;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link RollingWindow}.
 */
class RollingWindowTest {

    @Test
    @DisplayName("Should reject a non-positive capacity")
    void shouldRejectNonPositiveCapacity() {
        assertThatThrownBy(() -> new RollingWindow(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("capacity");
    }

    @Test
    @DisplayName("Should report nothing while empty")
    void shouldReportNothingWhileEmpty() {
        RollingWindow window = new RollingWindow(3);

        assertThat(window.size()).isZero();
        assertThat(window.mean()).isEmpty();
        assertThat(window.std()).isEmpty();
        assertThat(window.latest()).isEmpty();
        assertThat(window.previous()).isEmpty();
    }

    @Test
    @DisplayName("Should have a mean but no spread or previous value after one push")
    void shouldWarmUpAfterOnePush() {
        RollingWindow window = new RollingWindow(3);
        window.push(42.0);

        assertThat(window.mean()).contains(42.0);
        assertThat(window.latest()).contains(42.0);
        assertThat(window.std()).isEmpty();
        assertThat(window.previous()).isEmpty();
    }

    @Test
    @DisplayName("Should evict the oldest value once full")
    void shouldEvictOldest() {
        RollingWindow window = new RollingWindow(3);
        for (double v : new double[] {1, 2, 3, 4, 5}) {
            window.push(v);
        }

        assertThat(window.size()).isEqualTo(3);
        assertThat(window.toArray()).containsExactly(3.0, 4.0, 5.0);
        assertThat(window.latest()).contains(5.0);
        assertThat(window.previous()).contains(4.0);
        assertThat(window.mean()).contains(4.0);
        assertThat(window.std().orElseThrow()).isCloseTo(1.0, within(1e-12));
    }

    @Test
    @DisplayName("Should compute the sample standard deviation")
    void shouldComputeSampleStd() {
        RollingWindow window = new RollingWindow(10);
        window.push(40);
        window.push(50);
        window.push(60);

        assertThat(window.mean()).contains(50.0);
        assertThat(window.std()).contains(10.0);
    }

    @Test
    @DisplayName("Should never hold more values than its capacity")
    void shouldStayWithinCapacity() {
        RollingWindow window = new RollingWindow(7);
        Random random = new Random(42);
        for (int i = 0; i < 500; i++) {
            window.push(random.nextGaussian() * 100);
            assertThat(window.size()).isLessThanOrEqualTo(7);
        }
        assertThat(window.size()).isEqualTo(7);
    }

    @Test
    @DisplayName("Should match a direct computation over a long stream")
    void shouldMatchDirectComputation() {
        RollingWindow window = new RollingWindow(20);
        Random random = new Random(7);
        for (int i = 0; i < 10_000; i++) {
            window.push(1_000_000 + random.nextDouble() * 10);
        }

        double[] values = window.toArray();
        double mean = 0;
        for (double v : values) {
            mean += v;
        }
        mean /= values.length;
        double squares = 0;
        for (double v : values) {
            squares += (v - mean) * (v - mean);
        }
        double std = Math.sqrt(squares / (values.length - 1));

        assertThat(window.mean().orElseThrow()).isCloseTo(mean, within(1e-6));
        assertThat(window.std().orElseThrow()).isCloseTo(std, within(1e-6));
    }

    @Test
    @DisplayName("Should report zero spread once the window holds a constant value")
    void shouldReportZeroSpreadForConstantWindow() {
        RollingWindow window = new RollingWindow(5);
        for (double v : new double[] {1, 2, 3, 4, 5}) {
            window.push(v);
        }
        for (int i = 0; i < 20; i++) {
            window.push(7.3);
        }

        assertThat(window.std()).contains(0.0);
        assertThat(window.mean().orElseThrow()).isCloseTo(7.3, within(1e-12));
    }

    @Test
    @DisplayName("Should keep the most recent values when resized")
    void shouldResizeKeepingRecentValues() {
        RollingWindow window = new RollingWindow(4);
        for (double v : new double[] {1, 2, 3, 4, 5, 6}) {
            window.push(v);
        }

        RollingWindow smaller = window.withCapacity(2);
        RollingWindow larger = window.withCapacity(10);

        assertThat(smaller.toArray()).containsExactly(5.0, 6.0);
        assertThat(smaller.previous()).contains(5.0);
        assertThat(larger.capacity()).isEqualTo(10);
        assertThat(larger.toArray()).containsExactly(3.0, 4.0, 5.0, 6.0);
        assertThat(larger.mean().orElseThrow()).isCloseTo(4.5, within(1e-12));
        assertThat(window.withCapacity(4)).isSameAs(window);
    }
}
