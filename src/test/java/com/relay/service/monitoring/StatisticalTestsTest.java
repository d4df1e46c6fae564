package com.relay.service.monitoring;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class StatisticalTestsTest {

    @Test
    @DisplayName("should approximate the standard normal CDF")
    void normalCdf() {
        assertThat(StatisticalTests.normalCdf(0)).isCloseTo(0.5, within(1e-6));
        assertThat(StatisticalTests.normalCdf(1.96)).isCloseTo(0.975, within(1e-3));
        assertThat(StatisticalTests.normalCdf(-1.96)).isCloseTo(0.025, within(1e-3));
    }

    @Test
    @DisplayName("should compute Welch's t and degrees of freedom")
    void welch() {
        StatisticalTests.WelchResult result = StatisticalTests.welch(
                List.of(1.0, 2.0, 3.0, 4.0, 5.0),
                List.of(2.0, 3.0, 4.0, 5.0, 6.0));

        assertThat(result.getT()).isCloseTo(-1.0, within(1e-9));
        assertThat(result.getDegreesOfFreedom()).isCloseTo(8.0, within(1e-9));
        assertThat(result.getPValue()).isCloseTo(0.3173, within(1e-3));
    }

    @Test
    @DisplayName("should not claim a difference with fewer than two samples")
    void tooFewSamples() {
        assertThat(StatisticalTests.welch(List.of(1.0), List.of(0.0, 0.1)).getPValue()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should handle constant samples")
    void constantSamples() {
        List<Double> ones = List.of(1.0, 1.0, 1.0);

        assertThat(StatisticalTests.welch(ones, ones).significance()).isZero();
        assertThat(StatisticalTests.welch(ones, List.of(0.5, 0.5, 0.5)).significance()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should average an empty list to zero")
    void mean() {
        assertThat(StatisticalTests.mean(List.of())).isZero();
        assertThat(StatisticalTests.mean(List.of(1.0, 2.0))).isEqualTo(1.5);
    }
}
