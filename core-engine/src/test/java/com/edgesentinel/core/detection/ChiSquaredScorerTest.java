package com.edgesentinel.core.detection;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link ChiSquaredScorer}.
 */
class ChiSquaredScorerTest {

    @Test
    @DisplayName("Should score 0 without history")
    void shouldFloorAtZeroWithoutHistory() {
        assertThat(ChiSquaredScorer.chiSquared(5, 0, 10)).isZero();
        assertThat(ChiSquaredScorer.chiSquared(5, 10, 1)).isZero();
        assertThat(ChiSquaredScorer.chiSquared(5, 10, 0.5)).isZero();
        assertThat(ChiSquaredScorer.chiSquared(0, 0, 0)).isZero();
    }

    @Test
    @DisplayName("Should compute the chi-squared deviation from the mean rate")
    void shouldComputeStatistic() {
        // ((1001 - 1002 / 2) * 2)^2 / (1002 * 1)
        assertThat(ChiSquaredScorer.chiSquared(1001, 1002, 2))
                .isCloseTo(1_000_000.0 / 1002, within(1e-9));
        // a steady rate of one per tick scores 0
        assertThat(ChiSquaredScorer.chiSquared(1, 10, 10)).isZero();
    }

    @Test
    @DisplayName("Should return the same values with and without memoization")
    void shouldMatchUncached() {
        ChiSquaredScorer cached = new ChiSquaredScorer(16);
        ChiSquaredScorer uncached = new ChiSquaredScorer(0);

        for (int i = 0; i < 50; i++) {
            double cur = i % 7;
            double tot = 10 + i;
            double elapsed = 2 + i % 5;
            assertThat(cached.score(cur, tot, elapsed)).isEqualTo(uncached.score(cur, tot, elapsed));
        }
        assertThat(uncached.cachedEntries()).isZero();
    }

    @Test
    @DisplayName("Should keep the memo cache within its bound")
    void shouldBoundCache() {
        ChiSquaredScorer scorer = new ChiSquaredScorer(8);

        for (int i = 0; i < 1_000; i++) {
            scorer.score(i * 0.5, 1_000 + i, 3);
        }

        assertThat(scorer.cachedEntries()).isLessThanOrEqualTo(8);
    }
}
