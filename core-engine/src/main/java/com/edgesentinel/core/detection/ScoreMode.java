package com.edgesentinel.core.detection;

import com.edgesentinel.core.config.DetectorConfigurationException;
import org.apache.commons.math3.special.Gamma;

import java.util.Arrays;
import java.util.Locale;

/**
 * Output transform applied to the aggregated chi-squared score.
 *
 * <p>
 * The modes do not share a comparison direction. {@link #RAW} and
 * {@link #LOG} grow with the burst, so a flow is anomalous when its score is
 * above the threshold. {@link #PVALUE} shrinks as the burst grows, so a flow is
 * anomalous when its score is below the threshold. Always compare through
 * {@link #isAnomalous(double, double)} rather than with {@code >}.
 * </p>
 *
 * @since 1.0.0
 */
public enum ScoreMode {

    /** Identity. */
    RAW("raw") {
        @Override
        public double transform(double score) {
            return score;
        }
    },

    /** {@code ln(1 + score)}; compresses the heavy tail. */
    LOG("log") {
        @Override
        public double transform(double score) {
            return Math.log1p(score);
        }
    },

    /** Upper-tail probability of the chi-squared(1) distribution at the score. */
    PVALUE("pvalue") {
        @Override
        public double transform(double score) {
            // sf(x; k=1) = Q(1/2, x/2)
            return Gamma.regularizedGammaQ(0.5, Math.max(score, 0) / 2);
        }

        @Override
        public boolean isAnomalous(double score, double threshold) {
            return score < threshold;
        }
    };

    private final String modeName;

    ScoreMode(String modeName) {
        this.modeName = modeName;
    }

    /**
     * Apply this transform to a raw score.
     *
     * @param score non-negative raw score
     * @return transformed score
     */
    public abstract double transform(double score);

    /**
     * Compare a transformed score with the transformed threshold in the
     * direction this mode requires.
     *
     * @param score     transformed score
     * @param threshold transformed threshold
     * @return {@code true} if the score indicates a burst
     */
    public boolean isAnomalous(double score, double threshold) {
        return score > threshold;
    }

    /**
     * Transformed {@code 1 - alpha} quantile of the chi-squared(1) distribution.
     *
     * @param alpha significance level in (0, 1)
     * @return decision threshold in this mode's units
     */
    public double threshold(double alpha) {
        if (!(alpha > 0 && alpha < 1)) {
            throw new IllegalArgumentException("alpha must be in (0, 1), got: " + alpha);
        }
        return transform(ChiSquaredScorer.DISTRIBUTION.inverseCumulativeProbability(1 - alpha));
    }

    public String getModeName() {
        return modeName;
    }

    /**
     * Resolve a mode from its configuration name (case-insensitive).
     *
     * @param name mode name
     * @return the matching mode
     * @throws DetectorConfigurationException if the name matches no mode; the
     *                                        message lists the valid names
     */
    public static ScoreMode fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (ScoreMode mode : values()) {
                if (mode.modeName.equals(normalized)) {
                    return mode;
                }
            }
        }
        throw new DetectorConfigurationException(
                "Invalid mode '" + name + "'. Must be one of " + validNames());
    }

    /**
     * @return sorted list of accepted mode names
     */
    public static String validNames() {
        return Arrays.toString(Arrays.stream(values())
                .map(ScoreMode::getModeName)
                .sorted()
                .toArray(String[]::new));
    }

    @Override
    public String toString() {
        return modeName;
    }
}
