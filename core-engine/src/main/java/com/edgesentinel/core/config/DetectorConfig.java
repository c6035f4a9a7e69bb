package com.edgesentinel.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Configuration of one streaming burst detector, loaded from YAML.
 *
 * <p>
 * Expected YAML structure (every key optional, defaults shown):
 * </p>
 *
 * <pre>
 * name: midas-r
 * type: midas-r            # or sharded-midas-r
 * errorRate: 0.1
 * falsePositiveProbability: 0.02
 * decay: 0.5
 * tickSize: 1.0
 * alpha: 0.05
 * mode: raw                # raw, log or pvalue
 * precision: 5             # 0..17, null disables rounding
 * aggregation: max         # max, min, mean or sum
 * scoreCacheSize: 0        # 0 disables score memoization
 * shards: 4                # sharded-midas-r only
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after construction / deserialization. Enumerated
 * values (mode, aggregation, type) are checked by the detector that consumes
 * them so that the list of valid names lives next to the implementation.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectorConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Decimal places beyond which a {@code double} carries no further digits. */
    public static final int MAX_PRECISION = 17;

    private String name = "midas-r";
    private String type = "midas-r";

    // --- Sketch sizing ---
    private double errorRate = 0.1;
    private double falsePositiveProbability = 0.02;

    // --- Time windowing ---
    private double decay = 0.5;
    private double tickSize = 1.0;

    // --- Scoring ---
    private double alpha = 0.05;
    private String mode = "raw";
    private Integer precision = 5;
    private String aggregation = "max";
    private int scoreCacheSize = 0;

    // --- Sharding ---
    private int shards = 4;

    /**
     * Configuration with every default applied.
     *
     * @return new default configuration
     */
    public static DetectorConfig defaults() {
        return new DetectorConfig();
    }

    /**
     * Copy this configuration.
     *
     * @return independent copy
     */
    public DetectorConfig copy() {
        DetectorConfig c = new DetectorConfig();
        c.name = name;
        c.type = type;
        c.errorRate = errorRate;
        c.falsePositiveProbability = falsePositiveProbability;
        c.decay = decay;
        c.tickSize = tickSize;
        c.alpha = alpha;
        c.mode = mode;
        c.precision = precision;
        c.aggregation = aggregation;
        c.scoreCacheSize = scoreCacheSize;
        c.shards = shards;
        return c;
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate the numeric ranges of this configuration.
     *
     * @throws DetectorConfigurationException listing every violation
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (name == null || name.isBlank()) {
            errors.add("'name' is required");
        }
        if (type == null || type.isBlank()) {
            errors.add("'type' is required");
        }
        if (!(errorRate > 0 && errorRate < 1)) {
            errors.add("'errorRate' must be in (0, 1), got: " + errorRate);
        }
        if (!(falsePositiveProbability > 0 && falsePositiveProbability < 1)) {
            errors.add("'falsePositiveProbability' must be in (0, 1), got: "
                    + falsePositiveProbability);
        }
        if (!(decay >= 0 && decay <= 1)) {
            errors.add("'decay' must be in [0, 1], got: " + decay);
        }
        if (!(tickSize > 0) || Double.isInfinite(tickSize)) {
            errors.add("'tickSize' must be > 0, got: " + tickSize);
        }
        if (!(alpha > 0 && alpha < 1)) {
            errors.add("'alpha' must be in (0, 1), got: " + alpha);
        }
        if (mode == null || mode.isBlank()) {
            errors.add("'mode' is required");
        }
        if (precision != null && (precision < 0 || precision > MAX_PRECISION)) {
            errors.add("'precision' must be in [0, " + MAX_PRECISION + "], got: " + precision);
        }
        if (aggregation == null || aggregation.isBlank()) {
            errors.add("'aggregation' is required");
        }
        if (scoreCacheSize < 0) {
            errors.add("'scoreCacheSize' must be >= 0, got: " + scoreCacheSize);
        }
        if (shards < 1) {
            errors.add("'shards' must be >= 1, got: " + shards);
        }

        if (!errors.isEmpty()) {
            throw new DetectorConfigurationException(name != null ? name : "<unnamed>", errors);
        }
    }

    /**
     * Confidence of the count-min error bound derived from the false positive
     * probability.
     *
     * @return {@code 1 - falsePositiveProbability / 2}
     */
    public double confidence() {
        return 1 - falsePositiveProbability / 2;
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getType() {
        return type;
    }

    /**
     * Set the detector type, normalised to lowercase.
     *
     * @param type detector type string
     */
    public void setType(String type) {
        this.type = type != null ? type.toLowerCase(Locale.ROOT) : null;
    }

    public double getErrorRate() {
        return errorRate;
    }

    public void setErrorRate(double errorRate) {
        this.errorRate = errorRate;
    }

    public double getFalsePositiveProbability() {
        return falsePositiveProbability;
    }

    public void setFalsePositiveProbability(double falsePositiveProbability) {
        this.falsePositiveProbability = falsePositiveProbability;
    }

    public double getDecay() {
        return decay;
    }

    public void setDecay(double decay) {
        this.decay = decay;
    }

    public double getTickSize() {
        return tickSize;
    }

    public void setTickSize(double tickSize) {
        this.tickSize = tickSize;
    }

    public double getAlpha() {
        return alpha;
    }

    public void setAlpha(double alpha) {
        this.alpha = alpha;
    }

    public String getMode() {
        return mode;
    }

    public void setMode(String mode) {
        this.mode = mode;
    }

    public Integer getPrecision() {
        return precision;
    }

    public void setPrecision(Integer precision) {
        this.precision = precision;
    }

    public String getAggregation() {
        return aggregation;
    }

    public void setAggregation(String aggregation) {
        this.aggregation = aggregation;
    }

    public int getScoreCacheSize() {
        return scoreCacheSize;
    }

    public void setScoreCacheSize(int scoreCacheSize) {
        this.scoreCacheSize = scoreCacheSize;
    }

    public int getShards() {
        return shards;
    }

    public void setShards(int shards) {
        this.shards = shards;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectorConfig that))
            return false;
        return Double.compare(errorRate, that.errorRate) == 0
                && Double.compare(falsePositiveProbability, that.falsePositiveProbability) == 0
                && Double.compare(decay, that.decay) == 0
                && Double.compare(tickSize, that.tickSize) == 0
                && Double.compare(alpha, that.alpha) == 0
                && scoreCacheSize == that.scoreCacheSize
                && shards == that.shards
                && Objects.equals(name, that.name)
                && Objects.equals(type, that.type)
                && Objects.equals(mode, that.mode)
                && Objects.equals(precision, that.precision)
                && Objects.equals(aggregation, that.aggregation);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, errorRate, falsePositiveProbability, decay, tickSize,
                alpha, mode, precision, aggregation, scoreCacheSize, shards);
    }

    @Override
    public String toString() {
        return "DetectorConfig{" +
                "name='" + name + '\'' +
                ", type='" + type + '\'' +
                ", errorRate=" + errorRate +
                ", falsePositiveProbability=" + falsePositiveProbability +
                ", decay=" + decay +
                ", tickSize=" + tickSize +
                ", alpha=" + alpha +
                ", mode='" + mode + '\'' +
                ", precision=" + precision +
                ", aggregation='" + aggregation + '\'' +
                ", scoreCacheSize=" + scoreCacheSize +
                ", shards=" + shards +
                '}';
    }
}
