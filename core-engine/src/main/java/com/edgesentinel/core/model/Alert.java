package com.edgesentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Alert emitted when a monitor flags a flow as a burst.
 *
 * <p>
 * Serialized to JSON and published to the configured Kafka alerts topic.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder} to construct instances. The builder enforces that
 * {@code monitorName} and {@code timestamp} are present; omitting either will
 * throw a {@link NullPointerException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
public class Alert implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Name of the monitor that raised the alert. */
    private String monitorName;

    private String src;
    private String dst;

    /** Transformed anomaly score of the flow. */
    private double score;

    /** Decision threshold the score was compared against. */
    private double threshold;

    /** Score mode name (raw, log, pvalue). */
    private String mode;

    /** Event time of the flow that triggered the alert. */
    private Instant timestamp;

    /** Human-readable description of what was detected. */
    private String details;

    // ---------------------------------------------------------------
    // Constructors
    // ---------------------------------------------------------------

    /** No-arg constructor required by Jackson. */
    public Alert() {
    }

    private Alert(Builder builder) {
        this.monitorName = Objects.requireNonNull(builder.monitorName, "monitorName must not be null");
        this.src = builder.src;
        this.dst = builder.dst;
        this.score = builder.score;
        this.threshold = builder.threshold;
        this.mode = builder.mode;
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.details = builder.details;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Create a new {@link Builder}.
     *
     * @return builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Alert} instances.
     *
     * <p>
     * {@code monitorName} and {@code timestamp} are <strong>required</strong>.
     * </p>
     */
    public static class Builder {
        private String monitorName;
        private String src;
        private String dst;
        private double score;
        private double threshold;
        private String mode;
        private Instant timestamp;
        private String details;

        public Builder monitorName(String monitorName) {
            this.monitorName = monitorName;
            return this;
        }

        public Builder src(String src) {
            this.src = src;
            return this;
        }

        public Builder dst(String dst) {
            this.dst = dst;
            return this;
        }

        public Builder score(double score) {
            this.score = score;
            return this;
        }

        public Builder threshold(double threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder mode(String mode) {
            this.mode = mode;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder details(String details) {
            this.details = details;
            return this;
        }

        /**
         * Build the alert.
         *
         * @return a new {@link Alert}
         * @throws NullPointerException if {@code monitorName} or {@code timestamp}
         *                              is {@code null}
         */
        public Alert build() {
            return new Alert(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for Jackson)
    // ---------------------------------------------------------------

    public String getMonitorName() {
        return monitorName;
    }

    public void setMonitorName(String monitorName) {
        this.monitorName = monitorName;
    }

    public String getSrc() {
        return src;
    }

    public void setSrc(String src) {
        this.src = src;
    }

    public String getDst() {
        return dst;
    }

    public void setDst(String dst) {
        this.dst = dst;
    }

    public double getScore() {
        return score;
    }

    public void setScore(double score) {
        this.score = score;
    }

    public double getThreshold() {
        return threshold;
    }

    public void setThreshold(double threshold) {
        this.threshold = threshold;
    }

    public String getMode() {
        return mode;
    }

    public void setMode(String mode) {
        this.mode = mode;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public String getDetails() {
        return details;
    }

    public void setDetails(String details) {
        this.details = details;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Alert alert))
            return false;
        return Objects.equals(monitorName, alert.monitorName)
                && Objects.equals(src, alert.src)
                && Objects.equals(dst, alert.dst)
                && Objects.equals(timestamp, alert.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(monitorName, src, dst, timestamp);
    }

    @Override
    public String toString() {
        return "Alert{" +
                "monitorName='" + monitorName + '\'' +
                ", src='" + src + '\'' +
                ", dst='" + dst + '\'' +
                ", score=" + score +
                ", threshold=" + threshold +
                ", timestamp=" + timestamp +
                '}';
    }
}
