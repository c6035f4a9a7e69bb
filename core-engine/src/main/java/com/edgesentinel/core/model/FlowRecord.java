package com.edgesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;
import java.util.Optional;

/**
 * One directed flow observation: {@code src -> dst} at {@code timestamp}.
 *
 * <p>
 * Produced by the surrounding tooling (table reader, Kafka deserializer) and
 * fed to a {@link com.edgesentinel.core.detection.Monitor}. Node identifiers
 * are kept as strings; numeric identifiers are carried in their decimal form.
 * </p>
 *
 * <p>
 * The timestamp is optional. A record without one is stamped by the
 * monitor's wall clock when it is observed.
 * </p>
 *
 * <p>
 * Instances are immutable.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class FlowRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String src;
    private final String dst;

    /** Event time in seconds since the epoch (fractions allowed), or {@code null}. */
    private final Double timestamp;

    /** Number of occurrences this record stands for; at least 1. */
    private final long count;

    /** Optional ground-truth label carried through from labelled tables. */
    private final String label;

    /**
     * @param src       source identifier; must not be {@code null}
     * @param dst       destination identifier; must not be {@code null}
     * @param timestamp event time in seconds; {@code null} or finite
     * @param count     occurrences, {@code null} means 1
     * @param label     optional label
     * @throws NullPointerException     if {@code src} or {@code dst} is {@code null}
     * @throws IllegalArgumentException if the timestamp is not finite or the
     *                                  count is below 1
     */
    @JsonCreator
    public FlowRecord(@JsonProperty("src") String src,
            @JsonProperty("dst") String dst,
            @JsonProperty("timestamp") Double timestamp,
            @JsonProperty("count") Long count,
            @JsonProperty("label") String label) {
        this.src = Objects.requireNonNull(src, "src must not be null");
        this.dst = Objects.requireNonNull(dst, "dst must not be null");
        if (timestamp != null && !Double.isFinite(timestamp)) {
            throw new IllegalArgumentException("timestamp must be finite, got: " + timestamp);
        }
        if (count != null && count < 1) {
            throw new IllegalArgumentException("count must be >= 1, got: " + count);
        }
        this.timestamp = timestamp;
        this.count = count == null ? 1 : count;
        this.label = label;
    }

    /**
     * Single-occurrence, unlabelled record.
     *
     * @param src       source identifier
     * @param dst       destination identifier
     * @param timestamp event time in seconds
     * @return new record
     */
    public static FlowRecord of(String src, String dst, double timestamp) {
        return new FlowRecord(src, dst, timestamp, 1L, null);
    }

    /**
     * Unlabelled record standing for {@code count} occurrences.
     *
     * @param src       source identifier
     * @param dst       destination identifier
     * @param timestamp event time in seconds
     * @param count     occurrences
     * @return new record
     */
    public static FlowRecord of(String src, String dst, double timestamp, long count) {
        return new FlowRecord(src, dst, timestamp, count, null);
    }

    /**
     * Record for numeric node identifiers.
     *
     * @param src       numeric source identifier
     * @param dst       numeric destination identifier
     * @param timestamp event time in seconds
     * @return new record
     */
    public static FlowRecord of(long src, long dst, double timestamp) {
        return of(Long.toString(src), Long.toString(dst), timestamp);
    }

    public String getSrc() {
        return src;
    }

    public String getDst() {
        return dst;
    }

    /**
     * @return event time in seconds, or {@code null} when the record carries none
     */
    public Double getTimestamp() {
        return timestamp;
    }

    public boolean hasTimestamp() {
        return timestamp != null;
    }

    public long getCount() {
        return count;
    }

    public String getLabel() {
        return label;
    }

    /**
     * @return the label, if one was supplied
     */
    public Optional<String> label() {
        return Optional.ofNullable(label);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FlowRecord that))
            return false;
        return Objects.equals(timestamp, that.timestamp)
                && count == that.count
                && src.equals(that.src)
                && dst.equals(that.dst)
                && Objects.equals(label, that.label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(src, dst, timestamp, count, label);
    }

    @Override
    public String toString() {
        return "FlowRecord{" +
                "src='" + src + '\'' +
                ", dst='" + dst + '\'' +
                ", timestamp=" + timestamp +
                ", count=" + count +
                (label != null ? ", label='" + label + '\'' : "") +
                '}';
    }
}
