package com.edgesentinel.core.detection;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import org.apache.commons.math3.distribution.ChiSquaredDistribution;

import java.io.Serializable;

/**
 * Chi-squared burst statistic for one dimension.
 *
 * <p>
 * Under the null hypothesis that an item arrives at the constant rate
 * {@code total / elapsed} per tick, the statistic
 * </p>
 *
 * <pre>
 *   ((current - total / elapsed) * elapsed)^2 / (total * (elapsed - 1))
 * </pre>
 *
 * <p>
 * follows a chi-squared distribution with one degree of freedom. The score is
 * 0 when there is no history yet ({@code total == 0} or {@code elapsed <= 1}).
 * </p>
 *
 * <h3>Memoization</h3>
 * <p>
 * With a positive {@code cacheSize} each instance keeps its own LRU cache of
 * at most that many input triples. The cache is never shared between
 * instances and is rebuilt empty after deserialization.
 * </p>
 *
 * @since 1.0.0
 */
public class ChiSquaredScorer implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Chi-squared distribution with one degree of freedom. */
    static final ChiSquaredDistribution DISTRIBUTION = new ChiSquaredDistribution(1);

    private final int cacheSize;

    private transient Cache<Inputs, Double> cache;

    /**
     * @param cacheSize maximum memoized input triples; 0 disables memoization
     * @throws IllegalArgumentException if {@code cacheSize} is negative
     */
    public ChiSquaredScorer(int cacheSize) {
        if (cacheSize < 0) {
            throw new IllegalArgumentException("cacheSize must be >= 0, got: " + cacheSize);
        }
        this.cacheSize = cacheSize;
    }

    /**
     * Score one dimension.
     *
     * @param current estimate for the current tick
     * @param total   all-time estimate
     * @param elapsed elapsed ticks since the stream started
     * @return non-negative score
     */
    public double score(double current, double total, double elapsed) {
        if (cacheSize == 0) {
            return chiSquared(current, total, elapsed);
        }
        return cache().asMap().computeIfAbsent(new Inputs(current, total, elapsed),
                in -> chiSquared(in.current, in.total, in.elapsed));
    }

    /**
     * The statistic itself, without memoization.
     *
     * @param current estimate for the current tick
     * @param total   all-time estimate
     * @param elapsed elapsed ticks since the stream started
     * @return non-negative score
     */
    public static double chiSquared(double current, double total, double elapsed) {
        if (total == 0 || elapsed <= 1) {
            return 0;
        }
        double deviation = (current - total / elapsed) * elapsed;
        return deviation * deviation / (total * (elapsed - 1));
    }

    /**
     * @return number of memoized triples currently held
     */
    public long cachedEntries() {
        return cache == null ? 0 : cache.size();
    }

    public int getCacheSize() {
        return cacheSize;
    }

    private Cache<Inputs, Double> cache() {
        if (cache == null) {
            cache = CacheBuilder.newBuilder()
                    .concurrencyLevel(1)
                    .maximumSize(cacheSize)
                    .build();
        }
        return cache;
    }

    private static final class Inputs {

        private final double current;
        private final double total;
        private final double elapsed;

        Inputs(double current, double total, double elapsed) {
            this.current = current;
            this.total = total;
            this.elapsed = elapsed;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof Inputs that))
                return false;
            return Double.compare(current, that.current) == 0
                    && Double.compare(total, that.total) == 0
                    && Double.compare(elapsed, that.elapsed) == 0;
        }

        @Override
        public int hashCode() {
            int h = Double.hashCode(current);
            h = 31 * h + Double.hashCode(total);
            return 31 * h + Double.hashCode(elapsed);
        }
    }
}
