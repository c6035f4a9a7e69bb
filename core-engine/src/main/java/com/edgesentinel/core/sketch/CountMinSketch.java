package com.edgesentinel.core.sketch;

import org.apache.commons.codec.digest.XXHash32;

import java.io.Serializable;
import java.util.Arrays;

/**
 * Count-min sketch over real-valued bins.
 *
 * <p>
 * A {@code depth x width} matrix of counters; each row hashes a key to one
 * column with its own XXHash32 seed. {@link #check(SketchKey)} returns the
 * minimum over the rows, so the estimate never undercounts. With probability
 * at least {@code confidence} it overcounts by no more than
 * {@code errorRate * totalCount}.
 * </p>
 *
 * <h3>Sizing</h3>
 * <ul>
 * <li>{@code width = ceil(e / errorRate)}</li>
 * <li>{@code depth = ceil(ln(1 / (1 - confidence)))}</li>
 * </ul>
 *
 * <p>
 * Bins are {@code double} so that {@link #decay(double)} can scale them in
 * place. Memory is fixed at construction.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Not thread-safe. The owning detector serialises access.
 * </p>
 *
 * @since 1.0.0
 */
public class CountMinSketch implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int width;
    private final int depth;
    private final double[][] bins;

    /** Sum of all counts added, scaled by decay. */
    private double totalCount;

    /** Row hash functions; rebuilt lazily after deserialization. */
    private transient XXHash32[] hashFunctions;

    /**
     * Create a sketch with explicit dimensions.
     *
     * @param width  columns per row; must be positive
     * @param depth  number of rows; must be positive
     * @throws IllegalArgumentException if either dimension is not positive
     */
    public CountMinSketch(int width, int depth) {
        if (width <= 0 || depth <= 0) {
            throw new IllegalArgumentException(
                    "Sketch width (" + width + ") and depth (" + depth + ") must be positive");
        }
        this.width = width;
        this.depth = depth;
        this.bins = new double[depth][width];
    }

    /**
     * Create a sketch sized for the given error rate and confidence.
     *
     * @param errorRate  additive error as a fraction of the total count, in (0, 1)
     * @param confidence probability that the error bound holds, in (0, 1)
     * @return a new, empty sketch
     * @throws IllegalArgumentException if either parameter is out of range
     */
    public static CountMinSketch withErrorRate(double errorRate, double confidence) {
        return new CountMinSketch(widthFor(errorRate), depthFor(confidence));
    }

    /**
     * @param errorRate additive error rate in (0, 1)
     * @return {@code ceil(e / errorRate)}
     */
    public static int widthFor(double errorRate) {
        if (!(errorRate > 0 && errorRate < 1)) {
            throw new IllegalArgumentException("errorRate must be in (0, 1), got: " + errorRate);
        }
        return (int) Math.ceil(Math.E / errorRate);
    }

    /**
     * @param confidence confidence in (0, 1)
     * @return {@code ceil(ln(1 / (1 - confidence)))}, at least 1
     */
    public static int depthFor(double confidence) {
        if (!(confidence > 0 && confidence < 1)) {
            throw new IllegalArgumentException("confidence must be in (0, 1), got: " + confidence);
        }
        return Math.max(1, (int) Math.ceil(Math.log(1 / (1 - confidence))));
    }

    // ---------------------------------------------------------------
    // Counting
    // ---------------------------------------------------------------

    /**
     * Add {@code count} occurrences of {@code key}.
     *
     * @param key   the item
     * @param count non-negative amount to add
     * @throws IllegalArgumentException if {@code count} is negative or NaN
     */
    public void add(SketchKey key, double count) {
        if (!(count >= 0)) {
            throw new IllegalArgumentException("count must be >= 0, got: " + count);
        }
        byte[] keyBytes = key.encoded();
        for (int row = 0; row < depth; row++) {
            bins[row][column(row, keyBytes)] += count;
        }
        totalCount += count;
    }

    /**
     * Estimate the count of {@code key}.
     *
     * @param key the item
     * @return minimum bin value across the rows; never below the true count
     */
    public double check(SketchKey key) {
        byte[] keyBytes = key.encoded();
        double min = Double.MAX_VALUE;
        for (int row = 0; row < depth; row++) {
            min = Math.min(min, bins[row][column(row, keyBytes)]);
        }
        return min;
    }

    /**
     * Multiply every bin by {@code factor}.
     *
     * @param factor scale in [0, 1]
     * @throws IllegalArgumentException if {@code factor} is outside [0, 1]
     */
    public void decay(double factor) {
        if (!(factor >= 0 && factor <= 1)) {
            throw new IllegalArgumentException("Decay factor must be in [0, 1], got: " + factor);
        }
        for (double[] row : bins) {
            for (int col = 0; col < width; col++) {
                row[col] *= factor;
            }
        }
        totalCount *= factor;
    }

    /** Zero every bin. */
    public void clear() {
        for (double[] row : bins) {
            Arrays.fill(row, 0.0);
        }
        totalCount = 0;
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public int getWidth() {
        return width;
    }

    public int getDepth() {
        return depth;
    }

    public double getTotalCount() {
        return totalCount;
    }

    // ---------------------------------------------------------------
    // Hashing
    // ---------------------------------------------------------------

    private int column(int row, byte[] keyBytes) {
        XXHash32 hash = hashFunctions()[row];
        hash.reset();
        hash.update(keyBytes, 0, keyBytes.length);
        return Integer.remainderUnsigned((int) hash.getValue(), width);
    }

    private XXHash32[] hashFunctions() {
        if (hashFunctions == null) {
            XXHash32[] functions = new XXHash32[depth];
            for (int i = 0; i < depth; i++) {
                // row index doubles as the seed
                functions[i] = new XXHash32(i);
            }
            hashFunctions = functions;
        }
        return hashFunctions;
    }

    @Override
    public String toString() {
        return "CountMinSketch{width=" + width + ", depth=" + depth
                + ", totalCount=" + totalCount + '}';
    }
}
