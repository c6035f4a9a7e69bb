package com.edgesentinel.core.detection;

import com.edgesentinel.core.config.DetectorConfig;
import com.edgesentinel.core.model.FlowRecord;
import com.edgesentinel.core.sketch.CountMinSketch;
import com.edgesentinel.core.sketch.SketchKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.Objects;

/**
 * MIDAS-R burst detector for edge streams.
 *
 * <p>
 * Tracks three dimensions of a directed flow stream, the edge
 * {@code (src, dst)}, the source node and the destination node, each with a
 * current-tick and an all-time count-min sketch. Each dimension is scored with
 * the chi-squared statistic of {@link ChiSquaredScorer}; the three scores are
 * reduced by the configured {@link Aggregation}, rounded, and transformed by
 * the configured {@link ScoreMode}.
 * </p>
 *
 * <h3>Update Pipeline</h3>
 * <ol>
 * <li>snap the timestamp to a tick through the shared {@link EpochClock}</li>
 * <li>on a tick transition, decay the three current sketches once</li>
 * <li>add the count to the edge, source and destination sketches</li>
 * </ol>
 *
 * <h3>Scoring Pipeline</h3>
 * <p>
 * Scores are evaluated at the clock's current tick, aggregated, rounded to
 * {@code precision} decimals with {@link RoundingMode#HALF_EVEN}, and only then
 * transformed. The threshold is the transformed {@code 1 - alpha} quantile of
 * chi-squared(1), computed once at construction.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * The mutating and scoring methods are {@code synchronized}: tick check, decay
 * and the three adds form a single critical section, so concurrent producers
 * can never decay the same tick twice. Timestamps should still arrive in
 * non-decreasing order; late flows are counted in the current tick.
 * </p>
 *
 * @see <a href="https://arxiv.org/abs/1911.04464">MIDAS: Microcluster-Based
 *      Detector of Anomalies in Edge Streams</a>
 * @since 1.0.0
 */
public class MidasR implements Monitor {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(MidasR.class);

    /** Registry name of this detector type. */
    public static final String TYPE = "midas-r";

    private final String name;
    private final ScoreMode mode;
    private final Aggregation aggregation;
    private final Integer precision;
    private final double threshold;

    private final EpochClock clock;
    private final DimensionTracker edges;
    private final DimensionTracker sources;
    private final DimensionTracker destinations;
    private final ChiSquaredScorer scorer;

    /** Source of timestamps for flows that carry none. */
    private transient Clock wallClock;

    /**
     * @param config detector configuration; validated here
     * @throws NullPointerException                                        if {@code config} is {@code null}
     * @throws com.edgesentinel.core.config.DetectorConfigurationException if the configuration is invalid
     */
    public MidasR(DetectorConfig config) {
        this(config, Clock.systemUTC());
    }

    /**
     * @param config    detector configuration; validated here
     * @param wallClock clock used by {@link #update(String, String)}
     */
    public MidasR(DetectorConfig config, Clock wallClock) {
        Objects.requireNonNull(config, "DetectorConfig must not be null");
        config.validate();
        this.wallClock = Objects.requireNonNull(wallClock, "Clock must not be null");

        this.name = config.getName();
        this.mode = ScoreMode.fromName(config.getMode());
        this.aggregation = Aggregation.fromName(config.getAggregation());
        this.precision = config.getPrecision();
        this.threshold = mode.threshold(config.getAlpha());

        int width = CountMinSketch.widthFor(config.getErrorRate());
        int depth = CountMinSketch.depthFor(config.confidence());
        this.clock = new EpochClock(config.getTickSize());
        this.edges = new DimensionTracker("edge", width, depth, config.getDecay());
        this.sources = new DimensionTracker("src", width, depth, config.getDecay());
        this.destinations = new DimensionTracker("dst", width, depth, config.getDecay());
        this.scorer = new ChiSquaredScorer(config.getScoreCacheSize());

        LOG.info("Monitor [{}] created: sketch={}x{} decay={} tickSize={} mode={} threshold={}",
                name, depth, width, config.getDecay(), config.getTickSize(), mode, threshold);
    }

    // ---------------------------------------------------------------
    // Update
    // ---------------------------------------------------------------

    /**
     * Record a flow. A flow without a timestamp is stamped by the wall clock.
     */
    @Override
    public void update(FlowRecord flow) {
        Objects.requireNonNull(flow, "FlowRecord must not be null");
        update(flow.getSrc(), flow.getDst(), flow.getCount(), timestampOf(flow));
    }

    /**
     * Record one flow timestamped by the wall clock.
     *
     * @param src source identifier
     * @param dst destination identifier
     */
    public void update(String src, String dst) {
        update(src, dst, 1, now());
    }

    /**
     * Record {@code count} occurrences of {@code src -> dst} at
     * {@code timestamp}.
     *
     * @param src       source identifier; must not be {@code null}
     * @param dst       destination identifier; must not be {@code null}
     * @param count     non-negative number of occurrences
     * @param timestamp event time; must be finite
     * @throws IllegalArgumentException if {@code count} is negative or the
     *                                  timestamp is not finite
     */
    public synchronized void update(String src, String dst, long count, double timestamp) {
        observe(src, dst, count, timestamp);
    }

    private EpochClock.TickAdvance observe(String src, String dst, long count, double timestamp) {
        SketchKey edge = SketchKey.edge(src, dst);
        SketchKey srcKey = SketchKey.node(src);
        SketchKey dstKey = SketchKey.node(dst);
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0, got: " + count);
        }

        EpochClock.TickAdvance tick = clock.advance(timestamp);
        if (tick.advanced()) {
            LOG.trace("Monitor [{}] advanced to tick {}", name, tick.elapsed());
        }
        // one tick result shared by all three dimensions keeps their decay in step
        edges.observe(edge, count, tick.advanced());
        sources.observe(srcKey, count, tick.advanced());
        destinations.observe(dstKey, count, tick.advanced());
        return tick;
    }

    // ---------------------------------------------------------------
    // Detection
    // ---------------------------------------------------------------

    @Override
    public double detectScore(FlowRecord flow) {
        Objects.requireNonNull(flow, "FlowRecord must not be null");
        return detectScore(flow.getSrc(), flow.getDst());
    }

    /**
     * Score {@code src -> dst} at the current tick without changing any state.
     *
     * @param src source identifier
     * @param dst destination identifier
     * @return transformed score
     */
    public synchronized double detectScore(String src, String dst) {
        return scoreAt(src, dst, clock.currentTick());
    }

    private double scoreAt(String src, String dst, long elapsed) {
        double edgeScore = dimensionScore(edges, SketchKey.edge(src, dst), elapsed);
        double srcScore = dimensionScore(sources, SketchKey.node(src), elapsed);
        double dstScore = dimensionScore(destinations, SketchKey.node(dst), elapsed);

        double score = round(aggregation.apply(edgeScore, srcScore, dstScore));
        return mode.transform(score);
    }

    /**
     * @param src source identifier
     * @param dst destination identifier
     * @return {@code true} if {@code src -> dst} is currently a burst
     */
    public boolean detect(String src, String dst) {
        return mode.isAnomalous(detectScore(src, dst), threshold);
    }

    @Override
    public double updateDetectScore(FlowRecord flow) {
        Objects.requireNonNull(flow, "FlowRecord must not be null");
        return updateDetectScore(flow.getSrc(), flow.getDst(), flow.getCount(), timestampOf(flow));
    }

    /**
     * Update then score, holding the lock across both steps. The flow is
     * scored at the tick its own timestamp maps to, floored at 1, which
     * for a late flow is earlier than the current tick.
     *
     * @param src       source identifier
     * @param dst       destination identifier
     * @param count     non-negative number of occurrences
     * @param timestamp event time; must be finite
     * @return transformed score after the update
     */
    public synchronized double updateDetectScore(String src, String dst, long count, double timestamp) {
        EpochClock.TickAdvance tick = observe(src, dst, count, timestamp);
        return scoreAt(src, dst, Math.max(1, tick.elapsed()));
    }

    /**
     * @param src       source identifier
     * @param dst       destination identifier
     * @param count     non-negative number of occurrences
     * @param timestamp event time; must be finite
     * @return {@code true} if the flow is a burst after the update
     */
    public boolean updateDetect(String src, String dst, long count, double timestamp) {
        return mode.isAnomalous(updateDetectScore(src, dst, count, timestamp), threshold);
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    @Override
    public double getThreshold() {
        return threshold;
    }

    @Override
    public ScoreMode getMode() {
        return mode;
    }

    @Override
    public String getName() {
        return name;
    }

    public Aggregation getAggregation() {
        return aggregation;
    }

    /**
     * @return elapsed ticks since the first flow, 0 before it
     */
    public synchronized long getCurrentTick() {
        return clock.currentTick();
    }

    DimensionTracker edges() {
        return edges;
    }

    DimensionTracker sources() {
        return sources;
    }

    DimensionTracker destinations() {
        return destinations;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private double dimensionScore(DimensionTracker tracker, SketchKey key, long elapsed) {
        DimensionTracker.Estimate estimate = tracker.estimate(key);
        return scorer.score(estimate.current(), estimate.total(), elapsed);
    }

    private double round(double score) {
        if (precision == null || !Double.isFinite(score)) {
            return score;
        }
        return BigDecimal.valueOf(score).setScale(precision, RoundingMode.HALF_EVEN).doubleValue();
    }

    private double timestampOf(FlowRecord flow) {
        return flow.hasTimestamp() ? flow.getTimestamp() : now();
    }

    private double now() {
        if (wallClock == null) {
            wallClock = Clock.systemUTC();
        }
        return wallClock.millis() / 1000.0;
    }

    @Override
    public String toString() {
        return "MidasR{name='" + name + "', mode=" + mode + ", aggregation=" + aggregation
                + ", threshold=" + threshold + ", clock=" + clock + '}';
    }
}
