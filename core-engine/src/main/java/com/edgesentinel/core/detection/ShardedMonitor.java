package com.edgesentinel.core.detection;

import com.edgesentinel.core.config.DetectorConfig;
import com.edgesentinel.core.model.FlowRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * MIDAS-R partitioned by source node across independent shards.
 *
 * <p>
 * Every flow is routed to the shard {@link #shardFor(String, int)} picks for its
 * source, so each shard owns the complete edge and source history of its
 * partition. Shards keep their own clocks and locks, which lets several
 * producers feed disjoint partitions in parallel. Destination counts are
 * per-shard: a destination reached from sources in two shards is counted in
 * both, separately.
 * </p>
 *
 * <h3>Lifecycle</h3>
 * <p>
 * The configuration is validated and the threshold fixed on construction, but
 * the shards are only allocated by {@link #initialize()}. Until then every
 * update or detection call throws {@link NotInitializedException}.
 * </p>
 *
 * @since 1.0.0
 */
public class ShardedMonitor implements Monitor {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(ShardedMonitor.class);

    /** Registry name of this detector type. */
    public static final String TYPE = "sharded-midas-r";

    private final DetectorConfig config;
    private final ScoreMode mode;
    private final double threshold;

    private volatile MidasR[] shards;

    /**
     * @param config detector configuration; {@code shards} sets the partition count
     * @throws com.edgesentinel.core.config.DetectorConfigurationException if the configuration is invalid
     */
    public ShardedMonitor(DetectorConfig config) {
        Objects.requireNonNull(config, "DetectorConfig must not be null");
        config.validate();
        this.config = config.copy();
        this.mode = ScoreMode.fromName(config.getMode());
        // fail on a bad aggregation now rather than at initialize()
        Aggregation.fromName(config.getAggregation());
        this.threshold = mode.threshold(config.getAlpha());
    }

    @Override
    public synchronized void initialize() {
        if (shards != null) {
            LOG.debug("Monitor [{}] already initialized", config.getName());
            return;
        }
        MidasR[] created = new MidasR[config.getShards()];
        for (int i = 0; i < created.length; i++) {
            DetectorConfig shardConfig = config.copy();
            shardConfig.setName(config.getName() + "#" + i);
            created[i] = new MidasR(shardConfig);
        }
        shards = created;
        LOG.info("Monitor [{}] initialized with {} shard(s)", config.getName(), created.length);
    }

    @Override
    public boolean isInitialized() {
        return shards != null;
    }

    @Override
    public void update(FlowRecord flow) {
        shard(flow).update(flow);
    }

    @Override
    public double detectScore(FlowRecord flow) {
        return shard(flow).detectScore(flow);
    }

    @Override
    public double updateDetectScore(FlowRecord flow) {
        return shard(flow).updateDetectScore(flow);
    }

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
        return config.getName();
    }

    public int getShardCount() {
        return config.getShards();
    }

    /**
     * Partition of a source node.
     *
     * @param src    source identifier; must not be {@code null}
     * @param shards number of partitions; must be positive
     * @return shard index in {@code [0, shards)}
     */
    public static int shardFor(String src, int shards) {
        Objects.requireNonNull(src, "src must not be null");
        if (shards < 1) {
            throw new IllegalArgumentException("shards must be >= 1, got: " + shards);
        }
        return Math.floorMod(src.hashCode(), shards);
    }

    /**
     * @param index shard index
     * @return the shard instance
     * @throws NotInitializedException if {@link #initialize()} was not called
     */
    MidasR shardAt(int index) {
        return initializedShards()[index];
    }

    private MidasR shard(FlowRecord flow) {
        Objects.requireNonNull(flow, "FlowRecord must not be null");
        MidasR[] current = initializedShards();
        return current[shardFor(flow.getSrc(), current.length)];
    }

    private MidasR[] initializedShards() {
        MidasR[] current = shards;
        if (current == null) {
            throw new NotInitializedException(config.getName());
        }
        return current;
    }

    @Override
    public String toString() {
        return "ShardedMonitor{name='" + config.getName() + "', shards=" + config.getShards()
                + ", initialized=" + isInitialized() + '}';
    }
}
