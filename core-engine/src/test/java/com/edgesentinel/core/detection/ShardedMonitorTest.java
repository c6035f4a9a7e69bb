package com.edgesentinel.core.detection;

import com.edgesentinel.core.config.DetectorConfig;
import com.edgesentinel.core.model.FlowRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ShardedMonitor}.
 */
class ShardedMonitorTest {

    private static final FlowRecord FLOW = FlowRecord.of("A", "B", 1);

    private ShardedMonitor monitor;

    @BeforeEach
    void setUp() {
        DetectorConfig config = new DetectorConfig();
        config.setName("sharded");
        config.setType(ShardedMonitor.TYPE);
        config.setShards(3);
        monitor = new ShardedMonitor(config);
    }

    @Test
    @DisplayName("Should fail every operation before initialize()")
    void shouldFailBeforeInitialize() {
        assertThat(monitor.isInitialized()).isFalse();

        assertThatThrownBy(() -> monitor.update(FLOW))
                .isInstanceOf(NotInitializedException.class)
                .hasMessageContaining("sharded");
        assertThatThrownBy(() -> monitor.detect(FLOW))
                .isInstanceOf(NotInitializedException.class);
        assertThatThrownBy(() -> monitor.detectScore(FLOW))
                .isInstanceOf(NotInitializedException.class);
        assertThatThrownBy(() -> monitor.updateDetect(FLOW))
                .isInstanceOf(NotInitializedException.class);
        assertThatThrownBy(() -> monitor.updateDetectScore(FLOW))
                .isInstanceOf(NotInitializedException.class);
    }

    @Test
    @DisplayName("Should route a source to the same shard every time")
    void shouldRouteBySource() {
        monitor.initialize();

        monitor.update(FlowRecord.of("A", "B", 1));
        monitor.update(FlowRecord.of("A", "C", 1));

        int shard = ShardedMonitor.shardFor("A", 3);
        assertThat(monitor.shardAt(shard).getCurrentTick()).isEqualTo(1);
        for (int i = 0; i < 3; i++) {
            if (i != shard) {
                assertThat(monitor.shardAt(i).getCurrentTick()).isZero();
            }
        }
    }

    @Test
    @DisplayName("Should share the threshold of an equivalent single detector")
    void shouldShareThreshold() {
        DetectorConfig single = new DetectorConfig();
        assertThat(monitor.getThreshold()).isEqualTo(new MidasR(single).getThreshold());
        assertThat(monitor.getMode()).isEqualTo(ScoreMode.RAW);
    }

    @Test
    @DisplayName("Should tolerate repeated initialize() calls")
    void shouldInitializeOnce() {
        monitor.initialize();
        MidasR first = monitor.shardAt(0);

        monitor.initialize();

        assertThat(monitor.shardAt(0)).isSameAs(first);
        assertThat(monitor.getShardCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should flag a burst routed to its shard")
    void shouldFlagBurst() {
        monitor.initialize();
        monitor.update(FlowRecord.of("A", "B", 1));

        assertThat(monitor.updateDetect(FlowRecord.of("A", "B", 2, 1_000))).isTrue();
        assertThat(monitor.detect(FlowRecord.of("Q", "R", 2))).isFalse();
    }

    @Test
    @DisplayName("Should accept parallel producers on disjoint sources")
    void shouldAcceptParallelProducers() throws Exception {
        monitor.initialize();
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int p = 0; p < 4; p++) {
                String src = "src-" + p;
                futures.add(pool.submit(() -> {
                    for (int t = 1; t <= 200; t++) {
                        monitor.update(FlowRecord.of(src, "sink", t));
                    }
                }));
            }
            for (Future<?> f : futures) {
                f.get();
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(monitor.detectScore(FlowRecord.of("src-0", "sink", 200))).isNotNegative();
    }

    @Test
    @DisplayName("Should keep shard indexes in range for any source")
    void shouldKeepShardInRange() {
        for (String src : List.of("", "a", "10.0.0.1", "Aa", "BB", "é")) {
            assertThat(ShardedMonitor.shardFor(src, 7)).isBetween(0, 6);
        }
        assertThatThrownBy(() -> ShardedMonitor.shardFor("a", 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
