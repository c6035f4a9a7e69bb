package com.edgesentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link FlowRecord}.
 */
class FlowRecordTest {

    @Test
    @DisplayName("Should default a missing count to one")
    void shouldDefaultCount() {
        FlowRecord flow = new FlowRecord("a", "b", 1.0, null, null);

        assertThat(flow.getCount()).isEqualTo(1L);
        assertThat(flow.hasTimestamp()).isTrue();
    }

    @Test
    @DisplayName("Should reject a zero or negative count")
    void shouldRejectNonPositiveCount() {
        assertThatThrownBy(() -> new FlowRecord("a", "b", 1.0, 0L, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("count must be >= 1");
        assertThatThrownBy(() -> FlowRecord.of("a", "b", 1.0, -3))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should allow a missing timestamp but reject a non-finite one")
    void shouldHandleTimestamps() {
        FlowRecord untimed = new FlowRecord("a", "b", null, 2L, "normal");

        assertThat(untimed.hasTimestamp()).isFalse();
        assertThat(untimed.getTimestamp()).isNull();
        assertThat(untimed).isEqualTo(new FlowRecord("a", "b", null, 2L, "normal"));
        assertThat(untimed).isNotEqualTo(new FlowRecord("a", "b", 0.0, 2L, "normal"));
        assertThatThrownBy(() -> FlowRecord.of("a", "b", Double.POSITIVE_INFINITY))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("finite");
    }
}
