package com.edgesentinel.core.sketch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SketchKey}.
 */
class SketchKeyTest {

    @Test
    @DisplayName("Should not collide when identifiers contain a separator")
    void shouldNotCollideAcrossSeparators() {
        SketchKey left = SketchKey.edge("X->Y", "Z");
        SketchKey right = SketchKey.edge("X", "Y->Z");

        assertThat(left).isNotEqualTo(right);
        assertThat(left.toBytes()).isNotEqualTo(right.toBytes());
    }

    @Test
    @DisplayName("Should keep edge keys and node keys in separate key spaces")
    void shouldSeparateEdgeAndNodeKeys() {
        SketchKey edge = SketchKey.edge("a", "");
        SketchKey node = SketchKey.node("a");

        assertThat(edge).isNotEqualTo(node);
        assertThat(edge.getKind()).isEqualTo(SketchKey.Kind.EDGE);
        assertThat(node.getKind()).isEqualTo(SketchKey.Kind.NODE);
    }

    @Test
    @DisplayName("Should be direction-sensitive and value-equal")
    void shouldBeDirectionSensitive() {
        assertThat(SketchKey.edge("a", "b")).isEqualTo(SketchKey.edge("a", "b"));
        assertThat(SketchKey.edge("a", "b")).hasSameHashCodeAs(SketchKey.edge("a", "b"));
        assertThat(SketchKey.edge("a", "b")).isNotEqualTo(SketchKey.edge("b", "a"));
    }

    @Test
    @DisplayName("Should reject null identifiers")
    void shouldRejectNull() {
        assertThatThrownBy(() -> SketchKey.edge(null, "b"))
                .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> SketchKey.node(null))
                .isInstanceOf(NullPointerException.class);
    }
}
