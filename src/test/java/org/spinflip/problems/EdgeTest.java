package org.spinflip.problems;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class EdgeTest {

    @Test
    void testEdgesAreUndirected() {
        assertThat(Edge.of("a", "b")).isEqualTo(Edge.of("b", "a"));
        assertThat(Edge.of("a", "b").hashCode()).isEqualTo(Edge.of("b", "a").hashCode());
        assertThat(Edge.of("a", "b")).isNotEqualTo(Edge.of("a", "c"));
    }

    @Test
    void testTouches() {
        Edge<String> edge = Edge.of("a", "b");

        assertThat(edge.touches("b")).isTrue();
        assertThat(edge.touches("c")).isFalse();
    }

    @Test
    void testSelfLoopIsRejected() {
        assertThatThrownBy(() -> Edge.of("a", "a"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Self-loop");
    }
}
