package org.spinflip.problems;

import java.util.List;
import java.util.Map;
import java.util.Set;

import org.spinflip.model.IsingCoupling;
import org.spinflip.model.VariableDomain;
import org.spinflip.runtime.ISimulation;
import org.spinflip.runtime.SchedulePhase;
import org.spinflip.runtime.SpinSimulation;
import org.spinflip.runtime.internal.services.SeededRandomProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the graph partitioning encoding on the square a-b-c-d-a.
 */
@Tag("unit")
class GraphPartitioningTest {

    private GraphPartitioning<String> problem;

    @BeforeEach
    void setUp() {
        problem = new GraphPartitioning<>(List.of(
            Edge.of("a", "b"), Edge.of("b", "c"), Edge.of("c", "d"), Edge.of("d", "a")));
    }

    @Test
    void testOddVertexCountIsRejected() {
        List<Edge<String>> triangle = List.of(Edge.of("a", "b"), Edge.of("b", "c"), Edge.of("c", "a"));

        assertThatThrownBy(() -> new GraphPartitioning<>(triangle))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("even");
    }

    @Test
    void testDefaultWeights() {
        Encoding<String> encoding = problem.encode();

        assertThat(problem.getDegree()).isEqualTo(2);
        assertThat(problem.getVertices()).containsExactly("a", "b", "c", "d");
        assertThat(encoding.domain()).isEqualTo(VariableDomain.SPIN);
        assertThat(encoding.model()).isInstanceOf(IsingCoupling.class);
        // A = min(2 * 2, 4) / 8 = 0.5, so pairs couple with 2A = 1 and edges with 1 - B / 2 = 0.5
        assertThat(encoding.model().get(List.of("a", "c"))).isEqualTo(1.0);
        assertThat(encoding.model().get(List.of("a", "b"))).isEqualTo(0.5);
        assertThat(encoding.offset()).isEqualTo(4.0);
    }

    @Test
    void testObjectiveOfBalancedPartitionIsCutSize() {
        Encoding<String> encoding = problem.encode(2.0, 1.0);

        assertThat(encoding.objective(Map.of("a", 1, "b", 1, "c", -1, "d", -1))).isEqualTo(2.0);
        assertThat(encoding.objective(Map.of("a", 1, "b", -1, "c", 1, "d", -1))).isEqualTo(4.0);
    }

    @Test
    void testObjectivePenalizesImbalance() {
        Encoding<String> encoding = problem.encode(2.0, 1.0);

        // (sum s)^2 = 16, no cut edges
        assertThat(encoding.objective(Map.of("a", 1, "b", 1, "c", 1, "d", 1))).isEqualTo(32.0);
    }

    @Test
    void testConvertValidateAndCut() {
        GraphPartitioning.Partition<String> partition =
            problem.convertSolution(Map.of("a", 1, "b", 1, "c", -1, "d", -1));

        assertThat(partition.first()).containsExactlyInAnyOrder("a", "b");
        assertThat(partition.second()).containsExactlyInAnyOrder("c", "d");
        assertThat(problem.isSolutionValid(partition)).isTrue();
        assertThat(problem.cutSize(partition)).isEqualTo(2);
        assertThat(problem.isSolutionValid(new GraphPartitioning.Partition<>(Set.of("a", "b", "c"), Set.of("d"))))
            .isFalse();
        assertThat(problem.isSolutionValid(new GraphPartitioning.Partition<>(Set.of("a"), Set.of("b"))))
            .isFalse();
    }

    @Test
    void testAnnealingFindsBalancedPartition() {
        Encoding<String> encoding = problem.encode(2.0, 1.0);
        ISimulation<String> simulation = encoding.newSimulation(0, new SeededRandomProvider(3));

        simulation.scheduleUpdate(List.of(
            SchedulePhase.of(4.0, 20), SchedulePhase.of(1.0, 20), SchedulePhase.of(0.0, 50)));

        assertThat(simulation).isInstanceOf(SpinSimulation.class);
        GraphPartitioning.Partition<String> partition = problem.convertSolution(simulation.getState());
        assertThat(problem.isSolutionValid(partition)).isTrue();
        assertThat(problem.cutSize(partition)).isBetween(2, 4);
    }
}
