package org.spinflip.problems;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.spinflip.model.IsingCoupling;
import org.spinflip.model.VariableDomain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Balanced graph partitioning as a spin model, following section 2.2 of
 * A. Lucas, "Ising formulations of many NP problems" (2014).
 * <p>
 * One spin per vertex selects its side. The objective
 * {@code A * (sum s_v)^2 + B * sum over edges (1 - s_u s_v) / 2} equals the number of
 * cut edges whenever both sides have the same size.
 *
 * @param <V> The vertex label type.
 */
public class GraphPartitioning<V> implements IProblem<V, GraphPartitioning.Partition<V>> {

    private static final Logger LOG = LoggerFactory.getLogger(GraphPartitioning.class);

    /**
     * The two sides of a partition.
     *
     * @param first Vertices with spin {@code +1}.
     * @param second Vertices with spin {@code -1}.
     * @param <V> The vertex label type.
     */
    public record Partition<V>(Set<V> first, Set<V> second) {}

    private final Set<Edge<V>> edges;
    private final List<V> vertices;
    private final int degree;

    /**
     * @param edges The edges of the graph.
     * @throws IllegalArgumentException if the graph has an odd number of vertices.
     */
    public GraphPartitioning(Collection<Edge<V>> edges) {
        this.edges = new LinkedHashSet<>(edges);
        Set<V> vertexSet = new LinkedHashSet<>();
        Map<V, Integer> degrees = new HashMap<>();
        for (Edge<V> edge : this.edges) {
            vertexSet.add(edge.u());
            vertexSet.add(edge.v());
            degrees.merge(edge.u(), 1, Integer::sum);
            degrees.merge(edge.v(), 1, Integer::sum);
        }
        if (vertexSet.size() % 2 != 0) {
            throw new IllegalArgumentException(
                    "The graph must have an even number of vertices, got " + vertexSet.size());
        }
        this.vertices = List.copyOf(vertexSet);
        this.degree = degrees.values().stream().mapToInt(Integer::intValue).max().orElse(0);
    }

    public Set<Edge<V>> getEdges() {
        return Collections.unmodifiableSet(edges);
    }

    public List<V> getVertices() {
        return vertices;
    }

    /**
     * @return The maximum vertex degree of the graph.
     */
    public int getDegree() {
        return degree;
    }

    @Override
    public int getNumVariables() {
        return vertices.size();
    }

    /**
     * Encodes with {@code B = 1} and {@code A = min(2 * degree, N) * B / 8}.
     */
    @Override
    public Encoding<V> encode() {
        return encode(Math.min(2 * degree, vertices.size()) / 8.0, 1.0);
    }

    /**
     * @param a Weight of the balance constraint.
     * @param b Weight of every cut edge.
     */
    public Encoding<V> encode(double a, double b) {
        IsingCoupling<V> coupling = new IsingCoupling<>();
        int n = vertices.size();
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                coupling.add(vertices.get(i), vertices.get(j), 2 * a);
            }
        }
        for (Edge<V> edge : edges) {
            coupling.add(edge.u(), edge.v(), -b / 2);
        }
        double offset = a * n + b * edges.size() / 2.0;
        LOG.debug("Encoded graph partitioning: {} vertices, {} edges, A={}, B={}", n, edges.size(), a, b);
        return new Encoding<>(coupling, offset, VariableDomain.SPIN);
    }

    /**
     * @param state A spin state over the vertices.
     */
    @Override
    public Partition<V> convertSolution(Map<V, Integer> state) {
        Set<V> first = new LinkedHashSet<>();
        Set<V> second = new LinkedHashSet<>();
        for (Map.Entry<V, Integer> entry : state.entrySet()) {
            if (entry.getValue() == 1) {
                first.add(entry.getKey());
            } else {
                second.add(entry.getKey());
            }
        }
        return new Partition<>(first, second);
    }

    /**
     * @return {@code true} if both sides have equal size and together hold every vertex once.
     */
    @Override
    public boolean isSolutionValid(Partition<V> partition) {
        if (partition.first().size() != partition.second().size()) {
            return false;
        }
        Set<V> all = new LinkedHashSet<>(partition.first());
        all.addAll(partition.second());
        return all.size() == vertices.size() && all.containsAll(vertices);
    }

    /**
     * @return The number of edges whose endpoints lie on different sides.
     */
    public int cutSize(Partition<V> partition) {
        int cut = 0;
        for (Edge<V> edge : edges) {
            if (partition.first().contains(edge.u()) != partition.first().contains(edge.v())) {
                cut++;
            }
        }
        return cut;
    }
}
