package org.spinflip.problems;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import org.spinflip.model.EnergyModel;
import org.spinflip.model.VariableDomain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Minimum vertex cover as a Boolean model, following section 4.3 of
 * A. Lucas, "Ising formulations of many NP problems" (2014).
 * <p>
 * One variable per vertex; {@code 1} means the vertex belongs to the cover. The
 * objective {@code A * sum over edges (1 - x_u)(1 - x_v) + B * sum x_v} equals the
 * size of the cover whenever every edge is covered.
 *
 * @param <V> The vertex label type.
 */
public class VertexCover<V> implements IProblem<V, Set<V>> {

    private static final Logger LOG = LoggerFactory.getLogger(VertexCover.class);

    private final Set<Edge<V>> edges;
    private final Set<V> vertices;

    public VertexCover(Collection<Edge<V>> edges) {
        this.edges = new LinkedHashSet<>(edges);
        this.vertices = new LinkedHashSet<>();
        for (Edge<V> edge : this.edges) {
            vertices.add(edge.u());
            vertices.add(edge.v());
        }
    }

    public Set<Edge<V>> getEdges() {
        return Collections.unmodifiableSet(edges);
    }

    public Set<V> getVertices() {
        return Collections.unmodifiableSet(vertices);
    }

    @Override
    public int getNumVariables() {
        return vertices.size();
    }

    /**
     * Encodes with {@code A = 2} and {@code B = 1}.
     */
    @Override
    public Encoding<V> encode() {
        return encode(2.0, 1.0);
    }

    /**
     * @param a Penalty for an uncovered edge. Must exceed {@code b} for covers to be optimal.
     * @param b Cost of every vertex in the cover.
     */
    public Encoding<V> encode(double a, double b) {
        EnergyModel<V> model = new EnergyModel<>();
        for (V vertex : vertices) {
            model.add(Set.of(vertex), b);
        }
        for (Edge<V> edge : edges) {
            model.add(Set.of(edge.u(), edge.v()), a);
            model.add(Set.of(edge.u()), -a);
            model.add(Set.of(edge.v()), -a);
        }
        LOG.debug("Encoded vertex cover: {} vertices, {} edges, {} terms", vertices.size(), edges.size(), model.size());
        return new Encoding<>(model, edges.size() * a, VariableDomain.BOOLEAN);
    }

    /**
     * @param state A Boolean state over the vertices.
     * @return The vertices set to 1.
     */
    @Override
    public Set<V> convertSolution(Map<V, Integer> state) {
        Set<V> cover = new LinkedHashSet<>();
        for (Map.Entry<V, Integer> entry : state.entrySet()) {
            if (entry.getValue() == 1) {
                cover.add(entry.getKey());
            }
        }
        return cover;
    }

    /**
     * @return {@code true} if every edge has at least one endpoint in the cover.
     */
    @Override
    public boolean isSolutionValid(Set<V> cover) {
        for (Edge<V> edge : edges) {
            if (!cover.contains(edge.u()) && !cover.contains(edge.v())) {
                return false;
            }
        }
        return true;
    }
}
