package org.spinflip.problems;

import java.util.Objects;

/**
 * An undirected edge between two different vertices. {@code (u, v)} equals {@code (v, u)}.
 *
 * @param u One endpoint.
 * @param v The other endpoint.
 * @param <V> The vertex label type.
 */
public record Edge<V>(V u, V v) {

    public Edge {
        Objects.requireNonNull(u, "u");
        Objects.requireNonNull(v, "v");
        if (u.equals(v)) {
            throw new IllegalArgumentException("Self-loop on vertex '" + u + "' is not a valid edge");
        }
    }

    public static <V> Edge<V> of(V u, V v) {
        return new Edge<>(u, v);
    }

    public boolean touches(V vertex) {
        return u.equals(vertex) || v.equals(vertex);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Edge<?> other)) {
            return false;
        }
        return (u.equals(other.u) && v.equals(other.v)) || (u.equals(other.v) && v.equals(other.u));
    }

    @Override
    public int hashCode() {
        return u.hashCode() + v.hashCode();
    }

    @Override
    public String toString() {
        return "(" + u + ", " + v + ")";
    }
}
