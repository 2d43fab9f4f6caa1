package org.spinflip.model;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * An immutable, non-empty set of distinct variable labels.
 * <p>
 * Two terms are equal when they contain the same labels, regardless of the order
 * in which the labels were listed. Iteration follows the order of the first
 * construction, which keeps derived structures deterministic.
 *
 * @param <V> The variable label type. Only {@code equals} and {@code hashCode} are used.
 */
public final class Term<V> implements Iterable<V> {

    private final Set<V> labels;
    private final int hash;

    private Term(Set<V> labels) {
        this.labels = Collections.unmodifiableSet(labels);
        this.hash = labels.hashCode();
    }

    /**
     * Creates a term from the given labels.
     *
     * @param labels The labels of the term, in any order.
     * @param <V> The label type.
     * @return The canonical term.
     * @throws InvalidTermException if no label is given or a label is repeated.
     */
    @SafeVarargs
    public static <V> Term<V> of(V... labels) {
        return of(Arrays.asList(labels));
    }

    /**
     * Creates a term from a collection of labels.
     *
     * @param labels The labels of the term, in any order.
     * @param <V> The label type.
     * @return The canonical term.
     * @throws InvalidTermException if the collection is empty, contains {@code null}
     *                              or contains a label more than once.
     */
    public static <V> Term<V> of(Collection<? extends V> labels) {
        if (labels == null || labels.isEmpty()) {
            throw new InvalidTermException("A term must contain at least one variable");
        }
        Set<V> set = new LinkedHashSet<>(labels.size() * 2);
        for (V label : labels) {
            if (label == null) {
                throw new InvalidTermException("Term labels must not be null: " + labels);
            }
            if (!set.add(label)) {
                throw new InvalidTermException("Term contains duplicate variable '" + label + "': " + labels);
            }
        }
        return new Term<>(set);
    }

    public int arity() {
        return labels.size();
    }

    public boolean contains(V label) {
        return labels.contains(label);
    }

    /**
     * @return An unmodifiable view of the labels in this term.
     */
    public Set<V> labels() {
        return labels;
    }

    @Override
    public Iterator<V> iterator() {
        return labels.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Term<?> other)) {
            return false;
        }
        return hash == other.hash && labels.equals(other.labels);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return labels.toString();
    }
}
