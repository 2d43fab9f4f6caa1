package org.spinflip.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A sparse multilinear polynomial over opaque variable labels.
 * <p>
 * Each entry maps a {@link Term} to a nonzero real coefficient. The model enforces
 * its invariants on every mutation:
 * <ul>
 *   <li>No stored term has a zero coefficient. Setting, accumulating or scaling a
 *   coefficient to zero removes the entry.</li>
 *   <li>A term's identity does not depend on the order its labels are listed in.</li>
 *   <li>Labels within one term are pairwise distinct.</li>
 * </ul>
 * <p>
 * Arithmetic accepts either another model or a plain {@link Map} from label
 * collections to numbers on the right-hand side; both behave identically.
 * Iteration order is the order in which terms were first inserted, which keeps
 * simulations built from identically constructed models reproducible.
 * <p>
 * Thread Safety: Not thread-safe. A model that has been handed to a simulation
 * must not be mutated afterwards, but may be shared for reading.
 *
 * @param <V> The variable label type.
 */
public class EnergyModel<V> implements Iterable<Map.Entry<Term<V>, Double>> {

    private final Map<Term<V>, Double> coefficients = new LinkedHashMap<>();

    /**
     * Creates an empty model.
     */
    public EnergyModel() {
    }

    /**
     * Creates a model from plain (labels, coefficient) pairs. Pairs whose labels
     * address the same term are summed, and zero sums are dropped.
     *
     * @param terms The pairs to accumulate.
     * @throws InvalidTermException if any key is not a valid term for this model.
     */
    public EnergyModel(Map<? extends Collection<? extends V>, ? extends Number> terms) {
        addAll(terms);
    }

    /**
     * Hook for specialized models to restrict which terms they accept.
     *
     * @param term The term about to be written.
     * @throws InvalidTermException if the term is not accepted.
     */
    protected void validate(Term<V> term) {
    }

    /**
     * Creates an empty model of the same kind as this one. Used by {@link #copy()}
     * so that arithmetic on a specialized model keeps its specialization.
     */
    protected EnergyModel<V> newEmpty() {
        return new EnergyModel<>();
    }

    /**
     * Stores a coefficient under the canonical identity of the term, replacing any
     * existing value. A zero coefficient deletes the entry.
     *
     * @param term The term to write.
     * @param coefficient The new coefficient.
     * @throws InvalidTermException if the term is not accepted by this model.
     */
    public void set(Term<V> term, double coefficient) {
        validate(term);
        if (coefficient == 0.0) {
            coefficients.remove(term);
        } else {
            coefficients.put(term, coefficient);
        }
    }

    /**
     * Convenience form of {@link #set(Term, double)} for a collection of labels.
     */
    public void set(Collection<? extends V> labels, double coefficient) {
        set(Term.<V>of(labels), coefficient);
    }

    /**
     * Returns the coefficient of a term.
     *
     * @param term The term to look up.
     * @return The stored coefficient, or {@code 0.0} if the term is absent.
     */
    public double get(Term<V> term) {
        Double value = coefficients.get(term);
        return value == null ? 0.0 : value;
    }

    public double get(Collection<? extends V> labels) {
        return get(Term.<V>of(labels));
    }

    /**
     * Accumulates {@code amount} onto the coefficient of a term, removing the entry
     * if the sum is zero.
     */
    public void add(Term<V> term, double amount) {
        set(term, get(term) + amount);
    }

    public void add(Collection<? extends V> labels, double amount) {
        add(Term.<V>of(labels), amount);
    }

    /**
     * Removes a term.
     *
     * @return The removed coefficient, or {@code 0.0} if the term was absent.
     */
    public double remove(Term<V> term) {
        Double removed = coefficients.remove(term);
        return removed == null ? 0.0 : removed;
    }

    public boolean contains(Term<V> term) {
        return coefficients.containsKey(term);
    }

    public int size() {
        return coefficients.size();
    }

    public boolean isEmpty() {
        return coefficients.isEmpty();
    }

    public void clear() {
        coefficients.clear();
    }

    /**
     * @return An unmodifiable view of the stored terms, in insertion order.
     */
    public Set<Term<V>> terms() {
        return Collections.unmodifiableSet(coefficients.keySet());
    }

    /**
     * @return An unmodifiable view of the model as a term-to-coefficient map.
     */
    public Map<Term<V>, Double> asMap() {
        return Collections.unmodifiableMap(coefficients);
    }

    @Override
    public Iterator<Map.Entry<Term<V>, Double>> iterator() {
        return asMap().entrySet().iterator();
    }

    /**
     * Returns every label referenced by at least one term, in order of first appearance.
     *
     * @return A new mutable set of the model's variables.
     */
    public Set<V> variables() {
        Set<V> variables = new LinkedHashSet<>();
        for (Term<V> term : coefficients.keySet()) {
            for (V label : term) {
                variables.add(label);
            }
        }
        return variables;
    }

    /**
     * @return The largest arity of any stored term, or 0 for an empty model.
     */
    public int degree() {
        int degree = 0;
        for (Term<V> term : coefficients.keySet()) {
            degree = Math.max(degree, term.arity());
        }
        return degree;
    }

    /**
     * Evaluates the model for an assignment: the sum over all terms of the
     * coefficient times the product of the term's variable values.
     *
     * @param assignment Values for every variable of the model.
     * @return The energy (objective value) of the assignment.
     * @throws IllegalArgumentException if a variable of the model has no value.
     */
    public double value(Map<? super V, ? extends Number> assignment) {
        double total = 0.0;
        for (Map.Entry<Term<V>, Double> entry : coefficients.entrySet()) {
            double product = entry.getValue();
            for (V label : entry.getKey()) {
                Number value = assignment.get(label);
                if (value == null) {
                    throw new IllegalArgumentException("No value assigned to variable '" + label + "'");
                }
                product *= value.doubleValue();
            }
            total += product;
        }
        return total;
    }

    /**
     * @return An independent copy of this model, of the same kind.
     */
    public EnergyModel<V> copy() {
        EnergyModel<V> copy = newEmpty();
        copy.coefficients.putAll(coefficients);
        return copy;
    }

    // ---------------------------------------------------------------------------------
    // In-place arithmetic
    // ---------------------------------------------------------------------------------

    public EnergyModel<V> addAll(EnergyModel<V> other) {
        return accumulate(other.coefficients, 1.0);
    }

    public EnergyModel<V> addAll(Map<? extends Collection<? extends V>, ? extends Number> terms) {
        return accumulate(canonicalize(terms), 1.0);
    }

    public EnergyModel<V> subtractAll(EnergyModel<V> other) {
        return accumulate(other.coefficients, -1.0);
    }

    public EnergyModel<V> subtractAll(Map<? extends Collection<? extends V>, ? extends Number> terms) {
        return accumulate(canonicalize(terms), -1.0);
    }

    /**
     * Multiplies every coefficient by a scalar in place. Multiplying by zero empties the model.
     *
     * @return this model.
     */
    public EnergyModel<V> multiplyBy(double scalar) {
        Iterator<Map.Entry<Term<V>, Double>> it = coefficients.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<Term<V>, Double> entry = it.next();
            double scaled = entry.getValue() * scalar;
            if (scaled == 0.0) {
                it.remove();
            } else {
                entry.setValue(scaled);
            }
        }
        return this;
    }

    /**
     * Divides every coefficient by a scalar in place.
     *
     * @return this model.
     * @throws IllegalArgumentException if {@code divisor} is zero.
     */
    public EnergyModel<V> divideBy(double divisor) {
        if (divisor == 0.0) {
            throw new IllegalArgumentException("Cannot divide an energy model by zero");
        }
        return multiplyBy(1.0 / divisor);
    }

    // ---------------------------------------------------------------------------------
    // Arithmetic returning a new model
    // ---------------------------------------------------------------------------------

    public EnergyModel<V> plus(EnergyModel<V> other) {
        return copy().addAll(other);
    }

    public EnergyModel<V> plus(Map<? extends Collection<? extends V>, ? extends Number> terms) {
        return copy().addAll(terms);
    }

    public EnergyModel<V> minus(EnergyModel<V> other) {
        return copy().subtractAll(other);
    }

    public EnergyModel<V> minus(Map<? extends Collection<? extends V>, ? extends Number> terms) {
        return copy().subtractAll(terms);
    }

    public EnergyModel<V> times(double scalar) {
        return copy().multiplyBy(scalar);
    }

    public EnergyModel<V> dividedBy(double divisor) {
        if (divisor == 0.0) {
            throw new IllegalArgumentException("Cannot divide an energy model by zero");
        }
        return copy().multiplyBy(1.0 / divisor);
    }

    /**
     * Converts and validates every key before anything is written, so a malformed
     * entry leaves the model untouched.
     */
    private Map<Term<V>, Double> canonicalize(Map<? extends Collection<? extends V>, ? extends Number> terms) {
        List<Map.Entry<Term<V>, Double>> converted = new ArrayList<>(terms.size());
        for (Map.Entry<? extends Collection<? extends V>, ? extends Number> entry : terms.entrySet()) {
            Term<V> term = Term.of(entry.getKey());
            validate(term);
            converted.add(Map.entry(term, entry.getValue().doubleValue()));
        }
        // Keys that differ only in label order collapse here.
        Map<Term<V>, Double> merged = new LinkedHashMap<>();
        for (Map.Entry<Term<V>, Double> entry : converted) {
            merged.merge(entry.getKey(), entry.getValue(), Double::sum);
        }
        return merged;
    }

    private EnergyModel<V> accumulate(Map<Term<V>, Double> terms, double sign) {
        for (Term<V> term : terms.keySet()) {
            validate(term);
        }
        for (Map.Entry<Term<V>, Double> entry : new ArrayList<>(terms.entrySet())) {
            add(entry.getKey(), sign * entry.getValue());
        }
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EnergyModel<?> other)) {
            return false;
        }
        return coefficients.equals(other.coefficients);
    }

    @Override
    public int hashCode() {
        return coefficients.hashCode();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + coefficients;
    }
}
