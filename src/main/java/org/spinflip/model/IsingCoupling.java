package org.spinflip.model;

import java.util.Collection;
import java.util.Map;

/**
 * An {@link EnergyModel} restricted to pairwise couplings between two different
 * variables. The coupling {@code (a, b)} and {@code (b, a)} address the same entry.
 *
 * @param <V> The variable label type.
 */
public class IsingCoupling<V> extends EnergyModel<V> {

    public IsingCoupling() {
    }

    public IsingCoupling(Map<? extends Collection<? extends V>, ? extends Number> terms) {
        super(terms);
    }

    @Override
    protected void validate(Term<V> term) {
        if (term.arity() != 2) {
            throw new InvalidTermException("A coupling must contain exactly two different variables: " + term);
        }
    }

    @Override
    protected EnergyModel<V> newEmpty() {
        return new IsingCoupling<>();
    }

    public void set(V first, V second, double coefficient) {
        set(pair(first, second), coefficient);
    }

    public double get(V first, V second) {
        return get(pair(first, second));
    }

    public void add(V first, V second, double amount) {
        add(pair(first, second), amount);
    }

    private static <V> Term<V> pair(V first, V second) {
        if (first != null && first.equals(second)) {
            throw new InvalidTermException("Cannot couple variable '" + first + "' to itself");
        }
        return Term.of(first, second);
    }
}
