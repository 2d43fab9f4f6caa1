package org.spinflip.model;

import java.util.Collection;
import java.util.Map;

/**
 * An {@link EnergyModel} restricted to single-variable terms, i.e. a per-variable
 * bias. Writing a term of any other arity fails with {@link InvalidTermException}.
 *
 * @param <V> The variable label type.
 */
public class IsingField<V> extends EnergyModel<V> {

    public IsingField() {
    }

    public IsingField(Map<? extends Collection<? extends V>, ? extends Number> terms) {
        super(terms);
    }

    @Override
    protected void validate(Term<V> term) {
        if (term.arity() != 1) {
            throw new InvalidTermException("A field term must contain exactly one variable: " + term);
        }
    }

    @Override
    protected EnergyModel<V> newEmpty() {
        return new IsingField<>();
    }

    public void set(V label, double coefficient) {
        set(Term.of(label), coefficient);
    }

    public double get(V label) {
        return get(Term.of(label));
    }

    public void add(V label, double amount) {
        add(Term.of(label), amount);
    }
}
