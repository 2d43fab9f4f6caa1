package org.spinflip.runtime;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import org.spinflip.model.VariableDomain;

/**
 * The current assignment of every simulated variable, always stored as spins.
 * <p>
 * Total coverage: every variable of the {@link VariableIndex} has exactly one value
 * in {-1, +1}. Values are kept in an int array addressed by variable index so the
 * sweep loop never touches a map.
 *
 * @param <V> The variable label type.
 */
public final class SimulationState<V> {

    private final VariableIndex<V> variables;
    private final int[] spins;

    private SimulationState(VariableIndex<V> variables, int[] spins) {
        this.variables = variables;
        this.spins = spins;
    }

    /**
     * Creates a state with every variable set to {@code +1}.
     */
    public static <V> SimulationState<V> allUp(VariableIndex<V> variables) {
        int[] spins = new int[variables.size()];
        Arrays.fill(spins, 1);
        return new SimulationState<>(variables, spins);
    }

    /**
     * Creates a state from an assignment given in some domain.
     *
     * @param variables The variables to cover.
     * @param assignment Values for every variable; additional labels are ignored.
     * @param domain The domain the assignment values are expressed in.
     * @throws InvalidStateValueException if a variable is missing or a value is outside the domain.
     */
    public static <V> SimulationState<V> of(VariableIndex<V> variables, Map<? super V, Integer> assignment,
                                            VariableDomain domain) {
        return new SimulationState<>(variables, encode(variables, assignment, domain));
    }

    /**
     * Validates an assignment and encodes it as a spin array in index order.
     *
     * @throws InvalidStateValueException if a variable is missing or a value is outside the domain.
     */
    static <V> int[] encode(VariableIndex<V> variables, Map<? super V, Integer> assignment, VariableDomain domain) {
        int[] spins = new int[variables.size()];
        for (int i = 0; i < spins.length; i++) {
            V label = variables.label(i);
            Integer value = assignment.get(label);
            if (value == null) {
                throw new InvalidStateValueException("No value assigned to variable '" + label + "'");
            }
            if (!domain.isValid(value)) {
                throw new InvalidStateValueException(
                        "Value " + value + " of variable '" + label + "' is not in the " + domain + " domain");
            }
            spins[i] = domain.toSpin(value);
        }
        return spins;
    }

    public int size() {
        return spins.length;
    }

    public int spin(int index) {
        return spins[index];
    }

    /**
     * @throws IllegalArgumentException if the label is not a simulated variable.
     */
    public int spin(V label) {
        return spins[requireIndex(label)];
    }

    public void flip(int index) {
        spins[index] = -spins[index];
    }

    /**
     * @throws IllegalArgumentException if the label is not a simulated variable.
     */
    public void flip(V label) {
        flip(requireIndex(label));
    }

    /**
     * Overwrites every value with the given spins.
     */
    void assign(int[] source) {
        System.arraycopy(source, 0, spins, 0, spins.length);
    }

    /**
     * Direct access for the sweep loop. Callers must not modify the array.
     */
    int[] spins() {
        return spins;
    }

    public int[] copySpins() {
        return spins.clone();
    }

    /**
     * @return An independent copy of this state.
     */
    public SimulationState<V> snapshot() {
        return new SimulationState<>(variables, spins.clone());
    }

    /**
     * Decodes the state into a label-to-value map.
     *
     * @param domain The domain to express values in.
     * @return A new map in variable index order.
     */
    public Map<V, Integer> toMap(VariableDomain domain) {
        return decode(variables, spins, domain);
    }

    static <V> Map<V, Integer> decode(VariableIndex<V> variables, int[] spins, VariableDomain domain) {
        Map<V, Integer> map = new LinkedHashMap<>(spins.length * 2);
        for (int i = 0; i < spins.length; i++) {
            map.put(variables.label(i), domain.fromSpin(spins[i]));
        }
        return map;
    }

    private int requireIndex(V label) {
        int index = variables.indexOf(label);
        if (index < 0) {
            throw new IllegalArgumentException("Unknown variable '" + label + "'");
        }
        return index;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SimulationState<?> other)) {
            return false;
        }
        return variables.labels().equals(other.variables.labels()) && Arrays.equals(spins, other.spins);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(spins);
    }

    @Override
    public String toString() {
        return toMap(VariableDomain.SPIN).toString();
    }
}
