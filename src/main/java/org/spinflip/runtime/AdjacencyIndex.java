package org.spinflip.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.spinflip.model.EnergyModel;
import org.spinflip.model.Term;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;

/**
 * Maps every variable to the terms of one {@link EnergyModel} that reference it.
 * <p>
 * Built once in O(total term arity). Afterwards the energy change of flipping a
 * variable is computed from its incident terms only, in O(local degree).
 * <p>
 * The index is a snapshot: mutating the source model after construction leaves the
 * index stale. Rebuild it to reflect a changed model.
 *
 * @param <V> The variable label type.
 */
public final class AdjacencyIndex<V> {

    /**
     * One term incident to a variable.
     *
     * @param term The term.
     * @param coefficient The coefficient of the term in the source model.
     * @param <V> The variable label type.
     */
    public record IncidentTerm<V>(Term<V> term, double coefficient) {}

    private final VariableIndex<V> variables;
    private final List<List<IncidentTerm<V>>> incident;
    // Compiled form for the sweep loop: variable -> incident term -> member variable indices.
    private final int[][][] termMembers;
    private final double[][] termCoefficients;

    /**
     * Builds the index for all variables of {@code variables}.
     *
     * @param model The source model. Every label it references must be in {@code variables}.
     * @param variables The variable indexing shared with the simulation state.
     * @throws IllegalArgumentException if the model references an unindexed variable.
     */
    public AdjacencyIndex(EnergyModel<V> model, VariableIndex<V> variables) {
        this.variables = variables;
        int n = variables.size();
        List<ObjectArrayList<int[]>> members = new ArrayList<>(n);
        List<DoubleArrayList> coefficients = new ArrayList<>(n);
        List<List<IncidentTerm<V>>> terms = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            members.add(new ObjectArrayList<>());
            coefficients.add(new DoubleArrayList());
            terms.add(new ArrayList<>());
        }

        for (Map.Entry<Term<V>, Double> entry : model) {
            Term<V> term = entry.getKey();
            double coefficient = entry.getValue();
            int[] indices = new int[term.arity()];
            int k = 0;
            for (V label : term) {
                int index = variables.indexOf(label);
                if (index < 0) {
                    throw new IllegalArgumentException("Model references unindexed variable '" + label + "'");
                }
                indices[k++] = index;
            }
            IncidentTerm<V> incidentTerm = new IncidentTerm<>(term, coefficient);
            for (int index : indices) {
                members.get(index).add(indices);
                coefficients.get(index).add(coefficient);
                terms.get(index).add(incidentTerm);
            }
        }

        this.termMembers = new int[n][][];
        this.termCoefficients = new double[n][];
        this.incident = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            termMembers[i] = members.get(i).toArray(new int[0][]);
            termCoefficients[i] = coefficients.get(i).toDoubleArray();
            incident.add(Collections.unmodifiableList(terms.get(i)));
        }
    }

    /**
     * Convenience constructor indexing exactly the variables of the model.
     */
    public static <V> AdjacencyIndex<V> build(EnergyModel<V> model) {
        return new AdjacencyIndex<>(model, new VariableIndex<>(model.variables()));
    }

    public VariableIndex<V> variables() {
        return variables;
    }

    /**
     * @return The terms referencing the label, or an empty list for an unknown label.
     */
    public List<IncidentTerm<V>> incidentTerms(V label) {
        int index = variables.indexOf(label);
        return index < 0 ? List.of() : incident.get(index);
    }

    public int degree(int index) {
        return termCoefficients[index].length;
    }

    /**
     * Sums coefficient times product of current values over the incident terms of a variable.
     *
     * @param index The variable index.
     * @param spins Current spins in variable index order.
     * @return The contribution of the variable's terms to the total energy.
     */
    public double localEnergy(int index, int[] spins) {
        int[][] members = termMembers[index];
        double[] coefficients = termCoefficients[index];
        double local = 0.0;
        for (int t = 0; t < coefficients.length; t++) {
            int sign = 1;
            for (int member : members[t]) {
                sign *= spins[member];
            }
            local += coefficients[t] * sign;
        }
        return local;
    }

    /**
     * Energy change caused by flipping one variable. Every incident term changes sign
     * exactly once because labels within a term are distinct.
     */
    public double flipDelta(int index, int[] spins) {
        return -2.0 * localEnergy(index, spins);
    }
}
