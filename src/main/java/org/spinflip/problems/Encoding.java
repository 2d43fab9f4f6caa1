package org.spinflip.problems;

import java.util.Map;

import org.spinflip.model.EnergyModel;
import org.spinflip.model.VariableDomain;
import org.spinflip.runtime.BooleanSimulation;
import org.spinflip.runtime.ISimulation;
import org.spinflip.runtime.SpinSimulation;
import org.spinflip.runtime.spi.IRandomProvider;

/**
 * The energy model a problem encoder produces.
 * <p>
 * The problem's objective for an assignment {@code x} is {@code model.value(x) + offset}.
 *
 * @param model The model, over variables of {@code domain}.
 * @param offset The constant part of the objective.
 * @param domain The domain of the model's variables.
 * @param <V> The variable label type.
 */
public record Encoding<V>(EnergyModel<V> model, double offset, VariableDomain domain) {

    /**
     * Evaluates the problem objective for an assignment in this encoding's domain.
     */
    public double objective(Map<V, Integer> assignment) {
        return model.value(assignment) + offset;
    }

    /**
     * Creates a simulation of the model in its own domain, starting from the default state.
     *
     * @param memory The number of past states to retain.
     * @param randomProvider The random source for the simulation.
     * @return A spin or Boolean simulation, matching {@link #domain()}.
     */
    public ISimulation<V> newSimulation(int memory, IRandomProvider randomProvider) {
        return switch (domain) {
            case SPIN -> new SpinSimulation<>(model, null, memory, randomProvider);
            case BOOLEAN -> new BooleanSimulation<>(model, null, memory, randomProvider);
        };
    }
}
