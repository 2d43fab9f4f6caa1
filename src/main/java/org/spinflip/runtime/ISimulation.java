package org.spinflip.runtime;

import java.util.List;
import java.util.Map;

import org.spinflip.model.VariableDomain;
import org.spinflip.runtime.spi.IFlipListener;

/**
 * Metropolis simulation of an energy model over one variable domain.
 * <p>
 * All state exchanged through this interface is expressed in {@link #getDomain()}.
 * Every returned map or list is a fresh copy that the caller may modify freely.
 * Calls are synchronous and either complete fully or fail before changing anything.
 *
 * @param <V> The variable label type.
 */
public interface ISimulation<V> {

    VariableDomain getDomain();

    /**
     * @return The simulated variables, in sampling order.
     */
    List<V> getVariables();

    /**
     * @return The number of past states retained by the simulation.
     */
    int getMemory();

    Map<V, Integer> getState();

    Map<V, Integer> getInitialState();

    /**
     * Replaces the current state. The history is not touched.
     *
     * @throws InvalidStateValueException if a variable is missing or a value is outside the domain.
     */
    void setState(Map<V, Integer> state);

    /**
     * @return The energy (objective value) of the current state.
     */
    double energy();

    /**
     * Runs one sweep at the given temperature.
     */
    default void update(double temperature) {
        update(temperature, 1);
    }

    /**
     * Runs {@code sweeps} sweeps at the given temperature.
     *
     * @throws InvalidScheduleEntryException if the temperature is negative or NaN.
     * @throws InvalidUpdateCountException if {@code sweeps} is negative.
     */
    void update(double temperature, int sweeps);

    /**
     * Reseeds the random source, then runs {@code sweeps} sweeps at the given temperature.
     */
    void update(double temperature, int sweeps, long seed);

    /**
     * Runs every phase of the schedule in order.
     */
    void scheduleUpdate(List<SchedulePhase> schedule);

    /**
     * Reseeds the random source once, then runs every phase of the schedule in order.
     */
    void scheduleUpdate(List<SchedulePhase> schedule, long seed);

    /**
     * Restores the initial state and clears the history.
     */
    void reset();

    /**
     * @return Up to {@link #getMemory()} past states followed by the current state, oldest first.
     */
    List<Map<V, Integer>> getPastStates();

    /**
     * Returns the most recent states, ending with the current one.
     *
     * @param count The number of states to return, including the current state. At least 1.
     * @return Up to {@code count} states, oldest first.
     */
    List<Map<V, Integer>> getPastStates(int count);

    void addFlipListener(IFlipListener<V> listener);
}
