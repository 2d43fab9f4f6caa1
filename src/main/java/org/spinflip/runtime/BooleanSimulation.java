package org.spinflip.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.spinflip.model.DomainConversions;
import org.spinflip.model.EnergyModel;
import org.spinflip.model.VariableDomain;
import org.spinflip.runtime.internal.services.SeededRandomProvider;
import org.spinflip.runtime.spi.IFlipListener;
import org.spinflip.runtime.spi.IRandomProvider;

/**
 * Simulates a Boolean model by running a {@link SpinSimulation} on its spin equivalent.
 * <p>
 * The Boolean model is rewritten once at construction with {@code b = (1 - s) / 2}.
 * All simulation logic is delegated; this class only translates states at the
 * boundary with {@code boolean = (1 - spin) / 2} and holds no Boolean state itself.
 * Boolean {@code 0} corresponds to spin {@code +1}, so the default initial state
 * (all zeros) is the engine's default (all {@code +1}).
 *
 * @param <V> The variable label type.
 */
public class BooleanSimulation<V> implements ISimulation<V> {

    private final SpinSimulation<V> engine;
    private final double offset;

    /**
     * Creates a simulation starting with every variable at 0 and no history.
     *
     * @param model The Boolean model to simulate.
     */
    public BooleanSimulation(EnergyModel<V> model) {
        this(model, null, 0);
    }

    public BooleanSimulation(EnergyModel<V> model, Map<V, Integer> initialState, int memory) {
        this(model, initialState, memory, SeededRandomProvider.unseeded());
    }

    /**
     * Creates a simulation.
     *
     * @param model The Boolean model to simulate. It must not be mutated afterwards.
     * @param initialState Initial values in {0, 1} for every model variable, or {@code null} for all 0.
     * @param memory The number of past states to retain, at least 0.
     * @param randomProvider The random source owned by this simulation.
     * @throws InvalidStateValueException if the initial state misses a variable or holds a value other than 0 or 1.
     */
    public BooleanSimulation(EnergyModel<V> model, Map<V, Integer> initialState, int memory,
                             IRandomProvider randomProvider) {
        DomainConversions.Converted<V> converted = DomainConversions.booleanToSpin(model);
        this.offset = converted.offset();

        VariableIndex<V> booleanVariables = new VariableIndex<>(model.variables());
        int[] spins = initialState == null
                ? SimulationState.allUp(booleanVariables).copySpins()
                : SimulationState.encode(booleanVariables, initialState, VariableDomain.BOOLEAN);

        this.engine = new SpinSimulation<>(converted.model(),
                SimulationState.decode(booleanVariables, spins, VariableDomain.SPIN), memory, randomProvider);
    }

    @Override
    public VariableDomain getDomain() {
        return VariableDomain.BOOLEAN;
    }

    /**
     * @return The spin simulation doing the actual work.
     */
    public SpinSimulation<V> getSpinSimulation() {
        return engine;
    }

    /**
     * @return The constant split off the model by the conversion to spins.
     */
    public double getOffset() {
        return offset;
    }

    @Override
    public List<V> getVariables() {
        return engine.getVariables();
    }

    @Override
    public int getMemory() {
        return engine.getMemory();
    }

    @Override
    public Map<V, Integer> getState() {
        return toBoolean(engine.getState());
    }

    @Override
    public Map<V, Integer> getInitialState() {
        return toBoolean(engine.getInitialState());
    }

    @Override
    public void setState(Map<V, Integer> state) {
        VariableIndex<V> index = new VariableIndex<>(engine.getVariables());
        int[] spins = SimulationState.encode(index, state, VariableDomain.BOOLEAN);
        engine.setState(SimulationState.decode(index, spins, VariableDomain.SPIN));
    }

    /**
     * @return The Boolean objective value of the current state.
     */
    @Override
    public double energy() {
        return engine.energy() + offset;
    }

    @Override
    public void update(double temperature, int sweeps) {
        engine.update(temperature, sweeps);
    }

    @Override
    public void update(double temperature, int sweeps, long seed) {
        engine.update(temperature, sweeps, seed);
    }

    @Override
    public void scheduleUpdate(List<SchedulePhase> schedule) {
        engine.scheduleUpdate(schedule);
    }

    @Override
    public void scheduleUpdate(List<SchedulePhase> schedule, long seed) {
        engine.scheduleUpdate(schedule, seed);
    }

    @Override
    public void reset() {
        engine.reset();
    }

    @Override
    public List<Map<V, Integer>> getPastStates() {
        return toBoolean(engine.getPastStates());
    }

    @Override
    public List<Map<V, Integer>> getPastStates(int count) {
        return toBoolean(engine.getPastStates(count));
    }

    /**
     * Flip deltas are reported in spin energy, which differs from the Boolean
     * objective only by a constant, so they equal the Boolean energy changes.
     */
    @Override
    public void addFlipListener(IFlipListener<V> listener) {
        engine.addFlipListener(listener);
    }

    private List<Map<V, Integer>> toBoolean(List<Map<V, Integer>> spinStates) {
        List<Map<V, Integer>> states = new ArrayList<>(spinStates.size());
        for (Map<V, Integer> spinState : spinStates) {
            states.add(toBoolean(spinState));
        }
        return states;
    }

    private Map<V, Integer> toBoolean(Map<V, Integer> spinState) {
        spinState.replaceAll((label, spin) -> VariableDomain.BOOLEAN.fromSpin(spin));
        return spinState;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(memory=" + engine.getMemory() + ")";
    }
}
