package org.spinflip.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.spinflip.model.EnergyModel;
import org.spinflip.model.VariableDomain;
import org.spinflip.runtime.internal.services.SeededRandomProvider;
import org.spinflip.runtime.spi.IFlipListener;
import org.spinflip.runtime.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Simulates a spin model with Metropolis dynamics.
 * <p>
 * The model is indexed once at construction. Each sweep draws, with replacement, as
 * many variables as the model has and evaluates a flip for each of them in draw
 * order. A flip is accepted if it does not increase the energy, or, at a positive
 * temperature {@code T}, with probability {@code exp(-delta / T)}. At {@code T = 0}
 * the dynamics are a greedy descent.
 * <p>
 * Before every sweep the current state is appended to a bounded history of the most
 * recent {@code memory} states.
 * <p>
 * Thread Safety: Not thread-safe. The simulation owns its state, history and random
 * provider; the model may be shared by several simulations as long as nobody mutates it.
 *
 * @param <V> The variable label type.
 */
public class SpinSimulation<V> implements ISimulation<V> {

    private static final Logger LOG = LoggerFactory.getLogger(SpinSimulation.class);

    private final EnergyModel<V> model;
    private final VariableIndex<V> variables;
    private final AdjacencyIndex<V> adjacency;
    private final int[] initialSpins;
    private final SimulationState<V> state;
    private final StateHistory history;
    private final List<IFlipListener<V>> flipListeners = new ArrayList<>();
    private final int[] draws;
    private IRandomProvider randomProvider;

    /**
     * Creates a simulation starting with every spin at {@code +1} and no history.
     *
     * @param model The spin model to simulate.
     */
    public SpinSimulation(EnergyModel<V> model) {
        this(model, null, 0);
    }

    /**
     * Creates a simulation with an unseeded random provider.
     *
     * @param model The spin model to simulate.
     * @param initialState Initial spins for every model variable, or {@code null} for all {@code +1}.
     * @param memory The number of past states to retain, at least 0.
     */
    public SpinSimulation(EnergyModel<V> model, Map<V, Integer> initialState, int memory) {
        this(model, initialState, memory, SeededRandomProvider.unseeded());
    }

    /**
     * Creates a simulation.
     * <p>
     * The simulated variables are the model's variables in order of first appearance.
     * Labels of {@code initialState} that the model does not reference are ignored.
     *
     * @param model The spin model to simulate. It must not be mutated afterwards.
     * @param initialState Initial spins for every model variable, or {@code null} for all {@code +1}.
     * @param memory The number of past states to retain, at least 0.
     * @param randomProvider The random source owned by this simulation.
     * @throws InvalidStateValueException if the initial state misses a variable or holds a value other than ±1.
     * @throws IllegalArgumentException if {@code memory} is negative.
     */
    public SpinSimulation(EnergyModel<V> model, Map<V, Integer> initialState, int memory,
                          IRandomProvider randomProvider) {
        this.model = model;
        this.history = new StateHistory(memory);
        this.randomProvider = randomProvider;

        this.variables = new VariableIndex<>(model.variables());
        this.state = initialState == null
                ? SimulationState.allUp(variables)
                : SimulationState.of(variables, initialState, VariableDomain.SPIN);
        this.initialSpins = state.copySpins();
        this.adjacency = new AdjacencyIndex<>(model, variables);
        this.draws = new int[variables.size()];

        LOG.debug("Indexed {} terms over {} variables (memory={})", model.size(), variables.size(), memory);
    }

    @Override
    public VariableDomain getDomain() {
        return VariableDomain.SPIN;
    }

    @Override
    public List<V> getVariables() {
        return new ArrayList<>(variables.labels());
    }

    @Override
    public int getMemory() {
        return history.capacity();
    }

    @Override
    public Map<V, Integer> getState() {
        return state.toMap(VariableDomain.SPIN);
    }

    @Override
    public Map<V, Integer> getInitialState() {
        return SimulationState.decode(variables, initialSpins, VariableDomain.SPIN);
    }

    @Override
    public void setState(Map<V, Integer> newState) {
        state.assign(SimulationState.encode(variables, newState, VariableDomain.SPIN));
    }

    @Override
    public double energy() {
        return model.value(getState());
    }

    @Override
    public void addFlipListener(IFlipListener<V> listener) {
        flipListeners.add(listener);
    }

    /**
     * @return An unmodifiable view of the registered flip listeners.
     */
    public List<IFlipListener<V>> getFlipListeners() {
        return Collections.unmodifiableList(flipListeners);
    }

    @Override
    public void update(double temperature, int sweeps) {
        runUpdate(temperature, sweeps, null);
    }

    @Override
    public void update(double temperature, int sweeps, long seed) {
        runUpdate(temperature, sweeps, seed);
    }

    @Override
    public void scheduleUpdate(List<SchedulePhase> schedule) {
        runSchedule(schedule, null);
    }

    @Override
    public void scheduleUpdate(List<SchedulePhase> schedule, long seed) {
        runSchedule(schedule, seed);
    }

    @Override
    public void reset() {
        history.clear();
        state.assign(initialSpins);
    }

    /**
     * {@inheritDoc}
     * <p>
     * Every retained snapshot is returned, i.e. up to {@code memory} past states.
     */
    @Override
    public List<Map<V, Integer>> getPastStates() {
        return pastStates(history.capacity());
    }

    /**
     * {@inheritDoc}
     * <p>
     * A count of 1 returns only the current state without consulting the history.
     *
     * @throws IllegalArgumentException if {@code count} is less than 1.
     */
    @Override
    public List<Map<V, Integer>> getPastStates(int count) {
        if (count < 1) {
            throw new IllegalArgumentException("Number of states must be at least 1, got " + count);
        }
        return pastStates(count - 1);
    }

    private List<Map<V, Integer>> pastStates(int snapshots) {
        List<Map<V, Integer>> states = new ArrayList<>();
        for (int[] snapshot : history.recent(snapshots)) {
            states.add(SimulationState.decode(variables, snapshot, VariableDomain.SPIN));
        }
        states.add(getState());
        return states;
    }

    private void runSchedule(List<SchedulePhase> schedule, Long seed) {
        for (SchedulePhase phase : schedule) {
            if (phase == null) {
                throw new InvalidScheduleEntryException("Schedule contains a null phase");
            }
        }
        if (seed != null) {
            randomProvider.reseed(seed);
        }
        for (SchedulePhase phase : schedule) {
            runUpdate(phase.temperature(), phase.sweeps(), null);
        }
    }

    private void runUpdate(double temperature, int sweeps, Long seed) {
        SchedulePhase.requireValidSweeps(sweeps);
        SchedulePhase.requireValidTemperature(temperature);
        if (seed != null) {
            randomProvider.reseed(seed);
        }

        long accepted = 0;
        for (int s = 0; s < sweeps; s++) {
            if (history.isRecording()) {
                history.record(state.copySpins());
            }
            accepted += sweep(temperature);
        }
        LOG.debug("Ran {} sweep(s) at temperature {}: {} flip(s) accepted", sweeps, temperature, accepted);
    }

    /**
     * Performs one sweep and returns the number of accepted flips.
     */
    private int sweep(double temperature) {
        int n = draws.length;
        if (n == 0) {
            return 0;
        }
        // Draw the whole sweep up front: sampling with replacement, not a permutation.
        for (int k = 0; k < n; k++) {
            draws[k] = randomProvider.nextInt(n);
        }

        int[] spins = state.spins();
        int accepted = 0;
        for (int k = 0; k < n; k++) {
            int i = draws[k];
            double delta = adjacency.flipDelta(i, spins);
            if (delta <= 0.0 || (temperature > 0.0 && randomProvider.nextDouble() < Math.exp(-delta / temperature))) {
                state.flip(i);
                accepted++;
                if (!flipListeners.isEmpty()) {
                    notifyFlip(variables.label(i), delta, temperature);
                }
            }
        }
        return accepted;
    }

    private void notifyFlip(V label, double delta, double temperature) {
        for (IFlipListener<V> listener : flipListeners) {
            try {
                listener.onFlipAccepted(label, delta, temperature);
            } catch (RuntimeException e) {
                LOG.warn("Flip listener {} failed for variable '{}': {}",
                        listener.getClass().getSimpleName(), label, e.getMessage());
            }
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(memory=" + history.capacity() + ")";
    }
}
