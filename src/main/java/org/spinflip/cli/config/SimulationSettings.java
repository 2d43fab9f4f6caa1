package org.spinflip.cli.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalLong;

import org.spinflip.runtime.SchedulePhase;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

/**
 * Simulation parameters read from the {@code spinflip.simulation} configuration block.
 * <p>
 * <ul>
 *   <li>{@code memory}: number of past states to retain (default 0).</li>
 *   <li>{@code seed}: optional seed applied once before the schedule.</li>
 *   <li>{@code schedule}: list of {@code { temperature, sweeps }} phases, run in order.</li>
 * </ul>
 */
public final class SimulationSettings {

    private final int memory;
    private final Long seed;
    private final List<SchedulePhase> schedule;

    public SimulationSettings(int memory, Long seed, List<SchedulePhase> schedule) {
        if (memory < 0) {
            throw new IllegalArgumentException("memory must not be negative: " + memory);
        }
        this.memory = memory;
        this.seed = seed;
        this.schedule = List.copyOf(schedule);
    }

    /**
     * Parses the settings block.
     *
     * @param config The {@code spinflip.simulation} block.
     * @return The validated settings.
     * @throws ConfigException.BadValue if a phase has a negative temperature or sweep count.
     */
    public static SimulationSettings fromConfig(Config config) {
        int memory = config.hasPath("memory") ? config.getInt("memory") : 0;
        Long seed = config.hasPath("seed") ? config.getLong("seed") : null;

        List<SchedulePhase> schedule = new ArrayList<>();
        if (config.hasPath("schedule")) {
            List<? extends Config> phases = config.getConfigList("schedule");
            for (int i = 0; i < phases.size(); i++) {
                Config phase = phases.get(i);
                try {
                    schedule.add(new SchedulePhase(phase.getDouble("temperature"), phase.getInt("sweeps")));
                } catch (IllegalArgumentException e) {
                    throw new ConfigException.BadValue(phase.origin(), "schedule[" + i + "]", e.getMessage(), e);
                }
            }
        }
        return new SimulationSettings(memory, seed, schedule);
    }

    public int getMemory() {
        return memory;
    }

    public OptionalLong getSeed() {
        return seed == null ? OptionalLong.empty() : OptionalLong.of(seed);
    }

    public List<SchedulePhase> getSchedule() {
        return Collections.unmodifiableList(schedule);
    }

    public SimulationSettings withMemory(int newMemory) {
        return new SimulationSettings(newMemory, seed, schedule);
    }

    public SimulationSettings withSeed(Long newSeed) {
        return new SimulationSettings(memory, newSeed, schedule);
    }

    /**
     * @return The total number of sweeps over all phases.
     */
    public long totalSweeps() {
        long total = 0;
        for (SchedulePhase phase : schedule) {
            total += phase.sweeps();
        }
        return total;
    }
}
