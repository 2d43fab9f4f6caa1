package org.spinflip.runtime;

/**
 * One phase of an annealing schedule: run {@code sweeps} sweeps at {@code temperature}.
 *
 * @param temperature The temperature, at least 0.
 * @param sweeps The number of sweeps, at least 0.
 */
public record SchedulePhase(double temperature, int sweeps) {

    /**
     * @throws InvalidScheduleEntryException if the temperature is negative or NaN.
     * @throws InvalidUpdateCountException if the sweep count is negative.
     */
    public SchedulePhase {
        requireValidTemperature(temperature);
        requireValidSweeps(sweeps);
    }

    public static SchedulePhase of(double temperature, int sweeps) {
        return new SchedulePhase(temperature, sweeps);
    }

    static void requireValidTemperature(double temperature) {
        if (Double.isNaN(temperature) || temperature < 0.0) {
            throw new InvalidScheduleEntryException("Temperature must be non-negative, got " + temperature);
        }
    }

    static void requireValidSweeps(int sweeps) {
        if (sweeps < 0) {
            throw new InvalidUpdateCountException("Cannot update a negative number of times: " + sweeps);
        }
    }
}
