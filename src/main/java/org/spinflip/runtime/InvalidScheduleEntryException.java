package org.spinflip.runtime;

/**
 * Thrown when a temperature is negative or not a number.
 * <p>
 * Indicates a programming error in the caller. It is raised before the simulation
 * is modified, so the simulation remains usable.
 */
public class InvalidScheduleEntryException extends IllegalArgumentException {

    /**
     * Creates a InvalidScheduleEntryException with the specified message.
     *
     * @param message Description of the rejected argument
     */
    public InvalidScheduleEntryException(String message) {
        super(message);
    }
}
