package org.spinflip.runtime;

/**
 * Thrown when a negative number of sweeps is requested.
 * <p>
 * Indicates a programming error in the caller. It is raised before the simulation
 * is modified, so the simulation remains usable.
 */
public class InvalidUpdateCountException extends IllegalArgumentException {

    /**
     * Creates a InvalidUpdateCountException with the specified message.
     *
     * @param message Description of the rejected argument
     */
    public InvalidUpdateCountException(String message) {
        super(message);
    }
}
