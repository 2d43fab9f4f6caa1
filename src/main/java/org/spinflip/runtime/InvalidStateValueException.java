package org.spinflip.runtime;

/**
 * Thrown when an assignment is missing a variable or holds a value outside the variable domain.
 * <p>
 * Indicates a programming error in the caller. It is raised before the simulation
 * is modified, so the simulation remains usable.
 */
public class InvalidStateValueException extends IllegalArgumentException {

    /**
     * Creates a InvalidStateValueException with the specified message.
     *
     * @param message Description of the rejected argument
     */
    public InvalidStateValueException(String message) {
        super(message);
    }
}
