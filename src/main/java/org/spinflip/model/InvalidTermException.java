package org.spinflip.model;

/**
 * Thrown when a term cannot be stored in an {@link EnergyModel}.
 * <p>
 * Raised for empty terms, terms that list the same label more than once, and
 * terms whose arity is not accepted by a specialized model such as
 * {@link IsingCoupling} or {@link IsingField}. The model is never modified when
 * this exception is thrown.
 */
public class InvalidTermException extends IllegalArgumentException {

    /**
     * Creates an InvalidTermException with the specified message.
     *
     * @param message Description of the malformed term
     */
    public InvalidTermException(String message) {
        super(message);
    }
}
