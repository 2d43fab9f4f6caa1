package org.spinflip.model;

/**
 * The value domains a model variable can live in, together with the mapping of
 * each domain onto the bipolar (spin) representation used by the simulation engine.
 * <p>
 * The two domains are related by {@code boolean = (1 - spin) / 2}, so spin {@code +1}
 * corresponds to Boolean {@code 0} and spin {@code -1} to Boolean {@code 1}.
 */
public enum VariableDomain {

    /** Bipolar values {@code -1} and {@code +1}. */
    SPIN {
        @Override
        public boolean isValid(int value) {
            return value == 1 || value == -1;
        }

        @Override
        public int toSpin(int value) {
            return value;
        }

        @Override
        public int fromSpin(int spin) {
            return spin;
        }
    },

    /** Boolean values {@code 0} and {@code 1}. */
    BOOLEAN {
        @Override
        public boolean isValid(int value) {
            return value == 0 || value == 1;
        }

        @Override
        public int toSpin(int value) {
            return 1 - 2 * value;
        }

        @Override
        public int fromSpin(int spin) {
            return (1 - spin) / 2;
        }
    };

    /**
     * Checks whether a value belongs to this domain.
     *
     * @param value The value to check.
     * @return {@code true} if the value is a member of the domain.
     */
    public abstract boolean isValid(int value);

    /**
     * Encodes a value of this domain as a spin.
     *
     * @param value A valid value of this domain.
     * @return The corresponding spin, {@code -1} or {@code +1}.
     */
    public abstract int toSpin(int value);

    /**
     * Decodes a spin into this domain.
     *
     * @param spin A spin value, {@code -1} or {@code +1}.
     * @return The corresponding value of this domain.
     */
    public abstract int fromSpin(int spin);
}
