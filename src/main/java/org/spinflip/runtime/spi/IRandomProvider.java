package org.spinflip.runtime.spi;

/**
 * Provides deterministic randomness scoped to a single simulation.
 * Implementations should be pure with respect to the provided seed.
 * <p>
 * Each simulation owns its provider, so reseeding one simulation never affects
 * another one running in the same process.
 * </p>
 */
public interface IRandomProvider {

    /**
     * Returns a random integer in the range [0, bound).
     *
     * @param bound exclusive upper bound, must be > 0
     * @return the random int
     */
    int nextInt(int bound);

    /**
     * Returns a random double in the range [0.0, 1.0).
     *
     * @return the random double
     */
    double nextDouble();

    /**
     * Restarts the random stream deterministically from the given seed.
     *
     * @param seed the new seed
     */
    void reseed(long seed);
}
