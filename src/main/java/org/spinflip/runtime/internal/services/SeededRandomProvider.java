package org.spinflip.runtime.internal.services;

import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

import org.spinflip.runtime.spi.IRandomProvider;

/**
 * {@link IRandomProvider} backed by a {@link java.util.Random} seeded explicitly.
 * <p>
 * Two providers created with the same seed produce identical streams.
 * <p>
 * Thread Safety: Not thread-safe. Use one provider per simulation.
 */
public class SeededRandomProvider implements IRandomProvider {

    private final Random random;
    private long seed;

    /**
     * Creates a provider seeded with the given value.
     *
     * @param seed the seed
     */
    public SeededRandomProvider(long seed) {
        this.seed = seed;
        this.random = new Random(seed);
    }

    /**
     * Creates a provider with an arbitrary seed, for simulations that are never seeded explicitly.
     *
     * @return a new provider
     */
    public static SeededRandomProvider unseeded() {
        return new SeededRandomProvider(ThreadLocalRandom.current().nextLong());
    }

    @Override
    public int nextInt(int bound) {
        return random.nextInt(bound);
    }

    @Override
    public double nextDouble() {
        return random.nextDouble();
    }

    @Override
    public void reseed(long seed) {
        this.seed = seed;
        this.random.setSeed(seed);
    }

    public long getSeed() {
        return seed;
    }
}
