package org.ecosocial.runtime.internal.services;

import java.nio.charset.StandardCharsets;

import org.apache.commons.math3.random.Well19937c;
import org.ecosocial.runtime.spi.IRandomProvider;

/**
 * Default implementation of {@link IRandomProvider} backed by Apache Commons Math {@link Well19937c}.
 * <p>
 * Two providers created with the same seed produce identical sequences, which is what makes
 * {@code reset(seed)} repeatable. Child providers are derived with a stable hashing scheme so
 * that a sub-stream never depends on how many values the parent has already produced.
 */
public final class SeededRandomProvider implements IRandomProvider {

    private final long seed;
    private final Well19937c rng;

    /**
     * Creates a new seeded random provider.
     * @param seed The initial seed for the random number generator.
     */
    public SeededRandomProvider(long seed) {
        this.seed = seed;
        this.rng = new Well19937c(seed);
    }

    /**
     * Returns the seed this provider was created with.
     * @return the seed
     */
    public long getSeed() {
        return seed;
    }

    @Override
    public int nextInt(int bound) {
        return rng.nextInt(bound);
    }

    @Override
    public double nextDouble() {
        return rng.nextDouble();
    }

    @Override
    public IRandomProvider deriveFor(String scope, long key) {
        return new SeededRandomProvider(childSeed(seed, scope, key));
    }

    /**
     * Combines the parent seed, the scope name and the key into a child seed. Each input is
     * passed through the SplitMix64 finalizer before it is folded in, so neighbouring keys
     * yield unrelated streams.
     */
    static long childSeed(long parentSeed, String scope, long key) {
        long state = finalizeMix(parentSeed);
        state = finalizeMix(state ^ finalizeMix(fnv1a64(scope)));
        return finalizeMix(state ^ finalizeMix(key));
    }

    private static long fnv1a64(String text) {
        if (text == null) {
            return 0L;
        }
        long hash = 0xcbf29ce484222325L;
        for (byte b : text.getBytes(StandardCharsets.UTF_8)) {
            hash = (hash ^ (b & 0xFF)) * 0x100000001b3L;
        }
        return hash;
    }

    private static long finalizeMix(long value) {
        long z = (value ^ (value >>> 33)) * 0xff51afd7ed558ccdL;
        z = (z ^ (z >>> 33)) * 0xc4ceb9fe1a85ec53L;
        return z ^ (z >>> 33);
    }
}
