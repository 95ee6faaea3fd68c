package org.resilience.runtime.internal.services;

import java.nio.charset.StandardCharsets;
import java.util.Random;

import org.apache.commons.math3.random.RandomAdaptor;
import org.apache.commons.math3.random.Well19937c;
import org.resilience.runtime.spi.IRandomProvider;

/**
 * Default implementation of {@link IRandomProvider} backed by Apache Commons Math {@link Well19937c}.
 * <p>
 * Two providers created with the same seed produce identical streams, which makes whole runs
 * reproducible. Child providers are derived with a stable hashing scheme.
 */
public final class SeededRandomProvider implements IRandomProvider {

    private final long seed;
    private final Well19937c rng;
    private final Random javaRandom;

    /**
     * Creates a new seeded random provider.
     * @param seed The initial seed for the random number generator.
     */
    public SeededRandomProvider(long seed) {
        this.seed = seed;
        this.rng = new Well19937c(seed);
        this.javaRandom = new RandomAdaptor(rng);
    }

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
    public Random asJavaRandom() {
        return javaRandom;
    }

    @Override
    public IRandomProvider deriveFor(String scope, long key) {
        long h = mix64(seed);
        h = mix64(h ^ mix64(hashString(scope)));
        h = mix64(h ^ mix64(key));
        return new SeededRandomProvider(h);
    }

    /**
     * Hashes a string using the FNV-1a 64-bit algorithm.
     * @param s The string to hash.
     * @return The hashed value.
     */
    private static long hashString(String s) {
        if (s == null) return 0L;
        byte[] b = s.getBytes(StandardCharsets.UTF_8);
        long h = 1469598103934665603L; // FNV-1a 64-bit offset basis
        for (byte value : b) {
            h ^= (value & 0xFF);
            h *= 1099511628211L; // FNV-1a prime
        }
        return h;
    }

    /**
     * A SplitMix64 mix function for good bit diffusion.
     * @param z The value to mix.
     * @return The mixed value.
     */
    private static long mix64(long z) {
        z = (z ^ (z >>> 33)) * 0xff51afd7ed558ccdL;
        z = (z ^ (z >>> 33)) * 0xc4ceb9fe1a85ec53L;
        return z ^ (z >>> 33);
    }
}
