package org.resilience.runtime.spi;

import java.util.Random;

/**
 * Provides deterministic randomness scoped to a Simulation.
 * Implementations must be pure with respect to the provided seed and
 * support derivation of child providers for independent sub-streams.
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
     * Provides access to a {@link Random} view of this provider for APIs that require it
     * (e.g., shuffling). Draws through the view advance this provider's stream.
     *
     * @return the Random instance
     */
    Random asJavaRandom();

    /**
     * Creates a derived provider that is deterministically based on this provider and the given scope/key.
     *
     * @param scope a stable, descriptive scope name (e.g., "plugin")
     * @param key a stable numeric key (e.g., plugin index)
     * @return a derived random provider
     */
    IRandomProvider deriveFor(String scope, long key);
}
