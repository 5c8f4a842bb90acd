package org.ecosocial.runtime.spi;

/**
 * Provides deterministic randomness scoped to a simulation episode.
 * Implementations should be pure with respect to the provided seed and
 * support derivation of child providers for independent sub-streams.
 */
public interface IRandomProvider {

    /**
     * Returns a random integer in the range [0, bound).
     *
     * @param bound exclusive upper bound, must be &gt; 0
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
     * Creates a derived provider that is deterministically based on this provider and the given scope/key.
     * Use this to create independent sub-streams (e.g., for a decision policy) that must not
     * perturb the stream used for world placement.
     *
     * @param scope a stable, descriptive scope name (e.g., "policy")
     * @param key a stable numeric key (e.g., episode index)
     * @return a derived random provider
     */
    IRandomProvider deriveFor(String scope, long key);
}
