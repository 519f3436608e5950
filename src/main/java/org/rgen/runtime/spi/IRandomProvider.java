package org.rgen.runtime.spi;

/**
 * Provides deterministic randomness scoped to a World.
 * Implementations are pure with respect to the provided seed and support derivation
 * of child providers for independent sub-streams (e.g., one stream per generation request).
 * <p>
 * Implements {@link ISerializable} so that a restored world continues with the identical
 * random sequence.
 * </p>
 */
public interface IRandomProvider extends ISerializable {

    /**
     * Returns a random integer in the range [0, bound).
     *
     * @param bound exclusive upper bound, must be > 0
     * @return the random int
     */
    int nextInt(int bound);

    /**
     * Returns a random integer in the inclusive range [min, max].
     *
     * @param min inclusive lower bound
     * @param max inclusive upper bound, must be >= min
     * @return the random int
     */
    default int nextIntBetween(int min, int max) {
        if (max < min) {
            throw new IllegalArgumentException("max (" + max + ") must be >= min (" + min + ")");
        }
        return min + nextInt(max - min + 1);
    }

    /**
     * Returns a random double in the range [0.0, 1.0).
     *
     * @return the random double
     */
    double nextDouble();

    /**
     * Creates a derived provider that is deterministically based on this provider's seed and the given scope/key.
     *
     * @param scope a stable, descriptive scope name (e.g., "world", "spawn")
     * @param key a stable numeric key (e.g., a request hash or spawn counter)
     * @return a derived random provider
     */
    IRandomProvider deriveFor(String scope, long key);
}
