package org.spindlecheck.runtime.spi;

/**
 * Provides deterministic randomness scoped to a single simulation run.
 * Implementations should be pure with respect to the provided seed and
 * support derivation of child providers for independent sub-streams.
 */
public interface IRandomProvider {

    /**
     * Returns a random double in the range [0.0, 1.0).
     *
     * @return the random double
     */
    double nextDouble();

    /**
     * Returns a normally distributed value with mean 0.0 and standard deviation 1.0.
     *
     * @return the standard normal sample
     */
    double nextGaussian();

    /**
     * Returns a normally distributed value with the given mean and standard deviation.
     * A standard deviation of zero still consumes one draw and returns {@code mean},
     * so the stream position does not depend on the configured noise.
     *
     * @param mean the mean of the distribution
     * @param sigma the standard deviation, must be >= 0
     * @return the normal sample
     */
    default double nextGaussian(double mean, double sigma) {
        return mean + nextGaussian() * sigma;
    }

    /**
     * Creates a derived provider that is deterministically based on this provider and the given scope/key.
     * Use this to create independent sub-streams (e.g., one per kinetochore).
     *
     * @param scope a stable, descriptive scope name (e.g., "kinetochore")
     * @param key a stable numeric key (e.g., kinetochore uid)
     * @return a derived random provider
     */
    IRandomProvider deriveFor(String scope, long key);
}
