package io.github.manjago.lifegrid.core;

import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;

/**
 * Deterministic random number generator for the simulation.
 *
 * Uses Apache Commons RNG XO_RO_SHI_RO_128_PP algorithm:
 * - Fast and high quality
 * - State is just 2 longs (128 bits)
 * - Cheap to create, so derived streams can be keyed per organism pair
 *
 * IMPORTANT: Do not change RandomSource between versions!
 * Changing algorithm would break replay determinism.
 */
public final class GameRng {

    /**
     * Fixed algorithm - DO NOT CHANGE for backwards compatibility.
     */
    private static final RandomSource ALGORITHM = RandomSource.XO_RO_SHI_RO_128_PP;

    private static final long GOLDEN_GAMMA = 0x9E3779B97F4A7C15L;

    private final long initialSeed;
    private final UniformRandomProvider rng;

    /**
     * Create new RNG with given seed.
     */
    public GameRng(long seed) {
        this.initialSeed = seed;
        this.rng = ALGORITHM.create(seed);
    }

    /**
     * Derive a stream keyed to an unordered organism pair and a tick.
     * Swapping {@code a} and {@code b} yields the same stream, so the same seed
     * and the same pair always produce the same offspring.
     */
    public static GameRng forPair(long seed, long a, long b, long tick) {
        long lo = Math.min(a, b);
        long hi = Math.max(a, b);
        long key = mix(seed ^ mix(lo * GOLDEN_GAMMA) ^ mix(hi + GOLDEN_GAMMA) ^ mix(tick * 31 + 17));
        return new GameRng(key);
    }

    /**
     * Derive an independent child stream (for collaborators that need their own sequence).
     */
    public GameRng fork(long salt) {
        return new GameRng(mix(initialSeed + salt * GOLDEN_GAMMA));
    }

    // SplitMix64 finalizer
    private static long mix(long z) {
        z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
        z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
        return z ^ (z >>> 31);
    }

    // ========== Random Methods (compatible with java.util.Random API) ==========

    /**
     * Returns uniformly distributed int in [0, bound).
     */
    public int nextInt(int bound) {
        return rng.nextInt(bound);
    }

    /**
     * Returns uniformly distributed int in [min, max] (both inclusive).
     */
    public int nextIntInclusive(int min, int max) {
        return min + rng.nextInt(max - min + 1);
    }

    /**
     * Returns uniformly distributed long.
     */
    public long nextLong() {
        return rng.nextLong();
    }

    /**
     * Returns uniformly distributed double in [0, 1).
     */
    public double nextDouble() {
        return rng.nextDouble();
    }

    /**
     * Returns uniformly distributed double in [min, max).
     */
    public double nextDouble(double min, double max) {
        return min + rng.nextDouble() * (max - min);
    }

    /**
     * Returns true with probability p.
     */
    public boolean nextBoolean(double probability) {
        return rng.nextDouble() < probability;
    }

    /**
     * Returns uniformly distributed boolean.
     */
    public boolean nextBoolean() {
        return rng.nextBoolean();
    }

    /**
     * Get initial seed (for logging/debugging).
     */
    public long getInitialSeed() {
        return initialSeed;
    }
}
