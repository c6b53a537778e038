package io.github.manjago.lifegrid.sim;

import io.github.manjago.lifegrid.core.Numbers;
import io.github.manjago.lifegrid.core.Organism;
import it.unimi.dsi.fastutil.longs.Long2DoubleOpenHashMap;

/**
 * Genetic similarity memoised per unordered organism pair.
 *
 * Owned by one simulation and reset at the start of every tick, so a pair is
 * computed at most once per tick no matter which side asks first.
 */
public class SimilarityCache {

    private final Long2DoubleOpenHashMap values = new Long2DoubleOpenHashMap();
    private long hits;
    private long misses;

    public SimilarityCache() {
        values.defaultReturnValue(Double.NaN);
    }

    public double similarity(Organism a, Organism b) {
        if (a == b) return 1.0;
        long key = key(a.getId(), b.getId());
        double cached = values.get(key);
        if (!Double.isNaN(cached)) {
            hits++;
            return cached;
        }
        misses++;
        double value = Numbers.clamp01(Numbers.finiteOr(a.getGenome().similarity(b.getGenome()), 0));
        values.put(key, value);
        return value;
    }

    /**
     * Forget every cached pair.
     */
    public void reset() {
        values.clear();
    }

    public int size() {
        return values.size();
    }

    public long getHits() { return hits; }
    public long getMisses() { return misses; }

    // Order-independent pair key; ids are below 2^32 in practice
    static long key(long a, long b) {
        long lo = Math.min(a, b);
        long hi = Math.max(a, b);
        return (lo << 32) ^ (hi & 0xFFFFFFFFL);
    }
}
