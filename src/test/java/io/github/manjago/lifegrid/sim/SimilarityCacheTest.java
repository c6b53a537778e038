package io.github.manjago.lifegrid.sim;

import io.github.manjago.lifegrid.core.Organism;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SimilarityCacheTest {

    private final Organism a = new Organism(1, new TraitGenome(0.2), 0, 0, 1, -1, 0);
    private final Organism b = new Organism(2, new TraitGenome(0.7), 0, 1, 1, -1, 0);

    @Test
    void selfSimilarityIsOne() {
        SimilarityCache cache = new SimilarityCache();
        assertEquals(1.0, cache.similarity(a, a));
        assertEquals(0, cache.size());
    }

    @Test
    void pairIsComputedOnceRegardlessOfOrder() {
        SimilarityCache cache = new SimilarityCache();

        assertEquals(0.5, cache.similarity(a, b), 1e-12);
        assertEquals(0.5, cache.similarity(b, a), 1e-12);

        assertEquals(1, cache.size());
        assertEquals(1, cache.getMisses());
        assertEquals(1, cache.getHits());
        assertEquals(SimilarityCache.key(1, 2), SimilarityCache.key(2, 1));
    }

    @Test
    void resetForgetsPairs() {
        SimilarityCache cache = new SimilarityCache();
        cache.similarity(a, b);
        cache.reset();

        assertEquals(0, cache.size());
        cache.similarity(a, b);
        assertEquals(2, cache.getMisses());
    }
}
