package io.github.manjago.lifegrid.core;

/**
 * Creates genomes for organisms that have no parents (initial and compensatory seeding).
 */
@FunctionalInterface
public interface GenomeFactory {

    Genome random(GameRng rng);
}
