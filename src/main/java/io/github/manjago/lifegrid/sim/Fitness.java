package io.github.manjago.lifegrid.sim;

import io.github.manjago.lifegrid.core.Organism;

/**
 * Fitness score used in tick snapshots.
 *
 * {@code (fightsWon - fightsLost) * 0.5 + offspring * 1.5 + energy / maxTileEnergy + age / lifespan}
 *
 * The leaderboard ranks on a smoothed score: every snapshot moves it a fifth
 * of the way towards the current fitness.
 */
public final class Fitness {

    static final double SMOOTHING = 0.2;

    private Fitness() {
    }

    public static double of(Organism organism, double maxTileEnergy) {
        double combat = (organism.getFightsWon() - organism.getFightsLost()) * 0.5;
        double lineage = organism.getOffspring() * 1.5;
        double reserves = maxTileEnergy > 0 ? organism.getEnergy() / maxTileEnergy : 0;
        return combat + lineage + reserves + organism.getAgeFraction();
    }

    /**
     * Next smoothed score.
     *
     * @param previous last smoothed score, NaN when there is none yet
     */
    public static double smooth(double previous, double fitness) {
        if (Double.isNaN(previous)) return fitness;
        return previous * (1 - SMOOTHING) + fitness * SMOOTHING;
    }
}
