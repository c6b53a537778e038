package io.github.manjago.lifegrid.sim;

import io.github.manjago.lifegrid.core.GameRng;
import io.github.manjago.lifegrid.core.Numbers;
import io.github.manjago.lifegrid.core.Organism;
import io.github.manjago.lifegrid.grid.DensityField;
import io.github.manjago.lifegrid.grid.GridPosition;
import io.github.manjago.lifegrid.grid.TileGrid;

import java.util.ArrayList;
import java.util.List;

/**
 * Sorts the organisms an organism can see into society, enemies and mates.
 *
 * The window is scanned ring by ring, so every group comes out nearest first.
 * A neighbour is society when similarity reaches the ally threshold, an enemy
 * when it is at or below the enemy threshold or a hostility draw succeeds, and
 * a mate otherwise. Hostility grows with local density and risk tolerance:
 * {@code max(0, lerp(enemyBias.min, enemyBias.max, density) * (0.4 + 0.8 * risk))}.
 */
public class SpatialTargetResolver {

    private final TileGrid grid;
    private final DensityField density;
    private final SimilarityCache similarities;

    public SpatialTargetResolver(TileGrid grid, DensityField density, SimilarityCache similarities) {
        this.grid = grid;
        this.density = density;
        this.similarities = similarities;
    }

    /**
     * Classify every occupied tile within the organism's sight.
     *
     * @param organism the scanning organism
     * @param row its row
     * @param col its column
     * @param options thresholds used when the genome has none
     * @param rng source for hostility draws
     */
    public TargetGroups findTargets(Organism organism, int row, int col, TickOptions options, GameRng rng) {
        int sight = organism.getSight();
        double allyThreshold = Numbers.finiteOr(organism.getGenome().allyThreshold(), options.societySimilarity());
        double enemyThreshold = Numbers.finiteOr(organism.getGenome().enemyThreshold(), options.enemySimilarity());
        double hostility = hostilityBias(organism, effectiveDensity(row, col, options));

        List<Target> mates = new ArrayList<>();
        List<Target> enemies = new ArrayList<>();
        List<Target> society = new ArrayList<>();

        for (int ring = 1; ring <= sight; ring++) {
            int r0 = row - ring;
            int r1 = row + ring;
            for (int r = r0; r <= r1; r++) {
                if (r < 0 || r >= grid.rows()) continue;
                boolean edgeRow = r == r0 || r == r1;
                int step = edgeRow ? 1 : 2 * ring;
                for (int c = col - ring; c <= col + ring; c += step) {
                    if (c < 0 || c >= grid.cols()) continue;
                    Organism other = grid.occupantAt(r, c);
                    if (other == null || other == organism || !other.isAlive()) continue;

                    double similarity = similarities.similarity(organism, other);
                    Target target = new Target(new GridPosition(r, c), other, similarity, ring);
                    if (similarity >= allyThreshold) {
                        society.add(target);
                    } else if (similarity <= enemyThreshold || (hostility > 0 && rng.nextDouble() < hostility)) {
                        enemies.add(target);
                    } else {
                        mates.add(target);
                    }
                }
            }
        }

        if (mates.isEmpty() && enemies.isEmpty() && society.isEmpty()) {
            return TargetGroups.EMPTY;
        }
        return new TargetGroups(mates, enemies, society);
    }

    /**
     * Chance of treating a neutral neighbour as an enemy.
     */
    public static double hostilityBias(Organism organism, double effectiveDensity) {
        double risk = Numbers.clamp01(Numbers.finiteOr(organism.getGenome().riskTolerance(), 0.5));
        double bias = organism.getDensityResponses().enemyBias().rising(effectiveDensity);
        return Math.max(0, bias * (0.4 + 0.8 * risk));
    }

    private double effectiveDensity(int row, int col, TickOptions options) {
        return Numbers.clamp01(density.densityAt(row, col)
                * Math.max(0, Numbers.finiteOr(options.densityEffectMultiplier(), 1)));
    }
}
