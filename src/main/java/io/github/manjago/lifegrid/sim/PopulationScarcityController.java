package io.github.manjago.lifegrid.sim;

import io.github.manjago.lifegrid.core.GameRng;
import io.github.manjago.lifegrid.core.Numbers;
import io.github.manjago.lifegrid.core.Organism;
import io.github.manjago.lifegrid.grid.DensityField;
import io.github.manjago.lifegrid.grid.GridPosition;
import io.github.manjago.lifegrid.grid.TileEnergyField;
import io.github.manjago.lifegrid.grid.TileGrid;

import java.util.ArrayList;
import java.util.List;

/**
 * Population deficit signal and the compensation it drives.
 *
 * The minimum population is 2.5% of the grid area, never below a configured
 * floor; grids under 100 tiles have no minimum. Below the minimum the scarcity
 * signal grows with the deficit and with how empty the grid is:
 * {@code clamp(deficit * (0.6 + (1 - occupancy) * 0.4), 0, 1)}.
 */
public class PopulationScarcityController {

    static final int SMALL_GRID_AREA = 100;
    static final double MIN_POPULATION_DENSITY = 0.025;
    private static final double SEED_BAND = 0.2;

    private final TileGrid grid;
    private final TileEnergyField energy;
    private final DensityField density;
    private final int minPopulation;

    public PopulationScarcityController(TileGrid grid, TileEnergyField energy, DensityField density,
                                        int minPopulationFloor) {
        this.grid = grid;
        this.energy = energy;
        this.density = density;
        this.minPopulation = minPopulation(grid.rows(), grid.cols(), minPopulationFloor);
    }

    /**
     * Minimum population for a grid.
     */
    public static int minPopulation(int rows, int cols, int floor) {
        long area = (long) rows * cols;
        if (area < SMALL_GRID_AREA) return 0;
        return (int) Math.max(Math.max(0, floor), Math.round(area * MIN_POPULATION_DENSITY));
    }

    public int minPopulation() {
        return minPopulation;
    }

    /**
     * Scarcity signal in [0, 1]; 0 at or above the minimum.
     */
    public double signal(int population) {
        if (minPopulation <= 0 || population >= minPopulation) return 0;
        double occupancy = Numbers.clamp01((double) Math.max(0, population) / grid.size());
        double deficit = Numbers.clamp01((double) (minPopulation - Math.max(0, population)) / minPopulation);
        return Numbers.clamp01(deficit * (0.6 + (1 - occupancy) * 0.4));
    }

    /**
     * Reproduction bonus while the population is short.
     *
     * Lifts the probability by the scarcity, the deficit and how unlikely the
     * pair was to begin with, scaled by a drive that grows with behavioural
     * complementarity and shared appetite for diversity.
     *
     * @return exactly 1 when scarcity is 0; greater than 1 when scarcity and base probability are positive
     */
    public double reproductionMultiplier(Organism a, Organism b, double scarcity, double baseProbability,
                                         int population) {
        double s = Numbers.clamp01(Numbers.finiteOr(scarcity, 0));
        double base = Numbers.clamp01(Numbers.finiteOr(baseProbability, 0));
        if (s <= 0 || base <= 0) return 1.0;

        double deficit = minPopulation <= 0 ? 0
                : Numbers.clamp01((double) (minPopulation - Math.max(0, population)) / minPopulation);
        double complementarity = a.getInteractionGenes().complementarity(b.getInteractionGenes());
        double appetite = (a.getDiversityAppetite() + b.getDiversityAppetite()) / 2;
        double drive = Numbers.clamp(1 + 0.5 * complementarity + 0.3 * Math.max(0, appetite - 0.35), 1, 2);

        double lift = 1 + s * (0.25 + (1 - base) * 0.45 + deficit * 0.35);
        double multiplier = Numbers.clamp(drive * lift, 1 - 0.35 * s, 1 + 1.1 * s);
        return Numbers.clamp(multiplier, 1, 2);
    }

    /**
     * Minimum normalised tile energy for a compensatory seed.
     */
    public double seedingEnergyFloor(double scarcity) {
        return Numbers.clamp(0.35 + 0.15 * Numbers.clamp01(scarcity), 0.35, 0.85);
    }

    /**
     * Extra spawn energy on top of the starvation threshold, as a fraction of max tile energy.
     */
    public double seedingBuffer(double scarcity) {
        return 0.05 + 0.05 * Numbers.clamp01(scarcity);
    }

    /**
     * Empty tiles for compensatory seeding.
     *
     * Viable tiles are free and hold at least the seeding energy floor. Each is
     * scored {@code 0.7 * normalisedEnergy + 0.3 * (1 - density)}; sites are
     * drawn at random from the top-scoring fifth of the viable tiles.
     *
     * @param count how many sites are wanted
     * @param scarcity current scarcity signal
     * @param rng source for the draw
     */
    public List<GridPosition> seedSites(int count, double scarcity, GameRng rng) {
        if (count <= 0) return List.of();
        double floor = seedingEnergyFloor(scarcity);

        List<ScoredSite> viable = new ArrayList<>();
        for (int r = 0; r < grid.rows(); r++) {
            for (int c = 0; c < grid.cols(); c++) {
                if (!grid.isFree(r, c)) continue;
                double normalized = energy.normalizedAt(r, c);
                if (normalized < floor) continue;
                double score = 0.7 * normalized + 0.3 * (1 - density.densityAt(r, c));
                viable.add(new ScoredSite(new GridPosition(r, c), score));
            }
        }
        if (viable.isEmpty()) return List.of();

        // Stable sort keeps row-major order among equal scores
        viable.sort((x, y) -> Double.compare(y.score(), x.score()));
        int band = Math.min(viable.size(), Math.max(count, (int) Math.ceil(viable.size() * SEED_BAND)));
        List<ScoredSite> top = new ArrayList<>(viable.subList(0, band));

        int limit = Math.min(count, band);
        List<GridPosition> sites = new ArrayList<>(limit);
        for (int i = 0; i < limit; i++) {
            int pick = i + rng.nextInt(top.size() - i);
            ScoredSite chosen = top.get(pick);
            top.set(pick, top.get(i));
            top.set(i, chosen);
            sites.add(chosen.position());
        }
        return sites;
    }

    /**
     * Energy a seeded organism starts with: the starvation threshold plus a
     * scarcity-scaled buffer, never below the seeding floor and never more than
     * the tile holds.
     *
     * @param starvationFraction the genome's starvation threshold fraction
     * @param available energy on the tile
     */
    public double seedEnergy(double starvationFraction, double available, double scarcity) {
        double fraction = Numbers.clamp(Numbers.clamp01(starvationFraction) + seedingBuffer(scarcity),
                seedingEnergyFloor(scarcity), 0.95);
        return Math.min(Math.max(0, available), energy.getMaxTileEnergy() * fraction);
    }

    private record ScoredSite(GridPosition position, double score) {
    }
}
