package io.github.manjago.lifegrid.sim;

import io.github.manjago.lifegrid.core.GameRng;
import io.github.manjago.lifegrid.core.Numbers;
import io.github.manjago.lifegrid.core.Organism;
import io.github.manjago.lifegrid.grid.DensityField;
import io.github.manjago.lifegrid.grid.GridPosition;
import io.github.manjago.lifegrid.grid.TileEnergyField;
import io.github.manjago.lifegrid.grid.TileGrid;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Picks the tile where an offspring is born.
 *
 * Candidates are both parents' current tiles and the tiles they held when
 * the tick started, plus the eight neighbours of each, restricted to free tiles and passed
 * through the zone policy. Each candidate is scored on tile energy, how well
 * its crowding matches the parents' comfort level and the energy trend,
 * minus a crowding penalty that risk-averse parents feel more. The tile is
 * drawn with probability proportional to its score.
 */
public class SpawnSiteSelector {

    private static final Logger log = LoggerFactory.getLogger(SpawnSiteSelector.class);

    private final TileGrid grid;
    private final TileEnergyField energy;
    private final DensityField density;
    private final ReproductionZonePolicy zonePolicy;

    public SpawnSiteSelector(TileGrid grid, TileEnergyField energy, DensityField density,
                             ReproductionZonePolicy zonePolicy) {
        this.grid = grid;
        this.energy = energy;
        this.density = density;
        this.zonePolicy = zonePolicy;
    }

    /**
     * Free tiles around both parents, after the zone filter.
     */
    public List<GridPosition> candidates(Organism a, Organism b, GridPosition originA) {
        Set<GridPosition> anchors = new LinkedHashSet<>();
        anchors.add(originA);
        anchors.add(new GridPosition(a.getRow(), a.getCol()));
        anchors.add(new GridPosition(b.getOriginRow(), b.getOriginCol()));
        anchors.add(new GridPosition(b.getRow(), b.getCol()));

        Set<GridPosition> found = new LinkedHashSet<>();
        for (GridPosition anchor : anchors) {
            addIfFree(found, anchor.row(), anchor.col());
            for (int[] d : TileGrid.NEIGHBORS) {
                addIfFree(found, anchor.row() + d[0], anchor.col() + d[1]);
            }
        }
        if (found.isEmpty()) return List.of();
        return filter(new ArrayList<>(found));
    }

    private List<GridPosition> filter(List<GridPosition> found) {
        try {
            List<GridPosition> allowed = zonePolicy.filterSpawnCandidates(List.copyOf(found));
            return allowed != null ? allowed : found;
        } catch (RuntimeException e) {
            log.warn("Zone filter failed for {} candidates, keeping all: {}", found.size(), e.getMessage());
            return found;
        }
    }

    /**
     * Choose a spawn tile.
     *
     * @param densityMultiplier scales density before scoring
     * @return the tile, or null when there is no free candidate
     */
    @Nullable
    public GridPosition select(Organism a, Organism b, GridPosition originA, double densityMultiplier, GameRng rng) {
        List<GridPosition> candidates = candidates(a, b, originA);
        if (candidates.isEmpty()) return null;

        double resourceDrive = (a.getResourceTrendAdaptation() + b.getResourceTrendAdaptation()) / 2;
        double comfort = (a.getCrowdingTolerance() + b.getCrowdingTolerance()) / 2;
        double risk = Numbers.clamp01((a.getGenome().riskTolerance() + b.getGenome().riskTolerance()) / 2);
        double densityScale = Math.max(0, Numbers.finiteOr(densityMultiplier, 1));

        double[] scores = new double[candidates.size()];
        double total = 0;
        for (int i = 0; i < scores.length; i++) {
            GridPosition p = candidates.get(i);
            double tileDensity = Numbers.clamp01(density.densityAt(p.row(), p.col()) * densityScale);
            scores[i] = score(energy.normalizedAt(p.row(), p.col()), tileDensity,
                    energy.trendAt(p.row(), p.col()), resourceDrive, comfort, risk);
            total += scores[i];
        }

        if (total > 0) {
            double pick = rng.nextDouble() * total;
            for (int i = 0; i < scores.length; i++) {
                pick -= scores[i];
                if (pick < 0) return candidates.get(i);
            }
            // Rounding can leave a tiny remainder: last positive score wins
            for (int i = scores.length - 1; i >= 0; i--) {
                if (scores[i] > 0) return candidates.get(i);
            }
        }

        // All scores zero: prefer tiles that still hold energy
        List<GridPosition> energized = new ArrayList<>();
        for (GridPosition p : candidates) {
            if (energy.energyAt(p.row(), p.col()) > 0) energized.add(p);
        }
        List<GridPosition> pool = energized.isEmpty() ? candidates : energized;
        return pool.get(rng.nextInt(pool.size()));
    }

    /**
     * Score of a single candidate tile, at least 0.
     *
     * @param tileEnergy normalised energy in [0, 1]
     * @param tileDensity effective density in [0, 1]
     * @param trend normalised energy trend
     * @param resourceDrive parents' average trend adaptation
     * @param comfort parents' average crowding tolerance
     * @param risk parents' average risk tolerance
     */
    static double score(double tileEnergy, double tileDensity, double trend,
                        double resourceDrive, double comfort, double risk) {
        double energyWeight = 0.45 + 0.35 * resourceDrive;
        double densityWeight = 0.35 + 0.25 * (1 - resourceDrive);
        double trendWeight = 0.2 + 0.3 * resourceDrive;

        double crowdAffinity = 1 - Math.abs(tileDensity - comfort);
        double crowdPenalty = tileDensity > comfort ? (tileDensity - comfort) * (1 - risk) * 0.6 : 0;
        double trend01 = Numbers.clamp01(0.5 + 5 * Numbers.finiteOr(trend, 0));

        return Math.max(0, tileEnergy * energyWeight + crowdAffinity * densityWeight
                + trend01 * trendWeight - crowdPenalty);
    }

    private void addIfFree(Set<GridPosition> out, int row, int col) {
        if (grid.isFree(row, col)) {
            out.add(new GridPosition(row, col));
        }
    }
}
