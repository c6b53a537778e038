package io.github.manjago.lifegrid.grid;

import io.github.manjago.lifegrid.core.Numbers;
import io.github.manjago.lifegrid.core.Organism;
import io.github.manjago.lifegrid.event.EventModifiers;

import java.util.Arrays;
import java.util.BitSet;
import java.util.List;

/**
 * Per-tile energy store.
 *
 * Regeneration reads {@code current} and writes {@code next}; the two arrays
 * are swapped by reference afterwards, so a tile's update never sees a
 * neighbour value written in the same pass.
 *
 * An occupied tile holds no energy of its own. Whatever the tile would hold
 * is kept as pending regen: it keeps regenerating, the occupant harvests from
 * it, and it returns to the tile when the occupant leaves.
 *
 * The trend buffer stores the last per-tile change normalised by the maximum,
 * in [-1, 1].
 */
public class TileEnergyField {

    private final TileGrid grid;
    private final int rows;
    private final int cols;
    private final double maxTileEnergy;

    private double[] current;
    private double[] next;
    private final double[] trend;
    private final double[] pending;
    private final BitSet pendingMask;

    // Scratch for event accumulation
    private final double[] eventScratch = new double[3];

    public TileEnergyField(TileGrid grid, double maxTileEnergy, double initialFraction) {
        if (!(maxTileEnergy > 0) || Double.isInfinite(maxTileEnergy)) {
            throw new IllegalArgumentException("maxTileEnergy must be a positive finite number: " + maxTileEnergy);
        }
        this.grid = grid;
        this.rows = grid.rows();
        this.cols = grid.cols();
        this.maxTileEnergy = maxTileEnergy;
        int size = rows * cols;
        this.current = new double[size];
        this.next = new double[size];
        this.trend = new double[size];
        this.pending = new double[size];
        this.pendingMask = new BitSet(size);

        double initial = maxTileEnergy * Numbers.clamp01(Numbers.finiteOr(initialFraction, 0));
        for (int i = 0; i < size; i++) {
            current[i] = grid.isObstacle(i) ? 0 : initial;
        }
    }

    public double getMaxTileEnergy() {
        return maxTileEnergy;
    }

    // ========== Reads ==========

    /**
     * Energy available at a tile: stored energy plus pending regen. 0 outside the grid.
     */
    public double energyAt(int row, int col) {
        if (!grid.inBounds(row, col)) return 0;
        return energyAt(grid.index(row, col));
    }

    public double energyAt(int index) {
        return current[index] + pending[index];
    }

    /**
     * Energy stored directly in the tile, excluding pending regen.
     */
    public double storedAt(int index) {
        return current[index];
    }

    public double pendingAt(int index) {
        return pending[index];
    }

    public double normalizedAt(int row, int col) {
        return Numbers.clamp01(energyAt(row, col) / maxTileEnergy);
    }

    public double trendAt(int row, int col) {
        if (!grid.inBounds(row, col)) return 0;
        return trend[grid.index(row, col)];
    }

    /**
     * Room left in a tile before it reaches the maximum. 0 for obstacles.
     */
    public double capacityAt(int index) {
        if (grid.isObstacle(index)) return 0;
        return Math.max(0, maxTileEnergy - energyAt(index));
    }

    /**
     * Total energy held by the field, pending regen included.
     */
    public double totalEnergy() {
        double total = 0;
        for (int i = 0; i < current.length; i++) {
            total += current[i];
        }
        for (int i = pendingMask.nextSetBit(0); i >= 0; i = pendingMask.nextSetBit(i + 1)) {
            total += pending[i];
        }
        return total;
    }

    // ========== Writes ==========

    /**
     * Set a tile's energy, clamped to [0, max]. Ignored for obstacles and out-of-range tiles.
     */
    public void setEnergy(int row, int col, double value) {
        if (!grid.inBounds(row, col)) return;
        int idx = grid.index(row, col);
        if (grid.isObstacle(idx)) return;
        double clamped = Numbers.clamp(Numbers.finiteOr(value, 0), 0, maxTileEnergy);
        if (grid.occupantAt(idx) != null) {
            current[idx] = 0;
            setPending(idx, clamped);
        } else {
            clearPending(idx);
            current[idx] = clamped;
        }
    }

    /**
     * Drop all energy held by a tile, pending regen included.
     *
     * @return the energy removed
     */
    public double clearTile(int row, int col) {
        if (!grid.inBounds(row, col)) return 0;
        int idx = grid.index(row, col);
        double removed = current[idx] + pending[idx];
        current[idx] = 0;
        clearPending(idx);
        trend[idx] = 0;
        return removed;
    }

    /**
     * Add energy to a tile up to its capacity.
     *
     * @return the amount deposited
     */
    public double deposit(int index, double amount) {
        if (!(amount > 0)) return 0;
        double room = capacityAt(index);
        double added = Math.min(room, amount);
        if (added <= 0) return 0;
        if (grid.occupantAt(index) != null) {
            setPending(index, pending[index] + added);
        } else {
            current[index] += added;
        }
        return added;
    }

    /**
     * Remove up to {@code amount} from a tile, pending regen first.
     *
     * @return the amount removed
     */
    public double withdraw(int index, double amount) {
        if (!(amount > 0)) return 0;
        double taken = 0;
        if (pending[index] > 0) {
            double fromPending = Math.min(pending[index], amount);
            setPending(index, pending[index] - fromPending);
            taken += fromPending;
        }
        if (taken < amount && current[index] > 0) {
            double fromTile = Math.min(current[index], amount - taken);
            current[index] -= fromTile;
            taken += fromTile;
        }
        return taken;
    }

    /**
     * An organism arrived on the tile: its energy moves into pending regen.
     */
    public void occupy(int index) {
        if (current[index] > 0) {
            setPending(index, pending[index] + current[index]);
            current[index] = 0;
        }
    }

    /**
     * The occupant left the tile: pending regen merges back into it.
     */
    public void vacate(int index) {
        if (!pendingMask.get(index)) return;
        current[index] = Math.min(maxTileEnergy, current[index] + pending[index]);
        clearPending(index);
    }

    /**
     * Restore the "no energy under an occupant" rule for every tile.
     *
     * @return number of tiles that had to be corrected
     */
    public int enforceExclusivity() {
        int fixed = 0;
        for (int i = 0; i < current.length; i++) {
            boolean occupied = grid.occupantAt(i) != null;
            if (occupied && current[i] > 0) {
                occupy(i);
                fixed++;
            } else if (!occupied && pendingMask.get(i)) {
                vacate(i);
                fixed++;
            }
        }
        return fixed;
    }

    /**
     * Shift a tile's trend by a normalised amount (used for buffered decay deposits).
     */
    public void applyTrendDelta(int index, double normalizedDelta) {
        trend[index] = Numbers.clamp(trend[index] + Numbers.finiteOr(normalizedDelta, 0), -1, 1);
    }

    private void setPending(int index, double value) {
        if (value > 0) {
            pending[index] = value;
            pendingMask.set(index);
        } else {
            clearPending(index);
        }
    }

    private void clearPending(int index) {
        pending[index] = 0;
        pendingMask.clear(index);
    }

    // ========== Regeneration ==========

    /**
     * Regeneration parameters for one pass.
     *
     * @param regenRate fraction of the missing energy regrown per tick
     * @param diffusionRate pull towards the mean of unblocked orthogonal neighbours
     * @param densityPenalty how strongly crowding suppresses regrowth
     * @param densityEffectMultiplier scales density before it is used
     */
    public record RegenParams(double regenRate, double diffusionRate, double densityPenalty,
                              double densityEffectMultiplier) {
    }

    /**
     * Compute the next energy value of every tile and swap buffers.
     *
     * @param density density field (its published snapshot is read)
     * @param params rates for this pass
     * @param events resolved modifiers of the active events
     */
    public void regenerate(DensityField density, RegenParams params, List<EventModifiers> events) {
        double rate = Math.max(0, Numbers.finiteOr(params.regenRate(), 0));
        double diffusionRate = Numbers.clamp01(Numbers.finiteOr(params.diffusionRate(), 0));
        double penaltyStrength = Math.max(0, Numbers.finiteOr(params.densityPenalty(), 0));
        double densityScale = Math.max(0, Numbers.finiteOr(params.densityEffectMultiplier(), 1));
        double baseUnit = rate * maxTileEnergy;
        boolean hasEvents = !events.isEmpty();

        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                int idx = r * cols + c;
                if (grid.isObstacle(idx)) {
                    next[idx] = 0;
                    trend[idx] = 0;
                    continue;
                }
                boolean occupied = grid.occupantAt(idx) != null;
                double value = occupied ? pending[idx] + current[idx] : current[idx];

                double effDensity = Numbers.clamp01(density.densityAt(r, c) * densityScale);
                double sensitivity = crowdingSensitivity(r, c);
                double densityFactor = 1 - Numbers.clamp(penaltyStrength * effDensity * sensitivity, 0, 1.1);
                double regen = rate * (maxTileEnergy - value) * densityFactor;

                double scale = 1;
                double add = 0;
                double drain = 0;
                if (hasEvents) {
                    EventModifiers.combine(events, r, c, eventScratch);
                    scale = eventScratch[0];
                    add = eventScratch[1] * baseUnit;
                    drain = eventScratch[2] * baseUnit;
                }

                double diffusion = diffusionRate > 0 ? diffusionRate * (neighborMean(r, c, value) - value) : 0;
                double updated = Numbers.clamp(value + regen * scale + add - drain + diffusion, 0, maxTileEnergy);

                trend[idx] = Numbers.clamp((updated - value) / maxTileEnergy, -1, 1);
                next[idx] = updated;
            }
        }

        // Occupied tiles keep their share as pending regen; done after the pass
        // so neighbours above read the old pending values
        for (int idx = 0; idx < next.length; idx++) {
            if (grid.occupantAt(idx) != null) {
                setPending(idx, next[idx]);
                next[idx] = 0;
            }
        }

        double[] swap = current;
        current = next;
        next = swap;
    }

    // Mean of unblocked orthogonal neighbours; the tile's own value when it has none
    private double neighborMean(int row, int col, double own) {
        double sum = 0;
        int n = 0;
        for (int[] d : TileGrid.ORTHOGONAL) {
            int r = row + d[0];
            int c = col + d[1];
            if (!grid.inBounds(r, c)) continue;
            int idx = r * cols + c;
            if (grid.isObstacle(idx)) continue;
            sum += current[idx] + pending[idx];
            n++;
        }
        return n == 0 ? own : sum / n;
    }

    /**
     * How strongly crowding suppresses regrowth at a tile, from the occupied
     * neighbours' crowding tolerance and energy reserves. 1 with no neighbours,
     * bounded to [0.35, 1.8].
     */
    double crowdingSensitivity(int row, int col) {
        double intolerance = 0;
        double scarcity = 0;
        int n = 0;
        for (int[] d : TileGrid.NEIGHBORS) {
            int r = row + d[0];
            int c = col + d[1];
            if (!grid.inBounds(r, c)) continue;
            Organism neighbor = grid.occupantAt(r * cols + c);
            if (neighbor == null) continue;
            intolerance += 1 - neighbor.getCrowdingTolerance();
            scarcity += 1 - Numbers.clamp01(neighbor.getEnergy() / maxTileEnergy);
            n++;
        }
        if (n == 0) return 1.0;
        return Numbers.clamp(0.55 + 0.6 * (intolerance / n) + 0.5 * (scarcity / n), 0.35, 1.8);
    }

    // ========== Harvest ==========

    /**
     * Inputs for a harvest besides the organism itself.
     *
     * @param effectiveDensity local density in [0, 1]
     * @param consumptionPenalty how strongly crowding narrows the harvest cap
     */
    public record HarvestContext(double effectiveDensity, double consumptionPenalty) {
    }

    /**
     * Let an organism eat from its tile.
     *
     * The cap starts at the organism's forage rate, is narrowed by crowding,
     * widened on rising tiles and narrowed on declining ones (scaled by the
     * organism's trend adaptation), then clamped to the genome's harvest caps.
     *
     * @return energy transferred to the organism
     */
    public double harvest(int row, int col, Organism organism, HarvestContext context) {
        if (!grid.inBounds(row, col)) return 0;
        int idx = grid.index(row, col);
        double available = energyAt(idx);
        if (available <= 0) return 0;

        double cap = harvestCap(organism, context, trend[idx]);
        double room = Math.max(0, maxTileEnergy - organism.getEnergy());
        double want = Math.min(cap, Math.min(available, room));
        if (want <= 0) return 0;

        double taken = withdraw(idx, want);
        organism.gainEnergy(taken, maxTileEnergy);
        return taken;
    }

    /**
     * Maximum energy an organism may take per tick under the given conditions.
     */
    public static double harvestCap(Organism organism, HarvestContext context, double tileTrend) {
        double base = Numbers.clamp(Numbers.finiteOr(organism.getGenome().forageRate(), 0.4), 0.05, 1);
        double density = Numbers.clamp01(Numbers.finiteOr(context.effectiveDensity(), 0));
        double crowd = Math.max(0, 1 - Math.max(0, Numbers.finiteOr(context.consumptionPenalty(), 0)) * density);
        // Trend is a per-tick delta, so it is amplified before use
        double trendFactor = Numbers.clamp(1 + 5 * organism.getResourceTrendAdaptation()
                * Numbers.clamp(Numbers.finiteOr(tileTrend, 0), -1, 1), 0.5, 1.5);
        double minCap = Numbers.clamp01(Numbers.finiteOr(organism.getGenome().harvestCapMin(), 0.1));
        double maxCap = Math.max(minCap, Numbers.clamp(
                Numbers.finiteOr(organism.getGenome().harvestCapMax(), 0.5), minCap, 1));
        return Numbers.clamp(base * crowd * trendFactor, minCap, maxCap);
    }

    /**
     * Copy of the stored energy buffer (for diagnostics and tests).
     */
    public double[] snapshot() {
        return Arrays.copyOf(current, current.length);
    }
}
