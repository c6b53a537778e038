package io.github.manjago.lifegrid.grid;

import io.github.manjago.lifegrid.core.Numbers;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntIterator;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Returns a dead organism's energy to the grid.
 *
 * On death a fraction of the organism's energy comes back. Part of it is
 * deposited at once (the death tile first, overflow split evenly across the
 * unblocked orthogonal neighbours); the rest goes into the tile's decay pool.
 * Each tick every pool releases {@code min(pool, base + pool * rate)} through
 * the same deposit rule. A pool is dropped when it falls under
 * {@link #EPSILON} or has released nothing for {@code maxAge} ticks.
 *
 * Trend updates caused by deposits are buffered per tile and applied by
 * {@link #applyPendingDeltas()} after the energy pass.
 */
public class DecayRedistributor {

    private static final Logger log = LoggerFactory.getLogger(DecayRedistributor.class);

    public static final double EPSILON = 1e-4;

    /**
     * Decay tuning.
     *
     * @param immediateShare share of the returned energy deposited at death
     * @param releaseBase fixed release per tick
     * @param releaseRate proportional release per tick
     * @param maxAge ticks without a release before a pool is dropped
     * @param spawnEnergyFraction pool energy (fraction of max tile energy) that can become an organism
     */
    public record Settings(double immediateShare, double releaseBase, double releaseRate,
                           int maxAge, double spawnEnergyFraction) {
    }

    /**
     * Result of {@link #enqueue}.
     *
     * @param returned energy coming back to the grid
     * @param immediate energy deposited into tiles at once
     * @param reserved energy placed into the decay pool
     */
    public record Receipt(double returned, double immediate, double reserved) {
        public static final Receipt EMPTY = new Receipt(0, 0, 0);
    }

    /**
     * Converts pooled energy into a new organism while the population is short.
     */
    @FunctionalInterface
    public interface PoolSpawner {
        /**
         * @return energy used by the spawned organism, or 0 if nothing was spawned
         */
        double spawn(int row, int col, double poolEnergy);
    }

    private final TileGrid grid;
    private final TileEnergyField energy;
    private final Settings settings;

    private final double[] pool;
    private final int[] age;
    private final IntOpenHashSet active = new IntOpenHashSet();

    // Buffered deposits of the current pass
    private final double[] pendingDelta;
    private final IntArrayList touched = new IntArrayList();

    private double distributedTotal;
    private double droppedTotal;
    private long poolSpawns;

    public DecayRedistributor(TileGrid grid, TileEnergyField energy, Settings settings) {
        this.grid = grid;
        this.energy = energy;
        this.settings = settings;
        this.pool = new double[grid.size()];
        this.age = new int[grid.size()];
        this.pendingDelta = new double[grid.size()];
    }

    /**
     * Return a dead organism's energy at (row, col).
     *
     * @param deathEnergy the organism's energy at death
     * @param returnFraction share of it that comes back
     */
    public Receipt enqueue(int row, int col, double deathEnergy, double returnFraction) {
        if (!grid.inBounds(row, col)) return Receipt.EMPTY;
        double amount = Numbers.finiteOr(deathEnergy, 0);
        if (amount <= EPSILON) return Receipt.EMPTY;

        double returned = amount * Numbers.clamp01(Numbers.finiteOr(returnFraction, 0));
        if (returned <= EPSILON) return Receipt.EMPTY;

        int idx = grid.index(row, col);
        double reserve = returned * (1 - Numbers.clamp01(settings.immediateShare()));
        double immediate = returned - reserve;
        double deposited = 0;

        if (immediate > EPSILON) {
            double leftover = distribute(row, col, immediate);
            deposited = immediate - leftover;
            reserve += leftover;
        } else {
            reserve += immediate;
        }

        if (reserve > EPSILON) {
            pool[idx] += reserve;
            age[idx] = 0;
            active.add(idx);
        } else {
            reserve = 0;
        }

        log.debug("Decay at ({},{}): returned {}, immediate {}, pooled {}",
                row, col, String.format("%.4f", returned), String.format("%.4f", deposited),
                String.format("%.4f", reserve));
        return new Receipt(returned, deposited, reserve);
    }

    /**
     * Release every active pool once.
     *
     * @param spawner converts pools into organisms, or null when the population is not short
     */
    public void process(PoolSpawner spawner) {
        if (active.isEmpty()) return;

        // Sorted for a processing order independent of hash layout
        int[] tiles = active.toIntArray();
        Arrays.sort(tiles);

        double spawnThreshold = Math.max(EPSILON,
                Numbers.clamp01(settings.spawnEnergyFraction()) * energy.getMaxTileEnergy());

        for (int idx : tiles) {
            double amount = pool[idx];
            if (amount <= EPSILON) {
                clear(idx);
                continue;
            }
            int row = grid.rowOf(idx);
            int col = grid.colOf(idx);

            if (spawner != null && amount >= spawnThreshold && grid.isFree(row, col)) {
                double used = Math.min(amount, Math.max(0, spawner.spawn(row, col, amount)));
                if (used > 0) {
                    poolSpawns++;
                    amount -= used;
                    if (amount <= EPSILON) {
                        droppedTotal += Math.max(0, amount);
                        clear(idx);
                        continue;
                    }
                    pool[idx] = amount;
                }
            }

            double release = Math.min(amount, settings.releaseBase() + amount * settings.releaseRate());
            double leftover = amount - release;
            double remainder = distribute(row, col, release);
            double consumed = release - remainder;
            double nextAmount = leftover + remainder;

            int nextAge = consumed > EPSILON ? 0 : age[idx] + 1;
            if (nextAmount <= EPSILON || nextAge >= settings.maxAge()) {
                droppedTotal += Math.max(0, nextAmount);
                clear(idx);
                continue;
            }
            pool[idx] = nextAmount;
            age[idx] = nextAge;
        }
    }

    /**
     * Apply the trend changes buffered since the last call.
     */
    public void applyPendingDeltas() {
        double max = energy.getMaxTileEnergy();
        for (int i = 0; i < touched.size(); i++) {
            int idx = touched.getInt(i);
            energy.applyTrendDelta(idx, pendingDelta[idx] / max);
            pendingDelta[idx] = 0;
        }
        touched.clear();
    }

    /**
     * Deposit at a tile, then split the overflow evenly across the unblocked
     * orthogonal neighbours, repeating while some of them still have room.
     *
     * @return energy that could not be placed
     */
    double distribute(int row, int col, double amount) {
        int idx = grid.index(row, col);
        double remaining = amount - depositTracked(idx, amount);
        if (remaining <= EPSILON) {
            return Math.max(0, remaining);
        }

        int[] open = new int[4];
        for (int round = 0; round < 4 && remaining > EPSILON; round++) {
            int n = 0;
            for (int[] d : TileGrid.ORTHOGONAL) {
                int r = row + d[0];
                int c = col + d[1];
                if (!grid.inBounds(r, c)) continue;
                int nIdx = grid.index(r, c);
                if (energy.capacityAt(nIdx) > 0) open[n++] = nIdx;
            }
            if (n == 0) break;
            double share = remaining / n;
            for (int i = 0; i < n; i++) {
                remaining -= depositTracked(open[i], share);
            }
        }
        return Math.max(0, remaining);
    }

    private double depositTracked(int idx, double amount) {
        double added = energy.deposit(idx, amount);
        if (added > 0) {
            if (pendingDelta[idx] == 0) touched.add(idx);
            pendingDelta[idx] += added;
            distributedTotal += added;
        }
        return added;
    }

    private void clear(int idx) {
        pool[idx] = 0;
        age[idx] = 0;
        active.remove(idx);
    }

    // ========== Getters ==========

    public double poolAt(int row, int col) {
        return grid.inBounds(row, col) ? pool[grid.index(row, col)] : 0;
    }

    public int ageAt(int row, int col) {
        return grid.inBounds(row, col) ? age[grid.index(row, col)] : 0;
    }

    public int activePools() {
        return active.size();
    }

    public double pooledTotal() {
        double total = 0;
        IntIterator it = active.iterator();
        while (it.hasNext()) {
            total += pool[it.nextInt()];
        }
        return total;
    }

    /** Cumulative energy deposited into tiles by this redistributor. */
    public double distributedTotal() {
        return distributedTotal;
    }

    /** Cumulative pool energy dropped as residue or by ageing out. */
    public double droppedTotal() {
        return droppedTotal;
    }

    public long poolSpawns() {
        return poolSpawns;
    }

    public Settings settings() {
        return settings;
    }
}
