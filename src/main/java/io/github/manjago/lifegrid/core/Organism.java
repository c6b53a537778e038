package io.github.manjago.lifegrid.core;

/**
 * An organism living on the grid.
 *
 * Each organism has:
 * - A genome that supplies every behavioural trait
 * - An energy store capped at the maximum tile energy
 * - Lifecycle tracking (age, lifespan, alive status)
 * - Genealogy (parentId, birthTick)
 * - A cached grid position
 *
 * The grid is the owner of record for positions. The row/col stored here is a
 * cache that the grid keeps in sync; the simulation re-scans the grid when the
 * two disagree.
 *
 * Traits that are read every tick (lifespan, sight, density responses,
 * interaction genes) are copied from the genome at birth.
 */
public class Organism {

    private final long id;
    private final Genome genome;
    private final long parentId;
    private final long birthTick;

    // Trait snapshot taken at birth
    private final int lifespan;
    private final int sight;
    private final DensityResponses densityResponses;
    private final InteractionGenes interactionGenes;
    private final double diversityAppetite;
    private final double matePreferenceBias;
    private final double crowdingTolerance;
    private final double resourceTrendAdaptation;

    // Cached position (-1 when off-grid)
    private int row;
    private int col;
    private int originRow;
    private int originCol;
    private double smoothedFitness = Double.NaN;

    private double energy;
    private int age;
    private int reproductionCooldown;
    private double lastEventPressure;

    // Counters
    private int offspring;
    private int fightsWon;
    private int fightsLost;
    private int matingAttempts;
    private int matingSuccesses;

    private boolean alive = true;

    /**
     * Create a new organism.
     *
     * @param id unique organism identifier
     * @param genome trait provider
     * @param row initial row
     * @param col initial column
     * @param energy starting energy (non-finite or negative values become 0)
     * @param parentId id of the first parent (-1 for seeded organisms)
     * @param birthTick tick when the organism was created
     */
    public Organism(long id, Genome genome, int row, int col, double energy, long parentId, long birthTick) {
        this.id = id;
        this.genome = genome;
        this.row = row;
        this.col = col;
        this.originRow = row;
        this.originCol = col;
        this.energy = Math.max(0, Numbers.finiteOr(energy, 0));
        this.parentId = parentId;
        this.birthTick = birthTick;
        this.lifespan = Math.max(1, genome.lifespan());
        this.sight = Math.max(1, genome.sight());
        this.densityResponses = genome.densityResponses();
        this.interactionGenes = genome.interactionGenes();
        this.diversityAppetite = Numbers.clamp01(Numbers.finiteOr(genome.diversityAppetite(), 0.35));
        this.matePreferenceBias = Numbers.clamp(Numbers.finiteOr(genome.matePreferenceBias(), 0), -1, 1);
        this.crowdingTolerance = Numbers.clamp01(Numbers.finiteOr(genome.crowdingTolerance(), 0.5));
        this.resourceTrendAdaptation = Numbers.clamp01(Numbers.finiteOr(genome.resourceTrendAdaptation(), 0.5));
    }

    // ========== Getters ==========

    public long getId() { return id; }
    public Genome getGenome() { return genome; }
    public long getParentId() { return parentId; }
    public long getBirthTick() { return birthTick; }
    public int getRow() { return row; }
    public int getCol() { return col; }
    public double getEnergy() { return energy; }
    public int getAge() { return age; }
    public int getLifespan() { return lifespan; }
    public int getSight() { return sight; }
    public DensityResponses getDensityResponses() { return densityResponses; }
    public InteractionGenes getInteractionGenes() { return interactionGenes; }
    public double getDiversityAppetite() { return diversityAppetite; }
    public double getMatePreferenceBias() { return matePreferenceBias; }
    public double getCrowdingTolerance() { return crowdingTolerance; }
    public double getResourceTrendAdaptation() { return resourceTrendAdaptation; }
    public int getReproductionCooldown() { return reproductionCooldown; }
    public double getLastEventPressure() { return lastEventPressure; }
    public int getOffspring() { return offspring; }
    public int getFightsWon() { return fightsWon; }
    public int getFightsLost() { return fightsLost; }
    public int getMatingAttempts() { return matingAttempts; }
    public int getMatingSuccesses() { return matingSuccesses; }
    public boolean isAlive() { return alive; }

    /**
     * Age as a fraction of lifespan, in [0, 1].
     */
    public double getAgeFraction() {
        return Numbers.clamp01((double) age / lifespan);
    }

    // ========== Position ==========

    /**
     * Update the cached position. Called by the grid when the organism is placed or moved.
     */
    public void updatePosition(int row, int col) {
        this.row = row;
        this.col = col;
    }

    /**
     * Remember the current tile as the one held at the start of the tick.
     */
    public void markTickOrigin() {
        originRow = row;
        originCol = col;
    }

    /**
     * Smoothed fitness kept by the simulation across snapshots, NaN before the first one.
     */
    public double getSmoothedFitness() { return smoothedFitness; }

    public void setSmoothedFitness(double smoothedFitness) {
        this.smoothedFitness = smoothedFitness;
    }

    /** Tile held at the start of the tick, or the placement tile for organisms added during it. */
    public int getOriginRow() { return originRow; }
    public int getOriginCol() { return originCol; }

    // ========== Energy ==========

    /**
     * Add energy, never exceeding {@code cap}.
     *
     * @return the amount actually added
     */
    public double gainEnergy(double amount, double cap) {
        if (!(amount > 0)) return 0;
        double before = energy;
        energy = Math.min(cap, energy + amount);
        return Math.max(0, energy - before);
    }

    /**
     * Remove up to {@code amount} energy.
     *
     * @return the amount actually removed
     */
    public double spendEnergy(double amount) {
        if (!(amount > 0)) return 0;
        double spent = Math.min(energy, amount);
        energy -= spent;
        return spent;
    }

    public double starvationThreshold(double maxTileEnergy) {
        return Numbers.clamp01(genome.starvationThresholdFraction()) * maxTileEnergy;
    }

    public double reproductionThreshold(double maxTileEnergy) {
        return Numbers.clamp01(genome.reproductionThresholdFraction()) * maxTileEnergy;
    }

    // ========== Lifecycle ==========

    /**
     * Advance age and cooldown by one tick.
     */
    public void tickAge() {
        age++;
        if (reproductionCooldown > 0) {
            reproductionCooldown--;
        }
    }

    public boolean isPastLifespan() {
        return age >= lifespan;
    }

    public void startReproductionCooldown(int ticks) {
        reproductionCooldown = Math.max(reproductionCooldown, Math.max(0, ticks));
    }

    public void setLastEventPressure(double pressure) {
        this.lastEventPressure = Numbers.clamp01(Numbers.finiteOr(pressure, 0));
    }

    public void recordOffspring() {
        offspring++;
    }

    /**
     * Count a mating that reached the chance roll.
     */
    public void recordMating(boolean success) {
        matingAttempts++;
        if (success) matingSuccesses++;
    }

    public void recordFight(boolean won) {
        if (won) fightsWon++; else fightsLost++;
    }

    /**
     * Mark organism as dead.
     */
    public void kill() {
        this.alive = false;
    }

    // ========== Reproduction ==========

    /**
     * Base chance of reproducing with {@code partner} before diversity and scarcity shaping.
     *
     * Averages both genomes' probabilities, scales by both density responses
     * (full at an empty neighbourhood, reduced when crowded), the tile's energy
     * level and trend, a small kin-preference pull and an age penalty.
     *
     * @param partner the prospective mate
     * @param effectiveDensity local density in [0, 1]
     * @param tileEnergy normalised energy of the focal tile in [0, 1]
     * @param tileTrend normalised energy trend in [-1, 1]
     * @param similarity genetic similarity of the pair
     * @return probability in [0.01, 0.95]
     */
    public double reproductionProbability(Organism partner, double effectiveDensity,
                                          double tileEnergy, double tileTrend, double similarity) {
        double density = Numbers.clamp01(Numbers.finiteOr(effectiveDensity, 0));
        double base = (Numbers.clamp01(genome.reproductionProbability())
                + Numbers.clamp01(partner.genome.reproductionProbability())) / 2;
        double densityFactor = (densityResponses.reproduction().falling(density)
                + partner.densityResponses.reproduction().falling(density)) / 2;
        double adaptation = (resourceTrendAdaptation + partner.resourceTrendAdaptation) / 2;
        double energyFactor = Numbers.clamp(
                0.75 + 0.25 * Numbers.clamp01(Numbers.finiteOr(tileEnergy, 0))
                        + 0.15 * adaptation * Numbers.clamp(Numbers.finiteOr(tileTrend, 0), -1, 1),
                0.5, 1.2);
        double kinBias = (matePreferenceBias + partner.matePreferenceBias) / 2;
        double kinFactor = 1 + 0.05 * kinBias * (Numbers.clamp01(Numbers.finiteOr(similarity, 0)) - 0.5);
        double senescence = Math.max(0.2, 1 - 0.5 * (
                Numbers.clamp01(genome.senescenceSensitivity()) * getAgeFraction()
                        + Numbers.clamp01(partner.genome.senescenceSensitivity()) * partner.getAgeFraction()));
        return Numbers.clamp(base * densityFactor * energyFactor * kinFactor * senescence, 0.01, 0.95);
    }

    // ========== Object ==========

    @Override
    public String toString() {
        return String.format("Organism[id=%d, pos=(%d,%d), energy=%.3f, age=%d/%d, genome=%s, alive=%s]",
                id, row, col, energy, age, lifespan, genome.toShortString(), alive);
    }

    /**
     * Short representation for logging.
     */
    public String toShortString() {
        return String.format("#%d@(%d,%d)", id, row, col);
    }
}
