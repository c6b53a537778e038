package io.github.manjago.lifegrid.sim;

import io.github.manjago.lifegrid.config.SimulationConfig;
import io.github.manjago.lifegrid.core.GameRng;
import io.github.manjago.lifegrid.core.Genome;
import io.github.manjago.lifegrid.core.GenomeFactory;
import io.github.manjago.lifegrid.core.InteractionGenes;
import io.github.manjago.lifegrid.core.Numbers;
import io.github.manjago.lifegrid.core.Organism;
import io.github.manjago.lifegrid.core.RgbGenome;
import io.github.manjago.lifegrid.event.EnvironmentalEvent;
import io.github.manjago.lifegrid.event.EventManager;
import io.github.manjago.lifegrid.event.EventModifiers;
import io.github.manjago.lifegrid.event.RandomEventManager;
import io.github.manjago.lifegrid.grid.DecayRedistributor;
import io.github.manjago.lifegrid.grid.DensityField;
import io.github.manjago.lifegrid.grid.GridPosition;
import io.github.manjago.lifegrid.grid.TileEnergyField;
import io.github.manjago.lifegrid.grid.TileGrid;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Grid tick engine.
 *
 * Owns the grid, the energy and density fields, decay pools and the
 * reproduction machinery, and runs them in a fixed order every tick:
 * <ol>
 *   <li>publish the density snapshot, reset the similarity cache, compute scarcity</li>
 *   <li>advance environmental events</li>
 *   <li>release decay pools (spawning from them while the population is short)</li>
 *   <li>regenerate the energy field, then apply buffered decay deltas</li>
 *   <li>give every organism alive at tick start one turn, in row-major order</li>
 *   <li>compensatory seeding, energy exclusivity check, snapshot</li>
 * </ol>
 *
 * Organisms read density from the snapshot published at tick start, so the
 * order in which they move has no influence on what later organisms see.
 * Single-threaded: {@link #tick} runs to completion.
 */
public class GridSimulation {

    private static final Logger log = LoggerFactory.getLogger(GridSimulation.class);

    // Share of max tile energy lost per unit of event pressure
    private static final double EVENT_LOSS_SCALE = 0.02;
    private static final double FIGHT_COST_SCALE = 0.02;
    private static final long EVENT_STREAM_SALT = 0xE7E7L;

    private final SimulationConfig config;
    private final long seed;
    private final GameRng rng;
    private final TickOptions defaultOptions;

    // Arena and fields
    private final TileGrid grid;
    private final TileEnergyField energy;
    private final DensityField density;
    private final DecayRedistributor decay;

    // Collaborators
    private final EventManager events;
    private final GenomeFactory genomeFactory;
    private final InteractionResolver interactions;
    private final StatsCollector stats;

    // Tick machinery
    private final SimilarityCache similarities = new SimilarityCache();
    private final SpatialTargetResolver targets;
    private final PopulationScarcityController scarcityController;
    private final ReproductionPolicy reproduction;
    private final InteractionContext interactionContext = new Interactions();

    // Statistics
    private long tick = 0;
    private long nextId = 0;
    private int population = 0;
    private int peakPopulation = 0;
    private double scarcity = 0;
    private long births = 0;
    private long seeded = 0;
    private long interactionCount = 0;
    private long failedInteractions = 0;
    private long positionRepairs = 0;
    private final Map<DeathCause, Long> deaths = new EnumMap<>(DeathCause.class);

    // Resolved once per tick
    private List<EventModifiers> eventModifiers = List.of();
    private TickOptions currentOptions;
    private int populationAtStart;
    private @Nullable TickSnapshot lastSnapshot;

    public GridSimulation(SimulationConfig config) {
        this(builder(config));
    }

    private GridSimulation(Builder builder) {
        this.config = builder.config;
        this.seed = config.effectiveSeed();
        this.rng = new GameRng(seed);
        this.defaultOptions = TickOptions.from(config);
        this.currentOptions = defaultOptions;

        this.grid = new TileGrid(config.rows(), config.cols());
        this.energy = new TileEnergyField(grid, config.maxTileEnergy(), config.initialEnergyFraction());
        this.density = new DensityField(grid, config.densityRadius());
        this.decay = new DecayRedistributor(grid, energy, new DecayRedistributor.Settings(
                config.decayImmediateShare(), config.decayReleaseBase(), config.decayReleaseRate(),
                config.decayMaxAge(), config.decaySpawnEnergyFraction()));

        this.events = builder.events != null ? builder.events
                : new RandomEventManager(config.rows(), config.cols(), rng.fork(EVENT_STREAM_SALT));
        this.genomeFactory = builder.genomeFactory;
        this.interactions = builder.interactions;
        this.stats = builder.stats != null ? builder.stats : new RunningStats(config.diversityThreshold());

        this.targets = new SpatialTargetResolver(grid, density, similarities);
        this.scarcityController = new PopulationScarcityController(grid, energy, density,
                config.minPopulationFloor());
        SpawnSiteSelector spawnSites = new SpawnSiteSelector(grid, energy, density, builder.zonePolicy);
        this.reproduction = new ReproductionPolicy(energy, density, scarcityController, spawnSites,
                builder.zonePolicy, stats);

        log.info("Simulation created: {}x{} grid, min population {} (seed: {})",
                config.rows(), config.cols(), scarcityController.minPopulation(), seed);
    }

    // ========== Builder ==========

    public static Builder builder(SimulationConfig config) {
        return new Builder(config);
    }

    /**
     * Replaces default collaborators. Unset values fall back to the built-in ones.
     */
    public static class Builder {
        private final SimulationConfig config;
        private @Nullable EventManager events;
        private GenomeFactory genomeFactory = RgbGenome::random;
        private ReproductionZonePolicy zonePolicy = ReproductionZonePolicy.ALLOW_ALL;
        private InteractionResolver interactions = new DefaultInteractionResolver();
        private @Nullable StatsCollector stats;

        private Builder(SimulationConfig config) {
            this.config = config;
        }

        public Builder eventManager(@NotNull EventManager events) { this.events = events; return this; }
        public Builder genomeFactory(@NotNull GenomeFactory factory) { this.genomeFactory = factory; return this; }
        public Builder zonePolicy(@NotNull ReproductionZonePolicy policy) { this.zonePolicy = policy; return this; }
        public Builder interactionResolver(@NotNull InteractionResolver resolver) { this.interactions = resolver; return this; }
        public Builder statsCollector(@NotNull StatsCollector stats) { this.stats = stats; return this; }

        public GridSimulation build() {
            return new GridSimulation(this);
        }
    }

    // ========== Tick ==========

    /**
     * Run one tick with the configured options.
     */
    public TickSnapshot tick() {
        return tick(defaultOptions);
    }

    /**
     * Run one tick.
     *
     * @param options tunables for this tick; null uses the configured ones
     */
    public TickSnapshot tick(@Nullable TickOptions options) {
        tick++;
        currentOptions = options != null ? options : defaultOptions;

        similarities.reset();
        density.sync(false);
        populationAtStart = population;
        scarcity = scarcityController.signal(population);

        // Environment
        events.advance(currentOptions.eventFrequencyMultiplier(), currentOptions.maxConcurrentEvents());
        eventModifiers = EventModifiers.resolve(events.activeEvents(), currentOptions.eventStrengthMultiplier());

        decay.process(scarcity > 0 ? this::spawnFromPool : null);
        energy.regenerate(density, new TileEnergyField.RegenParams(
                currentOptions.regenRate(), currentOptions.diffusionRate(),
                config.regenDensityPenalty(), currentOptions.densityEffectMultiplier()), eventModifiers);
        decay.applyPendingDeltas();

        // Organisms
        List<Organism> turnOrder = grid.occupantsRowMajor();
        for (Organism organism : turnOrder) {
            organism.markTickOrigin();
        }
        for (Organism organism : turnOrder) {
            if (organism.isAlive()) {
                takeTurn(organism);
            }
        }

        compensatorySeeding();

        int fixed = energy.enforceExclusivity();
        if (fixed > 0) {
            log.debug("Tick {}: corrected energy exclusivity on {} tiles", tick, fixed);
        }
        scarcity = scarcityController.signal(population);
        stats.onTickEnd(tick, population, scarcity);
        return snapshot();
    }

    // ========== Organism turn ==========

    private void takeTurn(Organism organism) {
        GridPosition origin = locate(organism);
        if (origin == null) {
            return;
        }
        int row = origin.row();
        int col = origin.col();
        double max = config.maxTileEnergy();

        organism.tickAge();
        if (organism.isPastLifespan()) {
            registerDeath(organism, DeathDetails.of(DeathCause.SENESCENCE));
            return;
        }

        applyEventPressure(organism, row, col);

        double effDensity = effectiveDensity(row, col);
        energy.harvest(row, col, organism, new TileEnergyField.HarvestContext(
                effDensity, config.consumptionDensityPenalty()));

        double upkeep = Numbers.clamp01(organism.getGenome().energyLossFraction()) * max
                * organism.getDensityResponses().energyLoss().rising(effDensity);
        organism.spendEnergy(upkeep);
        if (organism.getEnergy() < organism.starvationThreshold(max)) {
            registerDeath(organism, DeathDetails.of(DeathCause.STARVATION));
            return;
        }

        TargetGroups visible = targets.findTargets(organism, row, col, currentOptions, rng);

        if (!visible.mates().isEmpty() || !visible.society().isEmpty()) {
            ReproductionOutcome outcome = reproduction.attempt(organism, visible, new ReproductionPolicy.Context(
                    tick, seed, currentOptions, scarcity, populationAtStart, origin, rng, this::spawnOffspring));
            if (outcome.isBorn()) {
                return;
            }
        }

        if (!visible.isEmpty() && rng.nextBoolean(Numbers.clamp01(organism.getGenome().activityRate()))) {
            if (interact(organism, visible, effDensity)) {
                return;
            }
        }

        if (organism.isAlive()) {
            wander(organism);
        }
    }

    private void applyEventPressure(Organism organism, int row, int col) {
        double pressure = 0;
        for (EventModifiers modifiers : eventModifiers) {
            EnvironmentalEvent event = modifiers.event();
            if (!event.getArea().contains(row, col)) continue;
            double strength = Numbers.clamp01(event.getStrength()
                    * Math.max(0, Numbers.finiteOr(currentOptions.eventStrengthMultiplier(), 1)));
            double resistance = Numbers.clamp01(organism.getGenome().eventResistance(event.getType()));
            pressure += strength * event.getType().effect().energyLoss() * (1 - resistance);
        }
        organism.setLastEventPressure(pressure);
        if (pressure > 0) {
            organism.spendEnergy(Numbers.clamp01(pressure) * EVENT_LOSS_SCALE * config.maxTileEnergy());
        }
    }

    /**
     * Avoid, fight or cooperate with the nearest suitable neighbour.
     *
     * @return true if the turn was used
     */
    private boolean interact(Organism organism, TargetGroups visible, double effDensity) {
        InteractionGenes genes = organism.getInteractionGenes();
        Target enemy = first(visible.enemies());
        Target friend = first(visible.society());
        Target other = first(visible.mates());

        Target fightTarget = enemy != null ? enemy : other;
        Target helpTarget = friend != null ? friend : other;
        Target threat = enemy != null ? enemy : fightTarget;

        double avoid = threat == null ? 0
                : genes.avoid() * (1 + effDensity * (1 - organism.getCrowdingTolerance()));
        double fight = fightTarget == null ? 0
                : genes.fight() * organism.getDensityResponses().fight().rising(effDensity) * (enemy != null ? 1 : 0.25);
        double cooperate = helpTarget == null ? 0
                : genes.cooperate() * organism.getDensityResponses().cooperate().rising(effDensity)
                        * (friend != null ? 1 : 0.25);

        double total = avoid + fight + cooperate;
        if (!(total > 0)) {
            return false;
        }
        double pick = rng.nextDouble() * total;
        if (pick < avoid) {
            return step(organism, threat.position(), false);
        }
        if (pick < avoid + fight) {
            return engage(organism, fightTarget, InteractionIntent.Kind.FIGHT, effDensity);
        }
        return engage(organism, helpTarget, InteractionIntent.Kind.COOPERATE, effDensity);
    }

    private boolean engage(Organism organism, Target target, InteractionIntent.Kind kind, double effDensity) {
        if (target.distance() > 1) {
            return step(organism, target.position(), true);
        }
        double risk = Numbers.clamp01(organism.getGenome().riskTolerance());
        InteractionIntent intent = new InteractionIntent(kind, organism, target.organism(),
                new GridPosition(organism.getRow(), organism.getCol()), target.position(), effDensity,
                config.maxTileEnergy() * FIGHT_COST_SCALE * (2 - risk),
                organism.getGenome().cooperationShare());
        interactionCount++;
        try {
            boolean resolved = interactions.resolve(intent, interactionContext);
            if (!resolved) failedInteractions++;
            return resolved;
        } catch (RuntimeException e) {
            failedInteractions++;
            log.warn("Interaction resolver failed for {} -> {}: {}",
                    organism.toShortString(), target.organism().toShortString(), e.getMessage());
            return false;
        }
    }

    /**
     * Step to the free neighbour that best closes (or opens) the distance to {@code goal}.
     */
    private boolean step(Organism organism, GridPosition goal, boolean toward) {
        int row = organism.getRow();
        int col = organism.getCol();
        int current = goal.distanceTo(row, col);
        int bestRow = -1;
        int bestCol = -1;
        int bestDistance = current;
        for (int[] d : TileGrid.NEIGHBORS) {
            int r = row + d[0];
            int c = col + d[1];
            if (!grid.isFree(r, c)) continue;
            int distance = goal.distanceTo(r, c);
            if (toward ? distance < bestDistance : distance > bestDistance) {
                bestDistance = distance;
                bestRow = r;
                bestCol = c;
            }
        }
        return bestRow >= 0 && relocateOrganism(organism, bestRow, bestCol);
    }

    /**
     * Move towards the richest free neighbour, or take a random step when no neighbour beats the current tile.
     */
    private void wander(Organism organism) {
        int row = organism.getRow();
        int col = organism.getCol();
        List<GridPosition> free = new ArrayList<>(TileGrid.NEIGHBORS.length);
        GridPosition richest = null;
        double richestEnergy = energy.energyAt(row, col);
        for (int[] d : TileGrid.NEIGHBORS) {
            int r = row + d[0];
            int c = col + d[1];
            if (!grid.isFree(r, c)) continue;
            GridPosition p = new GridPosition(r, c);
            free.add(p);
            double e = energy.energyAt(r, c);
            if (e > richestEnergy) {
                richestEnergy = e;
                richest = p;
            }
        }
        if (free.isEmpty()) {
            return;
        }
        if (richest == null && rng.nextBoolean(Numbers.clamp01(organism.getGenome().activityRate()))) {
            richest = free.get(rng.nextInt(free.size()));
        }
        if (richest != null) {
            relocateOrganism(organism, richest.row(), richest.col());
        }
    }

    // ========== Spawning ==========

    @Nullable
    private Organism spawnOffspring(Genome genome, int row, int col, double energyAmount,
                                    Organism parentA, Organism parentB) {
        return spawnOrganism(genome, row, col, energyAmount, parentA, parentB, BirthDetails.Origin.REPRODUCTION);
    }

    // Returns the pool energy consumed
    private double spawnFromPool(int row, int col, double poolEnergy) {
        if (population >= scarcityController.minPopulation()) {
            return 0;
        }
        Genome genome = genomeFactory.random(rng);
        double amount = Math.min(poolEnergy, config.maxTileEnergy()
                * (Numbers.clamp01(genome.starvationThresholdFraction()) + scarcityController.seedingBuffer(scarcity)));
        if (amount <= 0) {
            return 0;
        }
        Organism child = spawnOrganism(genome, row, col, amount, null, null, BirthDetails.Origin.DECAY_POOL);
        return child != null ? amount : 0;
    }

    private void compensatorySeeding() {
        double signal = scarcityController.signal(population);
        if (signal <= 0) {
            return;
        }
        int deficit = scarcityController.minPopulation() - population;
        int wanted = Math.max(1, deficit / 4);
        int placed = 0;
        for (GridPosition site : scarcityController.seedSites(wanted, signal, rng)) {
            Genome genome = genomeFactory.random(rng);
            int idx = grid.index(site.row(), site.col());
            double amount = scarcityController.seedEnergy(genome.starvationThresholdFraction(),
                    energy.energyAt(idx), signal);
            if (amount <= 0) continue;
            double taken = energy.withdraw(idx, amount);
            if (spawnOrganism(genome, site.row(), site.col(), taken, null, null, BirthDetails.Origin.SEEDED) != null) {
                placed++;
            } else {
                energy.deposit(idx, taken);
            }
        }
        if (placed > 0) {
            log.debug("Tick {}: seeded {} organisms (scarcity {})", tick, placed, String.format("%.3f", signal));
        }
    }

    /**
     * Place {@code count} random organisms on random free tiles.
     *
     * Seeded organisms start with half the max tile energy.
     *
     * @return number of organisms placed
     */
    public int seedPopulation(int count) {
        int placed = 0;
        int attempts = Math.max(0, count) * 20;
        double startEnergy = config.maxTileEnergy() * 0.5;
        while (placed < count && attempts-- > 0) {
            int row = rng.nextInt(grid.rows());
            int col = rng.nextInt(grid.cols());
            if (!grid.isFree(row, col)) continue;
            Genome genome = genomeFactory.random(rng);
            if (spawnOrganism(genome, row, col, startEnergy, null, null, BirthDetails.Origin.SEEDED) != null) {
                placed++;
            }
        }
        log.info("Seeded {} organisms ({} requested)", placed, count);
        return placed;
    }

    // ========== Arena operations ==========

    /**
     * Create and place a host-defined organism.
     *
     * @return the organism, or null if the tile is not free
     */
    @Nullable
    public Organism spawnOrganism(Genome genome, int row, int col, double startEnergy) {
        return spawnOrganism(genome, row, col, startEnergy, null, null, BirthDetails.Origin.PLACED);
    }

    @Nullable
    Organism spawnOrganism(Genome genome, int row, int col, double startEnergy,
                           @Nullable Organism parentA, @Nullable Organism parentB, BirthDetails.Origin origin) {
        if (!grid.isFree(row, col)) {
            return null;
        }
        double amount = Numbers.clamp(Numbers.finiteOr(startEnergy, 0), 0, config.maxTileEnergy());
        Organism child = new Organism(nextId, genome, row, col, amount,
                parentA != null ? parentA.getId() : -1, tick);
        if (!placeOrganism(child, row, col)) {
            return null;
        }
        births++;
        if (origin == BirthDetails.Origin.SEEDED) seeded++;
        stats.onBirth(new BirthDetails(child, parentA, parentB, origin, tick));
        return child;
    }

    /**
     * Put an existing organism on a free tile.
     *
     * @return false if the tile is not free or the organism is dead
     */
    public boolean placeOrganism(Organism organism, int row, int col) {
        if (!organism.isAlive() || !grid.place(organism, row, col)) {
            return false;
        }
        organism.markTickOrigin();
        int idx = grid.index(row, col);
        energy.occupy(idx);
        density.applyDelta(row, col, +1);
        nextId = Math.max(nextId, organism.getId() + 1);
        population++;
        peakPopulation = Math.max(peakPopulation, population);
        stats.onEnter(organism);
        return true;
    }

    /**
     * Take an organism off the grid without returning its energy.
     *
     * @return false if it was not on the grid
     */
    public boolean removeOrganism(Organism organism) {
        GridPosition pos = locate(organism);
        if (pos == null) {
            return false;
        }
        detach(organism, pos);
        organism.kill();
        return true;
    }

    /**
     * Move an organism to a free tile.
     *
     * @return false if the organism is not on the grid or the tile is not free
     */
    public boolean relocateOrganism(Organism organism, int row, int col) {
        GridPosition from = locate(organism);
        if (from == null || !grid.move(from.row(), from.col(), row, col)) {
            return false;
        }
        energy.vacate(grid.index(from.row(), from.col()));
        energy.occupy(grid.index(row, col));
        density.applyDelta(from.row(), from.col(), -1);
        density.applyDelta(row, col, +1);
        return true;
    }

    /**
     * Kill an organism and hand its energy to the decay redistributor.
     *
     * The returned share comes from the death details, then the genome, then
     * the configured default.
     *
     * @return false if the organism was already dead or not on the grid
     */
    public boolean registerDeath(Organism organism, DeathDetails details) {
        if (!organism.isAlive()) {
            return false;
        }
        GridPosition pos = locate(organism);
        if (pos == null) {
            organism.kill();
            return false;
        }
        double remaining = organism.getEnergy();
        detach(organism, pos);
        organism.kill();

        double fraction = Numbers.finiteOr(details.returnFraction(),
                Numbers.finiteOr(organism.getGenome().decayReturnFraction(), config.decayReturnFraction()));
        decay.enqueue(pos.row(), pos.col(), remaining, fraction);

        deaths.merge(details.cause(), 1L, Long::sum);
        stats.onDeath(organism, details, tick);
        log.debug("Organism {} died: {}", organism.toShortString(), details.cause());
        return true;
    }

    private void detach(Organism organism, GridPosition pos) {
        grid.clear(pos.row(), pos.col());
        energy.vacate(grid.index(pos.row(), pos.col()));
        density.applyDelta(pos.row(), pos.col(), -1);
        population--;
        stats.onLeave(organism);
    }

    /**
     * Where the organism really is.
     *
     * The organism's own row/col is only a cache. When it disagrees with the
     * grid the grid is scanned and the cache repaired.
     *
     * @return the position, or null if the organism is not on the grid
     */
    @Nullable
    public GridPosition locate(Organism organism) {
        if (grid.occupantAt(organism.getRow(), organism.getCol()) == organism) {
            return new GridPosition(organism.getRow(), organism.getCol());
        }
        GridPosition found = grid.find(organism);
        if (found == null) {
            return null;
        }
        positionRepairs++;
        if (positionRepairs == 1 || positionRepairs % 1000 == 0) {
            log.warn("Position drift for {}: cached ({},{}), actual ({},{}) [{} repairs so far]",
                    organism.getId(), organism.getRow(), organism.getCol(), found.row(), found.col(),
                    positionRepairs);
        } else {
            log.debug("Position drift for {} repaired", organism.getId());
        }
        organism.updatePosition(found.row(), found.col());
        return found;
    }

    // ========== Queries ==========

    @Nullable
    public Organism organismAt(int row, int col) {
        return grid.occupantAt(row, col);
    }

    /**
     * Published local density at a tile, in [0, 1].
     */
    public double getDensityAt(int row, int col) {
        return density.densityAt(row, col);
    }

    public double getEnergyAt(int row, int col) {
        return energy.energyAt(row, col);
    }

    /**
     * Set the energy of a free tile.
     */
    public void setTileEnergy(int row, int col, double value) {
        energy.setEnergy(row, col, value);
    }

    /**
     * Mark or clear an obstacle; a new obstacle loses its energy.
     *
     * @return false if the tile is occupied or already in that state
     */
    public boolean setObstacle(int row, int col, boolean blocked) {
        if (blocked && !grid.isFree(row, col)) {
            return false;
        }
        if (blocked) {
            energy.clearTile(row, col);
        }
        return grid.setObstacle(row, col, blocked);
    }

    /**
     * Living organisms in row-major order.
     */
    public List<Organism> organisms() {
        return grid.occupantsRowMajor();
    }

    private TickSnapshot snapshot() {
        List<Organism> living = grid.occupantsRowMajor();
        List<TickSnapshot.Entry> entries = new ArrayList<>(living.size());
        double totalEnergy = 0;
        long totalAge = 0;
        double maxFitness = 0;
        for (Organism o : living) {
            double fitness = Fitness.of(o, config.maxTileEnergy());
            double smoothed = Fitness.smooth(o.getSmoothedFitness(), fitness);
            o.setSmoothedFitness(smoothed);
            entries.add(new TickSnapshot.Entry(o.getId(), o.getRow(), o.getCol(), o.getEnergy(), o.getAge(),
                    fitness, smoothed, o.getOffspring(), o.getFightsWon()));
            totalEnergy += o.getEnergy();
            totalAge += o.getAge();
            maxFitness = Math.max(maxFitness, fitness);
        }
        lastSnapshot = new TickSnapshot(tick, living.size(), totalEnergy, totalAge, maxFitness, scarcity, entries);
        return lastSnapshot;
    }

    private double effectiveDensity(int row, int col) {
        return Numbers.clamp01(density.densityAt(row, col)
                * Math.max(0, Numbers.finiteOr(currentOptions.densityEffectMultiplier(), 1)));
    }

    @Nullable
    private static Target first(List<Target> list) {
        return list.isEmpty() ? null : list.get(0);
    }

    // ========== Getters ==========

    public SimulationConfig getConfig() { return config; }
    public long getSeed() { return seed; }
    public long getTick() { return tick; }
    public int getPopulation() { return population; }
    public double getScarcity() { return scarcity; }
    public long getPositionRepairs() { return positionRepairs; }
    public TickOptions getDefaultOptions() { return defaultOptions; }
    public TileGrid getGrid() { return grid; }
    public TileEnergyField getEnergyField() { return energy; }
    public DensityField getDensityField() { return density; }
    public DecayRedistributor getDecay() { return decay; }
    public PopulationScarcityController getScarcityController() { return scarcityController; }
    public ReproductionPolicy getReproductionPolicy() { return reproduction; }
    public SimilarityCache getSimilarityCache() { return similarities; }
    public StatsCollector getStatsCollector() { return stats; }

    /**
     * Snapshot produced by the latest tick, null before the first one.
     */
    @Nullable
    public TickSnapshot getLastSnapshot() { return lastSnapshot; }
    public EventManager getEventManager() { return events; }

    /**
     * Get current simulation statistics.
     */
    public SimulationStats getStats() {
        return new SimulationStats(
            tick,
            population,
            peakPopulation,
            scarcityController.minPopulation(),
            scarcity,
            births,
            seeded,
            decay.poolSpawns(),
            deaths.getOrDefault(DeathCause.SENESCENCE, 0L),
            deaths.getOrDefault(DeathCause.STARVATION, 0L),
            deaths.getOrDefault(DeathCause.COMBAT, 0L),
            deaths.getOrDefault(DeathCause.EXTERNAL, 0L),
            interactionCount,
            failedInteractions,
            events.activeEvents().size(),
            decay.activePools(),
            decay.distributedTotal(),
            decay.droppedTotal(),
            energy.totalEnergy(),
            positionRepairs
        );
    }

    private class Interactions implements InteractionContext {
        @Override
        public long tick() { return tick; }

        @Override
        public double maxTileEnergy() { return config.maxTileEnergy(); }

        @Override
        public GameRng rng() { return rng; }

        @Override
        public boolean kill(Organism organism, DeathDetails details) {
            return registerDeath(organism, details);
        }

        @Override
        public boolean relocate(Organism organism, int row, int col) {
            return relocateOrganism(organism, row, col);
        }
    }
}
