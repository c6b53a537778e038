package io.github.manjago.lifegrid.sim;

import io.github.manjago.lifegrid.core.GameRng;
import io.github.manjago.lifegrid.core.Genome;
import io.github.manjago.lifegrid.core.Numbers;
import io.github.manjago.lifegrid.core.Organism;
import io.github.manjago.lifegrid.grid.DensityField;
import io.github.manjago.lifegrid.grid.GridPosition;
import io.github.manjago.lifegrid.grid.TileEnergyField;
import io.github.manjago.lifegrid.sim.ReproductionZonePolicy.ZoneRequest;
import io.github.manjago.lifegrid.sim.ReproductionZonePolicy.ZoneVerdict;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Decides whether an organism reproduces this turn, with whom, and where the
 * offspring goes.
 *
 * An attempt runs in this order:
 * 1. choose a partner from the mates (or society when there are no mates)
 * 2. zone, reach and cooldown gates
 * 3. base probability from the organisms
 * 4. pair diversity threshold
 * 5. low-diversity penalty or diversity bonus
 * 6. scarcity bonus
 * 7. energy gate for both parents
 * 8. chance roll and spawn-site selection
 * 9. commit: crossover, parental investment, cooldowns
 *
 * Failures are returned as {@link ReproductionOutcome}s and reported to the
 * stats collector; nothing here throws for an ordinary "no".
 */
public class ReproductionPolicy {

    private static final Logger log = LoggerFactory.getLogger(ReproductionPolicy.class);

    /** Mate pool is limited to this many nearest candidates. */
    static final int MAX_POOL = 12;

    /**
     * Places a new organism on the grid.
     */
    @FunctionalInterface
    public interface OffspringSink {
        /**
         * @return the new organism, or null if the tile could not take it
         */
        @Nullable
        Organism spawn(Genome genome, int row, int col, double energy, Organism parentA, Organism parentB);
    }

    /**
     * Per-attempt inputs owned by the simulation.
     *
     * @param tick current tick
     * @param seed simulation seed, used for pair-keyed offspring streams
     * @param options tick tunables
     * @param scarcity scarcity signal computed at tick start
     * @param population population at tick start
     * @param focalOrigin the focal organism's tile at the start of its turn
     * @param rng simulation stream for selection and chance rolls
     * @param sink places offspring
     */
    public record Context(long tick, long seed, TickOptions options, double scarcity, int population,
                          GridPosition focalOrigin, GameRng rng, OffspringSink sink) {
    }

    /**
     * Local conditions of a pair, independent of the grid.
     *
     * @param effectiveDensity density around the focal organism
     * @param tileEnergy normalised energy of the focal tile
     * @param tileTrend energy trend of the focal tile
     * @param population population at tick start
     * @param lowDiversityFloor lowest penalty multiplier
     * @param environment diversity-shaping signals
     */
    public record PairConditions(double effectiveDensity, double tileEnergy, double tileTrend, int population,
                                 double lowDiversityFloor, DiversityMath.PairEnvironment environment) {
    }

    record MateSelection(Target target, MateChoice.SelectionMode mode) {
    }

    private final TileEnergyField energy;
    private final DensityField density;
    private final PopulationScarcityController scarcityController;
    private final SpawnSiteSelector spawnSites;
    private final ReproductionZonePolicy zonePolicy;
    private final StatsCollector stats;

    public ReproductionPolicy(TileEnergyField energy, DensityField density,
                              PopulationScarcityController scarcityController, SpawnSiteSelector spawnSites,
                              ReproductionZonePolicy zonePolicy, StatsCollector stats) {
        this.energy = energy;
        this.density = density;
        this.scarcityController = scarcityController;
        this.spawnSites = spawnSites;
        this.zonePolicy = zonePolicy;
        this.stats = stats;
    }

    // ========== Attempt ==========

    /**
     * Try to reproduce with one of the organism's visible partners.
     */
    public ReproductionOutcome attempt(Organism focal, TargetGroups targets, Context ctx) {
        List<Target> pool = !targets.mates().isEmpty() ? targets.mates() : targets.society();
        if (pool.isEmpty()) {
            return block(BlockReason.NO_MATE, null, focal, null, null, ctx.tick());
        }
        if (pool.size() > MAX_POOL) {
            pool = pool.subList(0, MAX_POOL);
        }

        MateSelection selection = selectMate(focal, pool, ctx.rng());
        Organism partner = selection.target().organism();
        GridPosition posA = new GridPosition(focal.getRow(), focal.getCol());
        GridPosition posB = selection.target().position();

        // Gates
        ZoneVerdict verdict = validateZone(new ZoneRequest(posA, posB, null));
        if (!verdict.allowed()) {
            return block(BlockReason.ZONE, verdict.reason(), focal, partner, null, ctx.tick());
        }
        int separation = posA.distanceTo(posB);
        double reach = Math.max(1.0, (Numbers.finiteOr(focal.getGenome().reach(), 1)
                + Numbers.finiteOr(partner.getGenome().reach(), 1)) / 2);
        if (separation == 0 || separation > reach) {
            return block(BlockReason.OUT_OF_REACH, null, focal, partner, null, ctx.tick());
        }
        if (focal.getReproductionCooldown() > 0 || partner.getReproductionCooldown() > 0) {
            return block(BlockReason.COOLDOWN, null, focal, partner, null, ctx.tick());
        }

        // Probability
        TickOptions options = ctx.options();
        double effDensity = Numbers.clamp01(density.densityAt(posA.row(), posA.col())
                * Math.max(0, Numbers.finiteOr(options.densityEffectMultiplier(), 1)));
        double tileEnergy = energy.normalizedAt(posA.row(), posA.col());
        double trend = energy.trendAt(posA.row(), posA.col());
        DiversityMath.PairEnvironment env = new DiversityMath.PairEnvironment(
                DiversityMath.urgency(effDensity, tileEnergy, trend, ctx.scarcity()),
                stats.diversityPressure(),
                stats.behavioralEvenness(),
                focal.getInteractionGenes().complementarity(partner.getInteractionGenes()),
                ctx.scarcity());
        double threshold = DiversityMath.pairThreshold(focal, partner, options.diversityThreshold(), env);
        env = env.withOpportunity(poolOpportunity(pool, selection.target(), threshold));
        PairConditions conditions = new PairConditions(effDensity, tileEnergy, trend, ctx.population(),
                options.lowDiversityMultiplier(), env);
        ProbabilityBreakdown probability = evaluate(focal, partner, selection.target().similarity(),
                threshold, conditions);

        // Energy gate
        double max = energy.getMaxTileEnergy();
        if (focal.getEnergy() < focal.reproductionThreshold(max)
                || partner.getEnergy() < partner.reproductionThreshold(max)) {
            return block(BlockReason.ENERGY, null, focal, partner, probability, ctx.tick());
        }

        if (!(ctx.rng().nextDouble() < probability.probability())) {
            focal.recordMating(false);
            recordChoice(focal, partner, selection, pool.size(), probability, false, ctx.tick());
            return ReproductionOutcome.notConceived(partner, probability);
        }

        // Spawn site
        GridPosition site = spawnSites.select(focal, partner, ctx.focalOrigin(),
                options.densityEffectMultiplier(), ctx.rng());
        if (site == null) {
            return block(BlockReason.NO_SPAWN_SITE, null, focal, partner, probability, ctx.tick());
        }
        verdict = validateZone(new ZoneRequest(posA, posB, site));
        if (!verdict.allowed()) {
            return block(BlockReason.ZONE, verdict.reason(), focal, partner, probability, ctx.tick());
        }

        // Commit
        double investA = investment(focal, max);
        double investB = investment(partner, max);
        if (investA <= 0 || investB <= 0) {
            return block(BlockReason.INVESTMENT, null, focal, partner, probability, ctx.tick());
        }
        double invested = investA + investB;
        if (invested > max) {
            double scale = max / invested;
            investA *= scale;
            investB *= scale;
            invested = investA + investB;
        }

        GameRng pairRng = GameRng.forPair(ctx.seed(), focal.getId(), partner.getId(), ctx.tick());
        double mutationMultiplier = Math.max(0, Numbers.finiteOr(options.mutationMultiplier(), 1));
        double mutationChance = Numbers.clamp01((focal.getGenome().mutationChance()
                + partner.getGenome().mutationChance()) / 2 * mutationMultiplier);
        double mutationRange = Math.max(0, (focal.getGenome().mutationRange()
                + partner.getGenome().mutationRange()) / 2 * mutationMultiplier);
        Genome childGenome = focal.getGenome().crossover(partner.getGenome(), pairRng, mutationChance, mutationRange);

        focal.spendEnergy(investA);
        partner.spendEnergy(investB);
        Organism child = ctx.sink().spawn(childGenome, site.row(), site.col(), invested, focal, partner);
        if (child == null) {
            focal.gainEnergy(investA, max);
            partner.gainEnergy(investB, max);
            return block(BlockReason.NO_SPAWN_SITE, "spawn rejected", focal, partner, probability, ctx.tick());
        }

        focal.recordMating(true);
        focal.recordOffspring();
        partner.recordOffspring();
        focal.startReproductionCooldown(cooldown(focal, ctx.scarcity()));
        partner.startReproductionCooldown(cooldown(partner, ctx.scarcity()));

        recordChoice(focal, partner, selection, pool.size(), probability, true, ctx.tick());
        log.debug("Birth: {} x {} -> {} (p={}, diversity={})",
                focal.toShortString(), partner.toShortString(), child.toShortString(),
                String.format("%.3f", probability.probability()), String.format("%.3f", probability.diversity()));
        return ReproductionOutcome.born(child, partner, probability);
    }

    // ========== Probability ==========

    /**
     * Full probability of a pair for a given similarity and pair threshold.
     */
    public ProbabilityBreakdown evaluate(Organism a, Organism b, double similarity, double threshold,
                                         PairConditions conditions) {
        double sim = Numbers.clamp01(Numbers.finiteOr(similarity, 0));
        double diversity = 1 - sim;
        double base = a.reproductionProbability(b, conditions.effectiveDensity(), conditions.tileEnergy(),
                conditions.tileTrend(), sim);
        DiversityMath.PairEnvironment env = conditions.environment();

        double penalty = DiversityMath.lowDiversityPenalty(a, b, diversity, threshold, base,
                conditions.lowDiversityFloor(), env);
        double bonus = DiversityMath.diversityBonus(diversity, threshold, env);
        double scarcityMultiplier = scarcityController.reproductionMultiplier(a, b, env.scarcity(), base,
                conditions.population());

        double probability = Numbers.clamp01(base * penalty * bonus * scarcityMultiplier);
        return new ProbabilityBreakdown(sim, diversity, threshold, base, penalty, bonus, scarcityMultiplier,
                probability);
    }

    // ========== Mate selection ==========

    /**
     * Pick a partner from the pool.
     *
     * Usually a weighted draw on preference score (similarity pull for kin-biased
     * organisms, diversity pull for curious ones). With probability
     * {@code min(0.5, appetite * 0.25)} the organism instead picks at random among
     * the most diverse third of the pool.
     */
    MateSelection selectMate(Organism focal, List<Target> pool, GameRng rng) {
        double appetite = focal.getDiversityAppetite();
        double bias = focal.getMatePreferenceBias();

        if (pool.size() > 1 && rng.nextBoolean(Math.min(0.5, appetite * 0.25))) {
            List<Target> diverse = new ArrayList<>(pool);
            diverse.sort(Comparator.comparingDouble(Target::similarity));
            int tail = Math.max(1, (int) Math.ceil(diverse.size() / 3.0));
            return new MateSelection(diverse.get(rng.nextInt(tail)), MateChoice.SelectionMode.CURIOSITY);
        }

        double[] weights = new double[pool.size()];
        double total = 0;
        int best = 0;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < weights.length; i++) {
            double score = preferenceScore(pool.get(i).similarity(), appetite, bias);
            if (score > bestScore) {
                bestScore = score;
                best = i;
            }
            weights[i] = Math.max(1e-4, score);
            total += weights[i];
        }

        if (total > 0 && Double.isFinite(total)) {
            double pick = rng.nextDouble() * total;
            for (int i = 0; i < weights.length; i++) {
                pick -= weights[i];
                if (pick < 0) return new MateSelection(pool.get(i), MateChoice.SelectionMode.PREFERENCE);
            }
        }
        return new MateSelection(pool.get(best), MateChoice.SelectionMode.FALLBACK);
    }

    static double preferenceScore(double similarity, double appetite, double bias) {
        double diversity = 1 - similarity;
        return similarity * (1 + Math.max(0, bias))
                + diversity * (1 + Math.max(0, -bias) + appetite)
                + diversity * appetite * 0.5;
    }

    // ========== Helpers ==========

    static DiversityMath.MateOpportunity poolOpportunity(List<Target> pool, Target chosen, double threshold) {
        double[] diversities = new double[pool.size()];
        for (int i = 0; i < diversities.length; i++) {
            diversities[i] = 1 - pool.get(i).similarity();
        }
        return DiversityMath.opportunity(diversities, 1 - chosen.similarity(), threshold);
    }

    private static double investment(Organism organism, double maxTileEnergy) {
        double fraction = Numbers.clamp01(organism.getGenome().parentalInvestmentFraction());
        double spare = organism.getEnergy() - organism.starvationThreshold(maxTileEnergy);
        return Math.min(organism.getEnergy() * fraction, spare);
    }

    // Scarcity shortens cooldowns by up to half
    private static int cooldown(Organism organism, double scarcity) {
        int base = Math.max(0, organism.getGenome().reproductionCooldown());
        return (int) Math.round(base * (1 - 0.5 * Numbers.clamp01(scarcity)));
    }

    private ZoneVerdict validateZone(ZoneRequest request) {
        try {
            ZoneVerdict verdict = zonePolicy.validateArea(request);
            return verdict != null ? verdict : ZoneVerdict.ALLOWED;
        } catch (RuntimeException e) {
            log.warn("Zone policy failed for {}, allowing: {}", request, e.getMessage());
            return ZoneVerdict.ALLOWED;
        }
    }

    private ReproductionOutcome block(BlockReason reason, @Nullable String detail, Organism focal,
                                      @Nullable Organism partner, @Nullable ProbabilityBreakdown probability,
                                      long tick) {
        ReproductionBlock block = new ReproductionBlock(reason, detail, focal.getId(),
                partner != null ? partner.getId() : -1, tick);
        stats.recordReproductionBlocked(block);
        if (reason != BlockReason.NO_MATE) {
            log.debug("Reproduction blocked for {}: {}", focal.toShortString(), block.message());
        }
        return ReproductionOutcome.blocked(block, partner, probability);
    }

    private void recordChoice(Organism focal, Organism partner, MateSelection selection, int poolSize,
                              ProbabilityBreakdown probability, boolean success, long tick) {
        stats.recordMateChoice(new MateChoice(focal.getId(), partner.getId(), selection.mode(), poolSize,
                probability, success, tick));
    }
}
