package io.github.manjago.lifegrid.core;

import io.github.manjago.lifegrid.event.EventType;
import org.jetbrains.annotations.NotNull;

/**
 * Trait provider behind every organism.
 *
 * The engine never decodes genes itself: it asks the genome for a trait and
 * uses whatever comes back. Every trait has a default, so a minimal genome
 * only has to implement {@link #similarity}, {@link #crossover} and
 * {@link #toShortString}. Thresholds that return NaN mean "no opinion" and the
 * caller falls back to the configured value.
 *
 * Fractions are relative to the maximum tile energy.
 */
public interface Genome {

    // ========== Genetic distance ==========

    /**
     * Genetic similarity in [0, 1], where 1 means identical.
     * Must be symmetric: {@code a.similarity(b) == b.similarity(a)}.
     */
    double similarity(@NotNull Genome other);

    /**
     * Produce an offspring genome from this genome and a partner.
     *
     * @param partner        the other parent
     * @param rng            stream keyed to the parent pair
     * @param mutationChance per-locus mutation probability
     * @param mutationRange  maximum absolute mutation step
     */
    @NotNull
    Genome crossover(@NotNull Genome partner, @NotNull GameRng rng, double mutationChance, double mutationRange);

    /**
     * Compact identifier for logs.
     */
    String toShortString();

    // ========== Social ==========

    /** Similarity at or above which a neighbour counts as society. */
    default double allyThreshold() { return Double.NaN; }

    /** Similarity at or below which a neighbour counts as an enemy. */
    default double enemyThreshold() { return Double.NaN; }

    default double riskTolerance() { return 0.5; }

    default InteractionGenes interactionGenes() { return InteractionGenes.DEFAULT; }

    default double combatPower() { return 1.0; }

    /** Share of own energy handed to a partner when cooperating. */
    default double cooperationShare() { return 0.2; }

    // ========== Energy ==========

    default double forageRate() { return 0.4; }

    default double harvestCapMin() { return 0.1; }

    default double harvestCapMax() { return 0.5; }

    /** Metabolic loss per tick as a fraction of max tile energy. */
    default double energyLossFraction() { return 0.01; }

    /** Energy below this fraction of max tile energy means starvation. */
    default double starvationThresholdFraction() { return 0.15; }

    // ========== Reproduction ==========

    default double reproductionProbability() { return 0.35; }

    default double reproductionThresholdFraction() { return 0.45; }

    default double parentalInvestmentFraction() { return 0.4; }

    default int reproductionCooldown() { return 8; }

    /** Maximum Chebyshev distance at which this organism can mate. */
    default double reach() { return 1.5; }

    default double mutationChance() { return 0.1; }

    default double mutationRange() { return 12; }

    /** Appetite for genetically distant mates in [0, 1]. */
    default double diversityAppetite() { return 0.35; }

    /** Kin preference in [-1, 1]; positive favours similar mates. */
    default double matePreferenceBias() { return 0.0; }

    // ========== Lifecycle and movement ==========

    default int lifespan() { return 400; }

    default int sight() { return 3; }

    /** Chance per tick of doing something other than staying put. */
    default double activityRate() { return 0.6; }

    default double senescenceSensitivity() { return 0.5; }

    default double crowdingTolerance() { return 0.5; }

    /** How strongly the organism follows rising or falling tile energy, in [0, 1]. */
    default double resourceTrendAdaptation() { return 0.5; }

    default DensityResponses densityResponses() { return DensityResponses.DEFAULT; }

    /** Resistance in [0, 1] to the given environmental event. */
    default double eventResistance(EventType type) { return 0.0; }

    /** Share of the energy returned to the grid on death; NaN uses the configured value. */
    default double decayReturnFraction() { return Double.NaN; }
}
