package io.github.manjago.lifegrid.core;

import io.github.manjago.lifegrid.event.EventType;
import org.jetbrains.annotations.NotNull;

/**
 * Default genome: three loci in [0, 255], read as a colour.
 *
 * Red drives aggression and metabolism, green drives foraging and endurance,
 * blue drives sociability and parental care. Every trait is a fixed linear
 * function of the normalised loci, so two genomes with the same colour
 * behave identically.
 *
 * Similarity is one minus the Euclidean colour distance normalised by the
 * largest possible distance.
 */
public final class RgbGenome implements Genome {

    private static final double MAX_DISTANCE = Math.sqrt(3.0 * 255 * 255);

    private final int r;
    private final int g;
    private final int b;

    // Normalised loci
    private final double rn;
    private final double gn;
    private final double bn;

    private final DensityResponses densityResponses;
    private final InteractionGenes interactionGenes;

    public RgbGenome(int r, int g, int b) {
        this.r = Numbers.clamp(r, 0, 255);
        this.g = Numbers.clamp(g, 0, 255);
        this.b = Numbers.clamp(b, 0, 255);
        this.rn = this.r / 255.0;
        this.gn = this.g / 255.0;
        this.bn = this.b / 255.0;
        this.densityResponses = new DensityResponses(
            new DensityResponses.Range(0.45 + 0.25 * gn, 1.0 + 0.3 * bn),
            new DensityResponses.Range(0.2 + 0.3 * rn, 0.4 + 0.5 * rn),
            new DensityResponses.Range(0.2 + 0.3 * bn, 0.3 + 0.5 * bn),
            new DensityResponses.Range(1.0, 1.2 + 0.5 * (1 - gn)),
            new DensityResponses.Range(0.02 + 0.08 * rn, 0.2 + 0.5 * rn)
        );
        this.interactionGenes = new InteractionGenes(
            0.3 + 0.7 * (1 - rn),
            0.1 + 0.9 * rn,
            0.1 + 0.9 * bn
        );
    }

    /**
     * Uniformly random colour.
     */
    public static RgbGenome random(GameRng rng) {
        return new RgbGenome(rng.nextInt(256), rng.nextInt(256), rng.nextInt(256));
    }

    public int red() { return r; }
    public int green() { return g; }
    public int blue() { return b; }

    // ========== Genetic distance ==========

    @Override
    public double similarity(@NotNull Genome other) {
        if (other == this) return 1.0;
        if (!(other instanceof RgbGenome o)) return 0.0;
        int dr = r - o.r;
        int dg = g - o.g;
        int db = b - o.b;
        double distance = Math.sqrt(dr * dr + dg * dg + db * db);
        return Numbers.clamp01(1.0 - distance / MAX_DISTANCE);
    }

    @Override
    public @NotNull Genome crossover(@NotNull Genome partner, @NotNull GameRng rng,
                                     double mutationChance, double mutationRange) {
        RgbGenome other = partner instanceof RgbGenome p ? p : this;
        int range = (int) Math.max(0, Math.round(mutationRange));
        return new RgbGenome(
            inherit(r, other.r, rng, mutationChance, range),
            inherit(g, other.g, rng, mutationChance, range),
            inherit(b, other.b, rng, mutationChance, range)
        );
    }

    private static int inherit(int mine, int theirs, GameRng rng, double chance, int range) {
        int value = rng.nextBoolean() ? mine : theirs;
        if (range > 0 && rng.nextBoolean(chance)) {
            value += rng.nextIntInclusive(-range, range);
        }
        return Numbers.clamp(value, 0, 255);
    }

    // ========== Traits ==========

    @Override public double allyThreshold() { return 0.5 + 0.4 * bn; }
    @Override public double enemyThreshold() { return 0.6 - 0.4 * rn; }
    @Override public double riskTolerance() { return 0.2 + 0.6 * rn; }
    @Override public InteractionGenes interactionGenes() { return interactionGenes; }
    @Override public double combatPower() { return 0.8 + 0.6 * rn; }
    @Override public double cooperationShare() { return 0.1 + 0.3 * bn; }

    @Override public double forageRate() { return 0.2 + 0.6 * gn; }
    @Override public double harvestCapMin() { return 0.05 + 0.1 * gn; }
    @Override public double harvestCapMax() { return 0.3 + 0.5 * gn; }
    @Override public double energyLossFraction() { return 0.004 + 0.008 * rn; }
    @Override public double starvationThresholdFraction() { return 0.1 + 0.15 * (1 - gn); }

    @Override public double reproductionProbability() { return 0.25 + 0.35 * bn; }
    @Override public double reproductionThresholdFraction() { return 0.4 + 0.2 * (1 - gn); }
    @Override public double parentalInvestmentFraction() { return 0.2 + 0.5 * bn; }
    @Override public int reproductionCooldown() { return 4 + (int) Math.round(10 * (1 - rn)); }
    @Override public double reach() { return 1.0 + gn; }
    @Override public double mutationChance() { return 0.05 + 0.15 * (1 - bn); }
    @Override public double mutationRange() { return 6 + 24 * rn; }
    @Override public double diversityAppetite() { return 0.1 + 0.7 * (rn + gn) / 2; }
    @Override public double matePreferenceBias() { return bn - rn; }

    @Override public int lifespan() { return 200 + (int) Math.round(400 * gn); }
    @Override public int sight() { return 1 + (int) Math.round(3 * bn); }
    @Override public double activityRate() { return 0.3 + 0.6 * rn; }
    @Override public double senescenceSensitivity() { return 0.3 + 0.5 * rn; }
    @Override public double crowdingTolerance() { return 0.3 + 0.6 * bn; }
    @Override public double resourceTrendAdaptation() { return 0.2 + 0.6 * gn; }
    @Override public DensityResponses densityResponses() { return densityResponses; }

    @Override
    public double eventResistance(EventType type) {
        return switch (type) {
            case FLOOD -> 0.5 * bn;
            case DROUGHT -> 0.6 * gn;
            case HEATWAVE -> 0.5 * rn;
            case COLDWAVE -> 0.5 * (1 - rn);
        };
    }

    // ========== Object ==========

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RgbGenome other)) return false;
        return r == other.r && g == other.g && b == other.b;
    }

    @Override
    public int hashCode() {
        return (r << 16) | (g << 8) | b;
    }

    @Override
    public String toShortString() {
        return String.format("#%02x%02x%02x", r, g, b);
    }

    @Override
    public String toString() {
        return "RgbGenome" + toShortString();
    }
}
