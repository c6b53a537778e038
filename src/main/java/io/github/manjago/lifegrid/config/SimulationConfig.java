package io.github.manjago.lifegrid.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.nio.file.Path;

/**
 * Configuration for the LifeGrid simulation.
 *
 * Loads from HOCON files using typesafe-config.
 * Default values are in reference.conf.
 *
 * {@code energy.max-tile-energy} is the one value the engine cannot guess:
 * a missing key fails with {@link com.typesafe.config.ConfigException.Missing}
 * and a non-positive value with {@link IllegalArgumentException}.
 */
public record SimulationConfig(
    // Grid
    int rows,
    int cols,

    // Energy field
    double maxTileEnergy,
    double initialEnergyFraction,
    double regenRate,
    double diffusionRate,
    double regenDensityPenalty,
    double consumptionDensityPenalty,

    // Density
    int densityRadius,
    double densityEffectMultiplier,

    // Similarity fallbacks
    double societySimilarity,
    double enemySimilarity,

    // Events
    double eventStrengthMultiplier,
    double eventFrequencyMultiplier,
    int maxConcurrentEvents,

    // Reproduction
    double mutationMultiplier,
    double diversityThreshold,
    double lowDiversityMultiplier,

    // Decay
    double decayReturnFraction,
    double decayImmediateShare,
    double decayReleaseBase,
    double decayReleaseRate,
    int decayMaxAge,
    double decaySpawnEnergyFraction,

    // Population
    int initialPopulation,    // 0 = 5% of tiles
    int minPopulationFloor,

    // Run
    long randomSeed,          // 0 = derive from time
    long maxTicks,            // 0 = infinite
    int reportInterval        // ticks between progress reports
) {

    public SimulationConfig {
        if (rows <= 0 || cols <= 0) {
            throw new IllegalArgumentException("Grid dimensions must be positive: " + rows + "x" + cols);
        }
        if (!(maxTileEnergy > 0) || Double.isInfinite(maxTileEnergy)) {
            throw new IllegalArgumentException("max-tile-energy must be a positive finite number: " + maxTileEnergy);
        }
        if (densityRadius < 1) {
            throw new IllegalArgumentException("density radius must be at least 1: " + densityRadius);
        }
        if (reportInterval <= 0) {
            reportInterval = 100;
        }
    }

    /**
     * Load default configuration.
     */
    public static SimulationConfig defaults() {
        return fromConfig(ConfigFactory.load());
    }

    /**
     * Load configuration from a specific file.
     */
    public static SimulationConfig fromFile(Path configFile) {
        Config fileConfig = ConfigFactory.parseFile(configFile.toFile());
        Config merged = fileConfig.withFallback(ConfigFactory.load());
        return fromConfig(merged);
    }

    /**
     * Load from Config object.
     */
    public static SimulationConfig fromConfig(Config config) {
        Config c = config.getConfig("lifegrid");

        return new SimulationConfig(
            c.getInt("grid.rows"),
            c.getInt("grid.cols"),
            c.getDouble("energy.max-tile-energy"),
            c.getDouble("energy.initial-fraction"),
            c.getDouble("energy.regen-rate"),
            c.getDouble("energy.diffusion-rate"),
            c.getDouble("energy.regen-density-penalty"),
            c.getDouble("energy.consumption-density-penalty"),
            c.getInt("density.radius"),
            c.getDouble("density.effect-multiplier"),
            c.getDouble("similarity.society"),
            c.getDouble("similarity.enemy"),
            c.getDouble("events.strength-multiplier"),
            c.getDouble("events.frequency-multiplier"),
            c.getInt("events.max-concurrent"),
            c.getDouble("reproduction.mutation-multiplier"),
            c.getDouble("reproduction.diversity-threshold"),
            c.getDouble("reproduction.low-diversity-multiplier"),
            c.getDouble("decay.return-fraction"),
            c.getDouble("decay.immediate-share"),
            c.getDouble("decay.release-base"),
            c.getDouble("decay.release-rate"),
            c.getInt("decay.max-age"),
            c.getDouble("decay.spawn-energy-fraction"),
            c.getInt("population.initial"),
            c.getInt("population.min-floor"),
            c.getLong("simulation.random-seed"),
            c.getLong("simulation.max-ticks"),
            c.getInt("simulation.report-interval")
        );
    }

    /**
     * Seed actually used by the run: the configured one, or one derived from time when 0.
     */
    public long effectiveSeed() {
        return randomSeed != 0 ? randomSeed : System.nanoTime();
    }

    /**
     * Number of organisms placed by the initial seeding.
     */
    public int effectiveInitialPopulation() {
        return initialPopulation > 0 ? initialPopulation : Math.max(1, rows * cols / 20);
    }

    /**
     * Builder for programmatic configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder pre-filled from an existing configuration.
     */
    public Builder toBuilder() {
        return new Builder()
                .rows(rows).cols(cols)
                .maxTileEnergy(maxTileEnergy)
                .initialEnergyFraction(initialEnergyFraction)
                .regenRate(regenRate)
                .diffusionRate(diffusionRate)
                .regenDensityPenalty(regenDensityPenalty)
                .consumptionDensityPenalty(consumptionDensityPenalty)
                .densityRadius(densityRadius)
                .densityEffectMultiplier(densityEffectMultiplier)
                .societySimilarity(societySimilarity)
                .enemySimilarity(enemySimilarity)
                .eventStrengthMultiplier(eventStrengthMultiplier)
                .eventFrequencyMultiplier(eventFrequencyMultiplier)
                .maxConcurrentEvents(maxConcurrentEvents)
                .mutationMultiplier(mutationMultiplier)
                .diversityThreshold(diversityThreshold)
                .lowDiversityMultiplier(lowDiversityMultiplier)
                .decayReturnFraction(decayReturnFraction)
                .decayImmediateShare(decayImmediateShare)
                .decayReleaseBase(decayReleaseBase)
                .decayReleaseRate(decayReleaseRate)
                .decayMaxAge(decayMaxAge)
                .decaySpawnEnergyFraction(decaySpawnEnergyFraction)
                .initialPopulation(initialPopulation)
                .minPopulationFloor(minPopulationFloor)
                .randomSeed(randomSeed)
                .maxTicks(maxTicks)
                .reportInterval(reportInterval);
    }

    public static class Builder {
        private int rows = 120;
        private int cols = 120;
        private double maxTileEnergy = 5.0;
        private double initialEnergyFraction = 0.5;
        private double regenRate = 0.0082;
        private double diffusionRate = 0.05;
        private double regenDensityPenalty = 0.5;
        private double consumptionDensityPenalty = 0.5;
        private int densityRadius = 1;
        private double densityEffectMultiplier = 1.0;
        private double societySimilarity = 0.7;
        private double enemySimilarity = 0.4;
        private double eventStrengthMultiplier = 1.0;
        private double eventFrequencyMultiplier = 1.0;
        private int maxConcurrentEvents = 2;
        private double mutationMultiplier = 1.0;
        private double diversityThreshold = 0.45;
        private double lowDiversityMultiplier = 0.12;
        private double decayReturnFraction = 0.9;
        private double decayImmediateShare = 0.5;
        private double decayReleaseBase = 0.12;
        private double decayReleaseRate = 0.18;
        private int decayMaxAge = 240;
        private double decaySpawnEnergyFraction = 0.5;
        private int initialPopulation = 0;
        private int minPopulationFloor = 15;
        private long randomSeed = 0;
        private long maxTicks = 0;
        private int reportInterval = 100;

        public Builder rows(int rows) { this.rows = rows; return this; }
        public Builder cols(int cols) { this.cols = cols; return this; }
        public Builder grid(int rows, int cols) { this.rows = rows; this.cols = cols; return this; }
        public Builder maxTileEnergy(double max) { this.maxTileEnergy = max; return this; }
        public Builder initialEnergyFraction(double fraction) { this.initialEnergyFraction = fraction; return this; }
        public Builder regenRate(double rate) { this.regenRate = rate; return this; }
        public Builder diffusionRate(double rate) { this.diffusionRate = rate; return this; }
        public Builder regenDensityPenalty(double penalty) { this.regenDensityPenalty = penalty; return this; }
        public Builder consumptionDensityPenalty(double penalty) { this.consumptionDensityPenalty = penalty; return this; }
        public Builder densityRadius(int radius) { this.densityRadius = radius; return this; }
        public Builder densityEffectMultiplier(double multiplier) { this.densityEffectMultiplier = multiplier; return this; }
        public Builder societySimilarity(double similarity) { this.societySimilarity = similarity; return this; }
        public Builder enemySimilarity(double similarity) { this.enemySimilarity = similarity; return this; }
        public Builder eventStrengthMultiplier(double multiplier) { this.eventStrengthMultiplier = multiplier; return this; }
        public Builder eventFrequencyMultiplier(double multiplier) { this.eventFrequencyMultiplier = multiplier; return this; }
        public Builder maxConcurrentEvents(int max) { this.maxConcurrentEvents = max; return this; }
        public Builder mutationMultiplier(double multiplier) { this.mutationMultiplier = multiplier; return this; }
        public Builder diversityThreshold(double threshold) { this.diversityThreshold = threshold; return this; }
        public Builder lowDiversityMultiplier(double multiplier) { this.lowDiversityMultiplier = multiplier; return this; }
        public Builder decayReturnFraction(double fraction) { this.decayReturnFraction = fraction; return this; }
        public Builder decayImmediateShare(double share) { this.decayImmediateShare = share; return this; }
        public Builder decayReleaseBase(double base) { this.decayReleaseBase = base; return this; }
        public Builder decayReleaseRate(double rate) { this.decayReleaseRate = rate; return this; }
        public Builder decayMaxAge(int age) { this.decayMaxAge = age; return this; }
        public Builder decaySpawnEnergyFraction(double fraction) { this.decaySpawnEnergyFraction = fraction; return this; }
        public Builder initialPopulation(int count) { this.initialPopulation = count; return this; }
        public Builder minPopulationFloor(int floor) { this.minPopulationFloor = floor; return this; }
        public Builder randomSeed(long seed) { this.randomSeed = seed; return this; }
        public Builder maxTicks(long max) { this.maxTicks = max; return this; }
        public Builder reportInterval(int interval) { this.reportInterval = interval; return this; }

        public SimulationConfig build() {
            return new SimulationConfig(
                rows, cols,
                maxTileEnergy, initialEnergyFraction, regenRate, diffusionRate,
                regenDensityPenalty, consumptionDensityPenalty,
                densityRadius, densityEffectMultiplier,
                societySimilarity, enemySimilarity,
                eventStrengthMultiplier, eventFrequencyMultiplier, maxConcurrentEvents,
                mutationMultiplier, diversityThreshold, lowDiversityMultiplier,
                decayReturnFraction, decayImmediateShare, decayReleaseBase, decayReleaseRate,
                decayMaxAge, decaySpawnEnergyFraction,
                initialPopulation, minPopulationFloor,
                randomSeed, maxTicks, reportInterval
            );
        }
    }

    @Override
    public String toString() {
        return String.format("""
            SimulationConfig:
              grid:                   %d x %d (%,d tiles)
              energy.max-tile-energy: %.2f
              energy.regen-rate:      %.4f
              energy.diffusion-rate:  %.3f
              density.radius:         %d
              similarity:             society >= %.2f, enemy <= %.2f
              events:                 strength x%.2f, frequency x%.2f, max %d
              reproduction:           diversity >= %.2f, floor x%.2f, mutation x%.2f
              decay:                  return %.0f%%, immediate %.0f%%, max age %d
              population.initial:     %,d
              simulation.seed:        %s
              simulation.max-ticks:   %s
              reporting.interval:     %,d ticks
            """,
            rows, cols, rows * cols,
            maxTileEnergy,
            regenRate,
            diffusionRate,
            densityRadius,
            societySimilarity, enemySimilarity,
            eventStrengthMultiplier, eventFrequencyMultiplier, maxConcurrentEvents,
            diversityThreshold, lowDiversityMultiplier, mutationMultiplier,
            decayReturnFraction * 100, decayImmediateShare * 100, decayMaxAge,
            effectiveInitialPopulation(),
            randomSeed == 0 ? "random" : Long.toString(randomSeed),
            maxTicks == 0 ? "infinite" : String.format("%,d", maxTicks),
            reportInterval
        );
    }
}
