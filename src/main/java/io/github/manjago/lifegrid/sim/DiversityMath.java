package io.github.manjago.lifegrid.sim;

import io.github.manjago.lifegrid.core.Numbers;
import io.github.manjago.lifegrid.core.Organism;

import java.util.Arrays;

/**
 * Pair diversity threshold and the low-diversity penalty.
 *
 * Both are pure functions of the two parents and a {@link PairEnvironment},
 * so they can be tested without a grid.
 */
public final class DiversityMath {

    private DiversityMath() {
    }

    /**
     * Conditions around a prospective pair.
     *
     * @param urgency environmental urgency in [0, 1], see {@link #urgency}
     * @param diversityPressure population diversity pressure in [0, 1]
     * @param evenness behavioural evenness of the population in [0, 1]
     * @param complementarity how differently the parents handle conflict, in [0, 1]
     * @param scarcity population scarcity in [0, 1]
     * @param opportunity how much more diverse the mate pool was than the chosen partner, see {@link MateOpportunity}
     * @param opportunityAvailability share of the pool that cleared the threshold besides the partner
     */
    public record PairEnvironment(double urgency, double diversityPressure, double evenness,
                                  double complementarity, double scarcity,
                                  double opportunity, double opportunityAvailability) {

        public static final PairEnvironment CALM = new PairEnvironment(0, 0, 1, 0, 0);

        public PairEnvironment {
            urgency = Numbers.clamp01(Numbers.finiteOr(urgency, 0));
            diversityPressure = Numbers.clamp01(Numbers.finiteOr(diversityPressure, 0));
            evenness = Numbers.clamp01(Numbers.finiteOr(evenness, 1));
            complementarity = Numbers.clamp01(Numbers.finiteOr(complementarity, 0));
            scarcity = Numbers.clamp01(Numbers.finiteOr(scarcity, 0));
            opportunity = Numbers.clamp01(Numbers.finiteOr(opportunity, 0));
            opportunityAvailability = Numbers.clamp01(Numbers.finiteOr(opportunityAvailability, 0));
        }

        /** Environment with no information about the mate pool. */
        public PairEnvironment(double urgency, double diversityPressure, double evenness,
                               double complementarity, double scarcity) {
            this(urgency, diversityPressure, evenness, complementarity, scarcity, 0, 0);
        }

        public PairEnvironment withOpportunity(MateOpportunity summary) {
            return new PairEnvironment(urgency, diversityPressure, evenness, complementarity, scarcity,
                    summary.score(), summary.availability());
        }
    }

    /**
     * What the mate pool offered compared to the partner that was chosen.
     *
     * @param score in [0, 1], grows with the gap to the most diverse candidates
     * @param availability share of candidates at or above the threshold, the partner excluded
     * @param weight confidence in the signal
     * @param gap average diversity of the top candidates minus the partner's
     */
    public record MateOpportunity(double score, double availability, double weight, double gap) {

        public static final MateOpportunity NONE = new MateOpportunity(0, 0, 0, 0);
    }

    private static final int OPPORTUNITY_SAMPLE = 5;

    /**
     * Summarise the diversity on offer in a mate pool.
     *
     * @param candidateDiversities diversity of every candidate, the chosen one included
     * @param chosen diversity of the chosen partner
     * @param threshold pair diversity threshold
     */
    public static MateOpportunity opportunity(double[] candidateDiversities, double chosen, double threshold) {
        int count = candidateDiversities.length;
        if (count <= 1) {
            return MateOpportunity.NONE;
        }
        double limit = Numbers.clamp01(Numbers.finiteOr(threshold, 0));
        double picked = Numbers.clamp01(Numbers.finiteOr(chosen, 0));

        double[] values = new double[count];
        double best = 0;
        int above = 0;
        for (int i = 0; i < count; i++) {
            values[i] = Numbers.clamp01(Numbers.finiteOr(candidateDiversities[i], 0));
            best = Math.max(best, values[i]);
            if (values[i] >= limit) above++;
        }
        Arrays.sort(values);
        int sample = Math.min(OPPORTUNITY_SAMPLE, count);
        double topSum = 0;
        for (int i = count - sample; i < count; i++) {
            topSum += values[i];
        }
        double topAverage = topSum / sample;

        int availableAbove = Math.max(0, above - (picked >= limit ? 1 : 0));
        double availability = Numbers.clamp01((double) availableAbove / count);
        double depth = above > 0 ? Numbers.clamp01(above / 4.0) : 0;
        double gap = Numbers.clamp01(topAverage - picked);
        double headroom = Numbers.clamp01(best - limit);

        double score = gap * (0.5 + availability * 0.3 + depth * 0.2);
        if (picked < limit) {
            score += availability * (0.25 + depth * 0.3) + headroom * 0.2;
        } else {
            score += headroom * 0.1;
        }
        double weight = Numbers.clamp01(availability * 0.65 + depth * 0.25 + (gap > 0.2 ? 0.1 : 0));
        return new MateOpportunity(Numbers.clamp01(score), availability, weight, gap);
    }

    /**
     * Blend of crowding, poor energy, declining energy and population scarcity.
     *
     * @param density effective local density in [0, 1]
     * @param tileEnergy normalised tile energy in [0, 1]
     * @param tileTrend normalised energy trend in [-1, 1]
     * @param scarcity population scarcity in [0, 1]
     */
    public static double urgency(double density, double tileEnergy, double tileTrend, double scarcity) {
        double decline = Numbers.clamp01(-Numbers.finiteOr(tileTrend, 0) * 10);
        return Numbers.clamp01(0.4 * Numbers.clamp01(density)
                + 0.3 * (1 - Numbers.clamp01(tileEnergy))
                + 0.15 * decline
                + 0.15 * Numbers.clamp01(scarcity));
    }

    /**
     * Minimum diversity the pair should have before being penalised.
     *
     * The baseline is shifted up by diversity appetite, caution, novelty
     * seeking and population pressure, down by kin preference and by
     * behavioural complementarity; the shifted value is then blended back
     * towards the baseline in proportion to urgency and pressure.
     */
    public static double pairThreshold(Organism a, Organism b, double baseline, PairEnvironment env) {
        double base = Numbers.clamp01(Numbers.finiteOr(baseline, 0.45));
        double u = env.urgency();
        double p = env.diversityPressure();

        double appetite = (a.getDiversityAppetite() + b.getDiversityAppetite()) / 2;
        double bias = (a.getMatePreferenceBias() + b.getMatePreferenceBias()) / 2;
        double caution = caution(a, b);
        double novelty = Math.max(0, -bias);
        double kin = Math.max(0, bias);

        double appetiteShift = (appetite - 0.35) * (0.3 + u * 0.3 + p * 0.2);
        double cautionShift = (caution - 0.5) * (0.18 + u * 0.22);
        double noveltyShift = novelty * (0.15 + 0.25 * u + 0.2 * p);
        double kinShift = kin * (0.2 - 0.1 * u - 0.05 * p);
        double pressureShift = 0.08 * p;
        double relief = env.complementarity() * (0.2 + 0.25 * p + 0.2 * u + 0.3 * env.scarcity());

        double raw = Numbers.clamp01(base + appetiteShift + cautionShift + noveltyShift - kinShift
                + pressureShift - relief);
        double smoothing = Numbers.clamp01(0.25 + 0.35 * u + 0.25 * p);
        return Numbers.clamp01(raw * (1 - smoothing) + base * smoothing);
    }

    /**
     * Multiplier applied to reproduction probability when pair diversity is below the threshold.
     *
     * @param diversity pair diversity, {@code 1 - similarity}
     * @param threshold pair diversity threshold
     * @param baseProbability the pair's probability before diversity shaping; unlikely pairs are judged harder
     * @param floor lowest multiplier allowed
     * @return 1 at or above the threshold, otherwise a value in [floor, 1]
     */
    public static double lowDiversityPenalty(Organism a, Organism b, double diversity, double threshold,
                                             double baseProbability, double floor, PairEnvironment env) {
        double limit = Numbers.clamp01(Numbers.finiteOr(floor, 0));
        if (!(threshold > 0) || !(diversity < threshold)) {
            return 1.0;
        }
        double shortfall = Numbers.clamp01(1 - Math.max(0, diversity) / threshold);
        double closeness = Math.pow(shortfall, 0.35);
        double slack = Numbers.clamp01(1 - Numbers.finiteOr(baseProbability, 0));
        double caution = caution(a, b);
        double drive = (diversityDrive(a, caution, env.urgency()) + diversityDrive(b, caution, env.urgency())) / 2;
        double envUrgency = env.urgency();

        double severity = closeness * 0.35
                + closeness * drive * (0.4 + 0.2 * slack)
                + closeness * envUrgency * (0.25 + 0.25 * slack)
                + closeness * slack * 0.1;

        double bias = (a.getMatePreferenceBias() + b.getMatePreferenceBias()) / 2;
        double kinComfort = Numbers.clamp01(0.5 + 0.5 * bias);
        severity *= Numbers.clamp(1 - kinComfort * 0.6, 0.3, 1);
        severity *= 1 + 0.75 * env.diversityPressure();
        double drag = 1 - env.evenness();
        severity *= 1 + drag * (0.35 + 0.25 * drive);

        // A pool that offered more diverse partners makes settling for this one costlier
        double pressure = env.diversityPressure();
        double opportunity = env.opportunity();
        if (opportunity > 0) {
            severity += opportunity * (0.22 + pressure * 0.25 + drive * 0.2 + slack * 0.15);
        }
        double availability = env.opportunityAvailability();
        if (availability > 0) {
            double demand = availability * (0.12 + pressure * 0.2 + drive * 0.15 + slack * 0.15);
            severity += demand * (0.35 + opportunity * 0.25);
            severity *= 1 + demand * 0.2;
        }
        if (env.complementarity() > 0) {
            severity *= 1 - 0.4 * env.complementarity();
        }
        severity = Numbers.clamp01(severity);
        severity *= Numbers.clamp(1 - 0.65 * env.scarcity(), 0.15, 1);

        return Numbers.clamp(1 - severity, limit, 1);
    }

    /**
     * Bonus for pairs at or above the threshold while the population needs diversity,
     * and for behaviourally complementary pairs in a monotonous population.
     *
     * @return a multiplier of at least 1
     */
    public static double diversityBonus(double diversity, double threshold, PairEnvironment env) {
        if (diversity < threshold) {
            return 1.0;
        }
        double bonus = 1.0;
        if (env.diversityPressure() > 0) {
            double excess = threshold >= 1 ? 0 : Numbers.clamp01((diversity - threshold) / (1 - threshold));
            bonus *= 1 + 0.6 * env.diversityPressure() * excess;
        }
        if (env.evenness() < 0.5 && env.complementarity() > 0) {
            bonus *= 1 + 0.3 * env.complementarity() * (1 - env.evenness());
        }
        return bonus;
    }

    // Low fertility makes a pair cautious about mating with kin
    private static double caution(Organism a, Organism b) {
        double fertility = (Numbers.clamp01(a.getGenome().reproductionProbability())
                + Numbers.clamp01(b.getGenome().reproductionProbability())) / 2;
        return 1 - fertility;
    }

    private static double diversityDrive(Organism o, double caution, double urgency) {
        double bias = o.getMatePreferenceBias();
        double curiosity = Numbers.clamp01(o.getDiversityAppetite()
                + Math.max(0, -bias) * 0.5 - Math.max(0, bias) * 0.4);
        return Numbers.clamp01(curiosity * (0.55 + 0.45 * caution) * 0.7 + urgency * 0.3);
    }
}
