package io.github.manjago.lifegrid.sim;

import io.github.manjago.lifegrid.config.SimulationConfig;
import io.github.manjago.lifegrid.core.GameRng;
import io.github.manjago.lifegrid.core.Organism;
import io.github.manjago.lifegrid.core.RgbGenome;
import io.github.manjago.lifegrid.event.EventManager;
import io.github.manjago.lifegrid.grid.GridPosition;
import io.github.manjago.lifegrid.sim.DiversityMath.PairEnvironment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ReproductionPolicyTest {

    private static final SimulationConfig CONFIG = SimulationConfig.builder()
            .grid(9, 9)
            .regenRate(0)
            .diffusionRate(0)
            .randomSeed(77)
            .build();

    private static GridSimulation simulation(ReproductionZonePolicy zones) {
        return GridSimulation.builder(CONFIG)
                .eventManager(EventManager.NONE)
                .zonePolicy(zones)
                .build();
    }

    private static TargetGroups mate(Organism partner, double similarity, int distance) {
        Target target = new Target(new GridPosition(partner.getRow(), partner.getCol()), partner, similarity, distance);
        return new TargetGroups(List.of(target), List.of(), List.of());
    }

    private static ReproductionPolicy.Context context(GridSimulation sim, Organism focal, GameRng rng) {
        return new ReproductionPolicy.Context(1, sim.getSeed(), sim.getDefaultOptions(), 0, sim.getPopulation(),
                new GridPosition(focal.getRow(), focal.getCol()), rng,
                (genome, row, col, energy, a, b) ->
                        sim.spawnOrganism(genome, row, col, energy, a, b, BirthDetails.Origin.REPRODUCTION));
    }

    /** Repeat the attempt until something other than a failed roll happens. */
    private static ReproductionOutcome attemptUntilDecided(ReproductionPolicy policy, Organism focal,
                                                           TargetGroups targets, ReproductionPolicy.Context ctx) {
        ReproductionOutcome outcome = policy.attempt(focal, targets, ctx);
        for (int i = 0; i < 500 && !outcome.isBorn() && !outcome.isBlocked(); i++) {
            outcome = policy.attempt(focal, targets, ctx);
        }
        return outcome;
    }

    @Nested
    @DisplayName("Attempt")
    class Attempt {

        private GridSimulation sim;
        private Organism a;
        private Organism b;

        @BeforeEach
        void setUp() {
            sim = simulation(ReproductionZonePolicy.ALLOW_ALL);
            a = sim.spawnOrganism(new TraitGenome(0.2).fertility(0.95), 4, 4, 4.0);
            b = sim.spawnOrganism(new TraitGenome(0.9).fertility(0.95), 4, 5, 4.0);
        }

        @Test
        void diversePairProducesOffspringNearby() {
            ReproductionOutcome outcome = attemptUntilDecided(sim.getReproductionPolicy(), a, mate(b, 0.3, 1),
                    context(sim, a, new GameRng(3)));
            RunningStats stats = (RunningStats) sim.getStatsCollector();

            assertTrue(outcome.isBorn(), () -> "expected birth, got " + outcome);
            Organism child = outcome.offspring();
            assertSame(b, outcome.partner());
            assertEquals(3, sim.getPopulation());
            assertEquals(0.55, ((TraitGenome) child.getGenome()).value(), 1e-12);
            assertTrue(Math.min(new GridPosition(4, 4).distanceTo(child.getRow(), child.getCol()),
                    new GridPosition(4, 5).distanceTo(child.getRow(), child.getCol())) <= 1);

            // 40% of 4.0 from each parent
            assertEquals(2.4, a.getEnergy(), 1e-9);
            assertEquals(2.4, b.getEnergy(), 1e-9);
            assertEquals(3.2, child.getEnergy(), 1e-9);

            assertEquals(1, a.getOffspring());
            assertEquals(1, b.getOffspring());
            assertEquals(1, a.getMatingSuccesses());
            assertEquals(a.getMatingAttempts(), stats.getMateChoices());
            assertEquals(8, a.getReproductionCooldown());
            assertEquals(8, b.getReproductionCooldown());

            assertEquals(1, stats.getBirths(BirthDetails.Origin.REPRODUCTION));
            assertEquals(1, stats.getSuccessfulMatings());
        }

        @Test
        void noVisiblePartner() {
            ReproductionOutcome outcome = sim.getReproductionPolicy().attempt(a, TargetGroups.EMPTY,
                    context(sim, a, new GameRng(1)));

            assertEquals(BlockReason.NO_MATE, outcome.block().reason());
            assertNull(outcome.partner());
            assertEquals(-1, outcome.block().partnerId());
        }

        @Test
        void cooldownBlocks() {
            b.startReproductionCooldown(4);

            ReproductionOutcome outcome = sim.getReproductionPolicy().attempt(a, mate(b, 0.3, 1),
                    context(sim, a, new GameRng(1)));

            assertEquals(BlockReason.COOLDOWN, outcome.block().reason());
            assertNull(outcome.probability());
        }

        @Test
        void distantPartnerIsOutOfReach() {
            Organism far = sim.spawnOrganism(new TraitGenome(0.9), 4, 7, 4.0);

            ReproductionOutcome outcome = sim.getReproductionPolicy().attempt(a, mate(far, 0.3, 3),
                    context(sim, a, new GameRng(1)));

            assertEquals(BlockReason.OUT_OF_REACH, outcome.block().reason());
        }

        @Test
        void hungryParentBlocksAfterEvaluation() {
            Organism hungry = sim.spawnOrganism(new TraitGenome(0.9), 3, 4, 1.0);

            ReproductionOutcome outcome = sim.getReproductionPolicy().attempt(a, mate(hungry, 0.3, 1),
                    context(sim, a, new GameRng(1)));

            assertEquals(BlockReason.ENERGY, outcome.block().reason());
            assertNotNull(outcome.probability());
            assertEquals(4.0, a.getEnergy());
        }

        @Test
        @DisplayName("Rejected spawn refunds both parents")
        void rejectedSpawnRefunds() {
            ReproductionPolicy.Context ctx = new ReproductionPolicy.Context(1, sim.getSeed(),
                    sim.getDefaultOptions(), 0, 2, new GridPosition(4, 4), new GameRng(3),
                    (genome, row, col, energy, pa, pb) -> null);

            ReproductionOutcome outcome = attemptUntilDecided(sim.getReproductionPolicy(), a, mate(b, 0.3, 1), ctx);

            assertEquals(BlockReason.NO_SPAWN_SITE, outcome.block().reason());
            assertEquals("spawn rejected", outcome.block().detail());
            assertEquals(4.0, a.getEnergy(), 1e-9);
            assertEquals(4.0, b.getEnergy(), 1e-9);
            assertEquals(0, a.getReproductionCooldown());
            assertEquals(2, sim.getPopulation());
        }

        @Test
        void blockedAttemptsAreReported() {
            b.startReproductionCooldown(4);
            sim.getReproductionPolicy().attempt(a, mate(b, 0.3, 1), context(sim, a, new GameRng(1)));

            RunningStats stats = (RunningStats) sim.getStatsCollector();
            assertEquals(1, stats.getBlocked(BlockReason.COOLDOWN));
        }
    }

    @Test
    @DisplayName("Surrounded parents have nowhere to put the offspring")
    void noSpawnSite() {
        GridSimulation sim = simulation(ReproductionZonePolicy.ALLOW_ALL);
        Organism a = sim.spawnOrganism(new TraitGenome(0.2).fertility(0.95), 0, 0, 4.0);
        Organism b = sim.spawnOrganism(new TraitGenome(0.9).fertility(0.95), 0, 1, 4.0);
        sim.spawnOrganism(new TraitGenome(0.5), 0, 2, 1.0);
        sim.spawnOrganism(new TraitGenome(0.5), 1, 0, 1.0);
        sim.spawnOrganism(new TraitGenome(0.5), 1, 1, 1.0);
        sim.spawnOrganism(new TraitGenome(0.5), 1, 2, 1.0);

        ReproductionOutcome outcome = attemptUntilDecided(sim.getReproductionPolicy(), a, mate(b, 0.3, 1),
                context(sim, a, new GameRng(8)));

        assertEquals(BlockReason.NO_SPAWN_SITE, outcome.block().reason());
        assertNull(outcome.block().detail());
        assertEquals(6, sim.getPopulation());
    }

    @Test
    void zonePolicyRejectsParentsOutsideZones() {
        GridSimulation sim = simulation(new RectangularZonePolicy(List.of(new RectangularZonePolicy.Zone(0, 0, 3, 3))));
        Organism a = sim.spawnOrganism(new TraitGenome(0.2), 4, 4, 4.0);
        Organism b = sim.spawnOrganism(new TraitGenome(0.9), 4, 5, 4.0);

        ReproductionOutcome outcome = sim.getReproductionPolicy().attempt(a, mate(b, 0.3, 1),
                context(sim, a, new GameRng(1)));

        assertEquals(BlockReason.ZONE, outcome.block().reason());
        assertEquals("Reproduction zone rejected: parents outside reproduction zones", outcome.block().message());
    }

    @Test
    @DisplayName("A failing zone policy does not stop reproduction")
    void failingZonePolicyAllows() {
        ReproductionZonePolicy broken = new ReproductionZonePolicy() {
            @Override
            public ZoneVerdict validateArea(ZoneRequest request) {
                throw new IllegalStateException("zone service down");
            }

            @Override
            public List<GridPosition> filterSpawnCandidates(List<GridPosition> candidates) {
                return candidates;
            }
        };
        GridSimulation sim = simulation(broken);
        Organism a = sim.spawnOrganism(new TraitGenome(0.2).fertility(0.95), 4, 4, 4.0);
        Organism b = sim.spawnOrganism(new TraitGenome(0.9).fertility(0.95), 4, 5, 4.0);

        ReproductionOutcome outcome = attemptUntilDecided(sim.getReproductionPolicy(), a, mate(b, 0.3, 1),
                context(sim, a, new GameRng(3)));

        assertTrue(outcome.isBorn());
    }

    @Test
    @DisplayName("A failing spawn filter does not abort the attempt")
    void failingSpawnFilterAllows() {
        ReproductionZonePolicy broken = new ReproductionZonePolicy() {
            @Override
            public ZoneVerdict validateArea(ZoneRequest request) {
                return ZoneVerdict.ALLOWED;
            }

            @Override
            public List<GridPosition> filterSpawnCandidates(List<GridPosition> candidates) {
                throw new IllegalStateException("zone service down");
            }
        };
        GridSimulation sim = simulation(broken);
        Organism a = sim.spawnOrganism(new TraitGenome(0.2).fertility(0.95), 4, 4, 4.0);
        Organism b = sim.spawnOrganism(new TraitGenome(0.9).fertility(0.95), 4, 5, 4.0);

        ReproductionOutcome outcome = assertDoesNotThrow(() -> attemptUntilDecided(sim.getReproductionPolicy(), a,
                mate(b, 0.3, 1), context(sim, a, new GameRng(3))));

        assertTrue(outcome.isBorn());
        assertEquals(3, sim.getPopulation());
    }

    @Nested
    @DisplayName("Probability")
    class Probability {

        private final ReproductionPolicy policy = simulation(ReproductionZonePolicy.ALLOW_ALL).getReproductionPolicy();
        private final ReproductionPolicy.PairConditions calm =
                new ReproductionPolicy.PairConditions(0.2, 0.8, 0, 2, 0.12, PairEnvironment.CALM);

        @Test
        @DisplayName("Near-identical pair is less likely than a diverse one")
        void lowDiversityIsPenalised() {
            Organism a = new Organism(1, new TraitGenome(0.5), 0, 0, 4, -1, 0);
            Organism b = new Organism(2, new TraitGenome(0.5), 0, 1, 4, -1, 0);

            ProbabilityBreakdown similar = policy.evaluate(a, b, 0.95, 0.4, calm);
            ProbabilityBreakdown diverse = policy.evaluate(a, b, 0.3, 0.4, calm);

            assertTrue(similar.belowThreshold());
            assertFalse(diverse.belowThreshold());
            assertTrue(similar.penaltyMultiplier() < 1.0);
            assertEquals(1.0, diverse.penaltyMultiplier());
            assertTrue(similar.probability() < diverse.probability());
        }

        @Test
        void penaltyNeverRaisesProbabilityWithoutScarcity() {
            GameRng rng = new GameRng(21);
            for (int i = 0; i < 300; i++) {
                Organism a = new Organism(1, RgbGenome.random(rng), 0, 0, 4, -1, 0);
                Organism b = new Organism(2, RgbGenome.random(rng), 0, 1, 4, -1, 0);
                double threshold = rng.nextDouble(0.1, 1);
                double similarity = 1 - rng.nextDouble(0, threshold);
                PairEnvironment env = new PairEnvironment(rng.nextDouble(), rng.nextDouble(), rng.nextDouble(),
                        rng.nextDouble(), 0);
                ReproductionPolicy.PairConditions conditions = new ReproductionPolicy.PairConditions(
                        rng.nextDouble(), rng.nextDouble(), 0, 10, 0.12, env);

                ProbabilityBreakdown p = policy.evaluate(a, b, similarity, threshold, conditions);

                assertTrue(p.probability() <= p.baseProbability() + 1e-12);
                assertEquals(1.0, p.scarcityMultiplier());
            }
        }

        @Test
        void probabilityIsAlwaysAProbability() {
            GameRng rng = new GameRng(22);
            for (int i = 0; i < 300; i++) {
                Organism a = new Organism(1, RgbGenome.random(rng), 0, 0, 4, -1, 0);
                Organism b = new Organism(2, RgbGenome.random(rng), 0, 1, 4, -1, 0);
                PairEnvironment env = new PairEnvironment(rng.nextDouble(), rng.nextDouble(), rng.nextDouble(),
                        rng.nextDouble(), rng.nextDouble());
                ReproductionPolicy.PairConditions conditions = new ReproductionPolicy.PairConditions(
                        rng.nextDouble(), rng.nextDouble(), rng.nextDouble(-1, 1), rng.nextInt(50), 0.12, env);

                ProbabilityBreakdown p = policy.evaluate(a, b, rng.nextDouble(), rng.nextDouble(), conditions);

                assertTrue(p.probability() >= 0 && p.probability() <= 1);
                assertTrue(p.bonusMultiplier() >= 1);
                assertTrue(p.scarcityMultiplier() >= 1 && p.scarcityMultiplier() <= 2);
            }
        }
    }

    @Nested
    @DisplayName("Mate selection")
    class Selection {

        private final ReproductionPolicy policy = simulation(ReproductionZonePolicy.ALLOW_ALL).getReproductionPolicy();

        @Test
        @DisplayName("Choosing the closest relative leaves diverse mates on the table")
        void poolOpportunityReflectsPassedOverMates() {
            List<Target> pool = pool(9);
            Target closest = pool.get(8);
            Target mostDiverse = pool.get(0);

            DiversityMath.MateOpportunity missed = ReproductionPolicy.poolOpportunity(pool, closest, 0.45);
            DiversityMath.MateOpportunity taken = ReproductionPolicy.poolOpportunity(pool, mostDiverse, 0.45);

            assertTrue(missed.availability() > 0);
            assertTrue(missed.score() > taken.score());
            assertEquals(DiversityMath.MateOpportunity.NONE,
                    ReproductionPolicy.poolOpportunity(List.of(closest), closest, 0.45));
        }

        private List<Target> pool(int size) {
            List<Target> pool = new ArrayList<>();
            for (int i = 0; i < size; i++) {
                double similarity = 0.4 + 0.05 * i;
                Organism o = new Organism(10 + i, new TraitGenome(0.5), 0, i, 3, -1, 0);
                pool.add(new Target(new GridPosition(0, i), o, similarity, 1));
            }
            return pool;
        }

        @Test
        @DisplayName("Curious picks come from the most diverse third")
        void curiosityPicksDiverseTail() {
            Organism focal = new Organism(1, new TraitGenome(0.5).appetite(1.0), 5, 5, 3, -1, 0);
            List<Target> pool = pool(9);
            Set<Long> diverse = Set.of(10L, 11L, 12L);
            GameRng rng = new GameRng(31);

            int curious = 0;
            Set<Long> chosen = new HashSet<>();
            for (int i = 0; i < 400; i++) {
                ReproductionPolicy.MateSelection selection = policy.selectMate(focal, pool, rng);
                chosen.add(selection.target().organism().getId());
                if (selection.mode() == MateChoice.SelectionMode.CURIOSITY) {
                    curious++;
                    assertTrue(diverse.contains(selection.target().organism().getId()));
                }
            }
            assertTrue(curious > 0);
            assertTrue(chosen.size() > 3);
        }

        @Test
        void singleCandidateIsAlwaysChosen() {
            Organism focal = new Organism(1, new TraitGenome(0.5).appetite(1.0), 5, 5, 3, -1, 0);
            List<Target> pool = pool(1);
            ReproductionPolicy.MateSelection selection = policy.selectMate(focal, pool, new GameRng(1));
            assertSame(pool.get(0), selection.target());
            assertEquals(MateChoice.SelectionMode.PREFERENCE, selection.mode());
        }

        @Test
        void preferenceFollowsBias() {
            // kin-biased organisms score similar partners higher, curious ones diverse partners
            assertTrue(ReproductionPolicy.preferenceScore(0.9, 0, 1) > ReproductionPolicy.preferenceScore(0.1, 0, 1));
            assertTrue(ReproductionPolicy.preferenceScore(0.1, 1, -1) > ReproductionPolicy.preferenceScore(0.9, 1, -1));
        }
    }
}
