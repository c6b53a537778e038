package io.github.manjago.lifegrid.sim;

import io.github.manjago.lifegrid.config.SimulationConfig;
import io.github.manjago.lifegrid.core.InteractionGenes;
import io.github.manjago.lifegrid.core.Organism;
import io.github.manjago.lifegrid.event.EventManager;
import io.github.manjago.lifegrid.grid.GridPosition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GridSimulationTest {

    private static SimulationConfig.Builder quiet(int rows, int cols) {
        return SimulationConfig.builder()
                .grid(rows, cols)
                .randomSeed(123)
                .eventFrequencyMultiplier(0);
    }

    private static GridSimulation simulation(SimulationConfig config) {
        return GridSimulation.builder(config).eventManager(EventManager.NONE).build();
    }

    @Nested
    @DisplayName("Arena operations")
    class Arena {

        private final GridSimulation sim = simulation(quiet(9, 9).initialEnergyFraction(0).build());

        @Test
        void placeAndRemoveKeepDensityLive() {
            Organism o = sim.spawnOrganism(new TraitGenome(0.5), 4, 4, 2.0);

            assertNotNull(o);
            assertSame(o, sim.organismAt(4, 4));
            assertEquals(1, sim.getPopulation());
            assertEquals(1.0 / 8, sim.getDensityField().liveDensityAt(4, 5), 1e-12);

            assertNull(sim.spawnOrganism(new TraitGenome(0.5), 4, 4, 2.0));

            assertTrue(sim.removeOrganism(o));
            assertFalse(o.isAlive());
            assertNull(sim.organismAt(4, 4));
            assertEquals(0, sim.getPopulation());
            assertEquals(0.0, sim.getDensityField().liveDensityAt(4, 5), 1e-12);
            assertFalse(sim.removeOrganism(o));
        }

        @Test
        void relocateMovesDensity() {
            Organism o = sim.spawnOrganism(new TraitGenome(0.5), 0, 0, 2.0);

            assertTrue(sim.relocateOrganism(o, 8, 8));
            assertEquals(new GridPosition(8, 8), new GridPosition(o.getRow(), o.getCol()));
            assertEquals(0.0, sim.getDensityField().liveDensityAt(1, 1), 1e-12);
            assertTrue(sim.getDensityField().liveDensityAt(7, 7) > 0);
        }

        @Test
        void obstaclesRejectOrganisms() {
            assertTrue(sim.setObstacle(2, 2, true));
            assertNull(sim.spawnOrganism(new TraitGenome(0.5), 2, 2, 2.0));

            Organism o = sim.spawnOrganism(new TraitGenome(0.5), 2, 3, 2.0);
            assertFalse(sim.relocateOrganism(o, 2, 2));
            assertFalse(sim.setObstacle(2, 3, true));
        }

        @Test
        @DisplayName("Death returns the configured share of energy to the grid")
        void deathFeedsDecay() {
            Organism o = sim.spawnOrganism(new TraitGenome(0.5), 4, 4, 4.0);

            assertTrue(sim.registerDeath(o, DeathDetails.of(DeathCause.EXTERNAL)));
            assertFalse(sim.registerDeath(o, DeathDetails.of(DeathCause.EXTERNAL)));

            double onTiles = sim.getEnergyField().totalEnergy();
            double pooled = sim.getDecay().pooledTotal();
            assertEquals(0.9 * 4.0, onTiles + pooled, 1e-9);
            assertTrue(onTiles > 0);
            assertEquals(1, sim.getStats().deathsExternal());
        }

        @Test
        void deathDetailsOverrideReturnShare() {
            Organism o = sim.spawnOrganism(new TraitGenome(0.5), 4, 4, 4.0);

            sim.registerDeath(o, new DeathDetails(DeathCause.EXTERNAL, -1, 0.25));

            assertEquals(1.0, sim.getEnergyField().totalEnergy() + sim.getDecay().pooledTotal(), 1e-9);
        }

        @Test
        @DisplayName("Stale cached position is repaired from the grid")
        void locateRepairsDrift() {
            Organism o = sim.spawnOrganism(new TraitGenome(0.5), 3, 3, 2.0);
            o.updatePosition(7, 7);

            assertEquals(new GridPosition(3, 3), sim.locate(o));
            assertEquals(3, o.getRow());
            assertEquals(3, o.getCol());
            assertEquals(1, sim.getPositionRepairs());

            assertEquals(new GridPosition(3, 3), sim.locate(o));
            assertEquals(1, sim.getPositionRepairs());
        }

        @Test
        @DisplayName("Behavioural evenness follows removals")
        void evennessFollowsRemovals() {
            Organism avoider = sim.spawnOrganism(new TraitGenome(0.5).genes(new InteractionGenes(1, 0, 0)), 1, 1, 2.0);
            Organism fighter = sim.spawnOrganism(new TraitGenome(0.5).genes(new InteractionGenes(0, 1, 0)), 1, 3, 2.0);
            Organism helper = sim.spawnOrganism(new TraitGenome(0.5).genes(new InteractionGenes(0, 0, 1)), 1, 5, 2.0);
            StatsCollector stats = sim.getStatsCollector();
            assertEquals(1.0, stats.behavioralEvenness(), 1e-9);

            sim.removeOrganism(fighter);
            sim.removeOrganism(helper);

            assertEquals(1, sim.getPopulation());
            assertEquals(0.0, stats.behavioralEvenness(), 1e-12);
            assertTrue(avoider.isAlive());
        }

        @Test
        void evennessCountsHostPlacedOrganisms() {
            sim.spawnOrganism(new TraitGenome(0.5).genes(new InteractionGenes(1, 0, 0)), 1, 1, 2.0);
            Organism fighter = new Organism(40, new TraitGenome(0.5).genes(new InteractionGenes(0, 1, 0)), 0, 0, 2, -1, 0);
            Organism helper = new Organism(41, new TraitGenome(0.5).genes(new InteractionGenes(0, 0, 1)), 0, 0, 2, -1, 0);

            assertTrue(sim.placeOrganism(fighter, 3, 3));
            assertTrue(sim.placeOrganism(helper, 5, 5));
            assertEquals(1.0, sim.getStatsCollector().behavioralEvenness(), 1e-9);

            sim.registerDeath(fighter, DeathDetails.of(DeathCause.EXTERNAL));
            sim.registerDeath(helper, DeathDetails.of(DeathCause.EXTERNAL));
            assertEquals(0.0, sim.getStatsCollector().behavioralEvenness(), 1e-12);
        }

        @Test
        void locateOffGridIsNull() {
            Organism stray = new Organism(99, new TraitGenome(0.5), 1, 1, 1, -1, 0);
            assertNull(sim.locate(stray));
        }
    }

    @Nested
    @DisplayName("Tick")
    class Tick {

        @Test
        void senescence() {
            GridSimulation sim = simulation(quiet(9, 9).build());
            sim.spawnOrganism(new TraitGenome(0.5).lifespan(1), 4, 4, 3.0);

            TickSnapshot snapshot = sim.tick();

            assertEquals(1, snapshot.tick());
            assertEquals(0, snapshot.population());
            assertEquals(1, sim.getStats().deathsBySenescence());
        }

        @Test
        void starvation() {
            GridSimulation sim = simulation(quiet(9, 9).initialEnergyFraction(0).regenRate(0).build());
            sim.spawnOrganism(new TraitGenome(0.5).starvation(0.5), 4, 4, 1.0);

            sim.tick();

            assertEquals(0, sim.getPopulation());
            assertEquals(1, sim.getStats().deathsByStarvation());
        }

        @Test
        @DisplayName("Snapshot lists organisms in row-major order")
        void snapshotOrder() {
            GridSimulation sim = simulation(quiet(9, 9).build());
            sim.seedPopulation(12);

            TickSnapshot snapshot = sim.tick();

            assertEquals(sim.getPopulation(), snapshot.population());
            assertEquals(snapshot.population(), snapshot.entries().size());
            for (int i = 1; i < snapshot.entries().size(); i++) {
                TickSnapshot.Entry prev = snapshot.entries().get(i - 1);
                TickSnapshot.Entry next = snapshot.entries().get(i);
                assertTrue(prev.row() < next.row() || (prev.row() == next.row() && prev.col() < next.col()));
            }
        }

        @Test
        @DisplayName("Hostile neighbours fight and one of them dies")
        void fightKillsOne() {
            GridSimulation sim = simulation(quiet(9, 9).build());
            InteractionGenes fighter = new InteractionGenes(0, 1, 0);
            sim.spawnOrganism(new TraitGenome(0.0).thresholds(0.95, 0.9).activity(1).genes(fighter), 4, 4, 4.0);
            sim.spawnOrganism(new TraitGenome(1.0).thresholds(0.95, 0.9).activity(1).genes(fighter), 4, 5, 4.0);

            sim.tick();

            SimulationStats stats = sim.getStats();
            assertEquals(1, stats.deathsByCombat());
            assertEquals(1, sim.getPopulation());
            assertEquals(1, stats.interactions());
        }

        @Test
        @DisplayName("A failing interaction resolver is contained")
        void resolverFailureIsContained() {
            GridSimulation sim = GridSimulation.builder(quiet(9, 9).build())
                    .eventManager(EventManager.NONE)
                    .interactionResolver((intent, context) -> {
                        throw new IllegalStateException("boom");
                    })
                    .build();
            InteractionGenes fighter = new InteractionGenes(0, 1, 0);
            sim.spawnOrganism(new TraitGenome(0.0).thresholds(0.95, 0.9).activity(1).genes(fighter), 4, 4, 4.0);
            sim.spawnOrganism(new TraitGenome(1.0).thresholds(0.95, 0.9).activity(1).genes(fighter), 4, 5, 4.0);

            assertDoesNotThrow(() -> sim.tick());

            assertEquals(2, sim.getPopulation());
            assertTrue(sim.getStats().failedInteractions() >= 1);
        }

        @Test
        @DisplayName("Empty grid below minimum population is reseeded")
        void compensatorySeeding() {
            GridSimulation sim = simulation(quiet(20, 20).initialEnergyFraction(1.0).build());
            assertEquals(15, sim.getScarcityController().minPopulation());

            sim.tick();

            // deficit 15 -> 15 / 4 sites per tick
            assertEquals(3, sim.getPopulation());
            assertEquals(3, sim.getStats().seeded());
            assertTrue(sim.getScarcity() > 0);
        }

        @Test
        void smallGridIsNotReseeded() {
            GridSimulation sim = simulation(quiet(9, 9).initialEnergyFraction(1.0).build());
            sim.tick();
            assertEquals(0, sim.getPopulation());
            assertEquals(0.0, sim.getScarcity());
        }

        @Test
        @DisplayName("Occupied tiles hold no stored energy after a tick")
        void exclusivityAfterTick() {
            GridSimulation sim = simulation(quiet(12, 12).build());
            sim.seedPopulation(30);

            for (int t = 0; t < 20; t++) {
                sim.tick();
                for (Organism o : sim.organisms()) {
                    assertEquals(0.0, sim.getEnergyField().storedAt(sim.getGrid().index(o.getRow(), o.getCol())));
                }
            }
        }

        @Test
        void tickOptionsOverrideDefaults() {
            GridSimulation sim = simulation(quiet(9, 9).initialEnergyFraction(0).build());
            TickOptions defaults = sim.getDefaultOptions();
            TickOptions still = new TickOptions(defaults.societySimilarity(), defaults.enemySimilarity(),
                    0, 0, 0, 1, 1, 0.45, 0.12, 0, 0);

            sim.tick(still);

            assertEquals(0.0, sim.getEnergyField().totalEnergy(), 1e-12);
            assertEquals(1, sim.getTick());
        }
    }
}
