package io.github.manjago.lifegrid.sim;

import io.github.manjago.lifegrid.config.SimulationConfig;
import io.github.manjago.lifegrid.core.GameRng;
import io.github.manjago.lifegrid.core.Organism;
import io.github.manjago.lifegrid.event.EventManager;
import io.github.manjago.lifegrid.grid.GridPosition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SpawnSiteSelectorTest {

    private final GridSimulation sim = GridSimulation.builder(SimulationConfig.builder()
                    .grid(9, 9)
                    .randomSeed(5)
                    .build())
            .eventManager(EventManager.NONE)
            .build();

    private SpawnSiteSelector selector(ReproductionZonePolicy zones) {
        return new SpawnSiteSelector(sim.getGrid(), sim.getEnergyField(), sim.getDensityField(), zones);
    }

    @Test
    @DisplayName("Partner's tile at tick start is a spawn anchor")
    void partnerOriginIsAnchor() {
        Organism a = sim.spawnOrganism(new TraitGenome(0.2), 4, 4, 3.0);
        Organism b = sim.spawnOrganism(new TraitGenome(0.8), 0, 0, 3.0);
        b.markTickOrigin();
        assertTrue(sim.relocateOrganism(b, 4, 5));

        List<GridPosition> candidates = selector(ReproductionZonePolicy.ALLOW_ALL)
                .candidates(a, b, new GridPosition(4, 4));

        assertTrue(candidates.contains(new GridPosition(0, 0)));
        assertTrue(candidates.contains(new GridPosition(1, 1)));
        assertTrue(candidates.contains(new GridPosition(3, 6)));
        assertFalse(candidates.contains(new GridPosition(4, 5)));
    }

    @Test
    void newbornsStartAtTheirBirthTile() {
        Organism o = sim.spawnOrganism(new TraitGenome(0.5), 2, 3, 3.0);

        assertEquals(2, o.getOriginRow());
        assertEquals(3, o.getOriginCol());
    }

    @Test
    @DisplayName("A failing zone filter keeps every free candidate")
    void failingFilterKeepsCandidates() {
        Organism a = sim.spawnOrganism(new TraitGenome(0.2), 4, 4, 3.0);
        Organism b = sim.spawnOrganism(new TraitGenome(0.8), 4, 5, 3.0);
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

        List<GridPosition> all = selector(ReproductionZonePolicy.ALLOW_ALL).candidates(a, b, new GridPosition(4, 4));
        List<GridPosition> kept = selector(broken).candidates(a, b, new GridPosition(4, 4));

        // 3x4 block around the pair, minus the two parents
        assertEquals(10, all.size());
        assertEquals(all, kept);
        assertNotNull(selector(broken).select(a, b, new GridPosition(4, 4), 1.0, new GameRng(1)));
    }
}
