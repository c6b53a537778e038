package io.github.manjago.lifegrid.sim;

import io.github.manjago.lifegrid.core.GameRng;
import io.github.manjago.lifegrid.core.Organism;

/**
 * What an interaction resolver may do to the simulation.
 */
public interface InteractionContext {

    long tick();

    double maxTileEnergy();

    GameRng rng();

    /**
     * Kill an organism; its energy decays back into the grid.
     *
     * @return false if it was already dead
     */
    boolean kill(Organism organism, DeathDetails details);

    /**
     * Move an organism to a free tile.
     *
     * @return false if the tile is not free
     */
    boolean relocate(Organism organism, int row, int col);
}
