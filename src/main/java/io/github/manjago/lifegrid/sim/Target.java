package io.github.manjago.lifegrid.sim;

import io.github.manjago.lifegrid.core.Organism;
import io.github.manjago.lifegrid.grid.GridPosition;

/**
 * A classified neighbour.
 *
 * @param position where the neighbour stands
 * @param organism the neighbour
 * @param similarity genetic similarity to the scanning organism
 * @param distance Chebyshev distance from the scanning organism
 */
public record Target(GridPosition position, Organism organism, double similarity, int distance) {
}
