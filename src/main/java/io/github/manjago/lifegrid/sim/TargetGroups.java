package io.github.manjago.lifegrid.sim;

import java.util.List;

/**
 * Neighbours within sight, split by how the scanning organism sees them.
 * Each list is ordered nearest first.
 */
public record TargetGroups(List<Target> mates, List<Target> enemies, List<Target> society) {

    public static final TargetGroups EMPTY = new TargetGroups(List.of(), List.of(), List.of());

    public boolean isEmpty() {
        return mates.isEmpty() && enemies.isEmpty() && society.isEmpty();
    }

    public int total() {
        return mates.size() + enemies.size() + society.size();
    }
}
