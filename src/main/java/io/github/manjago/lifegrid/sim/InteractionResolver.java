package io.github.manjago.lifegrid.sim;

/**
 * Resolves fights and cooperation between two organisms.
 */
@FunctionalInterface
public interface InteractionResolver {

    /**
     * Apply the intent's energy and stat effects.
     *
     * @return true if the interaction took place
     */
    boolean resolve(InteractionIntent intent, InteractionContext context);
}
