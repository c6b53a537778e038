package io.github.manjago.lifegrid.event;

/**
 * Per-unit-strength effect of an environmental event on tiles and organisms.
 *
 * Regeneration is scaled by {@code max(scaleMin, 1 + scaleChange * strength)}.
 * {@code regenAdd} and {@code regenDrain} are expressed in units of the base
 * regeneration ({@code regenRate * maxTileEnergy}) per tick.
 * {@code energyLoss} is the extra metabolic loss for unprotected organisms.
 */
public record EventEffect(
    double scaleChange,
    double scaleMin,
    double regenAdd,
    double regenDrain,
    double energyLoss
) {
}
