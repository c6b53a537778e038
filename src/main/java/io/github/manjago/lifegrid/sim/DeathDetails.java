package io.github.manjago.lifegrid.sim;

/**
 * Circumstances of a death.
 *
 * @param cause why the organism died
 * @param killerId id of the organism responsible, or -1
 * @param returnFraction share of the energy returned to the grid; NaN uses the genome or configured value
 */
public record DeathDetails(DeathCause cause, long killerId, double returnFraction) {

    public static DeathDetails of(DeathCause cause) {
        return new DeathDetails(cause, -1, Double.NaN);
    }

    public static DeathDetails killedBy(long killerId) {
        return new DeathDetails(DeathCause.COMBAT, killerId, Double.NaN);
    }
}
