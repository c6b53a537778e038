package io.github.manjago.lifegrid.sim;

import io.github.manjago.lifegrid.core.Numbers;
import io.github.manjago.lifegrid.core.Organism;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Built-in interaction rules.
 *
 * Fight: both sides pay the fight cost, then each rolls
 * {@code energy * combatPower * U(0.8, 1.2)}. The loser dies; an initiator
 * that wins moves onto the loser's tile.
 *
 * Cooperate: the initiator hands over a share of its energy, limited by the
 * target's free capacity.
 */
public class DefaultInteractionResolver implements InteractionResolver {

    private static final Logger log = LoggerFactory.getLogger(DefaultInteractionResolver.class);

    @Override
    public boolean resolve(InteractionIntent intent, InteractionContext context) {
        Organism a = intent.initiator();
        Organism b = intent.target();
        if (!a.isAlive() || !b.isAlive() || a == b) {
            return false;
        }
        return switch (intent.kind()) {
            case FIGHT -> fight(intent, a, b, context);
            case COOPERATE -> cooperate(intent, a, b, context);
        };
    }

    private boolean fight(InteractionIntent intent, Organism a, Organism b, InteractionContext context) {
        double cost = Math.max(0, Numbers.finiteOr(intent.fightCost(), 0));
        a.spendEnergy(cost);
        b.spendEnergy(cost);

        double powerA = a.getEnergy() * Math.max(0.01, a.getGenome().combatPower()) * context.rng().nextDouble(0.8, 1.2);
        double powerB = b.getEnergy() * Math.max(0.01, b.getGenome().combatPower()) * context.rng().nextDouble(0.8, 1.2);

        Organism winner = powerA >= powerB ? a : b;
        Organism loser = winner == a ? b : a;
        winner.recordFight(true);
        loser.recordFight(false);

        context.kill(loser, DeathDetails.killedBy(winner.getId()));
        if (winner == a) {
            context.relocate(a, intent.targetPosition().row(), intent.targetPosition().col());
        }
        log.debug("Fight: {} beat {}", winner.toShortString(), loser.toShortString());
        return true;
    }

    private boolean cooperate(InteractionIntent intent, Organism a, Organism b, InteractionContext context) {
        double share = Numbers.clamp01(Numbers.finiteOr(intent.cooperationShare(), 0));
        double room = Math.max(0, context.maxTileEnergy() - b.getEnergy());
        double amount = Math.min(a.getEnergy() * share, room);
        if (amount <= 0) {
            return false;
        }
        a.spendEnergy(amount);
        b.gainEnergy(amount, context.maxTileEnergy());
        log.debug("Cooperate: {} gave {} to {}", a.toShortString(), String.format("%.3f", amount), b.toShortString());
        return true;
    }
}
