package io.github.manjago.lifegrid.event;

import io.github.manjago.lifegrid.core.Numbers;

import java.util.ArrayList;
import java.util.List;

/**
 * Regeneration modifiers of one event, resolved once per tick.
 *
 * Overlapping events combine per tile: multipliers multiply, adds and drains sum.
 * {@link #combine} does the accumulation for a single tile.
 */
public record EventModifiers(
    EnvironmentalEvent event,
    double regenMultiplier,
    double regenAdd,
    double drain
) {

    public static EventModifiers of(EnvironmentalEvent event, double strengthMultiplier) {
        double strength = Numbers.clamp01(event.getStrength() * Math.max(0, Numbers.finiteOr(strengthMultiplier, 1)));
        EventEffect effect = event.getType().effect();
        double scale = Math.max(effect.scaleMin(), 1 + effect.scaleChange() * strength);
        return new EventModifiers(event, scale, effect.regenAdd() * strength, effect.regenDrain() * strength);
    }

    /**
     * Resolve every active event.
     */
    public static List<EventModifiers> resolve(List<EnvironmentalEvent> events, double strengthMultiplier) {
        List<EventModifiers> result = new ArrayList<>(events.size());
        for (EnvironmentalEvent event : events) {
            if (event.isActive()) {
                result.add(of(event, strengthMultiplier));
            }
        }
        return result;
    }

    /**
     * Combined effect at a tile, written to {@code out} as {@code [multiplier, add, drain]}.
     * A tile outside every event gets {@code [1, 0, 0]}.
     */
    public static double[] combine(List<EventModifiers> modifiers, int row, int col, double[] out) {
        double multiplier = 1.0;
        double add = 0.0;
        double drain = 0.0;
        for (int i = 0; i < modifiers.size(); i++) {
            EventModifiers m = modifiers.get(i);
            if (m.event.getArea().contains(row, col)) {
                multiplier *= m.regenMultiplier;
                add += m.regenAdd;
                drain += m.drain;
            }
        }
        out[0] = multiplier;
        out[1] = add;
        out[2] = drain;
        return out;
    }
}
