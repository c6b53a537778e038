package io.github.manjago.lifegrid.event;

/**
 * Kinds of environmental event.
 */
public enum EventType {
    /** Extra water: regeneration boost, but organisms lose energy wading. */
    FLOOD(new EventEffect(0.0, 1.0, 0.25, 0.0, 0.3)),

    /** Regeneration collapses and tiles dry out. */
    DROUGHT(new EventEffect(-0.7, 0.0, 0.0, 0.1, 0.25)),

    HEATWAVE(new EventEffect(-0.45, 0.0, 0.0, 0.08, 0.35)),

    COLDWAVE(new EventEffect(-0.25, 0.0, 0.0, 0.0, 0.2));

    private final EventEffect effect;

    EventType(EventEffect effect) {
        this.effect = effect;
    }

    public EventEffect effect() {
        return effect;
    }
}
