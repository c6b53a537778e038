package io.github.manjago.lifegrid.event;

import io.github.manjago.lifegrid.core.Numbers;

/**
 * An active environmental event: a typed, rectangular disturbance with a strength and a countdown.
 */
public class EnvironmentalEvent {

    private final EventType type;
    private final double strength;
    private final EventArea area;
    private final int duration;
    private int remaining;

    public EnvironmentalEvent(EventType type, double strength, EventArea area, int duration) {
        this.type = type;
        this.strength = Numbers.clamp01(Numbers.finiteOr(strength, 0));
        this.area = area;
        this.duration = Math.max(1, duration);
        this.remaining = this.duration;
    }

    public EventType getType() { return type; }
    public double getStrength() { return strength; }
    public EventArea getArea() { return area; }
    public int getDuration() { return duration; }
    public int getRemaining() { return remaining; }

    public boolean isActive() {
        return remaining > 0;
    }

    /**
     * Count one tick down.
     */
    void advance() {
        if (remaining > 0) {
            remaining--;
        }
    }

    @Override
    public String toString() {
        return String.format("%s[strength=%.2f, area=%s, remaining=%d/%d]",
                type, strength, area, remaining, duration);
    }
}
