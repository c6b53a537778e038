package io.github.manjago.lifegrid.event;

import io.github.manjago.lifegrid.core.GameRng;
import io.github.manjago.lifegrid.core.Numbers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Starts random events of random type, strength and extent.
 *
 * Durations are 300..900 ticks, strengths 0.25..1. After an event starts the
 * manager waits 180..480 ticks (divided by the frequency multiplier) before
 * it may start another one.
 */
public class RandomEventManager implements EventManager {

    private static final Logger log = LoggerFactory.getLogger(RandomEventManager.class);

    private static final int MIN_DURATION = 300;
    private static final int MAX_DURATION = 900;
    private static final double MIN_STRENGTH = 0.25;
    private static final int MIN_COOLDOWN = 180;
    private static final int MAX_COOLDOWN = 480;
    private static final int MIN_SPAN = 10;

    private final int rows;
    private final int cols;
    private final GameRng rng;

    private final List<EnvironmentalEvent> active = new ArrayList<>();
    private final List<EnvironmentalEvent> view = Collections.unmodifiableList(active);
    private double cooldown;
    private long started;

    public RandomEventManager(int rows, int cols, GameRng rng) {
        this.rows = rows;
        this.cols = cols;
        this.rng = rng;
        this.cooldown = rng.nextIntInclusive(0, MIN_COOLDOWN);
    }

    @Override
    public List<EnvironmentalEvent> activeEvents() {
        return view;
    }

    @Override
    public void advance(double frequencyMultiplier, int maxConcurrent) {
        Iterator<EnvironmentalEvent> it = active.iterator();
        while (it.hasNext()) {
            EnvironmentalEvent event = it.next();
            event.advance();
            if (!event.isActive()) {
                it.remove();
                log.debug("Event ended: {}", event.getType());
            }
        }

        double frequency = Math.max(0, Numbers.finiteOr(frequencyMultiplier, 1));
        if (frequency <= 0) {
            return;
        }

        cooldown -= 1;
        if (cooldown > 0 || active.size() >= Math.max(0, maxConcurrent)) {
            return;
        }

        EnvironmentalEvent event = generate();
        active.add(event);
        started++;
        cooldown = rng.nextIntInclusive(MIN_COOLDOWN, MAX_COOLDOWN) / frequency;
        log.debug("Event started: {}", event);
    }

    /**
     * Create a random event inside the grid bounds.
     */
    EnvironmentalEvent generate() {
        EventType[] types = EventType.values();
        EventType type = types[rng.nextInt(types.length)];
        double strength = rng.nextDouble(MIN_STRENGTH, 1.0);
        int duration = rng.nextIntInclusive(MIN_DURATION, MAX_DURATION);

        int width = span(cols);
        int height = span(rows);
        int x = rng.nextInt(cols - width + 1);
        int y = rng.nextInt(rows - height + 1);

        return new EnvironmentalEvent(type, strength, new EventArea(x, y, width, height), duration);
    }

    private int span(int limit) {
        int max = Math.min(limit, Math.max(MIN_SPAN, limit / 3));
        int min = Math.max(1, max / 2);
        return rng.nextIntInclusive(min, max);
    }

    /**
     * Total number of events started so far.
     */
    public long getStartedCount() {
        return started;
    }
}
