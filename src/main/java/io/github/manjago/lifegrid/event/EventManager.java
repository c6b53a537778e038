package io.github.manjago.lifegrid.event;

import java.util.List;

/**
 * Source of environmental events.
 *
 * The simulation calls {@link #advance} once per tick and then reads
 * {@link #activeEvents()}; the returned list must not be modified by callers.
 */
public interface EventManager {

    /**
     * Events currently affecting the grid.
     */
    List<EnvironmentalEvent> activeEvents();

    /**
     * Advance one tick: count down active events, expire finished ones and possibly start a new one.
     *
     * @param frequencyMultiplier scales how often new events start (0 = never)
     * @param maxConcurrent upper bound on simultaneously active events
     */
    void advance(double frequencyMultiplier, int maxConcurrent);

    /**
     * Manager that never produces events.
     */
    EventManager NONE = new EventManager() {
        @Override
        public List<EnvironmentalEvent> activeEvents() {
            return List.of();
        }

        @Override
        public void advance(double frequencyMultiplier, int maxConcurrent) {
        }
    };
}
