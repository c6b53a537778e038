package io.github.manjago.lifegrid.event;

import io.github.manjago.lifegrid.core.GameRng;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RandomEventManagerTest {

    @Test
    @DisplayName("Generated events fit inside the grid")
    void eventsInsideGrid() {
        RandomEventManager manager = new RandomEventManager(25, 40, new GameRng(5));
        for (int i = 0; i < 500; i++) {
            EnvironmentalEvent event = manager.generate();
            EventArea area = event.getArea();

            assertTrue(area.x() >= 0 && area.x() + area.width() <= 40, "area " + area);
            assertTrue(area.y() >= 0 && area.y() + area.height() <= 25, "area " + area);
            assertTrue(area.width() >= 1 && area.height() >= 1);
            assertTrue(event.getStrength() >= 0.25 && event.getStrength() <= 1.0);
            assertTrue(event.getDuration() >= 300 && event.getDuration() <= 900);
        }
    }

    @Test
    @DisplayName("Never more than the allowed number of concurrent events")
    void concurrencyLimit() {
        RandomEventManager manager = new RandomEventManager(30, 30, new GameRng(9));
        for (int tick = 0; tick < 5000; tick++) {
            manager.advance(4.0, 2);
            assertTrue(manager.activeEvents().size() <= 2);
        }
        assertTrue(manager.getStartedCount() > 0);
    }

    @Test
    @DisplayName("Zero frequency starts nothing")
    void zeroFrequency() {
        RandomEventManager manager = new RandomEventManager(30, 30, new GameRng(9));
        for (int tick = 0; tick < 2000; tick++) {
            manager.advance(0, 2);
        }
        assertEquals(0, manager.getStartedCount());
        assertTrue(manager.activeEvents().isEmpty());
    }

    @Test
    @DisplayName("Events expire after their duration")
    void expiry() {
        RandomEventManager manager = new RandomEventManager(30, 30, new GameRng(3));
        int tick = 0;
        while (manager.activeEvents().isEmpty() && tick++ < 1000) {
            manager.advance(1, 1);
        }
        assertEquals(1, manager.activeEvents().size());
        EnvironmentalEvent event = manager.activeEvents().get(0);

        for (int i = 0; i < event.getDuration(); i++) {
            manager.advance(0, 1);
        }
        assertFalse(event.isActive());
        assertFalse(manager.activeEvents().contains(event));
    }

    @Test
    @DisplayName("The empty manager never reports events")
    void none() {
        EventManager.NONE.advance(10, 10);
        assertTrue(EventManager.NONE.activeEvents().isEmpty());
    }
}
