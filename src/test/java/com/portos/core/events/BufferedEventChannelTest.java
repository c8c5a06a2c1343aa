package com.portos.core.events;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BufferedEventChannelTest {

    private static PortosEvent event(String subject) {
        return new PortosEvent("tool:stateChange", subject, Map.of(), Instant.parse("2026-01-01T00:00:00Z"));
    }

    @Test
    @DisplayName("drops the oldest event when full")
    void dropsOldestWhenFull() {
        var channel = new BufferedEventChannel(2);
        channel.accept(event("a"));
        channel.accept(event("b"));
        channel.accept(event("c"));

        var drained = channel.drain();
        assertEquals(2, drained.size());
        assertEquals("b", drained.get(0).subjectId());
        assertEquals("c", drained.get(1).subjectId());
        assertEquals(1, channel.droppedCount());
    }

    @Test
    @DisplayName("drain empties the buffer")
    void drainEmptiesBuffer() {
        var channel = new BufferedEventChannel(4);
        channel.accept(event("a"));
        assertEquals(1, channel.size());

        channel.drain();

        assertEquals(0, channel.size());
        assertTrue(channel.drain().isEmpty());
    }

    @Test
    @DisplayName("receives events when subscribed to the bus")
    void receivesFromBus() {
        var bus = new EventBus();
        var channel = new EventsConfig().dashboardEventChannel(bus, 8);

        bus.publish(event("exec-1"));

        assertEquals(1, channel.size());
        assertEquals(8, channel.capacity());
    }

    @Test
    @DisplayName("rejects non-positive capacity")
    void rejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new BufferedEventChannel(0));
    }
}
