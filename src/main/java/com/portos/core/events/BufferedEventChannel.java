package com.portos.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Bounded, non-blocking event buffer for slow consumers such as the dashboard push layer.
 * <p>
 * {@link #accept} never blocks the publisher: when the buffer is full the oldest event is
 * dropped. Consumers pull buffered events with {@link #drain()}.
 */
public class BufferedEventChannel implements Consumer<PortosEvent> {

    private static final Logger log = LoggerFactory.getLogger(BufferedEventChannel.class);

    private final int capacity;
    private final ArrayDeque<PortosEvent> buffer;
    private final AtomicLong dropped = new AtomicLong();

    public BufferedEventChannel(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
        this.buffer = new ArrayDeque<>(capacity);
    }

    @Override
    public synchronized void accept(PortosEvent event) {
        if (buffer.size() >= capacity) {
            PortosEvent evicted = buffer.pollFirst();
            long total = dropped.incrementAndGet();
            if (total == 1 || total % 100 == 0) {
                log.warn("Event channel full (capacity {}), dropped {} event(s); last dropped: {}",
                        capacity, total, evicted != null ? evicted.eventType() : null);
            }
        }
        buffer.addLast(event);
    }

    /**
     * Removes and returns every buffered event, oldest first.
     */
    public synchronized List<PortosEvent> drain() {
        List<PortosEvent> events = new ArrayList<>(buffer);
        buffer.clear();
        return events;
    }

    public synchronized int size() {
        return buffer.size();
    }

    public int capacity() {
        return capacity;
    }

    /** Total number of events dropped because the buffer was full. */
    public long droppedCount() {
        return dropped.get();
    }
}
