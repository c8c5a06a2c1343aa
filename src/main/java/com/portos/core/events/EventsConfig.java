package com.portos.core.events;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class EventsConfig {

    /**
     * Buffered channel the dashboard layer drains; registered as a global subscriber so
     * every orchestration event lands in it without blocking the publisher.
     */
    @Bean
    public BufferedEventChannel dashboardEventChannel(EventBus eventBus,
                                                      @Value("${portos.events.buffer-capacity:256}") int capacity) {
        var channel = new BufferedEventChannel(capacity);
        eventBus.subscribeAll(channel);
        return channel;
    }
}
