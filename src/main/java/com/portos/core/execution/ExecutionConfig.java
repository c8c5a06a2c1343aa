package com.portos.core.execution;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class ExecutionConfig {

    /**
     * Pool that runs wrapped tool calls submitted through {@link WrappedTool#invoke}.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService toolExecutor(ExecutionProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, properties.getToolThreads()), r -> {
            Thread t = new Thread(r, "portos-tool-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
