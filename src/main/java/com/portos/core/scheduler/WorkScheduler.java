package com.portos.core.scheduler;

import java.time.Duration;

/**
 * Single source of deferred work for the orchestration core: history eviction,
 * periodic maintenance and recovery backoff all go through here so tests can
 * drive time deterministically.
 */
public interface WorkScheduler {

    /**
     * Runs {@code task} once after {@code delay}.
     */
    Cancellable schedule(Runnable task, Duration delay);

    /**
     * Runs {@code task} repeatedly, first after {@code initialDelay}, then every {@code period}.
     */
    Cancellable scheduleAtFixedRate(Runnable task, Duration initialDelay, Duration period);

    /**
     * Suspends the calling thread for {@code duration}. Used for recovery backoff.
     */
    void sleep(Duration duration) throws InterruptedException;

    @FunctionalInterface
    interface Cancellable {
        void cancel();
    }
}
