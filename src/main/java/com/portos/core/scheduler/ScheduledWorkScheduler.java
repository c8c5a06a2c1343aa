package com.portos.core.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link WorkScheduler} backed by one daemon {@link ScheduledExecutorService} thread.
 */
public class ScheduledWorkScheduler implements WorkScheduler, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ScheduledWorkScheduler.class);

    private final ScheduledExecutorService executor;

    public ScheduledWorkScheduler() {
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "portos-timer-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public Cancellable schedule(Runnable task, Duration delay) {
        ScheduledFuture<?> future = executor.schedule(guarded(task), delay.toMillis(), TimeUnit.MILLISECONDS);
        return () -> future.cancel(false);
    }

    @Override
    public Cancellable scheduleAtFixedRate(Runnable task, Duration initialDelay, Duration period) {
        ScheduledFuture<?> future = executor.scheduleAtFixedRate(guarded(task),
                initialDelay.toMillis(), period.toMillis(), TimeUnit.MILLISECONDS);
        return () -> future.cancel(false);
    }

    @Override
    public void sleep(Duration duration) throws InterruptedException {
        if (duration.isNegative() || duration.isZero()) {
            return;
        }
        Thread.sleep(duration.toMillis());
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    // A throwing periodic task would otherwise be silently descheduled.
    private Runnable guarded(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.warn("Scheduled task failed: {}", e.getMessage(), e);
            }
        };
    }
}
