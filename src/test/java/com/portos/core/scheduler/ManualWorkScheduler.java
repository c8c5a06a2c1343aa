package com.portos.core.scheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Deterministic {@link WorkScheduler} for tests. Nothing runs until {@link #advance} is called;
 * {@link #sleep} records the requested delay and advances the clock instead of blocking.
 */
public class ManualWorkScheduler implements WorkScheduler {

    private final MutableClock clock;
    private final List<ScheduledTask> tasks = new ArrayList<>();
    private final List<Duration> sleeps = new ArrayList<>();

    public ManualWorkScheduler(MutableClock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized Cancellable schedule(Runnable task, Duration delay) {
        var scheduled = new ScheduledTask(task, clock.instant().plus(delay), null);
        tasks.add(scheduled);
        return () -> scheduled.cancelled = true;
    }

    @Override
    public synchronized Cancellable scheduleAtFixedRate(Runnable task, Duration initialDelay, Duration period) {
        var scheduled = new ScheduledTask(task, clock.instant().plus(initialDelay), period);
        tasks.add(scheduled);
        return () -> scheduled.cancelled = true;
    }

    @Override
    public void sleep(Duration duration) {
        synchronized (this) {
            sleeps.add(duration);
        }
        advance(duration);
    }

    /**
     * Moves the clock forward, running every task that falls due on the way, in due order.
     */
    public void advance(Duration duration) {
        Instant target = clock.instant().plus(duration);
        while (true) {
            ScheduledTask next;
            Instant due;
            synchronized (this) {
                tasks.removeIf(t -> t.cancelled);
                next = tasks.stream()
                        .filter(t -> !t.dueAt.isAfter(target))
                        .min(Comparator.comparing(t -> t.dueAt))
                        .orElse(null);
                if (next == null) {
                    break;
                }
                due = next.dueAt;
                if (next.period != null) {
                    next.dueAt = due.plus(next.period);
                } else {
                    tasks.remove(next);
                }
            }
            if (due.isAfter(clock.instant())) {
                clock.set(due);
            }
            next.task.run();
        }
        clock.set(target);
    }

    public synchronized List<Duration> sleeps() {
        return List.copyOf(sleeps);
    }

    public synchronized int pendingTasks() {
        tasks.removeIf(t -> t.cancelled);
        return tasks.size();
    }

    private static final class ScheduledTask {
        private final Runnable task;
        private final Duration period;
        private Instant dueAt;
        private volatile boolean cancelled;

        private ScheduledTask(Runnable task, Instant dueAt, Duration period) {
            this.task = task;
            this.dueAt = dueAt;
            this.period = period;
        }
    }
}
