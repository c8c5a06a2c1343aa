package com.portos.core.execution;

import com.portos.core.scheduler.WorkScheduler;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Periodically force-ends executions that never reached END.
 */
@Component
public class ExecutionMaintenance {

    private static final Logger log = LoggerFactory.getLogger(ExecutionMaintenance.class);

    private final ExecutionStateMachine stateMachine;
    private final WorkScheduler scheduler;
    private final ExecutionProperties properties;

    private WorkScheduler.Cancellable cleanupTask;

    public ExecutionMaintenance(ExecutionStateMachine stateMachine,
                                WorkScheduler scheduler,
                                ExecutionProperties properties) {
        this.stateMachine = stateMachine;
        this.scheduler = scheduler;
        this.properties = properties;
    }

    @PostConstruct
    public void start() {
        Duration interval = Duration.ofMillis(properties.getCleanupIntervalMs());
        Duration staleAfter = Duration.ofMillis(properties.getStaleAfterMs());
        cleanupTask = scheduler.scheduleAtFixedRate(
                () -> stateMachine.cleanupStaleExecutions(staleAfter), interval, interval);
        log.info("Stale execution cleanup every {} (max age {})", interval, staleAfter);
    }

    @PreDestroy
    public void stop() {
        if (cleanupTask != null) {
            cleanupTask.cancel();
            cleanupTask = null;
        }
    }
}
