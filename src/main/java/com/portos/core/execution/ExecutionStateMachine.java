package com.portos.core.execution;

import com.portos.core.events.EventBus;
import com.portos.core.events.PortosEvent;
import com.portos.core.logging.MdcContext;
import com.portos.core.metrics.PortosMetrics;
import com.portos.core.model.ExecutionError;
import com.portos.core.model.ExecutionHistoryEntry;
import com.portos.core.model.ExecutionResult;
import com.portos.core.model.ExecutionState;
import com.portos.core.model.ExecutionStats;
import com.portos.core.model.HistoryQuery;
import com.portos.core.recovery.ErrorAnalysis;
import com.portos.core.recovery.ErrorClassifier;
import com.portos.core.recovery.RecoveryAction;
import com.portos.core.recovery.RecoveryAttemptLedger;
import com.portos.core.recovery.RecoveryContext;
import com.portos.core.recovery.RecoveryDecision;
import com.portos.core.recovery.RecoveryOutcome;
import com.portos.core.recovery.RecoveryRequest;
import com.portos.core.recovery.RecoveryStrategy;
import com.portos.core.recovery.RecoveryStrategySelector;
import com.portos.core.recovery.ToolInvocationException;
import com.portos.core.scheduler.WorkScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Tracks every tool execution through its lifecycle.
 * <p>
 * Transitions are validated against {@link ExecutionState}; an illegal request is logged and
 * answered with {@code null} without touching the execution. Every accepted transition is
 * appended to the execution's state history and published as a {@value #STATE_CHANGE} event.
 * Ended executions are archived into a bounded history and evicted from the live table after
 * a delay so late readers can still look them up.
 */
@Service
public class ExecutionStateMachine {

    private static final Logger log = LoggerFactory.getLogger(ExecutionStateMachine.class);

    public static final String STATE_CHANGE = "tool:stateChange";

    private final ErrorClassifier errorClassifier;
    private final RecoveryStrategySelector strategySelector;
    private final RecoveryAttemptLedger ledger;
    private final EventBus eventBus;
    private final WorkScheduler scheduler;
    private final Clock clock;
    private final ExecutionProperties properties;
    private final PortosMetrics metrics;
    private final Executor toolExecutor;

    private final ConcurrentHashMap<String, Execution> executions = new ConcurrentHashMap<>();

    /** Newest first. */
    private final Deque<ExecutionHistoryEntry> history = new ArrayDeque<>();

    public ExecutionStateMachine(ErrorClassifier errorClassifier,
                                 RecoveryStrategySelector strategySelector,
                                 RecoveryAttemptLedger ledger,
                                 EventBus eventBus,
                                 WorkScheduler scheduler,
                                 Clock clock,
                                 ExecutionProperties properties,
                                 PortosMetrics metrics,
                                 @Qualifier("toolExecutor") Executor toolExecutor) {
        this.errorClassifier = errorClassifier;
        this.strategySelector = strategySelector;
        this.ledger = ledger;
        this.eventBus = eventBus;
        this.scheduler = scheduler;
        this.clock = clock;
        this.properties = properties;
        this.metrics = metrics;
        this.toolExecutor = toolExecutor;
    }

    public Execution create(String toolId, String agentId, Map<String, Object> metadata) {
        Objects.requireNonNull(toolId, "toolId");
        String id = UUID.randomUUID().toString();
        Map<String, Object> meta = metadata != null
                ? Collections.unmodifiableMap(new HashMap<>(metadata))
                : Map.of();
        Execution execution = new Execution(id, toolId, agentId, meta, clock.instant());
        executions.put(id, execution);
        log.debug("Created execution {} for tool {} (agent {})", id, toolId, agentId);
        return execution;
    }

    /**
     * Move an execution to {@code target}.
     *
     * @param executionId id returned by {@link #create}
     * @param target      requested state
     * @param data        transition payload; recognised keys depend on the target state
     * @return the execution, or {@code null} if it is unknown or the transition is not allowed
     */
    public Execution transition(String executionId, ExecutionState target, Map<String, Object> data) {
        Execution execution = executionId != null ? executions.get(executionId) : null;
        if (execution == null) {
            log.warn("Transition to {} requested for unknown execution {}", target, executionId);
            return null;
        }

        Map<String, Object> payload = data != null
                ? Collections.unmodifiableMap(new HashMap<>(data))
                : Map.of();
        Instant now = clock.instant();
        ExecutionState from;

        synchronized (execution) {
            from = execution.getState();
            if (!from.canTransitionTo(target)) {
                log.warn("Invalid state transition {} -> {} for execution {}",
                        from.value(), target != null ? target.value() : null, executionId);
                metrics.recordRejectedTransition(from.value(), target != null ? target.value() : "null");
                return null;
            }

            execution.applyTransition(target, now, payload);
            switch (target) {
                case START -> execution.markStarted(now);
                case RUNNING -> {
                    if (payload.get("input") != null) {
                        execution.setInput(payload.get("input"));
                    }
                }
                case UPDATE -> {
                    if (payload.containsKey("progress")) {
                        execution.setProgress(payload.get("progress"));
                    }
                    if (payload.containsKey("partialOutput")) {
                        execution.setPartialOutput(payload.get("partialOutput"));
                    }
                }
                case END -> execution.markEnded(now, payload.get("output"),
                        Boolean.TRUE.equals(payload.get("wasError")),
                        Boolean.TRUE.equals(payload.get("wasTimeout")));
                case ERROR -> execution.setError(toExecutionError(payload, now));
                case RECOVERED -> execution.markRecovered();
                default -> { }
            }
        }

        if (target == ExecutionState.END) {
            archive(execution);
        }

        Map<String, Object> event = new HashMap<>();
        event.put("executionId", executionId);
        event.put("toolId", execution.getToolId());
        event.put("agentId", execution.getAgentId());
        event.put("fromState", from.value());
        event.put("toState", target.value());
        event.put("timestamp", now);
        eventBus.publish(new PortosEvent(STATE_CHANGE, executionId, event, now));

        log.debug("Execution {} {} -> {}", executionId, from.value(), target.value());
        return execution;
    }

    /**
     * Moves a freshly created execution through START into RUNNING.
     *
     * @return the running execution, or {@code null} if the id is unknown or the execution already started
     */
    public Execution start(String executionId, Object input) {
        if (executionId == null || !executions.containsKey(executionId)) {
            log.warn("Cannot start unknown execution {}", executionId);
            return null;
        }
        Map<String, Object> data = new HashMap<>();
        data.put("input", input);
        if (transition(executionId, ExecutionState.START, data) == null) {
            return null;
        }
        return transition(executionId, ExecutionState.RUNNING, data);
    }

    /**
     * Report progress. Silently ignored unless the execution is running or already updating.
     */
    public Execution update(String executionId, Map<String, Object> data) {
        Execution execution = executions.get(executionId);
        if (execution == null) {
            return null;
        }
        ExecutionState state = execution.getState();
        if (state != ExecutionState.RUNNING && state != ExecutionState.UPDATE) {
            return execution;
        }
        if (state == ExecutionState.UPDATE) {
            transition(executionId, ExecutionState.RUNNING, Map.of());
        }
        return transition(executionId, ExecutionState.UPDATE, data);
    }

    public Execution complete(String executionId, Object output) {
        Execution execution = executions.get(executionId);
        if (execution == null) {
            return null;
        }
        Map<String, Object> data = new HashMap<>();
        data.put("output", output);

        ExecutionState state = execution.getState();
        if (state == ExecutionState.ERROR) {
            data.put("wasError", true);
            return transition(executionId, ExecutionState.END, data);
        }
        if (state == ExecutionState.UPDATE) {
            transition(executionId, ExecutionState.RUNNING, Map.of());
        }
        return transition(executionId, ExecutionState.END, data);
    }

    public Execution error(String executionId, Throwable error) {
        Map<String, Object> data = new HashMap<>();
        data.put("error", error);
        return transition(executionId, ExecutionState.ERROR, data);
    }

    public Execution error(String executionId, String message, String code) {
        Map<String, Object> data = new HashMap<>();
        data.put("message", message);
        data.put("code", code);
        return transition(executionId, ExecutionState.ERROR, data);
    }

    /**
     * Recover a failed execution and put it back into RUNNING.
     *
     * @return the execution, or {@code null} if it is not in ERROR or has used up its recoveries
     */
    public Execution recover(String executionId, RecoveryStrategy strategy) {
        Execution execution = executions.get(executionId);
        if (execution == null || execution.getState() != ExecutionState.ERROR) {
            return null;
        }
        if (execution.getRecoveryAttempts() >= properties.getMaxRecoveryAttempts()) {
            log.warn("Execution {} exceeded {} recovery attempts", executionId, properties.getMaxRecoveryAttempts());
            return null;
        }
        Map<String, Object> data = new HashMap<>();
        data.put("strategy", strategy != null ? strategy.value() : null);
        if (transition(executionId, ExecutionState.RECOVERED, data) == null) {
            return null;
        }
        return transition(executionId, ExecutionState.RUNNING, Map.of());
    }

    public Optional<Execution> getExecution(String executionId) {
        return Optional.ofNullable(executionId != null ? executions.get(executionId) : null);
    }

    public List<Execution> getAgentExecutions(String agentId) {
        return executions.values().stream()
                .filter(e -> Objects.equals(e.getAgentId(), agentId))
                .toList();
    }

    /**
     * Archived executions, newest first.
     */
    public List<ExecutionHistoryEntry> getExecutionHistory(HistoryQuery query) {
        HistoryQuery q = query != null ? query : HistoryQuery.all();
        List<ExecutionHistoryEntry> snapshot;
        synchronized (history) {
            snapshot = new ArrayList<>(history);
        }
        return snapshot.stream()
                .filter(e -> q.agentId() == null || q.agentId().equals(e.agentId()))
                .filter(e -> q.toolId() == null || q.toolId().equals(e.toolId()))
                .filter(e -> q.success() == null || e.success() == q.success())
                .limit(q.effectiveLimit())
                .toList();
    }

    public ExecutionStats getStats() {
        Map<ExecutionState, Integer> byState = new EnumMap<>(ExecutionState.class);
        int active = 0;
        for (Execution execution : executions.values()) {
            byState.merge(execution.getState(), 1, Integer::sum);
            active++;
        }

        List<ExecutionHistoryEntry> recent;
        int historySize;
        synchronized (history) {
            historySize = history.size();
            recent = history.stream().limit(properties.getStatsWindow()).toList();
        }

        double successRate = recent.isEmpty()
                ? 1.0
                : (double) recent.stream().filter(ExecutionHistoryEntry::success).count() / recent.size();
        long avgDuration = Math.round(recent.stream()
                .mapToLong(e -> e.durationMs() != null ? e.durationMs() : 0L)
                .average()
                .orElse(0));

        return new ExecutionStats(active, byState, historySize, successRate, avgDuration);
    }

    /**
     * Force-end executions that have not reached END within {@code maxAge}. Running ones are
     * failed with "Execution timeout" first; ones that never started are dropped.
     *
     * @return number of executions cleaned up
     */
    public int cleanupStaleExecutions(Duration maxAge) {
        Instant cutoff = clock.instant().minus(maxAge);
        int cleaned = 0;

        for (Execution execution : List.copyOf(executions.values())) {
            ExecutionState state = execution.getState();
            if (state == ExecutionState.END || !execution.getCreatedAt().isBefore(cutoff)) {
                continue;
            }
            String id = execution.getId();
            if (state == ExecutionState.IDLE) {
                executions.remove(id, execution);
                cleaned++;
                continue;
            }
            if (state != ExecutionState.ERROR) {
                error(id, "Execution timeout", "TIMEOUT");
            }
            Map<String, Object> data = new HashMap<>();
            data.put("wasError", true);
            data.put("wasTimeout", true);
            if (transition(id, ExecutionState.END, data) != null) {
                cleaned++;
            }
        }

        if (cleaned > 0) {
            log.info("Cleaned up {} stale executions older than {}", cleaned, maxAge);
        }
        return cleaned;
    }

    /**
     * Bind a tool function to this state machine.
     */
    public WrappedTool wrap(String toolId, ToolFunction toolFn) {
        Objects.requireNonNull(toolId, "toolId");
        Objects.requireNonNull(toolFn, "toolFn");
        return new WrappedTool(this, toolId, toolFn, toolExecutor);
    }

    ExecutionResult runWrapped(String toolId, ToolFunction toolFn, String agentId,
                               Object input, Map<String, Object> metadata) {
        Map<String, Object> meta = metadata != null ? new HashMap<>(metadata) : new HashMap<>();
        meta.put("input", input);
        Execution execution = create(toolId, agentId, meta);
        String id = execution.getId();

        MdcContext.setExecution(id, toolId, agentId);
        try {
            if (start(id, input) == null) {
                return ExecutionResult.failure(id, "Execution could not be started", null, null);
            }

            var context = new RecoveryContext(stringOf(meta.get("taskId")), agentId,
                    stringOf(meta.get("provider")), stringOf(meta.get("model")));
            if (context.provider() != null) {
                MdcContext.setProvider(context.provider());
            }
            int maxAttempts = properties.getMaxAttempts();

            Throwable lastError = null;
            ErrorAnalysis lastAnalysis = null;
            RecoveryOutcome lastOutcome = null;

            for (int attempt = 1; attempt <= maxAttempts; attempt++) {
                try {
                    Object output = toolFn.apply(input);
                    complete(id, output);
                    ledger.reset(RecoveryAttemptLedger.keyFor(context.taskId(), agentId));
                    return ExecutionResult.success(id, output);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    lastError = e;
                    error(id, e);
                    lastOutcome = RecoveryOutcome.manualIntervention("Execution interrupted");
                    break;
                } catch (Exception e) {
                    lastError = e;
                    error(id, e);
                    lastAnalysis = errorClassifier.analyze(e, context);
                    log.warn("Tool {} failed on attempt {}/{} ({}): {}", toolId, attempt, maxAttempts,
                            lastAnalysis.category().value(), lastAnalysis.message());

                    if (attempt == maxAttempts) {
                        break;
                    }

                    var request = new RecoveryRequest(context.taskId(), agentId, attempt);
                    RecoveryDecision decision = strategySelector.select(lastAnalysis, request);
                    try {
                        lastOutcome = strategySelector.execute(decision, request, lastAnalysis);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        lastOutcome = RecoveryOutcome.manualIntervention("Execution interrupted");
                        break;
                    }

                    if (lastOutcome.action() == RecoveryAction.RESCHEDULE) {
                        // deferred work is retried in place after the backoff
                        long delay = lastOutcome.rescheduleAfterMs() != null ? lastOutcome.rescheduleAfterMs() : 0L;
                        try {
                            scheduler.sleep(Duration.ofMillis(delay));
                        } catch (InterruptedException ie) {
                            Thread.currentThread().interrupt();
                            lastOutcome = RecoveryOutcome.manualIntervention("Execution interrupted");
                            break;
                        }
                    } else if (lastOutcome.action() != RecoveryAction.RETRY_NOW) {
                        break;
                    }
                    if (recover(id, RecoveryStrategy.RETRY) == null) {
                        break;
                    }
                }
            }

            complete(id, null);
            if (lastOutcome == null || lastOutcome.action() == RecoveryAction.RETRY_NOW
                    || lastOutcome.action() == RecoveryAction.RESCHEDULE) {
                lastOutcome = RecoveryOutcome.manualIntervention("Maximum recovery attempts exceeded");
            }
            String message = lastAnalysis != null ? lastAnalysis.message() : messageOf(lastError);
            log.warn("Tool {} gave up: {} ({})", toolId, message, lastOutcome.action().value());
            return ExecutionResult.failure(id, message,
                    lastAnalysis != null ? lastAnalysis.category() : null, lastOutcome);
        } finally {
            MdcContext.clear();
        }
    }

    private void archive(Execution execution) {
        ExecutionHistoryEntry entry = execution.toHistoryEntry();
        synchronized (history) {
            history.addFirst(entry);
            while (history.size() > properties.getHistorySize()) {
                history.removeLast();
            }
        }
        metrics.recordToolExecution(entry.toolId(), entry.success(),
                entry.durationMs() != null ? entry.durationMs() : 0L);

        String id = execution.getId();
        scheduler.schedule(() -> executions.remove(id, execution),
                Duration.ofMillis(properties.getEvictionDelayMs()));
    }

    private static ExecutionError toExecutionError(Map<String, Object> data, Instant now) {
        Object error = data.get("error");
        String code = stringOf(data.get("code"));
        if (error instanceof ExecutionError executionError) {
            return executionError;
        }
        if (error instanceof Throwable throwable) {
            String errorCode = code;
            if (errorCode == null && throwable instanceof ToolInvocationException tie) {
                errorCode = tie.getCode();
            }
            return ExecutionError.from(throwable, errorCode, now);
        }
        return ExecutionError.of(stringOf(data.get("message")), code, now);
    }

    private static String stringOf(Object value) {
        return value != null ? value.toString() : null;
    }

    private static String messageOf(Throwable error) {
        if (error == null) {
            return ExecutionError.UNKNOWN_MESSAGE;
        }
        return error.getMessage() != null ? error.getMessage() : error.toString();
    }
}
