package com.portos.core.execution;

import com.portos.core.model.ExecutionError;
import com.portos.core.model.ExecutionHistoryEntry;
import com.portos.core.model.ExecutionState;
import com.portos.core.model.StateHistoryEntry;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One tracked invocation of a tool or agent function.
 * <p>
 * Only {@link ExecutionStateMachine} mutates an execution, always while holding its monitor.
 * The state history is append-only for the whole life of the execution.
 */
public class Execution {

    private final String id;
    private final String toolId;
    private final String agentId;
    private final Map<String, Object> metadata;
    private final Instant createdAt;
    private final List<StateHistoryEntry> stateHistory = new ArrayList<>();

    private volatile ExecutionState state;
    private Instant startedAt;
    private Instant completedAt;
    private Long durationMs;
    private Object input;
    private Object output;
    private Object progress;
    private Object partialOutput;
    private ExecutionError error;
    private int recoveryAttempts;
    private boolean wasError;
    private boolean wasTimeout;

    Execution(String id, String toolId, String agentId, Map<String, Object> metadata, Instant createdAt) {
        this.id = id;
        this.toolId = toolId;
        this.agentId = agentId;
        this.metadata = metadata;
        this.createdAt = createdAt;
        this.state = ExecutionState.IDLE;
        this.input = metadata.get("input");
        this.stateHistory.add(new StateHistoryEntry(ExecutionState.IDLE, createdAt, Map.of()));
    }

    public String getId() { return id; }
    public String getToolId() { return toolId; }
    public String getAgentId() { return agentId; }
    public Map<String, Object> getMetadata() { return metadata; }
    public Instant getCreatedAt() { return createdAt; }
    public ExecutionState getState() { return state; }
    public synchronized Instant getStartedAt() { return startedAt; }
    public synchronized Instant getCompletedAt() { return completedAt; }
    public synchronized Long getDurationMs() { return durationMs; }
    public synchronized Object getInput() { return input; }
    public synchronized Object getOutput() { return output; }
    public synchronized Object getProgress() { return progress; }
    public synchronized Object getPartialOutput() { return partialOutput; }
    public synchronized ExecutionError getError() { return error; }
    public synchronized int getRecoveryAttempts() { return recoveryAttempts; }

    /** True when the execution was completed from the error state, i.e. the caller gave up. */
    public synchronized boolean wasError() { return wasError; }

    /** True when the execution was force-ended by stale cleanup. */
    public synchronized boolean wasTimeout() { return wasTimeout; }

    public synchronized List<StateHistoryEntry> getStateHistory() {
        return List.copyOf(stateHistory);
    }

    void applyTransition(ExecutionState target, Instant timestamp, Map<String, Object> data) {
        this.state = target;
        this.stateHistory.add(new StateHistoryEntry(target, timestamp, data));
    }

    void markStarted(Instant timestamp) {
        this.startedAt = timestamp;
    }

    void setInput(Object input) {
        this.input = input;
    }

    void setProgress(Object progress) {
        this.progress = progress;
    }

    void setPartialOutput(Object partialOutput) {
        this.partialOutput = partialOutput;
    }

    void markEnded(Instant timestamp, Object output, boolean wasError, boolean wasTimeout) {
        this.completedAt = timestamp;
        Instant from = startedAt != null ? startedAt : createdAt;
        this.durationMs = timestamp.toEpochMilli() - from.toEpochMilli();
        if (output != null) {
            this.output = output;
        }
        this.wasError = wasError;
        this.wasTimeout = wasTimeout;
    }

    void setError(ExecutionError error) {
        this.error = error;
    }

    void markRecovered() {
        this.recoveryAttempts++;
        this.error = null;
    }

    synchronized ExecutionHistoryEntry toHistoryEntry() {
        return new ExecutionHistoryEntry(id, toolId, agentId, startedAt, completedAt, durationMs,
                error == null, recoveryAttempts);
    }

    @Override
    public String toString() {
        return "Execution{" + id + ", tool=" + toolId + ", agent=" + agentId + ", state=" + state.value() + "}";
    }
}
