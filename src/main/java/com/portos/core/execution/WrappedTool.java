package com.portos.core.execution;

import com.portos.core.model.ExecutionResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * A tool function bound to the execution state machine. Every call is tracked as an
 * execution with retries and recovery; callers only see the {@link ExecutionResult}.
 * <p>
 * Recognised metadata keys: {@code taskId} (attempt-counting identity), {@code provider}
 * and {@code model} (passed to error classification).
 */
public final class WrappedTool {

    private final ExecutionStateMachine stateMachine;
    private final String toolId;
    private final ToolFunction toolFn;
    private final Executor executor;

    WrappedTool(ExecutionStateMachine stateMachine, String toolId, ToolFunction toolFn, Executor executor) {
        this.stateMachine = stateMachine;
        this.toolId = toolId;
        this.toolFn = toolFn;
        this.executor = executor;
    }

    public String toolId() {
        return toolId;
    }

    /**
     * Runs the tool on the calling thread.
     */
    public ExecutionResult call(String agentId, Object input, Map<String, Object> metadata) {
        return stateMachine.runWrapped(toolId, toolFn, agentId, input, metadata);
    }

    public ExecutionResult call(String agentId, Object input) {
        return call(agentId, input, Map.of());
    }

    /**
     * Runs the tool on the tool executor.
     */
    public CompletableFuture<ExecutionResult> invoke(String agentId, Object input, Map<String, Object> metadata) {
        return CompletableFuture.supplyAsync(() -> call(agentId, input, metadata), executor);
    }
}
