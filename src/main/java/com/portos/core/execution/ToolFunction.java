package com.portos.core.execution;

/**
 * Any tool or agent function the orchestrator can run. Input and output are opaque.
 */
@FunctionalInterface
public interface ToolFunction {

    Object apply(Object input) throws Exception;
}
