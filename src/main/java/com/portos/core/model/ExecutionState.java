package com.portos.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle states of a tool execution and the only legal transitions between them.
 * <p>
 * {@link #END} is terminal.
 */
public enum ExecutionState {
    IDLE,
    START,
    RUNNING,
    UPDATE,
    END,
    ERROR,
    RECOVERED;

    private static final Map<ExecutionState, Set<ExecutionState>> TRANSITIONS = new EnumMap<>(ExecutionState.class);

    static {
        TRANSITIONS.put(IDLE, EnumSet.of(START));
        TRANSITIONS.put(START, EnumSet.of(RUNNING, ERROR));
        TRANSITIONS.put(RUNNING, EnumSet.of(UPDATE, END, ERROR));
        TRANSITIONS.put(UPDATE, EnumSet.of(RUNNING, END, ERROR));
        TRANSITIONS.put(END, EnumSet.noneOf(ExecutionState.class));
        TRANSITIONS.put(ERROR, EnumSet.of(RECOVERED, END));
        TRANSITIONS.put(RECOVERED, EnumSet.of(RUNNING, ERROR));
    }

    public boolean canTransitionTo(ExecutionState target) {
        return target != null && TRANSITIONS.get(this).contains(target);
    }

    public Set<ExecutionState> allowedTargets() {
        return Collections.unmodifiableSet(TRANSITIONS.get(this));
    }

    public boolean isTerminal() {
        return TRANSITIONS.get(this).isEmpty();
    }

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}
