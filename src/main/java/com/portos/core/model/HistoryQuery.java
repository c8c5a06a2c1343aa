package com.portos.core.model;

/**
 * Filter for execution history lookups. Null fields do not filter.
 */
public record HistoryQuery(String agentId, String toolId, Boolean success, Integer limit) {

    public static final int DEFAULT_LIMIT = 100;

    public static HistoryQuery all() {
        return new HistoryQuery(null, null, null, null);
    }

    public static HistoryQuery forAgent(String agentId) {
        return new HistoryQuery(agentId, null, null, null);
    }

    public int effectiveLimit() {
        return limit != null && limit > 0 ? limit : DEFAULT_LIMIT;
    }
}
