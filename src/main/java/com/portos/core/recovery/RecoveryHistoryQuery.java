package com.portos.core.recovery;

/**
 * Filter for {@link RecoveryStrategySelector#getHistory}. Null fields do not filter.
 */
public record RecoveryHistoryQuery(RecoveryStrategy strategy, Boolean success, Integer limit) {

    public static final int DEFAULT_LIMIT = 50;

    public static RecoveryHistoryQuery all() {
        return new RecoveryHistoryQuery(null, null, null);
    }

    public int effectiveLimit() {
        return limit != null && limit > 0 ? limit : DEFAULT_LIMIT;
    }
}
