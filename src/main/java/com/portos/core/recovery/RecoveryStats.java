package com.portos.core.recovery;

import java.util.Locale;
import java.util.Map;

/**
 * Aggregate view over the recovery history.
 *
 * @param totalAttempts    entries in the bounded history
 * @param recentAttempts   entries in the stats window
 * @param successRate      share of successful recoveries in the window, 0..1 (0 when empty)
 * @param byStrategy       window counts per strategy
 * @param byCategory       window counts per error category
 * @param activeAttemptKeys ledger keys currently tracked
 */
public record RecoveryStats(
    int totalAttempts,
    int recentAttempts,
    double successRate,
    Map<RecoveryStrategy, Integer> byStrategy,
    Map<ErrorCategory, Integer> byCategory,
    int activeAttemptKeys
) {

    public String successRatePercent() {
        return String.format(Locale.ROOT, "%.1f%%", successRate * 100);
    }
}
