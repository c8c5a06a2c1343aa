package com.portos.core.classifier;

import java.util.List;

/**
 * Limits for auto-approval.
 *
 * @param maxLinesChanged   global line limit, applied on top of each rule's own; non-positive means 50
 * @param allowedCategories auto-approve categories that are switched on; empty allows none
 */
public record AutoFixThresholds(int maxLinesChanged, List<String> allowedCategories) {

    public static final int DEFAULT_MAX_LINES = 50;
    public static final AutoFixThresholds DEFAULT = new AutoFixThresholds(DEFAULT_MAX_LINES, List.of());

    public AutoFixThresholds {
        maxLinesChanged = maxLinesChanged > 0 ? maxLinesChanged : DEFAULT_MAX_LINES;
        allowedCategories = allowedCategories != null ? List.copyOf(allowedCategories) : List.of();
    }
}
