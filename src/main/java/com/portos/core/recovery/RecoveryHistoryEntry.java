package com.portos.core.recovery;

import java.time.Instant;

public record RecoveryHistoryEntry(
    Instant timestamp,
    String ledgerKey,
    ErrorCategory errorCategory,
    RecoveryStrategy strategy,
    boolean success,
    long durationMs
) {}
