package com.portos.core.recovery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Counts recovery attempts per ledger key (task id, else agent id, else {@value #GLOBAL_KEY}).
 * <p>
 * An entry whose last attempt is older than the reset window is stale: reading it deletes it
 * and yields zero, so a task that has been dormant for a while starts over.
 */
@Service
public class RecoveryAttemptLedger {

    private static final Logger log = LoggerFactory.getLogger(RecoveryAttemptLedger.class);

    public static final String GLOBAL_KEY = "global";
    static final int MAX_RECORD_HISTORY = 5;

    private final ConcurrentHashMap<String, AttemptRecord> records = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration resetAfter;

    public RecoveryAttemptLedger(RecoveryProperties properties, Clock clock) {
        this.clock = clock;
        this.resetAfter = Duration.ofMillis(properties.getAttemptResetMs());
    }

    /**
     * Derives the attempt-counting identity: taskId, else agentId, else {@value #GLOBAL_KEY}.
     */
    public static String keyFor(String taskId, String agentId) {
        if (taskId != null && !taskId.isBlank()) return taskId;
        if (agentId != null && !agentId.isBlank()) return agentId;
        return GLOBAL_KEY;
    }

    public int getCount(String key) {
        AttemptRecord record = records.get(key);
        if (record == null) {
            return 0;
        }
        if (isStale(record)) {
            records.remove(key, record);
            log.debug("Recovery attempts for {} expired after {}", key, resetAfter);
            return 0;
        }
        return record.count;
    }

    /**
     * Records one attempt. {@code success} may be null while the attempt is still in flight;
     * fill it in later with {@link #completeLast}.
     */
    public void record(String key, RecoveryStrategy strategy, Boolean success) {
        Instant now = clock.instant();
        records.compute(key, (k, existing) -> {
            AttemptRecord record = existing == null || isStale(existing) ? new AttemptRecord() : existing;
            record.count++;
            record.lastAttempt = now;
            record.history.add(new AttemptHistoryEntry(now, strategy, success));
            while (record.history.size() > MAX_RECORD_HISTORY) {
                record.history.remove(0);
            }
            return record;
        });
    }

    /**
     * Sets the outcome of the most recent attempt for {@code key}.
     */
    public void completeLast(String key, boolean success) {
        records.computeIfPresent(key, (k, record) -> {
            int last = record.history.size() - 1;
            if (last >= 0) {
                AttemptHistoryEntry entry = record.history.get(last);
                record.history.set(last, new AttemptHistoryEntry(entry.timestamp(), entry.strategy(), success));
            }
            return record;
        });
    }

    public Optional<RecoveryAttemptRecord> getRecord(String key) {
        if (getCount(key) == 0) {
            return Optional.empty();
        }
        var snapshot = new AtomicReference<RecoveryAttemptRecord>();
        records.computeIfPresent(key, (k, record) -> {
            snapshot.set(new RecoveryAttemptRecord(k, record.count, record.lastAttempt, List.copyOf(record.history)));
            return record;
        });
        return Optional.ofNullable(snapshot.get());
    }

    public void reset(String key) {
        if (records.remove(key) != null) {
            log.debug("Recovery attempts reset for {}", key);
        }
    }

    public void clearAll() {
        records.clear();
    }

    /** Number of keys currently holding an attempt record. */
    public int activeKeys() {
        return records.size();
    }

    private boolean isStale(AttemptRecord record) {
        return record.lastAttempt != null
                && Duration.between(record.lastAttempt, clock.instant()).compareTo(resetAfter) > 0;
    }

    private static final class AttemptRecord {
        private volatile int count;
        private volatile Instant lastAttempt;
        private final List<AttemptHistoryEntry> history = new ArrayList<>();
    }

    public record AttemptHistoryEntry(Instant timestamp, RecoveryStrategy strategy, Boolean success) {}

    public record RecoveryAttemptRecord(
        String key,
        int count,
        Instant lastAttempt,
        List<AttemptHistoryEntry> history
    ) {}
}
