package com.portos.core.recovery;

import com.portos.core.scheduler.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RecoveryAttemptLedgerTest {

    private MutableClock clock;
    private RecoveryAttemptLedger ledger;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
        ledger = new RecoveryAttemptLedger(new RecoveryProperties(), clock);
    }

    @Test
    @DisplayName("key prefers task id, then agent id, then global")
    void keyFor() {
        assertEquals("task-1", RecoveryAttemptLedger.keyFor("task-1", "agent-1"));
        assertEquals("agent-1", RecoveryAttemptLedger.keyFor(null, "agent-1"));
        assertEquals("agent-1", RecoveryAttemptLedger.keyFor(" ", "agent-1"));
        assertEquals(RecoveryAttemptLedger.GLOBAL_KEY, RecoveryAttemptLedger.keyFor(null, null));
    }

    @Test
    @DisplayName("counts attempts per key")
    void countsAttempts() {
        ledger.record("task-1", RecoveryStrategy.RETRY, true);
        ledger.record("task-1", RecoveryStrategy.RETRY, false);
        ledger.record("task-2", RecoveryStrategy.DEFER, true);

        assertEquals(2, ledger.getCount("task-1"));
        assertEquals(1, ledger.getCount("task-2"));
        assertEquals(0, ledger.getCount("task-3"));
        assertEquals(2, ledger.activeKeys());
    }

    @Test
    @DisplayName("entries older than an hour are dropped on read")
    void staleEntriesExpire() {
        ledger.record("task-1", RecoveryStrategy.RETRY, false);
        ledger.record("task-1", RecoveryStrategy.RETRY, false);

        clock.advance(Duration.ofMinutes(59));
        assertEquals(2, ledger.getCount("task-1"));

        clock.advance(Duration.ofMinutes(2));
        assertEquals(0, ledger.getCount("task-1"));
        assertEquals(0, ledger.activeKeys());
    }

    @Test
    @DisplayName("recording on a stale entry starts over")
    void recordOnStaleEntryStartsOver() {
        ledger.record("task-1", RecoveryStrategy.RETRY, false);
        ledger.record("task-1", RecoveryStrategy.RETRY, false);
        clock.advance(Duration.ofHours(2));

        ledger.record("task-1", RecoveryStrategy.RETRY, null);

        assertEquals(1, ledger.getCount("task-1"));
    }

    @Test
    @DisplayName("keeps only the five most recent attempts in the record history")
    void historyIsCapped() {
        for (int i = 0; i < 7; i++) {
            ledger.record("task-1", RecoveryStrategy.RETRY, i % 2 == 0);
        }

        var record = ledger.getRecord("task-1").orElseThrow();
        assertEquals(7, record.count());
        assertEquals(5, record.history().size());
        assertEquals(clock.instant(), record.lastAttempt());
    }

    @Test
    @DisplayName("completeLast fills in the outcome of the latest attempt")
    void completeLast() {
        ledger.record("task-1", RecoveryStrategy.DEFER, null);
        ledger.completeLast("task-1", true);

        var last = ledger.getRecord("task-1").orElseThrow().history().get(0);
        assertEquals(Boolean.TRUE, last.success());
        assertEquals(RecoveryStrategy.DEFER, last.strategy());
    }

    @Test
    @DisplayName("reset and clearAll remove entries")
    void resetAndClear() {
        ledger.record("task-1", RecoveryStrategy.RETRY, true);
        ledger.record("task-2", RecoveryStrategy.RETRY, true);

        ledger.reset("task-1");
        assertEquals(0, ledger.getCount("task-1"));
        assertTrue(ledger.getRecord("task-1").isEmpty());
        assertEquals(1, ledger.activeKeys());

        ledger.clearAll();
        assertEquals(0, ledger.activeKeys());
    }
}
