package com.portos.core.recovery;

import com.portos.core.events.EventBus;
import com.portos.core.events.PortosEvent;
import com.portos.core.metrics.PortosMetrics;
import com.portos.core.scheduler.ManualWorkScheduler;
import com.portos.core.scheduler.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RecoveryStrategySelectorTest {

    private MutableClock clock;
    private ManualWorkScheduler scheduler;
    private RecoveryAttemptLedger ledger;
    private EventBus eventBus;
    private SimpleMeterRegistry registry;
    private ErrorClassifier classifier;
    private RecoveryStrategySelector selector;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
        scheduler = new ManualWorkScheduler(clock);
        var properties = new RecoveryProperties();
        ledger = new RecoveryAttemptLedger(properties, clock);
        eventBus = new EventBus();
        registry = new SimpleMeterRegistry();
        classifier = new ErrorClassifier(properties);
        selector = new RecoveryStrategySelector(ledger, properties, eventBus, scheduler, clock,
                new PortosMetrics(registry));
    }

    private ErrorAnalysis analyze(String message) {
        return classifier.analyze(message, null, RecoveryContext.EMPTY);
    }

    @Nested
    @DisplayName("select")
    class SelectTests {

        @Test
        @DisplayName("unknown errors back off 5s, 10s, 20s and then need a human")
        void backoffThenManual() {
            var analysis = analyze("Something strange happened");
            var request = RecoveryRequest.forTask("task-1");

            List<Long> delays = new ArrayList<>();
            for (int i = 0; i < 3; i++) {
                var decision = selector.select(analysis, request);
                assertEquals(RecoveryStrategy.RETRY, decision.strategy());
                assertEquals(i + 1, decision.attemptNumber());
                delays.add(decision.params().delayMs());
                ledger.record("task-1", RecoveryStrategy.RETRY, false);
            }
            assertEquals(List.of(5_000L, 10_000L, 20_000L), delays);

            var exhausted = selector.select(analysis, request);
            assertEquals(RecoveryStrategy.MANUAL, exhausted.strategy());
            assertTrue(exhausted.params().requiresApproval());
            assertEquals("Maximum recovery attempts exceeded", exhausted.reason());
            assertEquals(3, exhausted.maxAttempts());
        }

        @Test
        @DisplayName("rate limits defer from the 60s cooldown")
        void rateLimitDefers() {
            var analysis = analyze("429 Too Many Requests");
            var request = RecoveryRequest.forAgent("agent-1");

            var first = selector.select(analysis, request);
            assertEquals(RecoveryStrategy.DEFER, first.strategy());
            assertEquals(60_000L, first.params().delayMs());

            ledger.record("agent-1", RecoveryStrategy.DEFER, true);
            assertEquals(120_000L, selector.select(analysis, request).params().delayMs());
        }

        @Test
        @DisplayName("backoff is capped at five minutes")
        void backoffIsCapped() {
            assertEquals(300_000L, selector.backoffDelay(300_000, 1));
            assertEquals(300_000L, selector.backoffDelay(5_000, 100));
            assertEquals(160_000L, selector.backoffDelay(5_000, 5));
        }

        @Test
        @DisplayName("context length decomposes into 2000-character chunks")
        void contextLengthDecomposes() {
            var decision = selector.select(analyze("maximum context length is 8192 tokens"), RecoveryRequest.forTask("t"));
            assertEquals(RecoveryStrategy.DECOMPOSE, decision.strategy());
            assertTrue(decision.params().suggestSmallerContext());
            assertEquals(2000, decision.params().maxChunkSize());
        }

        @Test
        @DisplayName("auth failures switch to a fallback provider")
        void authUsesFallback() {
            var decision = selector.select(analyze("401 Unauthorized"), RecoveryRequest.forTask("t"));
            assertEquals(RecoveryStrategy.FALLBACK, decision.strategy());
            assertTrue(decision.params().useFallbackProvider());
        }

        @Test
        @DisplayName("requests without task or agent share the global key")
        void globalKey() {
            var request = new RecoveryRequest(null, null, 1);
            assertEquals(RecoveryAttemptLedger.GLOBAL_KEY, request.ledgerKey());
            ledger.record(RecoveryAttemptLedger.GLOBAL_KEY, RecoveryStrategy.RETRY, false);

            assertEquals(2, selector.select(analyze("weird"), request).attemptNumber());
        }
    }

    @Nested
    @DisplayName("execute")
    class ExecuteTests {

        @Test
        @DisplayName("retry sleeps for the delay, records the attempt and publishes an event")
        void retrySleepsAndRecords() throws InterruptedException {
            List<PortosEvent> events = new ArrayList<>();
            eventBus.subscribe(RecoveryStrategySelector.RECOVERY_EXECUTED, events::add);
            var analysis = analyze("ETIMEDOUT");
            var request = RecoveryRequest.forTask("task-1");

            var outcome = selector.execute(selector.select(analysis, request), request, analysis);

            assertTrue(outcome.success());
            assertEquals(RecoveryAction.RETRY_NOW, outcome.action());
            assertEquals(List.of(Duration.ofMillis(5_000)), scheduler.sleeps());
            assertEquals(1, ledger.getCount("task-1"));
            assertEquals(1, events.size());
            assertEquals("task-1", events.get(0).payload().get("taskId"));
            assertEquals("retry", events.get(0).payload().get("strategy"));
            assertEquals(Boolean.TRUE, events.get(0).payload().get("success"));
        }

        @Test
        @DisplayName("event payload keeps task and agent apart from the ledger key")
        void eventSeparatesTaskAndAgent() throws InterruptedException {
            List<PortosEvent> events = new ArrayList<>();
            eventBus.subscribe(RecoveryStrategySelector.RECOVERY_EXECUTED, events::add);
            var analysis = analyze("content filter triggered");
            var request = RecoveryRequest.forAgent("agent-7");

            selector.execute(selector.select(analysis, request), request, analysis);

            var payload = events.get(0).payload();
            assertNull(payload.get("taskId"));
            assertEquals("agent-7", payload.get("agentId"));
            assertEquals("agent-7", payload.get("ledgerKey"));
            assertEquals("agent-7", events.get(0).subjectId());
        }

        @Test
        @DisplayName("defer asks the caller to reschedule")
        void deferReschedules() throws InterruptedException {
            var analysis = analyze("rate limit");
            var request = RecoveryRequest.forTask("task-1");

            var outcome = selector.execute(selector.select(analysis, request), request, analysis);

            assertEquals(RecoveryAction.RESCHEDULE, outcome.action());
            assertEquals(60_000L, outcome.rescheduleAfterMs());
            assertTrue(scheduler.sleeps().isEmpty());
        }

        @Test
        @DisplayName("investigate carries the original error")
        void investigateCarriesError() throws InterruptedException {
            var analysis = analyze("blocked by safety system");
            var outcome = selector.execute(RecoveryStrategy.INVESTIGATE, RecoveryRequest.forTask("t"),
                    analysis, RecoveryParams.NONE);

            assertEquals(RecoveryAction.CREATE_INVESTIGATION, outcome.action());
            assertEquals("blocked by safety system", outcome.originalError());
        }

        @Test
        @DisplayName("manual never succeeds")
        void manualFails() throws InterruptedException {
            var outcome = selector.execute(RecoveryStrategy.MANUAL, RecoveryRequest.forTask("t"),
                    analyze("weird"), null);

            assertFalse(outcome.success());
            assertTrue(outcome.requiresManualIntervention());
        }

        @Test
        @DisplayName("three executions for a task exhaust it")
        void executionsExhaustTask() throws InterruptedException {
            var analysis = analyze("model overloaded");
            var request = RecoveryRequest.forTask("task-9");
            for (int i = 0; i < 3; i++) {
                selector.execute(selector.select(analysis, request), request, analysis);
            }

            assertEquals(RecoveryStrategy.MANUAL, selector.select(analysis, request).strategy());
        }
    }

    @Nested
    @DisplayName("stats and history")
    class StatsTests {

        @Test
        @DisplayName("aggregates by strategy and category")
        void aggregates() throws InterruptedException {
            var network = analyze("network unreachable");
            selector.execute(RecoveryStrategy.RETRY, RecoveryRequest.forTask("a"), network, RecoveryParams.delay(10));
            selector.execute(RecoveryStrategy.MANUAL, RecoveryRequest.forTask("b"), analyze("weird"), null);

            var stats = selector.getStats();
            assertEquals(2, stats.totalAttempts());
            assertEquals(0.5, stats.successRate(), 1e-9);
            assertEquals(1, stats.byStrategy().get(RecoveryStrategy.RETRY));
            assertEquals(1, stats.byCategory().get(ErrorCategory.NETWORK));
            assertEquals(2, stats.activeAttemptKeys());
            assertEquals("50.0%", stats.successRatePercent());

            var failures = selector.getHistory(new RecoveryHistoryQuery(null, false, null));
            assertEquals(1, failures.size());
            assertEquals(RecoveryStrategy.MANUAL, failures.get(0).strategy());

            var newestFirst = selector.getHistory(RecoveryHistoryQuery.all());
            assertEquals("b", newestFirst.get(0).ledgerKey());

            var counter = registry.find("portos.recovery.executions")
                    .tag("strategy", "retry").tag("category", "network").counter();
            assertNotNull(counter);
            assertEquals(1.0, counter.count());
        }
    }
}
