package com.portos.core.recovery;

import com.portos.core.events.EventBus;
import com.portos.core.events.PortosEvent;
import com.portos.core.metrics.PortosMetrics;
import com.portos.core.scheduler.WorkScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Picks a recovery strategy for a classified failure and carries it out.
 * <p>
 * Attempt counting is delegated to the {@link RecoveryAttemptLedger}; once a ledger key has
 * used up its attempts every further failure is routed to {@link RecoveryStrategy#MANUAL}
 * regardless of what the error category suggests.
 */
@Service
public class RecoveryStrategySelector {

    private static final Logger log = LoggerFactory.getLogger(RecoveryStrategySelector.class);

    public static final String RECOVERY_EXECUTED = "recovery:executed";
    static final int DECOMPOSE_CHUNK_SIZE = 2000;
    static final long DEFAULT_RESCHEDULE_MS = 60_000;

    private final RecoveryAttemptLedger ledger;
    private final RecoveryProperties properties;
    private final EventBus eventBus;
    private final WorkScheduler scheduler;
    private final Clock clock;
    private final PortosMetrics metrics;

    /** Newest first. */
    private final Deque<RecoveryHistoryEntry> history = new ArrayDeque<>();

    public RecoveryStrategySelector(RecoveryAttemptLedger ledger,
                                    RecoveryProperties properties,
                                    EventBus eventBus,
                                    WorkScheduler scheduler,
                                    Clock clock,
                                    PortosMetrics metrics) {
        this.ledger = ledger;
        this.properties = properties;
        this.eventBus = eventBus;
        this.scheduler = scheduler;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Select the strategy for {@code analysis}.
     *
     * @param analysis classified error
     * @param request  identity used to look up prior attempts
     * @return the decision; {@link RecoveryStrategy#MANUAL} once attempts are exhausted
     */
    public RecoveryDecision select(ErrorAnalysis analysis, RecoveryRequest request) {
        int maxAttempts = properties.getMaxAttempts();
        int attempts = ledger.getCount(request.ledgerKey());

        if (attempts >= maxAttempts) {
            log.info("Recovery attempts exhausted for {} ({}/{}), requiring manual intervention",
                    request.ledgerKey(), attempts, maxAttempts);
            return new RecoveryDecision(RecoveryStrategy.MANUAL, "Maximum recovery attempts exceeded",
                    RecoveryParams.approvalRequired(), attempts + 1, maxAttempts);
        }

        RecoveryStrategy strategy = analysis.primaryStrategy();
        RecoveryParams params = switch (strategy) {
            case RETRY, DEFER -> RecoveryParams.delay(backoffDelay(analysis.cooldownMs(), attempts));
            case ESCALATE -> RecoveryParams.heavyModel();
            case DECOMPOSE -> RecoveryParams.smallerContext(DECOMPOSE_CHUNK_SIZE);
            case FALLBACK -> RecoveryParams.fallbackProvider();
            case INVESTIGATE, SKIP, MANUAL -> RecoveryParams.NONE;
        };

        log.debug("Selected {} for {} (category={}, attempt {}/{})",
                strategy.value(), request.ledgerKey(), analysis.category().value(), attempts + 1, maxAttempts);
        return new RecoveryDecision(strategy, "Error category: " + analysis.category().value(),
                params, attempts + 1, maxAttempts);
    }

    /**
     * Exponential backoff: {@code base * 2^attempts}, capped. A zero cooldown backs off from
     * the configured default base instead.
     */
    public long backoffDelay(long cooldownMs, int attempts) {
        long base = cooldownMs > 0 ? cooldownMs : properties.getDefaultBackoffMs();
        long cap = properties.getMaxBackoffMs();
        if (attempts >= 62 || base > (cap >> attempts)) {
            return cap;
        }
        return Math.min(base << attempts, cap);
    }

    public RecoveryOutcome execute(RecoveryDecision decision, RecoveryRequest request, ErrorAnalysis analysis)
            throws InterruptedException {
        return execute(decision.strategy(), request, analysis, decision.params());
    }

    /**
     * Carry out a strategy. Retry blocks for the backoff delay; every other strategy returns an
     * instruction immediately. The attempt is always recorded in the ledger and the recovery
     * history, and a {@value #RECOVERY_EXECUTED} event is published.
     */
    public RecoveryOutcome execute(RecoveryStrategy strategy, RecoveryRequest request,
                                   ErrorAnalysis analysis, RecoveryParams params) throws InterruptedException {
        Instant startedAt = clock.instant();
        String key = request.ledgerKey();
        RecoveryParams p = params != null ? params : RecoveryParams.NONE;

        ledger.record(key, strategy, null);

        RecoveryOutcome outcome;
        try {
            outcome = switch (strategy) {
                case RETRY -> {
                    long delay = p.delayMs() != null ? p.delayMs() : 0;
                    if (delay > 0) {
                        scheduler.sleep(Duration.ofMillis(delay));
                    }
                    yield RecoveryOutcome.of(strategy, RecoveryAction.RETRY_NOW,
                            "Retry after " + delay + "ms delay");
                }
                case DEFER -> {
                    long delay = p.delayMs() != null ? p.delayMs() : DEFAULT_RESCHEDULE_MS;
                    yield new RecoveryOutcome(true, strategy, RecoveryAction.RESCHEDULE,
                            "Task rescheduled for " + delay + "ms later", delay, null, null);
                }
                case FALLBACK -> RecoveryOutcome.of(strategy, RecoveryAction.USE_FALLBACK,
                        "Switching to fallback provider");
                case ESCALATE -> RecoveryOutcome.of(strategy, RecoveryAction.ESCALATE_MODEL,
                        "Escalating to heavy model");
                case DECOMPOSE -> {
                    int chunk = p.maxChunkSize() != null ? p.maxChunkSize() : DECOMPOSE_CHUNK_SIZE;
                    yield new RecoveryOutcome(true, strategy, RecoveryAction.DECOMPOSE_TASK,
                            "Breaking task into smaller chunks", null, chunk, null);
                }
                case INVESTIGATE -> new RecoveryOutcome(true, strategy, RecoveryAction.CREATE_INVESTIGATION,
                        "Creating investigation task", null, null, analysis != null ? analysis.message() : null);
                case SKIP -> RecoveryOutcome.of(strategy, RecoveryAction.SKIP_TASK,
                        "Task skipped due to unrecoverable error");
                case MANUAL -> RecoveryOutcome.manualIntervention("Manual intervention required");
            };
        } catch (InterruptedException e) {
            ledger.completeLast(key, false);
            recordHistory(startedAt, key, analysis, strategy, false);
            throw e;
        }

        ledger.completeLast(key, outcome.success());
        recordHistory(startedAt, key, analysis, strategy, outcome.success());

        Map<String, Object> payload = new HashMap<>();
        payload.put("taskId", request.taskId());
        payload.put("agentId", request.agentId());
        payload.put("ledgerKey", key);
        payload.put("strategy", strategy.value());
        payload.put("success", outcome.success());
        payload.put("action", outcome.action().value());
        eventBus.publish(new PortosEvent(RECOVERY_EXECUTED, key, payload, clock.instant()));

        log.info("Recovery {} for {} -> {} ({})", strategy.value(), key, outcome.action().value(), outcome.message());
        return outcome;
    }

    public RecoveryStats getStats() {
        List<RecoveryHistoryEntry> recent;
        int total;
        synchronized (history) {
            total = history.size();
            recent = history.stream().limit(properties.getStatsWindow()).toList();
        }

        Map<RecoveryStrategy, Integer> byStrategy = new EnumMap<>(RecoveryStrategy.class);
        Map<ErrorCategory, Integer> byCategory = new EnumMap<>(ErrorCategory.class);
        int successes = 0;
        for (RecoveryHistoryEntry entry : recent) {
            byStrategy.merge(entry.strategy(), 1, Integer::sum);
            byCategory.merge(entry.errorCategory(), 1, Integer::sum);
            if (entry.success()) successes++;
        }
        double rate = recent.isEmpty() ? 0.0 : (double) successes / recent.size();
        return new RecoveryStats(total, recent.size(), rate, byStrategy, byCategory, ledger.activeKeys());
    }

    /**
     * Recovery history, newest first.
     */
    public List<RecoveryHistoryEntry> getHistory(RecoveryHistoryQuery query) {
        RecoveryHistoryQuery q = query != null ? query : RecoveryHistoryQuery.all();
        List<RecoveryHistoryEntry> snapshot;
        synchronized (history) {
            snapshot = new ArrayList<>(history);
        }
        return snapshot.stream()
                .filter(e -> q.strategy() == null || e.strategy() == q.strategy())
                .filter(e -> q.success() == null || e.success() == q.success())
                .limit(q.effectiveLimit())
                .toList();
    }

    private void recordHistory(Instant startedAt, String key, ErrorAnalysis analysis,
                               RecoveryStrategy strategy, boolean success) {
        ErrorCategory category = analysis != null ? analysis.category() : ErrorCategory.UNKNOWN;
        Instant now = clock.instant();
        var entry = new RecoveryHistoryEntry(now, key, category, strategy, success,
                Duration.between(startedAt, now).toMillis());
        synchronized (history) {
            history.addFirst(entry);
            while (history.size() > properties.getHistorySize()) {
                history.removeLast();
            }
        }
        metrics.recordRecovery(strategy.value(), category.value(), success);
    }
}
