package com.portos.core.provider;

import com.portos.core.events.EventBus;
import com.portos.core.events.PortosEvent;
import com.portos.core.metrics.PortosMetrics;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks which AI providers are currently usable and picks fallbacks for those that are not.
 * <p>
 * Every status change is written to the {@link ProviderStatusStore} before the mutating call
 * returns and published as a {@value #STATUS_CHANGED} event. A provider with no recorded
 * status is available.
 */
@Service
public class ProviderStatusRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProviderStatusRegistry.class);

    public static final String STATUS_CHANGED = "provider:status:changed";

    static final Duration DEFAULT_USAGE_LIMIT_WAIT = Duration.ofHours(24);
    static final Duration RATE_LIMIT_WAIT = Duration.ofMinutes(5);
    static final String USAGE_LIMIT_MESSAGE = "Usage limit exceeded";
    static final String RATE_LIMIT_MESSAGE = "Rate limit exceeded - temporary";

    private final ProviderStatusStore store;
    private final ProviderProperties properties;
    private final EventBus eventBus;
    private final Clock clock;
    private final PortosMetrics metrics;

    private final ConcurrentHashMap<String, ProviderStatus> statuses = new ConcurrentHashMap<>();
    private volatile Instant lastUpdated;

    public ProviderStatusRegistry(ProviderStatusStore store,
                                  ProviderProperties properties,
                                  EventBus eventBus,
                                  Clock clock,
                                  PortosMetrics metrics) {
        this.store = store;
        this.properties = properties;
        this.eventBus = eventBus;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Loads the persisted snapshot and marks providers whose recovery time has passed as
     * available again.
     */
    @PostConstruct
    public synchronized void init() {
        ProviderStatusSnapshot snapshot = store.load();
        statuses.clear();
        statuses.putAll(snapshot.providers());
        lastUpdated = snapshot.lastUpdated();

        Instant now = clock.instant();
        List<String> recovered = new ArrayList<>();
        statuses.forEach((id, status) -> {
            if (status.recoveryDue(now)) {
                recovered.add(id);
            }
        });
        for (String id : recovered) {
            statuses.put(id, ProviderStatus.ok(now));
        }
        if (!recovered.isEmpty()) {
            log.info("Providers past their recovery time marked available: {}", recovered);
            persist();
        }
        log.info("Provider status registry initialized ({} tracked, store {})", statuses.size(), store.location());
    }

    public ProviderStatus getStatus(String providerId) {
        ProviderStatus status = statuses.get(providerId);
        return status != null ? status : ProviderStatus.ok(clock.instant());
    }

    public ProviderStatusSnapshot getAll() {
        return new ProviderStatusSnapshot(new HashMap<>(statuses), lastUpdated);
    }

    public boolean isAvailable(String providerId) {
        return getStatus(providerId).available();
    }

    /**
     * Mark a provider as out of quota.
     *
     * @param message  provider's own message, defaults to {@value #USAGE_LIMIT_MESSAGE}
     * @param waitTime provider's wait time text; unparseable or missing means 24 hours
     */
    public synchronized ProviderStatus markUsageLimit(String providerId, String message, String waitTime) {
        Instant now = clock.instant();
        Duration wait = WaitTimeParser.parse(waitTime).orElse(DEFAULT_USAGE_LIMIT_WAIT);
        ProviderStatus status = ProviderStatus.unavailable(
                ProviderStatusReason.USAGE_LIMIT,
                message != null && !message.isBlank() ? message : USAGE_LIMIT_MESSAGE,
                waitTime,
                now,
                now.plus(wait),
                previousFailures(providerId) + 1);
        log.warn("Provider {} unavailable: usage limit (retry after {})", providerId,
                waitTime != null ? waitTime : "24h");
        return apply(providerId, status, "usage-limit");
    }

    public synchronized ProviderStatus markRateLimited(String providerId) {
        Instant now = clock.instant();
        ProviderStatus status = ProviderStatus.unavailable(
                ProviderStatusReason.RATE_LIMIT,
                RATE_LIMIT_MESSAGE,
                null,
                now,
                now.plus(RATE_LIMIT_WAIT),
                previousFailures(providerId) + 1);
        log.warn("Provider {} rate limited for {}", providerId, RATE_LIMIT_WAIT);
        return apply(providerId, status, "rate-limit");
    }

    public synchronized ProviderStatus markAvailable(String providerId) {
        ProviderStatus status = ProviderStatus.ok(clock.instant());
        log.info("Provider {} marked available", providerId);
        return apply(providerId, status, "recovered");
    }

    /**
     * Fallback for {@code primaryId} among the configured provider definitions.
     */
    public Optional<FallbackSelection> getFallbackProvider(String primaryId, String taskFallbackId) {
        return getFallbackProvider(primaryId, properties.toDefinitions(), taskFallbackId);
    }

    /**
     * Pick a fallback for {@code primaryId}. Tried in order: the task's own fallback, the
     * primary provider's configured fallback, then the system priority list. A candidate must
     * be known, enabled and available; the primary itself is never returned from the
     * priority list.
     */
    public Optional<FallbackSelection> getFallbackProvider(String primaryId,
                                                           Map<String, ProviderDefinition> providers,
                                                           String taskFallbackId) {
        if (taskFallbackId != null && !taskFallbackId.equals(primaryId)) {
            ProviderDefinition candidate = providers.get(taskFallbackId);
            if (usable(candidate)) {
                return Optional.of(new FallbackSelection(candidate, FallbackSource.TASK));
            }
        }

        ProviderDefinition primary = providers.get(primaryId);
        if (primary != null && primary.fallbackProvider() != null) {
            ProviderDefinition candidate = providers.get(primary.fallbackProvider());
            if (usable(candidate)) {
                return Optional.of(new FallbackSelection(candidate, FallbackSource.PROVIDER));
            }
        }

        for (String id : properties.getFallbackPriority()) {
            if (id.equals(primaryId)) {
                continue;
            }
            ProviderDefinition candidate = providers.get(id);
            if (usable(candidate)) {
                return Optional.of(new FallbackSelection(candidate, FallbackSource.SYSTEM));
            }
        }

        log.debug("No fallback available for provider {}", primaryId);
        return Optional.empty();
    }

    /**
     * Human-readable time until an unavailable provider is expected back, e.g. "1d 2h 3m".
     *
     * @return empty when the provider is available or has no recovery estimate
     */
    public Optional<String> timeUntilRecovery(String providerId) {
        ProviderStatus status = getStatus(providerId);
        if (status.available() || status.estimatedRecovery() == null) {
            return Optional.empty();
        }
        return Optional.of(formatRemaining(Duration.between(clock.instant(), status.estimatedRecovery())));
    }

    static String formatRemaining(Duration remaining) {
        if (remaining.isNegative() || remaining.isZero()) {
            return "any moment";
        }
        List<String> parts = new ArrayList<>(3);
        long days = remaining.toDays();
        int hours = remaining.toHoursPart();
        int minutes = remaining.toMinutesPart();
        if (days > 0) parts.add(days + "d");
        if (hours > 0) parts.add(hours + "h");
        if (minutes > 0) parts.add(minutes + "m");
        return parts.isEmpty() ? "< 1m" : String.join(" ", parts);
    }

    private boolean usable(ProviderDefinition candidate) {
        return candidate != null && candidate.enabled() && isAvailable(candidate.id());
    }

    private int previousFailures(String providerId) {
        ProviderStatus previous = statuses.get(providerId);
        return previous != null ? previous.failureCount() : 0;
    }

    private ProviderStatus apply(String providerId, ProviderStatus status, String changeType) {
        statuses.put(providerId, status);
        persist();
        metrics.recordProviderStatusChange(changeType);

        Map<String, Object> payload = new HashMap<>();
        payload.put("providerId", providerId);
        payload.put("status", status);
        payload.put("type", changeType);
        eventBus.publish(new PortosEvent(STATUS_CHANGED, providerId, payload, clock.instant()));
        return status;
    }

    private void persist() {
        lastUpdated = clock.instant();
        try {
            store.save(new ProviderStatusSnapshot(new HashMap<>(statuses), lastUpdated));
        } catch (ProviderStatusPersistenceException e) {
            log.error("Provider status kept in memory only: {}", e.getMessage(), e);
        }
    }
}
