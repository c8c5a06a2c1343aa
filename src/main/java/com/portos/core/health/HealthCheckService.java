package com.portos.core.health;

import com.portos.core.execution.ExecutionStateMachine;
import com.portos.core.model.ExecutionStats;
import com.portos.core.provider.ProviderStatusRegistry;
import com.portos.core.provider.ProviderStatusStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final ProviderStatusRegistry providerRegistry;
    private final ExecutionStateMachine stateMachine;
    private final ProviderStatusStore statusStore;

    public HealthCheckService(
            @Autowired(required = false) ProviderStatusRegistry providerRegistry,
            @Autowired(required = false) ExecutionStateMachine stateMachine,
            @Autowired(required = false) ProviderStatusStore statusStore) {
        this.providerRegistry = providerRegistry;
        this.stateMachine = stateMachine;
        this.statusStore = statusStore;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkProviders());
        results.add(checkExecutions());
        results.add(checkStatusStore());
        return results;
    }

    private HealthStatus checkProviders() {
        if (providerRegistry == null) {
            return HealthStatus.down("providers", "Provider registry not available");
        }
        var tracked = providerRegistry.getAll().providers();
        Map<String, String> unavailable = new LinkedHashMap<>();
        tracked.forEach((id, status) -> {
            if (!status.available()) {
                unavailable.put(id, providerRegistry.timeUntilRecovery(id).orElse("unknown"));
            }
        });
        if (unavailable.isEmpty()) {
            return HealthStatus.up("providers", "All " + tracked.size() + " tracked providers available", Map.of());
        }
        return new HealthStatus("providers", HealthStatus.Status.DEGRADED,
                unavailable.size() + " provider(s) unavailable: " + String.join(", ", unavailable.keySet()),
                unavailable);
    }

    private HealthStatus checkExecutions() {
        if (stateMachine == null) {
            return HealthStatus.down("executions", "Execution state machine not available");
        }
        ExecutionStats stats = stateMachine.getStats();
        return HealthStatus.up("executions",
                stats.activeExecutions() + " active, " + stats.historySize() + " archived",
                Map.of("activeExecutions", String.valueOf(stats.activeExecutions()),
                        "recentSuccessRate", String.valueOf(stats.recentSuccessRate())));
    }

    private HealthStatus checkStatusStore() {
        if (statusStore == null) {
            return HealthStatus.down("status-store", "No provider status store configured");
        }
        try {
            if (statusStore.isWritable()) {
                return HealthStatus.up("status-store", "Writable at " + statusStore.location(), Map.of());
            }
            return HealthStatus.down("status-store", "Not writable: " + statusStore.location());
        } catch (SecurityException e) {
            log.warn("Status store health check failed: {}", e.getMessage());
            return HealthStatus.down("status-store", "Status store error: " + e.getMessage());
        }
    }
}
