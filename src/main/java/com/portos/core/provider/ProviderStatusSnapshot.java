package com.portos.core.provider;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * The persisted form of the provider registry: {@code {providers: {id -> status}, lastUpdated}}.
 * Entries with a null id or status are dropped; a missing entry means the provider is available.
 */
public record ProviderStatusSnapshot(Map<String, ProviderStatus> providers, Instant lastUpdated) {

    public ProviderStatusSnapshot {
        Map<String, ProviderStatus> copy = new TreeMap<>();
        if (providers != null) {
            providers.forEach((id, status) -> {
                if (id != null && status != null) {
                    copy.put(id, status);
                }
            });
        }
        providers = Collections.unmodifiableMap(copy);
    }

    public static ProviderStatusSnapshot empty() {
        return new ProviderStatusSnapshot(Map.of(), null);
    }
}
