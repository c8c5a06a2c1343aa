package com.portos.core.provider;

/**
 * A configured AI provider, as far as fallback routing needs to know it.
 */
public record ProviderDefinition(
    String id,
    String name,
    String type,
    boolean enabled,
    String fallbackProvider,
    String defaultModel
) {}
