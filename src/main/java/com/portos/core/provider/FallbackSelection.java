package com.portos.core.provider;

public record FallbackSelection(ProviderDefinition provider, FallbackSource source) {}
