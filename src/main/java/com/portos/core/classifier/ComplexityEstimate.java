package com.portos.core.classifier;

public record ComplexityEstimate(ComplexityLevel level, String reason) {}
