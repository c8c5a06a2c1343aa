package com.portos.core.classifier;

/**
 * One finding from an idle code review.
 */
public record ReviewFinding(String title, String description, Integer estimatedLines) {}
