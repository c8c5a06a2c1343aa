package com.portos.core.classifier;

public record ClassifiedFinding(ReviewFinding finding, ClassificationResult classification) {}
