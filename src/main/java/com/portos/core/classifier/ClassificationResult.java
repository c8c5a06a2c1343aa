package com.portos.core.classifier;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * @param maxLines effective line limit, present only when the task was auto-approved
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ClassificationResult(
    boolean autoApprove,
    String category,
    String reason,
    Confidence confidence,
    Integer maxLines
) {

    static ClassificationResult requiresApproval(String category, String reason, Confidence confidence) {
        return new ClassificationResult(false, category, reason, confidence, null);
    }

    static ClassificationResult approved(String category, String reason, int maxLines) {
        return new ClassificationResult(true, category, reason, Confidence.HIGH, maxLines);
    }
}
