package com.portos.core.classifier;

import java.util.List;

/**
 * Read-only view of the classifier's rule tables, in evaluation order.
 */
public record ClassificationRules(List<AutoApproveRule> autoApprove, List<ApprovalRule> requireApproval) {}
