package com.portos.core.classifier;

import com.portos.core.metrics.PortosMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Decides whether a task's change may be applied without human review.
 * <p>
 * Require-approval rules are checked first and always win. The first matching auto-approve
 * rule then decides, subject to the category being switched on and the change staying under
 * both the rule's and the global line limit.
 */
@Service
public class TaskClassifier {

    private static final Logger log = LoggerFactory.getLogger(TaskClassifier.class);

    private static final List<ApprovalRule> REQUIRE_APPROVAL = List.of(
            new ApprovalRule("security",
                    ci("security|auth|password|token|credential|secret|key|permission"),
                    "Security-related changes require manual review"),
            new ApprovalRule("database",
                    ci("database|migration|schema|sql|query|prisma"),
                    "Database changes require manual review"),
            new ApprovalRule("api-change",
                    ci("api.*change|endpoint.*change|route.*change|breaking.*change"),
                    "API changes may affect consumers"),
            new ApprovalRule("dependency",
                    ci("package\\.json|dependency|upgrade.*version|npm.*install"),
                    "Dependency changes require verification"),
            new ApprovalRule("architecture",
                    ci("architect|restructure|rewrite|major.*refactor"),
                    "Architectural changes need approval"),
            new ApprovalRule("config",
                    ci("config.*change|environment|\\.env|ecosystem\\.config"),
                    "Configuration changes require review"),
            new ApprovalRule("deployment",
                    ci("deploy|production|release|publish"),
                    "Deployment changes need approval"));

    private static final List<AutoApproveRule> AUTO_APPROVE = List.of(
            new AutoApproveRule("formatting",
                    List.of(ci("format|lint|prettier|eslint|style")), 100,
                    "Code formatting and linting fixes"),
            new AutoApproveRule("dry-violations",
                    List.of(ci("dry|duplicate|extract.*function|refactor.*common")), 50,
                    "Removing code duplication"),
            new AutoApproveRule("dead-code",
                    List.of(ci("dead.*code|unused|remove.*unused")), 30,
                    "Removing unused code"),
            new AutoApproveRule("typo-fix",
                    List.of(ci("typo|spelling|grammar|comment")), 20,
                    "Fixing typos and comments"),
            new AutoApproveRule("import-cleanup",
                    List.of(ci("import|require|module.*cleanup")), 30,
                    "Cleaning up imports"),
            new AutoApproveRule("documentation",
                    List.of(ci("doc|readme|jsdoc|add.*comment")), 100,
                    "Documentation updates"));

    private static final List<Pattern> HIGH_COMPLEXITY = List.of(
            ci("multiple.*file"), ci("across.*codebase"), ci("refactor.*entire"),
            ci("restructure"), ci("migration"), ci("integration"));

    private static final List<Pattern> LOW_COMPLEXITY = List.of(
            ci("single.*file"), ci("one.*line"), ci("simple"),
            ci("typo"), ci("comment"), ci("rename"));

    private final ClassifierProperties properties;
    private final PortosMetrics metrics;

    public TaskClassifier(ClassifierProperties properties, PortosMetrics metrics) {
        this.properties = properties;
        this.metrics = metrics;
    }

    /**
     * Classify using the configured thresholds.
     */
    public ClassificationResult classify(ClassifiableTask task, ChangeAnalysis analysis) {
        return classify(task, analysis, properties.toThresholds());
    }

    public ClassificationResult classify(ClassifiableTask task, ChangeAnalysis analysis,
                                         AutoFixThresholds thresholds) {
        String description = task.description().toLowerCase(Locale.ROOT);
        int linesChanged = analysis != null ? analysis.linesChanged() : 0;
        AutoFixThresholds limits = thresholds != null ? thresholds : AutoFixThresholds.DEFAULT;

        ClassificationResult result = evaluate(description, linesChanged, limits);
        metrics.recordClassification(result.category(), result.autoApprove());
        log.debug("Classified task as {} (autoApprove={}, confidence={}): {}",
                result.category(), result.autoApprove(), result.confidence().value(), result.reason());
        return result;
    }

    private static ClassificationResult evaluate(String description, int linesChanged, AutoFixThresholds limits) {
        for (ApprovalRule rule : REQUIRE_APPROVAL) {
            if (rule.matches(description)) {
                return ClassificationResult.requiresApproval(rule.category(), rule.reason(), Confidence.HIGH);
            }
        }

        for (AutoApproveRule rule : AUTO_APPROVE) {
            if (!rule.matches(description)) {
                continue;
            }
            if (!limits.allowedCategories().contains(rule.category())) {
                return ClassificationResult.requiresApproval(rule.category(),
                        "Category '" + rule.category() + "' not in auto-approve list", Confidence.MEDIUM);
            }
            int maxLines = Math.min(rule.maxLines(), limits.maxLinesChanged());
            if (linesChanged > maxLines) {
                return ClassificationResult.requiresApproval(rule.category(),
                        "Changes exceed auto-approve limit (" + linesChanged + " > " + maxLines + " lines)",
                        Confidence.MEDIUM);
            }
            return ClassificationResult.approved(rule.category(), rule.description(), maxLines);
        }

        return ClassificationResult.requiresApproval("unknown",
                "Task does not match auto-approve patterns", Confidence.LOW);
    }

    /**
     * Classify each finding of an idle review, using its description (or title when there is
     * none) and its estimated size.
     */
    public List<ClassifiedFinding> classifyReviewFindings(List<ReviewFinding> findings, AutoFixThresholds thresholds) {
        return findings.stream()
                .map(finding -> {
                    String text = finding.description() != null ? finding.description() : finding.title();
                    int lines = finding.estimatedLines() != null ? finding.estimatedLines() : 0;
                    return new ClassifiedFinding(finding,
                            classify(ClassifiableTask.of(text), new ChangeAnalysis(lines), thresholds));
                })
                .toList();
    }

    public ClassificationRules getClassificationRules() {
        return new ClassificationRules(AUTO_APPROVE, REQUIRE_APPROVAL);
    }

    public boolean isIdleReviewTask(ClassifiableTask task) {
        String description = task.description().toLowerCase(Locale.ROOT);
        return description.contains("[idle review]")
                || description.contains("autonomous code review")
                || "idle".equals(task.metadata().get("reviewType"))
                || Boolean.TRUE.equals(task.metadata().get("autoGenerated"));
    }

    public ComplexityEstimate estimateComplexity(ClassifiableTask task) {
        String description = task.description();
        if (HIGH_COMPLEXITY.stream().anyMatch(p -> p.matcher(description).find())) {
            return new ComplexityEstimate(ComplexityLevel.HIGH, "Task involves multiple files or significant changes");
        }
        if (LOW_COMPLEXITY.stream().anyMatch(p -> p.matcher(description).find())) {
            return new ComplexityEstimate(ComplexityLevel.LOW, "Task is simple and localized");
        }
        return new ComplexityEstimate(ComplexityLevel.MEDIUM, "Standard complexity task");
    }

    private static Pattern ci(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }
}
