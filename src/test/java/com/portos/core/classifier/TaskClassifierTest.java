package com.portos.core.classifier;

import com.portos.core.metrics.PortosMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TaskClassifierTest {

    private static final AutoFixThresholds TYPO_ONLY = new AutoFixThresholds(50, List.of("typo-fix"));

    private SimpleMeterRegistry meterRegistry;
    private ClassifierProperties properties;
    private TaskClassifier classifier;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        properties = new ClassifierProperties();
        classifier = new TaskClassifier(properties, new PortosMetrics(meterRegistry));
    }

    private ClassificationResult classify(String description, int lines, AutoFixThresholds thresholds) {
        return classifier.classify(ClassifiableTask.of(description), new ChangeAnalysis(lines), thresholds);
    }

    @Nested
    @DisplayName("require-approval rules")
    class RequireApprovalTests {

        @ParameterizedTest
        @CsvSource(delimiter = '|', value = {
                "refactor auth token handling        | security     | Security-related changes require manual review",
                "add index to users schema           | database     | Database changes require manual review",
                "breaking change to the orders route | api-change   | API changes may affect consumers",
                "upgrade lodash version              | dependency   | Dependency changes require verification",
                "restructure the worker pool         | architecture | Architectural changes need approval",
                "update .env defaults                | config       | Configuration changes require review",
                "publish the nightly build           | deployment   | Deployment changes need approval"
        })
        void matchesCategory(String description, String category, String reason) {
            var result = classify(description, 1, TYPO_ONLY);

            assertFalse(result.autoApprove());
            assertEquals(category, result.category());
            assertEquals(reason, result.reason());
            assertEquals(Confidence.HIGH, result.confidence());
            assertNull(result.maxLines());
        }

        @Test
        @DisplayName("require-approval wins over an auto-approve match")
        void approvalWins() {
            var result = classify("fix typo in password prompt", 1, TYPO_ONLY);

            assertFalse(result.autoApprove());
            assertEquals("security", result.category());
        }
    }

    @Nested
    @DisplayName("auto-approve rules")
    class AutoApproveTests {

        @Test
        @DisplayName("small change in an allowed category is approved")
        void approved() {
            var result = classify("fix typo in comment", 5, TYPO_ONLY);

            assertTrue(result.autoApprove());
            assertEquals("typo-fix", result.category());
            assertEquals("Fixing typos and comments", result.reason());
            assertEquals(Confidence.HIGH, result.confidence());
            assertEquals(20, result.maxLines());
        }

        @Test
        @DisplayName("category not switched on needs approval")
        void categoryNotAllowed() {
            var result = classify("fix typo in comment", 5, new AutoFixThresholds(50, List.of("formatting")));

            assertFalse(result.autoApprove());
            assertEquals("typo-fix", result.category());
            assertEquals("Category 'typo-fix' not in auto-approve list", result.reason());
            assertEquals(Confidence.MEDIUM, result.confidence());
        }

        @Test
        @DisplayName("rule line limit applies")
        void overRuleLimit() {
            var result = classify("fix typo in comment", 25, TYPO_ONLY);

            assertFalse(result.autoApprove());
            assertEquals("Changes exceed auto-approve limit (25 > 20 lines)", result.reason());
            assertEquals(Confidence.MEDIUM, result.confidence());
        }

        @Test
        @DisplayName("global line limit caps a generous rule")
        void globalLimitCaps() {
            var thresholds = new AutoFixThresholds(40, List.of("formatting"));

            assertEquals(40, classify("run prettier on utils", 40, thresholds).maxLines());
            assertEquals("Changes exceed auto-approve limit (41 > 40 lines)",
                    classify("run prettier on utils", 41, thresholds).reason());
        }

        @Test
        @DisplayName("matching ignores case")
        void caseInsensitive() {
            var result = classify("Fix Lint warnings", 3, new AutoFixThresholds(0, List.of("formatting")));

            assertTrue(result.autoApprove());
            assertEquals("formatting", result.category());
        }

        @Test
        @DisplayName("configured thresholds are used by default")
        void configuredThresholds() {
            properties.setAllowedCategories(List.of("dead-code"));

            var result = classifier.classify(ClassifiableTask.of("remove unused variables"), new ChangeAnalysis(12));

            assertTrue(result.autoApprove());
            assertEquals(30, result.maxLines());
        }

        @Test
        @DisplayName("nothing allowed by default")
        void defaultsAllowNothing() {
            var result = classifier.classify(ClassifiableTask.of("remove unused variables"), null);

            assertFalse(result.autoApprove());
            assertEquals(Confidence.MEDIUM, result.confidence());
        }
    }

    @Test
    @DisplayName("unmatched tasks need approval with low confidence")
    void unknownTask() {
        var result = classify("implement pagination widget", 3, TYPO_ONLY);

        assertFalse(result.autoApprove());
        assertEquals("unknown", result.category());
        assertEquals("Task does not match auto-approve patterns", result.reason());
        assertEquals(Confidence.LOW, result.confidence());
    }

    @Test
    @DisplayName("decisions are counted")
    void recordsMetrics() {
        classify("fix typo in comment", 5, TYPO_ONLY);
        classify("fix typo in comment", 5, TYPO_ONLY);

        var counter = meterRegistry.find("portos.classifier.decisions")
                .tag("category", "typo-fix").tag("auto_approve", "true").counter();
        assertNotNull(counter);
        assertEquals(2.0, counter.count());
    }

    @Test
    @DisplayName("review findings are classified one by one")
    void reviewFindings() {
        var findings = List.of(
                new ReviewFinding("Fix typo", null, 3),
                new ReviewFinding("Secrets", "Rotate secret key loading", 10),
                new ReviewFinding("Fix typo in comment", "Fix typo in comment", null));

        var classified = classifier.classifyReviewFindings(findings, TYPO_ONLY);

        assertEquals(3, classified.size());
        assertTrue(classified.get(0).classification().autoApprove());
        assertEquals("security", classified.get(1).classification().category());
        assertTrue(classified.get(2).classification().autoApprove());
        assertSame(findings.get(1), classified.get(1).finding());
    }

    @Test
    void exposesRuleTables() {
        var rules = classifier.getClassificationRules();

        assertEquals(6, rules.autoApprove().size());
        assertEquals(7, rules.requireApproval().size());
        assertEquals("security", rules.requireApproval().get(0).category());
        assertEquals("formatting", rules.autoApprove().get(0).category());
    }

    @Nested
    @DisplayName("idle review detection")
    class IdleReviewTests {

        @Test
        void byDescriptionMarker() {
            assertTrue(classifier.isIdleReviewTask(ClassifiableTask.of("[Idle Review] src/server.js")));
            assertTrue(classifier.isIdleReviewTask(ClassifiableTask.of("Autonomous code review of utils")));
        }

        @Test
        void byMetadata() {
            assertTrue(classifier.isIdleReviewTask(new ClassifiableTask("scan", Map.of("reviewType", "idle"))));
            assertTrue(classifier.isIdleReviewTask(new ClassifiableTask("scan", Map.of("autoGenerated", true))));
        }

        @Test
        void ordinaryTask() {
            assertFalse(classifier.isIdleReviewTask(new ClassifiableTask("review PR 12", Map.of("autoGenerated", false))));
        }
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "Refactor entire module across codebase | HIGH",
            "Add provider integration               | HIGH",
            "Fix typo in README                     | LOW",
            "Rename helper                          | LOW",
            "Add caching layer                      | MEDIUM"
    })
    void estimatesComplexity(String description, ComplexityLevel expected) {
        assertEquals(expected, classifier.estimateComplexity(ClassifiableTask.of(description)).level());
    }
}
