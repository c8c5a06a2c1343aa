package com.portos.dispatch.cli;

import com.portos.core.classifier.AutoFixThresholds;
import com.portos.core.classifier.ChangeAnalysis;
import com.portos.core.classifier.ClassifiableTask;
import com.portos.core.classifier.ClassifierProperties;
import com.portos.core.classifier.TaskClassifier;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;

/**
 * CLI command: portos classify &lt;description&gt;
 * <p>
 * Shows whether a task would be auto-approved and how complex it looks.
 */
@Command(name = "classify", mixinStandardHelpOptions = true, description = "Classify a task for auto-approval")
@Component
public class ClassifyCommand implements Runnable {

    @Parameters(arity = "1..*", description = "Task description")
    private List<String> words;

    @Option(names = {"--lines", "-l"}, description = "Lines changed", defaultValue = "0")
    private int lines;

    @Option(names = {"--allow", "-a"}, split = ",",
            description = "Auto-approve categories to allow (defaults to portos.classifier.allowed-categories)")
    private List<String> allowed;

    private final TaskClassifier classifier;
    private final ClassifierProperties properties;

    public ClassifyCommand(TaskClassifier classifier, ClassifierProperties properties) {
        this.classifier = classifier;
        this.properties = properties;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        var task = ClassifiableTask.of(String.join(" ", words));
        var thresholds = allowed != null
                ? new AutoFixThresholds(properties.getMaxLinesChanged(), allowed)
                : properties.toThresholds();
        var result = classifier.classify(task, new ChangeAnalysis(lines), thresholds);
        var complexity = classifier.estimateComplexity(task);

        if (result.autoApprove()) {
            ConsoleOutput.success("Auto-approve: " + result.reason());
        } else {
            ConsoleOutput.warn("Needs approval: " + result.reason());
        }
        ConsoleOutput.field("Category", result.category());
        ConsoleOutput.field("Confidence", result.confidence().value());
        if (result.maxLines() != null) {
            ConsoleOutput.field("Max lines", result.maxLines());
        }
        ConsoleOutput.field("Complexity", complexity.level().value() + " (" + complexity.reason() + ")");
    }
}
