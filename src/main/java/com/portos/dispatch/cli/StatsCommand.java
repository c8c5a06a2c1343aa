package com.portos.dispatch.cli;

import com.portos.core.execution.ExecutionStateMachine;
import com.portos.core.recovery.RecoveryStrategySelector;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.Locale;

/**
 * CLI command: portos stats
 */
@Command(name = "stats", mixinStandardHelpOptions = true, description = "Show execution and recovery statistics")
@Component
public class StatsCommand implements Runnable {

    private final ExecutionStateMachine stateMachine;
    private final RecoveryStrategySelector strategySelector;

    public StatsCommand(ExecutionStateMachine stateMachine, RecoveryStrategySelector strategySelector) {
        this.stateMachine = stateMachine;
        this.strategySelector = strategySelector;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        var executions = stateMachine.getStats();
        ConsoleOutput.info("Executions");
        ConsoleOutput.field("Active", executions.activeExecutions());
        executions.byState().forEach((state, count) -> ConsoleOutput.field("  " + state.value(), count));
        ConsoleOutput.field("Archived", executions.historySize());
        ConsoleOutput.field("Success rate", String.format(Locale.ROOT, "%.1f%%", executions.recentSuccessRate() * 100));
        ConsoleOutput.field("Avg duration", ConsoleOutput.formatDuration(executions.avgDurationMs()));

        var recovery = strategySelector.getStats();
        System.out.println(ConsoleOutput.RULE);
        ConsoleOutput.info("Recovery");
        ConsoleOutput.field("Attempts", recovery.totalAttempts() + " (" + recovery.recentAttempts() + " recent)");
        ConsoleOutput.field("Success rate", recovery.successRatePercent());
        recovery.byStrategy().forEach((strategy, count) -> ConsoleOutput.field("  " + strategy.value(), count));
        ConsoleOutput.field("Tracked keys", recovery.activeAttemptKeys());
    }
}
