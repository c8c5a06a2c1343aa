package com.portos.dispatch.cli;

import com.portos.core.health.HealthCheckService;
import com.portos.core.health.HealthStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: portos health
 * <p>
 * Runs every health check and exits with 1 unless all components are UP.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check orchestrator health")
@Component
public class HealthCommand implements Callable<Integer> {

    private final HealthCheckService healthCheckService;

    @Option(names = {"-v", "--verbose"}, description = "Show per-component metadata")
    private boolean verbose;

    public HealthCommand(@Autowired(required = false) HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        if (healthCheckService == null) {
            ConsoleOutput.error("Health check service not available");
            return 1;
        }

        List<HealthStatus> checks = healthCheckService.checkAll();
        Map<HealthStatus.Status, Integer> tally = new EnumMap<>(HealthStatus.Status.class);
        for (HealthStatus check : checks) {
            tally.merge(check.status(), 1, Integer::sum);
            ConsoleOutput.status(check.status(), check.component() + ": " + check.detail());
            if (verbose && check.metadata() != null) {
                check.metadata().forEach(ConsoleOutput::field);
            }
        }

        System.out.println(ConsoleOutput.RULE);
        int degraded = tally.getOrDefault(HealthStatus.Status.DEGRADED, 0);
        int down = tally.getOrDefault(HealthStatus.Status.DOWN, 0);
        if (degraded == 0 && down == 0) {
            ConsoleOutput.success("Overall: all systems operational (" + checks.size() + " checks)");
            return 0;
        }
        ConsoleOutput.error("Overall: " + degraded + " degraded, " + down + " down");
        return 1;
    }
}
