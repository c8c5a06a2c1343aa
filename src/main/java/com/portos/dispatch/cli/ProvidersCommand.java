package com.portos.dispatch.cli;

import com.portos.core.provider.ProviderStatus;
import com.portos.core.provider.ProviderStatusRegistry;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.Map;

/**
 * CLI command: portos providers
 * <p>
 * Lists every provider with a recorded status and the time until unavailable ones are
 * expected back.
 */
@Command(name = "providers", mixinStandardHelpOptions = true,
        description = "Show provider availability",
        subcommands = ProviderRecoverCommand.class)
@Component
public class ProvidersCommand implements Runnable {

    private final ProviderStatusRegistry registry;

    public ProvidersCommand(ProviderStatusRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        Map<String, ProviderStatus> providers = registry.getAll().providers();
        if (providers.isEmpty()) {
            ConsoleOutput.info("No provider status recorded; all providers available.");
            return;
        }

        System.out.printf("  %-18s %-10s %-14s %-10s %s%n", "PROVIDER", "STATUS", "REASON", "FAILURES", "RECOVERY");
        System.out.println("  " + "-".repeat(70));
        providers.forEach((id, status) -> System.out.printf("  %-18s %-10s %-14s %-10d %s%n",
                id,
                status.available() ? "available" : "down",
                status.reason().value(),
                status.failureCount(),
                registry.timeUntilRecovery(id).orElse("-")));
    }
}
