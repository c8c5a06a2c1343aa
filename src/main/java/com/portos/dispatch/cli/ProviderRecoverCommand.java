package com.portos.dispatch.cli;

import com.portos.core.provider.ProviderStatusRegistry;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: portos providers recover &lt;id&gt;
 */
@Command(name = "recover", mixinStandardHelpOptions = true, description = "Mark a provider available again")
@Component
public class ProviderRecoverCommand implements Runnable {

    @Parameters(index = "0", description = "Provider id")
    private String providerId;

    private final ProviderStatusRegistry registry;

    public ProviderRecoverCommand(ProviderStatusRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void run() {
        var status = registry.markAvailable(providerId);
        ConsoleOutput.success(providerId + ": " + status.message());
    }
}
