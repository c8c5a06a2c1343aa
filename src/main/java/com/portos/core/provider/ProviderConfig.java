package com.portos.core.provider;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
public class ProviderConfig {

    @Bean
    public ProviderStatusStore providerStatusStore(ProviderProperties properties) {
        return new ProviderStatusStore(Path.of(properties.getStatusFile()));
    }
}
