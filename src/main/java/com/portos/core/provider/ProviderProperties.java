package com.portos.core.provider;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Binds {@code portos.providers.*}.
 *
 * <pre>
 * portos:
 *   providers:
 *     status-file: data/provider-status.json
 *     definitions:
 *       claude-code:
 *         name: Claude Code
 *         fallback-provider: codex
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "portos.providers")
public class ProviderProperties {

    private String statusFile = "data/provider-status.json";
    private List<String> fallbackPriority = new ArrayList<>(
            List.of("claude-code", "codex", "lmstudio", "local-lm-studio", "ollama", "gemini-cli"));
    private Map<String, Definition> definitions = new LinkedHashMap<>();

    public String getStatusFile() { return statusFile; }
    public void setStatusFile(String statusFile) { this.statusFile = statusFile; }
    public List<String> getFallbackPriority() { return fallbackPriority; }
    public void setFallbackPriority(List<String> fallbackPriority) { this.fallbackPriority = fallbackPriority; }
    public Map<String, Definition> getDefinitions() { return definitions; }
    public void setDefinitions(Map<String, Definition> definitions) { this.definitions = definitions; }

    /**
     * Configured definitions keyed by provider id.
     */
    public Map<String, ProviderDefinition> toDefinitions() {
        Map<String, ProviderDefinition> result = new LinkedHashMap<>();
        if (definitions != null) {
            definitions.forEach((id, d) -> result.put(id, new ProviderDefinition(
                    id, d.getName() != null ? d.getName() : id, d.getType(), d.isEnabled(),
                    d.getFallbackProvider(), d.getDefaultModel())));
        }
        return result;
    }

    public static class Definition {
        private String name;
        private String type = "cli";
        private boolean enabled = true;
        private String fallbackProvider;
        private String defaultModel;

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public String getType() { return type; }
        public void setType(String type) { this.type = type; }
        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public String getFallbackProvider() { return fallbackProvider; }
        public void setFallbackProvider(String fallbackProvider) { this.fallbackProvider = fallbackProvider; }
        public String getDefaultModel() { return defaultModel; }
        public void setDefaultModel(String defaultModel) { this.defaultModel = defaultModel; }
    }
}
