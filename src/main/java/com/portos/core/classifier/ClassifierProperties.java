package com.portos.core.classifier;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "portos.classifier")
public class ClassifierProperties {

    private int maxLinesChanged = AutoFixThresholds.DEFAULT_MAX_LINES;
    private List<String> allowedCategories = new ArrayList<>();

    public int getMaxLinesChanged() { return maxLinesChanged; }
    public void setMaxLinesChanged(int maxLinesChanged) { this.maxLinesChanged = maxLinesChanged; }
    public List<String> getAllowedCategories() { return allowedCategories; }
    public void setAllowedCategories(List<String> allowedCategories) { this.allowedCategories = allowedCategories; }

    public AutoFixThresholds toThresholds() {
        return new AutoFixThresholds(maxLinesChanged, allowedCategories);
    }
}
