package com.portos.core.classifier;

import java.util.List;
import java.util.regex.Pattern;

/**
 * A change category that may be applied without review when allowed and small enough.
 *
 * @param maxLines largest change the category ever auto-approves
 */
public record AutoApproveRule(String category, List<Pattern> patterns, int maxLines, String description) {

    boolean matches(String description) {
        for (Pattern pattern : patterns) {
            if (pattern.matcher(description).find()) {
                return true;
            }
        }
        return false;
    }
}
