package com.portos.core.classifier;

import java.util.regex.Pattern;

/**
 * A change category that always needs a human to sign off.
 */
public record ApprovalRule(String category, Pattern pattern, String reason) {

    boolean matches(String description) {
        return pattern.matcher(description).find();
    }
}
