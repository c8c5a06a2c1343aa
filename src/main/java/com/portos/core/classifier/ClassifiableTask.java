package com.portos.core.classifier;

import java.util.Map;

/**
 * The parts of a task the classifier looks at.
 *
 * @param description free-text task description
 * @param metadata    task metadata; {@code reviewType} and {@code autoGenerated} are read
 */
public record ClassifiableTask(String description, Map<String, Object> metadata) {

    public ClassifiableTask {
        description = description != null ? description : "";
        metadata = metadata != null ? metadata : Map.of();
    }

    public static ClassifiableTask of(String description) {
        return new ClassifiableTask(description, Map.of());
    }
}
