package com.portos.core.classifier;

/**
 * Size of the change a task produced or is expected to produce.
 */
public record ChangeAnalysis(int linesChanged) {

    public static final ChangeAnalysis NONE = new ChangeAnalysis(0);
}
