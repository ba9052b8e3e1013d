package com.qamigrate.compiler.extraction;

import java.util.Map;

/**
 * One action or assertion extracted from a test statement.
 * Target fields are {@code null} when resolution found nothing.
 */
public record ExtractedStep(
    StepKind kind,
    String name,
    String targetNameId,
    String targetNodeId,
    Map<String, String> parameters
) {
    public ExtractedStep {
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
    }

    public boolean hasTarget() {
        return targetNameId != null;
    }
}
