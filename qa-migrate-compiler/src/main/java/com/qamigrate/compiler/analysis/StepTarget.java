package com.qamigrate.compiler.analysis;

/**
 * Result of resolving a statement to the UI target it acts on.
 *
 * @param targetName inferred or declared target name, e.g. {@code emailInput}
 * @param nodeId     id of the node that produced the match (locator initializer or call site)
 */
public record StepTarget(String targetName, String nodeId) {}
