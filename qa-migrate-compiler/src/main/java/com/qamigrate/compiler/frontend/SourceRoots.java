package com.qamigrate.compiler.frontend;

import java.nio.file.Path;
import java.util.List;

/**
 * Result of source root resolution.
 */
public record SourceRoots(
    String buildTool,   // maven, gradle or manifest
    List<Path> roots    // absolute; test sources first
) {
    public SourceRoots {
        roots = List.copyOf(roots);
    }
}
