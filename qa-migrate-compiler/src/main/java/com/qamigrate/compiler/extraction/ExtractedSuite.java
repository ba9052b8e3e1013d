package com.qamigrate.compiler.extraction;

import java.util.List;

/**
 * A class-level suite. {@code parentName} is the enclosing class for nested suites.
 */
public record ExtractedSuite(
    String name,
    List<String> tests,
    String parentName,
    String description,
    List<String> tags
) {
    public ExtractedSuite {
        tests = List.copyOf(tests);
        tags = List.copyOf(tags);
    }
}
