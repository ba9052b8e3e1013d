package com.qamigrate.compiler.extraction;

import java.util.List;

/**
 * A test method and the steps found in its body.
 *
 * @param environmentId always {@code null} at extraction time; environments are bound later
 * @param dataSource    name of the data set feeding the test ({@code dataProvider}, {@code @MethodSource})
 * @param suiteName     enclosing class
 */
public record ExtractedTest(
    String name,
    List<ExtractedStep> steps,
    List<String> tags,
    String environmentId,
    String dataSource,
    String suiteName,
    String description
) {
    public ExtractedTest {
        steps = List.copyOf(steps);
        tags = List.copyOf(tags);
    }
}
