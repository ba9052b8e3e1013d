package com.qamigrate.compiler.extraction;

import java.util.List;

/**
 * Everything extracted from one source file.
 * Environments are never derived from source and stay empty.
 */
public record ExtractionResult(
    String projectName,
    String sourceLanguage,
    String filePath,
    List<ExtractedTest> tests,
    List<ExtractedSuite> suites,
    List<ExtractedTarget> targets,
    List<String> environments
) {
    public ExtractionResult {
        tests = List.copyOf(tests);
        suites = List.copyOf(suites);
        targets = List.copyOf(targets);
        environments = List.copyOf(environments);
    }
}
