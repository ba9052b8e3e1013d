package com.qamigrate.compiler.ir.builder;

import com.qamigrate.compiler.ir.IrIds;
import com.qamigrate.compiler.ir.IrModel;
import com.qamigrate.compiler.ir.IrModel.ProjectIr;
import com.qamigrate.compiler.ir.IrModel.ProjectMetadata;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Builds the top-level project record. {@code generated_at} is the only value that
 * depends on the clock; pass a fixed clock for reproducible output.
 */
public class ProjectIrBuilder {

    static final String PROJECT_VERSION = "1.0.0";

    private final Clock clock;

    public ProjectIrBuilder() {
        this(Clock.systemUTC());
    }

    public ProjectIrBuilder(Clock clock) {
        this.clock = clock;
    }

    public ProjectIr build(
            String projectName,
            String sourceLanguage,
            List<String> tests,
            List<String> suites,
            List<String> environments,
            String compilerVersion
    ) {
        ProjectMetadata metadata = new ProjectMetadata(
            projectName,
            PROJECT_VERSION,
            Instant.now(clock).toString(),
            sourceLanguage,
            compilerVersion
        );
        return new ProjectIr(IrIds.project(projectName), IrModel.SCHEMA_VERSION, metadata,
                environments, suites, tests);
    }
}
