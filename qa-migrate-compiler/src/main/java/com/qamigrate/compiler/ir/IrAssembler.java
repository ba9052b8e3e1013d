package com.qamigrate.compiler.ir;

import com.qamigrate.compiler.extraction.ExtractedSuite;
import com.qamigrate.compiler.extraction.ExtractedTarget;
import com.qamigrate.compiler.extraction.ExtractedTest;
import com.qamigrate.compiler.extraction.ExtractionResult;
import com.qamigrate.compiler.ir.IrModel.EnvironmentIr;
import com.qamigrate.compiler.ir.IrModel.IrDocument;
import com.qamigrate.compiler.ir.IrModel.ProjectIr;
import com.qamigrate.compiler.ir.IrModel.SuiteIr;
import com.qamigrate.compiler.ir.IrModel.TargetIr;
import com.qamigrate.compiler.ir.IrModel.TestDataIr;
import com.qamigrate.compiler.ir.IrModel.TestIr;
import com.qamigrate.compiler.ir.builder.EnvironmentIrBuilder;
import com.qamigrate.compiler.ir.builder.ProjectIrBuilder;
import com.qamigrate.compiler.ir.builder.SuiteIrBuilder;
import com.qamigrate.compiler.ir.builder.TargetsIrBuilder;
import com.qamigrate.compiler.ir.builder.TestDataIrBuilder;
import com.qamigrate.compiler.ir.builder.TestIrBuilder;
import com.qamigrate.compiler.manifest.CompilerManifest;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Merges the per-file extraction results of a project into one {@link IrDocument}.
 *
 * Targets are built before any test so that a step can link to a target declared in a
 * file processed after the test's own file. Input order is preserved everywhere; nothing
 * is sorted or deduplicated except the target name map, where the first name wins.
 */
public class IrAssembler {

    private final ProjectIrBuilder projectBuilder;
    private final SuiteIrBuilder suiteBuilder = new SuiteIrBuilder();
    private final TargetsIrBuilder targetsBuilder = new TargetsIrBuilder();
    private final TestIrBuilder testBuilder = new TestIrBuilder();
    private final EnvironmentIrBuilder environmentBuilder = new EnvironmentIrBuilder();
    private final TestDataIrBuilder dataBuilder = new TestDataIrBuilder();

    public IrAssembler(ProjectIrBuilder projectBuilder) {
        this.projectBuilder = projectBuilder;
    }

    public IrDocument assemble(List<ExtractionResult> results, CompilerManifest manifest) {
        List<ExtractedTest> allTests = new ArrayList<>();
        List<ExtractedSuite> allSuites = new ArrayList<>();
        List<ExtractedTarget> allTargets = new ArrayList<>();
        List<String> environmentNames = new ArrayList<>();
        for (ExtractionResult result : results) {
            allTests.addAll(result.tests());
            allSuites.addAll(result.suites());
            allTargets.addAll(result.targets());
            environmentNames.addAll(result.environments());
        }
        for (CompilerManifest.EnvironmentConfig env : manifest.getEnvironments()) {
            environmentNames.add(env.getName());
        }

        ProjectIr project = projectBuilder.build(
            manifest.getProjectName(),
            manifest.getSourceLanguage(),
            allTests.stream().map(ExtractedTest::name).toList(),
            allSuites.stream().map(ExtractedSuite::name).toList(),
            environmentNames,
            manifest.getCompilerVersion()
        );

        // --- Phase 1: suites and targets ---
        List<SuiteIr> suites = new ArrayList<>();
        Map<String, String> suiteIdsByName = new LinkedHashMap<>();
        for (ExtractedSuite suite : allSuites) {
            SuiteIr built = suiteBuilder.build(suite);
            suites.add(built);
            suiteIdsByName.putIfAbsent(suite.name(), built.id());
        }

        List<TargetIr> targets = targetsBuilder.build(allTargets);
        Map<String, String> targetIdsByName = new LinkedHashMap<>();
        for (TargetIr target : targets) {
            if (targetIdsByName.putIfAbsent(target.name(), target.id()) != null) {
                System.err.println("[qa-migrate] WARNING: duplicate target name, first declaration kept: "
                        + target.name() + " (" + target.sourceFile() + ")");
            }
        }

        // --- Phase 2: tests against the complete target map ---
        Set<String> dataSetNames = new LinkedHashSet<>();
        for (CompilerManifest.DataSetConfig dataSet : manifest.getDataSets()) {
            dataSetNames.add(dataSet.getName());
        }
        String defaultEnvironmentId = manifest.getDefaultEnvironment() != null
                ? IrIds.environment(manifest.getDefaultEnvironment())
                : null;

        List<TestIr> tests = new ArrayList<>();
        for (ExtractedTest test : allTests) {
            String suiteId = test.suiteName() != null ? suiteIdsByName.get(test.suiteName()) : null;
            String environmentId = test.environmentId() != null ? test.environmentId() : defaultEnvironmentId;
            tests.add(testBuilder.build(test, suiteId, environmentId, dataIdOf(test, dataSetNames), targetIdsByName));
        }

        List<EnvironmentIr> environments = manifest.getEnvironments().stream()
                .map(environmentBuilder::build)
                .toList();
        List<TestDataIr> data = manifest.getDataSets().stream()
                .map(dataBuilder::build)
                .toList();

        return new IrDocument(project, tests, suites, targets, data, environments);
    }

    private static String dataIdOf(ExtractedTest test, Set<String> dataSetNames) {
        if (test.dataSource() == null) {
            return null;
        }
        if (!dataSetNames.contains(test.dataSource())) {
            System.err.println("[qa-migrate] WARNING: test " + test.name()
                    + " uses undeclared data set '" + test.dataSource() + "', left unlinked");
            return null;
        }
        return IrIds.data(test.dataSource());
    }
}
