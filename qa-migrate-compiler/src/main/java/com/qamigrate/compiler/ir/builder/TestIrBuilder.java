package com.qamigrate.compiler.ir.builder;

import com.qamigrate.compiler.extraction.ExtractedStep;
import com.qamigrate.compiler.extraction.ExtractedTest;
import com.qamigrate.compiler.ir.IrIds;
import com.qamigrate.compiler.ir.IrModel.StepIr;
import com.qamigrate.compiler.ir.IrModel.TestIr;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds a test and its steps.
 *
 * A step's {@code targetId} is looked up by its target name in the project-wide
 * {@code target name -> target id} map, so the map must be complete before any test is
 * built. Names missing from the map leave {@code targetId} null; the raw
 * {@code targetNameId}/{@code targetNodeId} are always kept.
 */
public class TestIrBuilder {

    public TestIr build(
            ExtractedTest test,
            String suiteId,
            String environmentId,
            String dataId,
            Map<String, String> targetIdsByName
    ) {
        String testId = IrIds.test(test.name());

        List<StepIr> steps = new ArrayList<>();
        for (int i = 0; i < test.steps().size(); i++) {
            ExtractedStep step = test.steps().get(i);
            String targetId = step.targetNameId() != null ? targetIdsByName.get(step.targetNameId()) : null;
            steps.add(new StepIr(
                IrIds.step(testId, i, step.name()),
                step.kind().value(),
                step.name(),
                targetId,
                step.targetNameId(),
                step.targetNodeId(),
                step.parameters()
            ));
        }

        return new TestIr(testId, test.name(), test.description(), suiteId, environmentId, dataId,
                test.tags(), steps);
    }
}
