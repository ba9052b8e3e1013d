package com.qamigrate.compiler.ir.builder;

import com.qamigrate.compiler.extraction.ExtractedSuite;
import com.qamigrate.compiler.ir.IrIds;
import com.qamigrate.compiler.ir.IrModel.SuiteIr;

public class SuiteIrBuilder {

    public SuiteIr build(ExtractedSuite suite) {
        String parentId = suite.parentName() != null ? IrIds.suite(suite.parentName()) : null;
        return new SuiteIr(
            IrIds.suite(suite.name()),
            suite.name(),
            suite.description(),
            parentId,
            suite.tests().stream().map(IrIds::test).toList()
        );
    }
}
