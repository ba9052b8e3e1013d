package com.qamigrate.compiler.ir.builder;

import com.qamigrate.compiler.ir.IrIds;
import com.qamigrate.compiler.ir.IrModel.TestDataIr;
import com.qamigrate.compiler.manifest.CompilerManifest.DataSetConfig;

public class TestDataIrBuilder {

    public TestDataIr build(DataSetConfig dataSet) {
        return new TestDataIr(IrIds.data(dataSet.getName()), dataSet.getName(), dataSet.getType(),
                dataSet.getRecords());
    }
}
