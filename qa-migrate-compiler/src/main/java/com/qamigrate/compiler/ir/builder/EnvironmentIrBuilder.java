package com.qamigrate.compiler.ir.builder;

import com.qamigrate.compiler.ir.IrIds;
import com.qamigrate.compiler.ir.IrModel.EnvironmentIr;
import com.qamigrate.compiler.ir.IrModel.RetryPolicy;
import com.qamigrate.compiler.ir.IrModel.Timeouts;
import com.qamigrate.compiler.manifest.CompilerManifest.EnvironmentConfig;

public class EnvironmentIrBuilder {

    public EnvironmentIr build(EnvironmentConfig env) {
        return new EnvironmentIr(
            IrIds.environment(env.getName()),
            env.getName(),
            env.getBaseUrl(),
            env.getVariables(),
            env.getBrowsers(),
            env.getExecutionMode(),
            new Timeouts(env.getTimeouts().getImplicit(), env.getTimeouts().getExplicit(),
                    env.getTimeouts().getPageLoad()),
            new RetryPolicy(env.getRetry().isEnabled(), env.getRetry().getMaxRetries())
        );
    }
}
