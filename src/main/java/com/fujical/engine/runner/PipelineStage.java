package com.fujical.engine.runner;

import com.fujical.core.RunTelemetry;

public enum PipelineStage {
    STAGE1(RunTelemetry.STEP_STAGE1, OrchestratorState.STAGE1_RUNNING),
    STAGE2(RunTelemetry.STEP_STAGE2, OrchestratorState.STAGE2_RUNNING),
    STAGE3(RunTelemetry.STEP_STAGE3, OrchestratorState.STAGE3_RUNNING);

    private final String stepName;
    private final OrchestratorState runningState;

    PipelineStage(String stepName, OrchestratorState runningState) {
        this.stepName = stepName;
        this.runningState = runningState;
    }

    public String stepName() {
        return stepName;
    }

    public OrchestratorState runningState() {
        return runningState;
    }
}
