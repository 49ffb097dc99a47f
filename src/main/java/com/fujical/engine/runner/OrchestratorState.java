package com.fujical.engine.runner;

public enum OrchestratorState {
    IDLE,
    STAGE1_RUNNING,
    STAGE2_RUNNING,
    STAGE3_RUNNING,
    DONE,
    FAILED;

    public boolean running() {
        return this == STAGE1_RUNNING || this == STAGE2_RUNNING || this == STAGE3_RUNNING;
    }
}
