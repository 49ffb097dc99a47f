package com.fujical.engine.runner;

/**
 * A pipeline stage could not complete; the run is aborted.
 */
public class StageFailureException extends Exception {
    private final PipelineStage stage;

    public StageFailureException(PipelineStage stage, String message) {
        super(message);
        this.stage = stage;
    }

    public StageFailureException(PipelineStage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public PipelineStage stage() {
        return stage;
    }
}
