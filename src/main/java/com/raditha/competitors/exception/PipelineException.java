package com.raditha.competitors.exception;

/**
 * Base type for structural failures that halt a clustering run.
 * Data-level defects are never reported through this hierarchy; they are
 * recorded as exclusions and the run continues.
 */
public abstract class PipelineException extends RuntimeException {

    private final String stage;

    protected PipelineException(String stage, String message) {
        super(message);
        this.stage = stage;
    }

    protected PipelineException(String stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    /**
     * Name of the pipeline stage that failed.
     */
    public String getStage() {
        return stage;
    }
}
