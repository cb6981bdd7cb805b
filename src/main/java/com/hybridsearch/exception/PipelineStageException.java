package com.hybridsearch.exception;

import com.hybridsearch.pipeline.PipelineStage;
import lombok.Getter;

@Getter
public class PipelineStageException extends RuntimeException {
    private final PipelineStage stage;

    public PipelineStageException(PipelineStage stage, String message) {
        super("Stage " + stage + ": " + message);
        this.stage = stage;
    }

    public PipelineStageException(PipelineStage stage, String message, Throwable cause) {
        super("Stage " + stage + ": " + message, cause);
        this.stage = stage;
    }

    public static PipelineStageException missingPredecessor(PipelineStage stage, PipelineStage missing) {
        return new PipelineStageException(stage,
            "cannot run before " + missing + " has completed (its output is missing)");
    }
}
