package com.hybridsearch.exception;

public class PipelineAlreadyRunningException extends RuntimeException {

    public PipelineAlreadyRunningException() {
        super("An index rebuild is already in progress");
    }
}
