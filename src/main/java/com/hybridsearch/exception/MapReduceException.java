package com.hybridsearch.exception;

import lombok.Getter;

@Getter
public class MapReduceException extends RuntimeException {
    private final String job;

    public MapReduceException(String job, String message, Throwable cause) {
        super("Job '" + job + "' failed: " + message, cause);
        this.job = job;
    }
}
