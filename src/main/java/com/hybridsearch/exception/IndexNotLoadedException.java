package com.hybridsearch.exception;

public class IndexNotLoadedException extends RuntimeException {

    public IndexNotLoadedException() {
        super("No index is loaded");
    }

    public IndexNotLoadedException(String message, Throwable cause) {
        super(message, cause);
    }
}
