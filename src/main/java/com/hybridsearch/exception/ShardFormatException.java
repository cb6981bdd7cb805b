package com.hybridsearch.exception;

import lombok.Getter;

import java.nio.file.Path;

@Getter
public class ShardFormatException extends RuntimeException {
    private final Path file;
    private final int lineNumber;

    public ShardFormatException(Path file, int lineNumber, String message) {
        super("Malformed shard " + file + " at line " + lineNumber + ": " + message);
        this.file = file;
        this.lineNumber = lineNumber;
    }
}
