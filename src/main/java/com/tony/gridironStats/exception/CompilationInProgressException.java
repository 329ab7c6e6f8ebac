package com.tony.gridironStats.exception;

public class CompilationInProgressException extends RuntimeException {
    public CompilationInProgressException(String message) {
        super(message);
    }
}
