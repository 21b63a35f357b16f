package com.example.progress.shared.exception;

import lombok.Getter;

/**
 * Signals that the work behind one workflow stage failed. Carries the stage name so the
 * terminal failure notification can say where the workflow stopped.
 */
@Getter
public class StageExecutionException extends RuntimeException {

    private final String stageName;

    public StageExecutionException(String stageName, String message) {
        super(message);
        this.stageName = stageName;
    }

    public StageExecutionException(String stageName, String message, Throwable cause) {
        super(message, cause);
        this.stageName = stageName;
    }
}
