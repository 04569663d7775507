package com.company.reporting.exception;

import lombok.Getter;

/**
 * Wraps a failure in the transform, visualization or render stage of a report run.
 */
@Getter
public class ExecutionFailureException extends RuntimeException {

    private final String stage;

    public ExecutionFailureException(String stage, Throwable cause) {
        super("Report execution failed during " + stage + ": " + cause.getMessage(), cause);
        this.stage = stage;
    }
}
