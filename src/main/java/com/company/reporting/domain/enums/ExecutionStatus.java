package com.company.reporting.domain.enums;

public enum ExecutionStatus {
    QUEUED("Execution is waiting to start"),
    RUNNING("Execution is in progress"),
    COMPLETED("Execution finished successfully"),
    FAILED("Execution failed with errors"),
    // No transition leads here yet; there is no cancel operation for in-flight runs.
    CANCELLED("Execution was cancelled");

    private final String description;

    ExecutionStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public static ExecutionStatus fromString(String status) {
        if (status == null) {
            return QUEUED;
        }
        try {
            return ExecutionStatus.valueOf(status.toUpperCase());
        } catch (IllegalArgumentException e) {
            return QUEUED;
        }
    }
}
