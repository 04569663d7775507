package com.company.reporting.exception;

public class ReportValidationException extends RuntimeException {
    public ReportValidationException(String message) {
        super(message);
    }
}
