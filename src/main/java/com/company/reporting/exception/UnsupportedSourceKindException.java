package com.company.reporting.exception;

public class UnsupportedSourceKindException extends RuntimeException {
    public UnsupportedSourceKindException(String sourceType) {
        super("Unsupported data source type: " + sourceType);
    }
}
