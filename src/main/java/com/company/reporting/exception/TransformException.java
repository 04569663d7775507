package com.company.reporting.exception;

public class TransformException extends RuntimeException {
    public TransformException(String message) {
        super(message);
    }
}
