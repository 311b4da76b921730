package com.clipflow.publisher.exception;

public class ValidationException extends PipelineException {

    public ValidationException(String message) {
        super(message);
    }
}
