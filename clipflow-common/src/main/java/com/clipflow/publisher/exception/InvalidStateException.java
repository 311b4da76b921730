package com.clipflow.publisher.exception;

public class InvalidStateException extends PipelineException {

    public InvalidStateException(String message) {
        super(message);
    }
}
