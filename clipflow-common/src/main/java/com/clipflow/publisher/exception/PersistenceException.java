package com.clipflow.publisher.exception;

public class PersistenceException extends PipelineException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
