package com.clipflow.publisher.exception;

public class RemoteTransientException extends RemoteServiceException {

    public RemoteTransientException(String service, int statusCode, String message) {
        super(service, statusCode, message, null);
    }

    public RemoteTransientException(String service, int statusCode, String message, Throwable cause) {
        super(service, statusCode, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
