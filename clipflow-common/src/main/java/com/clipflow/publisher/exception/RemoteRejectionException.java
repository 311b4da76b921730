package com.clipflow.publisher.exception;

public class RemoteRejectionException extends RemoteServiceException {

    public RemoteRejectionException(String service, int statusCode, String message) {
        super(service, statusCode, message, null);
    }

    public RemoteRejectionException(String service, int statusCode, String message, Throwable cause) {
        super(service, statusCode, message, cause);
    }
}
