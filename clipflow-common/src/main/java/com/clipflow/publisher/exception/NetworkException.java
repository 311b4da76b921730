package com.clipflow.publisher.exception;

public class NetworkException extends RemoteServiceException {

    public NetworkException(String service, String message, Throwable cause) {
        super(service, 0, message, cause);
    }
}
