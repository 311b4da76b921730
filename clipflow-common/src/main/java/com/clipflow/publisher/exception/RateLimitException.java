package com.clipflow.publisher.exception;

public class RateLimitException extends RemoteTransientException {

    public RateLimitException(String service, String message, Throwable cause) {
        super(service, 429, message, cause);
    }
}
