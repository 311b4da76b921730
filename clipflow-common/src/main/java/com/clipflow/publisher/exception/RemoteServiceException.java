package com.clipflow.publisher.exception;

/**
 * Failure reported by, or while talking to, an external service.
 */
public abstract class RemoteServiceException extends PipelineException {
    private final String service;
    private final int statusCode;

    protected RemoteServiceException(String service, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.service = service;
        this.statusCode = statusCode;
    }

    public String getService() {
        return service;
    }

    /** HTTP status of the failed call, or 0 when no response was received. */
    public int getStatusCode() {
        return statusCode;
    }
}
