package com.clipflow.publisher.exception;

/**
 * Root of every error raised by the publishing pipeline.
 */
public class PipelineException extends RuntimeException {

    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Whether repeating the same call may succeed. */
    public boolean isRetryable() {
        return false;
    }
}
