package com.clipflow.publisher.exception;

import com.clipflow.publisher.model.Platform;

/**
 * The access token for a platform is missing, expired or was rejected.
 */
public class CredentialException extends PipelineException {
    private final Platform platform;

    public CredentialException(Platform platform, String message) {
        super(message);
        this.platform = platform;
    }

    public CredentialException(Platform platform, String message, Throwable cause) {
        super(message, cause);
        this.platform = platform;
    }

    public Platform getPlatform() {
        return platform;
    }
}
