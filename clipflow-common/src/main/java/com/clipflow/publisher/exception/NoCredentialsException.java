package com.clipflow.publisher.exception;

import com.clipflow.publisher.model.Platform;

import java.util.Collection;
import java.util.stream.Collectors;

public class NoCredentialsException extends PipelineException {

    public NoCredentialsException(Collection<Platform> platforms) {
        super("No credentials configured for any selected platform: " + platforms.stream()
                .map(Platform::getDisplayName)
                .collect(Collectors.joining(", ")));
    }
}
