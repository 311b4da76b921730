package com.clipflow.publisher.exception;

public class ResourceNotFoundException extends PipelineException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public static ResourceNotFoundException video(Long videoId) {
        return new ResourceNotFoundException("Video not found: " + videoId);
    }
}
