package com.clipflow.publisher.client;

public record TranscriptStatus(String id, String status, TranscriptResult result, String error) {

    public boolean isCompleted() {
        return "completed".equals(status);
    }

    public boolean isFailed() {
        return "error".equals(status);
    }
}
