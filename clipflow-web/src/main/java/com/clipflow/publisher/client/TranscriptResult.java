package com.clipflow.publisher.client;

public record TranscriptResult(String text, Double confidence, Integer wordCount) {
}
