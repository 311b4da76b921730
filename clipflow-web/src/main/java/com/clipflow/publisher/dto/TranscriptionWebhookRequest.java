package com.clipflow.publisher.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TranscriptionWebhookRequest(@JsonProperty("transcript_id") String transcriptId, String status) {
}
