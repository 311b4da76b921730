package com.clipflow.publisher.client;

public interface TranscriptionClient {

    /**
     * Submits the audio for transcription and returns the remote transcript id. When a webhook URL
     * is given the service calls it once the transcript is finished.
     */
    String submit(String audioUrl, String webhookUrl);

    TranscriptStatus fetch(String transcriptId);

    /** Submits the audio and blocks until the transcript is finished. */
    TranscriptResult transcribe(String audioUrl);
}
