package com.clipflow.publisher.client;

import com.clipflow.publisher.exception.PipelineException;
import com.clipflow.publisher.exception.RemoteRejectionException;
import com.clipflow.publisher.exception.RemoteTransientException;
import com.clipflow.publisher.exception.ValidationException;
import com.clipflow.publisher.util.AppConstants;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

@Slf4j
@Component
public class AssemblyAiClient implements TranscriptionClient {

    private final String baseUrl;
    private final String apiKey;
    private final Duration pollInterval;
    private final int maxPolls;
    private final RestTemplate restTemplate;
    private final RemoteErrorTranslator errorTranslator;

    public AssemblyAiClient(@Value("${app.assemblyai.base-url:https://api.assemblyai.com/v2}") String baseUrl,
                            @Value("${app.assemblyai.key:}") String apiKey,
                            @Value("${app.assemblyai.poll-interval:5s}") Duration pollInterval,
                            @Value("${app.assemblyai.max-polls:120}") int maxPolls,
                            RestTemplate restTemplate,
                            RemoteErrorTranslator errorTranslator) {
        this.baseUrl = baseUrl;
        this.apiKey = apiKey;
        this.pollInterval = pollInterval;
        this.maxPolls = maxPolls;
        this.restTemplate = restTemplate;
        this.errorTranslator = errorTranslator;
    }

    @Override
    public String submit(String audioUrl, String webhookUrl) {
        Map<String, Object> body = new HashMap<>();
        body.put("audio_url", audioUrl);
        body.put("speech_model", "best");
        body.put("language_detection", true);
        body.put("punctuate", true);
        body.put("format_text", true);
        if (webhookUrl != null && !webhookUrl.isBlank()) {
            body.put("webhook_url", webhookUrl);
        }

        JsonNode response = call(baseUrl + "/transcript", HttpMethod.POST, body);
        String id = response.path("id").asText(null);
        if (id == null) {
            throw new RemoteRejectionException(AppConstants.SERVICE_ASSEMBLY_AI, 0, "AssemblyAI returned no transcript id");
        }
        log.info("Submitted transcription {} for {}", id, audioUrl);
        return id;
    }

    @Override
    public TranscriptStatus fetch(String transcriptId) {
        JsonNode response = call(baseUrl + "/transcript/" + transcriptId, HttpMethod.GET, null);
        String status = response.path("status").asText("");
        TranscriptResult result = null;
        if ("completed".equals(status)) {
            JsonNode words = response.path("words");
            String text = response.path("text").asText("");
            int wordCount = words.isArray() ? words.size() : countWords(text);
            Double confidence = response.hasNonNull("confidence") ? response.get("confidence").asDouble() : null;
            result = new TranscriptResult(text, confidence, wordCount);
        }
        return new TranscriptStatus(transcriptId, status, result, response.path("error").asText(null));
    }

    @Override
    public TranscriptResult transcribe(String audioUrl) {
        String transcriptId = submit(audioUrl, null);
        for (int poll = 1; poll <= maxPolls; poll++) {
            TranscriptStatus status = fetch(transcriptId);
            if (status.isCompleted()) {
                return status.result();
            }
            if (status.isFailed()) {
                throw new RemoteRejectionException(AppConstants.SERVICE_ASSEMBLY_AI, 0,
                        "Transcription failed: " + status.error());
            }
            sleep();
        }
        throw new RemoteTransientException(AppConstants.SERVICE_ASSEMBLY_AI, 0,
                "Transcription " + transcriptId + " did not finish after " + maxPolls + " polls");
    }

    private JsonNode call(String url, HttpMethod method, Map<String, Object> body) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new ValidationException("AssemblyAI API key not configured");
        }
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.AUTHORIZATION, apiKey);
        headers.setContentType(MediaType.APPLICATION_JSON);
        try {
            JsonNode response = restTemplate.exchange(url, method, new HttpEntity<>(body, headers), JsonNode.class).getBody();
            if (response == null) {
                throw new RemoteRejectionException(AppConstants.SERVICE_ASSEMBLY_AI, 0, "Empty response from AssemblyAI");
            }
            return response;
        } catch (RestClientException e) {
            throw errorTranslator.translate(AppConstants.SERVICE_ASSEMBLY_AI, e);
        }
    }

    private void sleep() {
        try {
            Thread.sleep(pollInterval.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PipelineException("Interrupted while waiting for transcript", e);
        }
    }

    private static int countWords(String text) {
        String trimmed = text.trim();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }
}
