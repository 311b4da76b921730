package com.clipflow.publisher.client;

import com.clipflow.publisher.exception.RemoteRejectionException;
import com.clipflow.publisher.exception.RemoteTransientException;
import com.clipflow.publisher.exception.ValidationException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AssemblyAiClientTest {

    private static final String BASE = "https://api.assemblyai.test/v2";

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Mock
    private RestTemplate restTemplate;

    @Captor
    private ArgumentCaptor<HttpEntity<Map<String, Object>>> entity;

    private AssemblyAiClient client;

    @BeforeEach
    void setUp() {
        client = new AssemblyAiClient(BASE, "aai-key", Duration.ZERO, 2, restTemplate, new RemoteErrorTranslator(objectMapper));
    }

    private void stubSubmit(String id) {
        ObjectNode created = objectMapper.createObjectNode().put("id", id).put("status", "queued");
        when(restTemplate.exchange(eq(BASE + "/transcript"), eq(HttpMethod.POST), any(HttpEntity.class), eq(JsonNode.class)))
                .thenReturn(ResponseEntity.ok(created));
    }

    @Test
    void submit_shouldSendWebhookAndApiKey() {
        stubSubmit("tr_1");

        assertEquals("tr_1", client.submit("https://cdn.example.com/a.mp4", "https://app.example.com/hook"));

        verify(restTemplate).exchange(eq(BASE + "/transcript"), eq(HttpMethod.POST), entity.capture(), eq(JsonNode.class));
        assertEquals("aai-key", entity.getValue().getHeaders().getFirst(HttpHeaders.AUTHORIZATION));
        assertEquals("https://app.example.com/hook", entity.getValue().getBody().get("webhook_url"));
        assertEquals("https://cdn.example.com/a.mp4", entity.getValue().getBody().get("audio_url"));
    }

    @Test
    void transcribe_shouldPollUntilCompleted() {
        stubSubmit("tr_2");
        ObjectNode processing = objectMapper.createObjectNode().put("status", "processing");
        ObjectNode completed = objectMapper.createObjectNode()
                .put("status", "completed")
                .put("text", "hello there world")
                .put("confidence", 0.93);
        when(restTemplate.exchange(eq(BASE + "/transcript/tr_2"), eq(HttpMethod.GET), any(HttpEntity.class), eq(JsonNode.class)))
                .thenReturn(ResponseEntity.ok(processing), ResponseEntity.ok(completed));

        TranscriptResult result = client.transcribe("https://cdn.example.com/a.mp4");

        assertEquals("hello there world", result.text());
        assertEquals(0.93, result.confidence());
        assertEquals(3, result.wordCount());
    }

    @Test
    void transcribe_shouldRejectFailedTranscript() {
        stubSubmit("tr_3");
        ObjectNode failed = objectMapper.createObjectNode().put("status", "error").put("error", "audio too short");
        when(restTemplate.exchange(eq(BASE + "/transcript/tr_3"), eq(HttpMethod.GET), any(HttpEntity.class), eq(JsonNode.class)))
                .thenReturn(ResponseEntity.ok(failed));

        RemoteRejectionException e = assertThrows(RemoteRejectionException.class,
                () -> client.transcribe("https://cdn.example.com/a.mp4"));
        assertEquals("Transcription failed: audio too short", e.getMessage());
    }

    @Test
    void transcribe_shouldTimeOutAsTransient() {
        stubSubmit("tr_4");
        ObjectNode processing = objectMapper.createObjectNode().put("status", "processing");
        when(restTemplate.exchange(eq(BASE + "/transcript/tr_4"), eq(HttpMethod.GET), any(HttpEntity.class), eq(JsonNode.class)))
                .thenReturn(ResponseEntity.ok(processing));

        RemoteTransientException e = assertThrows(RemoteTransientException.class,
                () -> client.transcribe("https://cdn.example.com/a.mp4"));
        assertTrue(e.isRetryable());
        verify(restTemplate, times(2)).exchange(eq(BASE + "/transcript/tr_4"), eq(HttpMethod.GET), any(HttpEntity.class), eq(JsonNode.class));
    }

    @Test
    void submit_shouldRequireApiKey() {
        AssemblyAiClient unconfigured = new AssemblyAiClient(BASE, "", Duration.ZERO, 2, restTemplate,
                new RemoteErrorTranslator(objectMapper));

        assertThrows(ValidationException.class, () -> unconfigured.submit("https://cdn.example.com/a.mp4", null));
        verifyNoInteractions(restTemplate);
    }
}
