package com.clipflow.publisher.client;

import com.clipflow.publisher.exception.RemoteRejectionException;
import com.clipflow.publisher.exception.RemoteTransientException;
import com.clipflow.publisher.exception.ValidationException;
import com.clipflow.publisher.model.Platform;
import com.clipflow.publisher.model.PlatformCaption;
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
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestTemplate;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OpenAiCaptionClientTest {

    private static final String CAPTIONS = """
            {
              "instagram": {"caption": "Morning vibes", "hashtags": ["morning", "#routine", " "]},
              "facebook": {"caption": "Here is how I start my day", "hashtags": ["#morning"]},
              "tiktok": {"caption": "POV: 6am", "hashtags": ["#fyp"]},
              "youtube": {"caption": "My full morning routine explained", "hashtags": []}
            }
            """;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Mock
    private RestTemplate restTemplate;

    @Captor
    private ArgumentCaptor<HttpEntity<Map<String, Object>>> request;

    private OpenAiCaptionClient client;
    private CaptionStyle style;

    @BeforeEach
    void setUp() {
        client = new OpenAiCaptionClient("dummy-key", "gpt-4o-mini", "https://api.openai.test/v1/chat/completions",
                restTemplate, objectMapper, new RemoteErrorTranslator(objectMapper));
        style = new CaptionStyle(null, "engaging", "Follow for more", Map.of(
                Platform.TIKTOK, new CaptionStyle.PlatformStyle(150, "short, punchy, and viral", 3)));
    }

    private JsonNode completion(String content) {
        ObjectNode root = objectMapper.createObjectNode();
        root.putArray("choices").addObject().putObject("message").put("content", content);
        return root;
    }

    @Test
    void generate_shouldParseCaptionsForEveryPlatform() {
        when(restTemplate.postForObject(anyString(), any(), eq(JsonNode.class))).thenReturn(completion(CAPTIONS));

        Map<Platform, PlatformCaption> captions = client.generate("transcript text", "Morning", style);

        assertEquals(4, captions.size());
        assertEquals("Morning vibes", captions.get(Platform.INSTAGRAM).caption());
        assertEquals(List.of("#morning", "#routine"), captions.get(Platform.INSTAGRAM).hashtags());
        assertTrue(captions.get(Platform.YOUTUBE).hashtags().isEmpty());
    }

    @Test
    void generate_shouldSendModelAndPrompts() {
        when(restTemplate.postForObject(anyString(), any(), eq(JsonNode.class))).thenReturn(completion(CAPTIONS));

        client.generate("transcript text", "Morning", style);

        verify(restTemplate).postForObject(eq("https://api.openai.test/v1/chat/completions"), request.capture(), eq(JsonNode.class));
        Map<String, Object> body = request.getValue().getBody();
        assertEquals("gpt-4o-mini", body.get("model"));
        assertEquals("Bearer dummy-key", request.getValue().getHeaders().getFirst("Authorization"));
        String messages = body.get("messages").toString();
        assertTrue(messages.contains("Follow for more"));
        assertTrue(messages.contains("tiktok: short, punchy, and viral, at most 150 characters"));
    }

    @Test
    void parseCaptions_shouldRejectMissingPlatform() {
        RemoteRejectionException error = assertThrows(RemoteRejectionException.class,
                () -> client.parseCaptions("{\"instagram\": {\"caption\": \"only one\"}}"));

        assertEquals("Invalid response format for facebook", error.getMessage());
    }

    @Test
    void parseCaptions_shouldRejectNonJsonContent() {
        assertThrows(RemoteRejectionException.class, () -> client.parseCaptions("Sure! Here are your captions"));
    }

    @Test
    void generate_shouldTranslateServerErrors() {
        when(restTemplate.postForObject(anyString(), any(), eq(JsonNode.class)))
                .thenThrow(new HttpServerErrorException(HttpStatus.SERVICE_UNAVAILABLE, "Service Unavailable",
                        new byte[0], StandardCharsets.UTF_8));

        assertThrows(RemoteTransientException.class, () -> client.generate("transcript", null, style));
    }

    @Test
    void generate_shouldRequireApiKey() {
        OpenAiCaptionClient unconfigured = new OpenAiCaptionClient("", "gpt-4o-mini", "https://api.openai.test",
                restTemplate, objectMapper, new RemoteErrorTranslator(objectMapper));

        assertThrows(ValidationException.class, () -> unconfigured.generate("transcript", null, style));
        verifyNoInteractions(restTemplate);
    }
}
