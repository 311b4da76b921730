package com.clipflow.publisher.client;

import com.clipflow.publisher.exception.RemoteRejectionException;
import com.clipflow.publisher.exception.ValidationException;
import com.clipflow.publisher.model.Platform;
import com.clipflow.publisher.model.PlatformCaption;
import com.clipflow.publisher.util.AppConstants;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Chat-completions client asking for a JSON object with one caption per platform.
 */
@Slf4j
@Component
public class OpenAiCaptionClient implements CaptionGenerationClient {

    private static final int MAX_TRANSCRIPT_CHARS = 12_000;

    private final String apiKey;
    private final String model;
    private final String url;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final RemoteErrorTranslator errorTranslator;

    public OpenAiCaptionClient(@Value("${app.openai.key:}") String apiKey,
                               @Value("${app.openai.model:gpt-4o-mini}") String model,
                               @Value("${app.openai.url:https://api.openai.com/v1/chat/completions}") String url,
                               RestTemplate restTemplate,
                               ObjectMapper objectMapper,
                               RemoteErrorTranslator errorTranslator) {
        this.apiKey = apiKey;
        this.model = model;
        this.url = url;
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.errorTranslator = errorTranslator;
    }

    @Override
    public Map<Platform, PlatformCaption> generate(String transcript, String title, CaptionStyle style) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new ValidationException("OpenAI API key not configured");
        }

        Map<String, Object> requestBody = Map.of(
                "model", model,
                "messages", List.of(
                        Map.of("role", "system", "content", systemPrompt(style)),
                        Map.of("role", "user", "content", userPrompt(transcript, title, style))),
                "max_tokens", 1500,
                "temperature", 0.7,
                "response_format", Map.of("type", "json_object"));

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(apiKey);

        JsonNode response;
        try {
            response = restTemplate.postForObject(url, new HttpEntity<>(requestBody, headers), JsonNode.class);
        } catch (RestClientException e) {
            throw errorTranslator.translate(AppConstants.SERVICE_OPENAI, e);
        }

        String content = response == null ? null
                : response.path("choices").path(0).path("message").path("content").asText(null);
        if (content == null || content.isBlank()) {
            throw new RemoteRejectionException(AppConstants.SERVICE_OPENAI, 0, "No content received from OpenAI");
        }
        return parseCaptions(content);
    }

    Map<Platform, PlatformCaption> parseCaptions(String content) {
        JsonNode root;
        try {
            root = objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new RemoteRejectionException(AppConstants.SERVICE_OPENAI, 0, "Caption response is not valid JSON", e);
        }

        Map<Platform, PlatformCaption> captions = new EnumMap<>(Platform.class);
        for (Platform platform : Platform.values()) {
            JsonNode node = root.path(platform.key());
            String caption = node.path("caption").asText(null);
            if (caption == null || caption.isBlank()) {
                throw new RemoteRejectionException(AppConstants.SERVICE_OPENAI, 0,
                        "Invalid response format for " + platform.key());
            }
            List<String> hashtags = new ArrayList<>();
            node.path("hashtags").forEach(tag -> hashtags.add(normalizeHashtag(tag.asText())));
            hashtags.removeIf(String::isEmpty);
            captions.put(platform, PlatformCaption.of(caption.trim(), hashtags));
        }
        return captions;
    }

    private static String normalizeHashtag(String tag) {
        String trimmed = tag.trim().replace(" ", "");
        if (trimmed.isEmpty()) {
            return "";
        }
        return trimmed.startsWith("#") ? trimmed : "#" + trimmed;
    }

    private static String systemPrompt(CaptionStyle style) {
        StringBuilder prompt = new StringBuilder();
        if (style.systemPrompt() != null && !style.systemPrompt().isBlank()) {
            prompt.append(style.systemPrompt().trim()).append("\n\n");
        } else {
            prompt.append("You are a social media copywriter who turns video transcripts into captions.\n\n");
        }
        prompt.append("Write in a ").append(style.tone()).append(" tone.\n");
        if (style.callToAction() != null) {
            prompt.append("End every caption with this call to action: ").append(style.callToAction()).append('\n');
        }
        prompt.append("Respond with a JSON object keyed by platform (")
                .append(String.join(", ", Platform.INSTAGRAM.key(), Platform.FACEBOOK.key(),
                        Platform.TIKTOK.key(), Platform.YOUTUBE.key()))
                .append("). Each value has \"caption\" (string) and \"hashtags\" (array of strings).");
        return prompt.toString();
    }

    private static String userPrompt(String transcript, String title, CaptionStyle style) {
        StringBuilder prompt = new StringBuilder();
        if (title != null && !title.isBlank()) {
            prompt.append("Video title: ").append(title).append("\n\n");
        }
        String text = transcript.length() > MAX_TRANSCRIPT_CHARS ? transcript.substring(0, MAX_TRANSCRIPT_CHARS) : transcript;
        prompt.append("Transcript:\n").append(text).append("\n\nPlatform requirements:\n");
        style.platforms().forEach((platform, platformStyle) -> prompt
                .append("- ").append(platform.key()).append(": ")
                .append(platformStyle.style())
                .append(", at most ").append(platformStyle.maxLength()).append(" characters")
                .append(", ").append(platformStyle.hashtagCount()).append(" hashtags\n"));
        return prompt.toString();
    }
}
